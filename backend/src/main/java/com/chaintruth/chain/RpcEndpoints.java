package com.chaintruth.chain;

import java.util.Map;
import java.util.Optional;

/**
 * Endpoint rotators for the networks of one chain family, keyed by network id.
 */
public class RpcEndpoints {

    private final Map<String, RpcEndpointRotator> rotatorsByNetwork;

    public RpcEndpoints(Map<String, RpcEndpointRotator> rotatorsByNetwork) {
        this.rotatorsByNetwork = Map.copyOf(rotatorsByNetwork);
    }

    public Optional<RpcEndpointRotator> forNetwork(String networkId) {
        return Optional.ofNullable(rotatorsByNetwork.get(networkId));
    }

    /**
     * Next endpoint for the network.
     *
     * @throws RpcException when no endpoint is configured
     */
    public String nextEndpoint(String networkId) {
        return forNetwork(networkId)
                .orElseThrow(() -> new RpcException("No RPC endpoint configured for network " + networkId))
                .getNextEndpoint();
    }

    public boolean isEmpty() {
        return rotatorsByNetwork.isEmpty();
    }
}
