package com.chaintruth.registry;

/**
 * Network id is not registered.
 */
public class UnknownNetworkException extends RuntimeException {

    private final String networkId;

    public UnknownNetworkException(String networkId) {
        super("Unknown network: " + networkId);
        this.networkId = networkId;
    }

    public String getNetworkId() {
        return networkId;
    }
}
