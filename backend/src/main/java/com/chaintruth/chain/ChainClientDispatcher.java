package com.chaintruth.chain;

import com.chaintruth.registry.NetworkDefinition;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Picks the chain client serving a network's family.
 */
@Component
@RequiredArgsConstructor
public class ChainClientDispatcher {

    private final List<ChainClient> clients;

    public ChainClient forNetwork(NetworkDefinition network) {
        return clients.stream()
                .filter(c -> c.supports(network.family()))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No chain client for family " + network.family()));
    }
}
