package com.chaintruth.verification;

/**
 * One chain watcher sighting: a transaction touching an address on a network.
 *
 * @param blockHeight null when seen in the mempool
 */
public record WatcherObservation(String networkId, String address, String txHash, Long blockHeight) {
}
