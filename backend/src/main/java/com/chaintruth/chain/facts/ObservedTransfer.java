package com.chaintruth.chain.facts;

import java.math.BigInteger;

/**
 * Value received by one address in one asset.
 *
 * @param assetRef null for the network's native coin, otherwise the contract address or mint
 */
public record ObservedTransfer(String recipient, String assetRef, BigInteger amount) {
}
