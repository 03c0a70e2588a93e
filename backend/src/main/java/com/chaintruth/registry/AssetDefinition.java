package com.chaintruth.registry;

import com.chaintruth.domain.AssetType;
import com.chaintruth.domain.NetworkFamily;

/**
 * Static description of one asset on one network.
 *
 * @param contractRef ERC-20 contract address or SPL mint; null for native coins
 * @param nonceWidth  number of lowest raw digits reserved for the per-intent amount nonce
 */
public record AssetDefinition(
        String id,
        String networkId,
        String symbol,
        String name,
        AssetType type,
        int decimals,
        String contractRef,
        String coingeckoId,
        int nonceWidth
) {

    /**
     * Whether an observed asset reference identifies this asset. {@code assetRef} is null for native transfers.
     */
    public boolean matchesRef(String assetRef, NetworkFamily family) {
        if (type == AssetType.NATIVE) {
            return assetRef == null;
        }
        if (assetRef == null || contractRef == null) {
            return false;
        }
        return family == NetworkFamily.EVM ? contractRef.equalsIgnoreCase(assetRef) : contractRef.equals(assetRef);
    }
}
