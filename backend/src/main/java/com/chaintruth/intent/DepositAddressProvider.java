package com.chaintruth.intent;

import com.chaintruth.registry.AssetDefinition;
import com.chaintruth.registry.NetworkDefinition;

/**
 * Source of deposit addresses. Custody and derivation live behind this seam.
 */
public interface DepositAddressProvider {

    /**
     * @throws DepositAddressUnavailableException when no valid address exists for the network
     */
    String depositAddress(String campaignId, NetworkDefinition network, AssetDefinition asset);
}
