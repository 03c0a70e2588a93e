package com.chaintruth.registry;

import com.chaintruth.domain.AssetType;
import org.springframework.stereotype.Component;

/**
 * Builds the QR/URI payload for a deposit. The scheme comes from the network definition only:
 * a network without a scheme (EVM) gets the plain address, so one chain's scheme can never leak into another's.
 */
@Component
public class PaymentUriBuilder {

    public String build(NetworkDefinition network, AssetDefinition asset, String depositAddress, String amountNative) {
        if (!asset.networkId().equals(network.id())) {
            throw new IllegalArgumentException("Asset " + asset.id() + " does not belong to network " + network.id());
        }
        if (!network.isValidAddress(depositAddress)) {
            throw new IllegalArgumentException("Address is not a valid " + network.id() + " address: " + depositAddress);
        }
        String scheme = network.uriScheme();
        if (scheme == null) {
            return depositAddress;
        }
        StringBuilder uri = new StringBuilder(scheme).append(':').append(depositAddress);
        if (amountNative != null && !amountNative.isBlank()) {
            uri.append("?amount=").append(amountNative);
        }
        if (asset.type() == AssetType.SPL) {
            uri.append(amountNative != null && !amountNative.isBlank() ? '&' : '?')
                    .append("spl-token=").append(asset.contractRef());
        }
        return uri.toString();
    }
}
