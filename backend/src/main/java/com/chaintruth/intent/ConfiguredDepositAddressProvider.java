package com.chaintruth.intent;

import com.chaintruth.intent.config.DepositAddressProperties;
import com.chaintruth.registry.AssetDefinition;
import com.chaintruth.registry.NetworkDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Deposit addresses from chaintruth.deposit. Every address is checked against the network's format, so
 * a Bitcoin address configured for Litecoin (or the reverse) is refused rather than shown to a donor.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConfiguredDepositAddressProvider implements DepositAddressProvider {

    private final DepositAddressProperties properties;

    @Override
    public String depositAddress(String campaignId, NetworkDefinition network, AssetDefinition asset) {
        String address = null;
        Map<String, String> campaignOverrides = campaignId != null ? properties.getCampaignAddresses().get(campaignId) : null;
        if (campaignOverrides != null) {
            address = campaignOverrides.get(network.id());
        }
        if (address == null) {
            address = properties.getAddresses().get(network.id());
        }
        if (address == null || address.isBlank()) {
            throw new DepositAddressUnavailableException("No deposit address for network " + network.id());
        }
        String candidate = address.strip();
        if (!network.isValidAddress(candidate)) {
            log.error("Configured deposit address for {} does not match its format", network.id());
            throw new DepositAddressUnavailableException("Deposit address for " + network.id() + " has an invalid format");
        }
        return network.family().canonicalAddress(candidate);
    }
}
