package com.chaintruth.intent.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Deposit addresses per network id, with optional per-campaign overrides (campaignId → networkId → address).
 */
@ConfigurationProperties(prefix = "chaintruth.deposit")
@NoArgsConstructor
@Getter
@Setter
public class DepositAddressProperties {

    private Map<String, String> addresses = new HashMap<>();

    private Map<String, Map<String, String>> campaignAddresses = new HashMap<>();

    public void setAddresses(Map<String, String> addresses) {
        this.addresses = addresses != null ? addresses : new HashMap<>();
    }

    public void setCampaignAddresses(Map<String, Map<String, String>> campaignAddresses) {
        this.campaignAddresses = campaignAddresses != null ? campaignAddresses : new HashMap<>();
    }
}
