package com.chaintruth.registry;

import com.chaintruth.domain.AssetType;
import com.chaintruth.domain.NetworkFamily;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Network and asset catalog. Key = network id / asset id (e.g. ethereum, usdc_ethereum_mainnet).
 * Documented in application.yml under chaintruth.registry.
 */
@ConfigurationProperties(prefix = "chaintruth.registry")
@NoArgsConstructor
@Getter
@Setter
public class RegistryProperties {

    /** Nonce width for assets that do not set their own. */
    private int defaultNonceWidth = 4;

    private Map<String, NetworkEntry> networks = new LinkedHashMap<>();

    private Map<String, AssetEntry> assets = new LinkedHashMap<>();

    public void setNetworks(Map<String, NetworkEntry> networks) {
        this.networks = networks != null ? networks : new LinkedHashMap<>();
    }

    public void setAssets(Map<String, AssetEntry> assets) {
        this.assets = assets != null ? assets : new LinkedHashMap<>();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class NetworkEntry {
        private NetworkFamily family;
        private String name;
        private String nativeSymbol;
        private Long chainId;
        private int confirmationsRequired = 1;
        /** Regex the deposit address must match. */
        private String addressFormat;
        private String explorerBaseUrl;
        private String explorerAddressPath = "address";
        private String explorerTxPath = "tx";
        private String uriScheme;
        private String bech32Prefix;
        private String apiChain;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class AssetEntry {
        private String networkId;
        private String symbol;
        private String name;
        private AssetType type = AssetType.NATIVE;
        private int decimals;
        private String contractRef;
        private String coingeckoId;
        private Integer nonceWidth;
        private boolean enabled = true;
    }
}
