package com.chaintruth.registry;

import com.chaintruth.domain.AssetType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Immutable lookup over the configured networks and assets. Built once at startup; no state beyond the catalog.
 */
@Component
@Slf4j
public class AssetNetworkRegistry {

    private final Map<String, NetworkDefinition> networks;
    private final Map<String, AssetDefinition> assets;

    @Autowired
    public AssetNetworkRegistry(RegistryProperties properties) {
        this(toNetworks(properties), toAssets(properties));
        log.info("Registry loaded: {} networks, {} assets", networks.size(), assets.size());
    }

    private AssetNetworkRegistry(List<NetworkDefinition> networks, List<AssetDefinition> assets) {
        Map<String, NetworkDefinition> n = new LinkedHashMap<>();
        for (NetworkDefinition network : networks) {
            if (n.put(network.id(), network) != null) {
                throw new IllegalStateException("Duplicate network id: " + network.id());
            }
        }
        Map<String, AssetDefinition> a = new LinkedHashMap<>();
        for (AssetDefinition asset : assets) {
            if (!n.containsKey(asset.networkId())) {
                throw new IllegalStateException("Asset " + asset.id() + " references unknown network " + asset.networkId());
            }
            if (asset.type().isToken() && (asset.contractRef() == null || asset.contractRef().isBlank())) {
                throw new IllegalStateException("Token asset " + asset.id() + " has no contractRef");
            }
            if (a.put(asset.id(), asset) != null) {
                throw new IllegalStateException("Duplicate asset id: " + asset.id());
            }
        }
        this.networks = Collections.unmodifiableMap(n);
        this.assets = Collections.unmodifiableMap(a);
    }

    /**
     * Registry over explicit definitions; used by tests and tooling.
     */
    public static AssetNetworkRegistry of(List<NetworkDefinition> networks, List<AssetDefinition> assets) {
        return new AssetNetworkRegistry(networks, assets);
    }

    /**
     * @throws UnknownNetworkException when the id is not registered
     */
    public NetworkDefinition network(String networkId) {
        NetworkDefinition network = networkId != null ? networks.get(networkId) : null;
        if (network == null) {
            throw new UnknownNetworkException(networkId);
        }
        return network;
    }

    /**
     * @throws UnknownAssetException when the id is not registered
     */
    public AssetDefinition asset(String assetId) {
        AssetDefinition asset = assetId != null ? assets.get(assetId) : null;
        if (asset == null) {
            throw new UnknownAssetException(assetId);
        }
        return asset;
    }

    public Optional<NetworkDefinition> findNetwork(String networkId) {
        return Optional.ofNullable(networkId != null ? networks.get(networkId) : null);
    }

    /**
     * Asset on the given network; fails when the asset belongs to another network.
     */
    public AssetDefinition assetOnNetwork(String assetId, String networkId) {
        network(networkId);
        AssetDefinition asset = asset(assetId);
        if (!asset.networkId().equals(networkId)) {
            throw new UnknownAssetException(assetId, "Asset " + assetId + " is not available on network " + networkId);
        }
        return asset;
    }

    public List<AssetDefinition> assetsOn(String networkId) {
        return assets.values().stream()
                .filter(a -> a.networkId().equals(networkId))
                .collect(Collectors.toList());
    }

    public Collection<NetworkDefinition> networks() {
        return networks.values();
    }

    public Collection<AssetDefinition> assets() {
        return assets.values();
    }

    private static List<NetworkDefinition> toNetworks(RegistryProperties properties) {
        return properties.getNetworks().entrySet().stream()
                .map(e -> {
                    RegistryProperties.NetworkEntry v = e.getValue();
                    if (v.getFamily() == null) {
                        throw new IllegalStateException("Network " + e.getKey() + " has no family");
                    }
                    return new NetworkDefinition(
                            e.getKey(),
                            v.getFamily(),
                            v.getName() != null ? v.getName() : e.getKey(),
                            v.getNativeSymbol(),
                            v.getChainId(),
                            Math.max(0, v.getConfirmationsRequired()),
                            v.getAddressFormat() != null ? Pattern.compile(v.getAddressFormat()) : null,
                            v.getExplorerBaseUrl(),
                            v.getExplorerAddressPath(),
                            v.getExplorerTxPath(),
                            blankToNull(v.getUriScheme()),
                            blankToNull(v.getBech32Prefix()),
                            blankToNull(v.getApiChain()));
                })
                .collect(Collectors.toList());
    }

    private static List<AssetDefinition> toAssets(RegistryProperties properties) {
        return properties.getAssets().entrySet().stream()
                .filter(e -> e.getValue().isEnabled())
                .map(e -> {
                    RegistryProperties.AssetEntry v = e.getValue();
                    AssetType type = v.getType() != null ? v.getType() : AssetType.NATIVE;
                    int nonceWidth = v.getNonceWidth() != null ? v.getNonceWidth() : properties.getDefaultNonceWidth();
                    return new AssetDefinition(
                            e.getKey(),
                            v.getNetworkId(),
                            v.getSymbol(),
                            v.getName() != null ? v.getName() : v.getSymbol(),
                            type,
                            v.getDecimals(),
                            blankToNull(v.getContractRef()),
                            blankToNull(v.getCoingeckoId()),
                            Math.max(0, Math.min(nonceWidth, v.getDecimals())));
                })
                .collect(Collectors.toList());
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.strip();
    }
}
