package com.chaintruth.registry;

import com.chaintruth.domain.NetworkFamily;

import java.util.regex.Pattern;

/**
 * Static description of one network: family, confirmation policy, address format, explorer and URI scheme.
 *
 * @param uriScheme payment URI scheme ("bitcoin", "litecoin", "solana"); null means the QR payload is the plain address
 * @param apiChain  chain slug used by REST indexers (Blockchair); null for RPC-served networks
 */
public record NetworkDefinition(
        String id,
        NetworkFamily family,
        String name,
        String nativeSymbol,
        Long chainId,
        int confirmationsRequired,
        Pattern addressFormat,
        String explorerBaseUrl,
        String explorerAddressPath,
        String explorerTxPath,
        String uriScheme,
        String bech32Prefix,
        String apiChain
) {

    public boolean isValidAddress(String address) {
        return address != null && addressFormat != null && addressFormat.matcher(address.strip()).matches();
    }

    public String explorerAddressUrl(String address) {
        return join(explorerBaseUrl, explorerAddressPath, address);
    }

    public String explorerTxUrl(String txHash) {
        return join(explorerBaseUrl, explorerTxPath, txHash);
    }

    private static String join(String base, String path, String value) {
        if (base == null || value == null) {
            return null;
        }
        String b = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        return b + "/" + path + "/" + value;
    }
}
