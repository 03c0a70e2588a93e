package com.chaintruth.registry;

/**
 * Asset id is not registered, or is not served on the requested network.
 */
public class UnknownAssetException extends RuntimeException {

    private final String assetId;

    public UnknownAssetException(String assetId) {
        this(assetId, "Unknown asset: " + assetId);
    }

    public UnknownAssetException(String assetId, String message) {
        super(message);
        this.assetId = assetId;
    }

    public String getAssetId() {
        return assetId;
    }
}
