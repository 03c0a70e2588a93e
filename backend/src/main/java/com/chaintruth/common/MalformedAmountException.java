package com.chaintruth.common;

/**
 * Amount string is not a non-negative decimal number, or does not fit the asset's precision.
 */
public class MalformedAmountException extends RuntimeException {

    public MalformedAmountException(String message) {
        super(message);
    }
}
