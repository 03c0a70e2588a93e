package com.chaintruth.intent;

/**
 * Intent request is inconsistent (missing campaign, both or neither amount, amount too small).
 */
public class InvalidIntentRequestException extends RuntimeException {

    public InvalidIntentRequestException(String message) {
        super(message);
    }
}
