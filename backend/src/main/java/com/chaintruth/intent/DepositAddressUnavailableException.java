package com.chaintruth.intent;

/**
 * No deposit address is configured for the network, or the configured one does not match its address format.
 */
public class DepositAddressUnavailableException extends RuntimeException {

    public DepositAddressUnavailableException(String message) {
        super(message);
    }
}
