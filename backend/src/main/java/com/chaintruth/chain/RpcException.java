package com.chaintruth.chain;

/**
 * Chain data source failed: HTTP error, timeout, JSON-RPC error object or unparseable payload.
 * Always transient from the caller's point of view.
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
