package com.propertyintel.poi.exception;

/**
 * Provider failure worth retrying: quota throttling, 5xx, I/O timeouts,
 * or a page token that is not valid yet.
 */
public class TransientProviderException extends ProviderException {

    public TransientProviderException(String message) {
        super(message);
    }

    public TransientProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
