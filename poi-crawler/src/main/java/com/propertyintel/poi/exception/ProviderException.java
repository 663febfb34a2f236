package com.propertyintel.poi.exception;

/**
 * A call to the place search provider failed or returned an error status.
 */
public class ProviderException extends CrawlException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
