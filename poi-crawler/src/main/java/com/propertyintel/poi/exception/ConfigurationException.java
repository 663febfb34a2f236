package com.propertyintel.poi.exception;

/**
 * Bad catalog, bad input dataset or missing credentials.
 * Always raised before the first network call of a crawl.
 */
public class ConfigurationException extends CrawlException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
