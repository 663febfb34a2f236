package com.propertyintel.poi.exception;

/**
 * Root of the crawler's failure taxonomy.
 *
 * Configuration, persistence and integrity failures are fatal and stop the run.
 * Provider failures are recovered per call by the crawl engine.
 */
public abstract class CrawlException extends RuntimeException {

    protected CrawlException(String message) {
        super(message);
    }

    protected CrawlException(String message, Throwable cause) {
        super(message, cause);
    }
}
