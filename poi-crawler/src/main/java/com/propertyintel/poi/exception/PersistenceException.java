package com.propertyintel.poi.exception;

/**
 * Checkpoint or dataset write failed. The crawl must stop rather than keep
 * accumulating state it cannot save.
 */
public class PersistenceException extends CrawlException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
