package com.propertyintel.poi.exception;

import java.util.Set;

/**
 * A duplicate place_id survived deduplication. Indicates a bug upstream, never recovered.
 */
public class IntegrityException extends CrawlException {

    private final Set<String> duplicateIds;

    public IntegrityException(String message, Set<String> duplicateIds) {
        super(message + " " + duplicateIds);
        this.duplicateIds = Set.copyOf(duplicateIds);
    }

    public Set<String> getDuplicateIds() {
        return duplicateIds;
    }
}
