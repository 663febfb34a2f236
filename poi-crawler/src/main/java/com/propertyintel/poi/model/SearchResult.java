package com.propertyintel.poi.model;

import java.util.List;

/**
 * Everything collected for one (zone, keyword) pair across its pages.
 */
public record SearchResult(List<PlaceCandidate> candidates, int callsMade) {

    public static SearchResult empty() {
        return new SearchResult(List.of(), 0);
    }
}
