package com.propertyintel.poi.model;

import java.util.List;

/**
 * One page of nearby-search results plus the token for the next page, if any.
 */
public record SearchPage(List<PlaceCandidate> candidates, String nextPageToken) {

    public SearchPage {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static SearchPage empty() {
        return new SearchPage(List.of(), null);
    }

    public boolean hasNextPage() {
        return nextPageToken != null && !nextPageToken.isBlank();
    }
}
