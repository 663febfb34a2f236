package com.propertyintel.poi.model;

import java.util.List;

/**
 * Raw hit from one search page. Types are captured here because the detail
 * endpoint omits them or formats them differently.
 */
public record PlaceCandidate(
        String placeId,
        String name,
        List<String> types,
        String sourceZone,
        String sourceKeyword
) {
    public PlaceCandidate {
        types = types == null ? List.of() : List.copyOf(types);
    }
}
