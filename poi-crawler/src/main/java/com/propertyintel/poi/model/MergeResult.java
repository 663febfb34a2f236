package com.propertyintel.poi.model;

import java.util.List;

/**
 * Outcome of reconciling two datasets.
 */
public record MergeResult(
        List<PlaceRecord> records,
        int primarySize,
        int secondarySize,
        int overlapSize,
        int finalSize
) {
}
