package com.propertyintel.poi.model;

/**
 * One search term and its taxonomy placement.
 *
 * radiusM is optional: community-style catalogs search each keyword with its own
 * radius and carry it through to the record as the buffer radius.
 */
public record Query(String keyword, String category, String subCategory, Integer radiusM) {

    public Query(String keyword, String category, String subCategory) {
        this(keyword, category, subCategory, null);
    }
}
