package com.propertyintel.poi.output;

import java.util.List;

/**
 * Output column set. Names and order are a compatibility contract with downstream
 * consumers (GIS import) and must not change.
 */
public final class DatasetColumns {

    public static final String PLACE_ID = "place_id";

    public static final List<String> HEADERS = List.of(
            PLACE_ID, "name",
            "category", "sub_category",
            "latitude", "longitude",
            "address", "vicinity",
            "rating", "review_count",
            "website", "phone",
            "price_level", "types",
            "is_operational",
            "search_zone", "search_keyword",
            "is_open_now", "timestamp",
            "popularity_score", "buffer_radius_m"
    );

    private DatasetColumns() {
    }
}
