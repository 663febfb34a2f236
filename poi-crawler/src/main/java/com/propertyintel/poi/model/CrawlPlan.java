package com.propertyintel.poi.model;

import java.util.List;
import java.util.Set;

/**
 * Input of one crawl: the catalog plus place ids already present in a prior dataset.
 */
public record CrawlPlan(List<Zone> zones, List<Query> queries, Set<String> excludedPlaceIds) {

    public CrawlPlan {
        zones = List.copyOf(zones);
        queries = List.copyOf(queries);
        excludedPlaceIds = excludedPlaceIds == null ? Set.of() : Set.copyOf(excludedPlaceIds);
    }

    public CrawlPlan(List<Zone> zones, List<Query> queries) {
        this(zones, queries, Set.of());
    }

    public int totalSearches() {
        return zones.size() * queries.size();
    }
}
