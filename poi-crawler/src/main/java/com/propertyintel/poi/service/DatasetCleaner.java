package com.propertyintel.poi.service;

import com.propertyintel.poi.config.PoiCrawlerProperties;
import com.propertyintel.poi.model.PlaceRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Prepares a dataset for GIS analysis: unique ids, open businesses only, and the
 * low-relevance rows of the competitor and affluence categories removed.
 * Columns are unchanged.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DatasetCleaner {

    static final String COMPETITOR = "Competitor";
    static final String AFFLUENCE_PROXY = "Affluence_Proxy";

    private final PoiCrawlerProperties properties;

    public List<PlaceRecord> clean(List<PlaceRecord> input) {
        PoiCrawlerProperties.Cleaning cfg = properties.getCleaning();
        Set<String> competitorSubs = Set.copyOf(cfg.getCompetitorSubCategories());

        Map<String, PlaceRecord> unique = new LinkedHashMap<>();
        input.forEach(r -> unique.putIfAbsent(r.getPlaceId(), r));
        int afterDedup = unique.size();

        List<PlaceRecord> kept = new ArrayList<>();
        int closed = 0;
        for (PlaceRecord r : unique.values()) {
            if (cfg.isRequireOperational() && !r.isOperational()) {
                closed++;
                continue;
            }
            if (isLowRelevance(r, competitorSubs, cfg.getMinAffluenceReviews())) continue;
            kept.add(r);
        }
        kept.sort(DatasetReconciler.DATASET_ORDER);

        log.info("Cleaned dataset: {} -> {} records ({} duplicates, {} closed, {} low-relevance)",
                input.size(), kept.size(), input.size() - afterDedup, closed, afterDedup - closed - kept.size());
        return kept;
    }

    private boolean isLowRelevance(PlaceRecord r, Set<String> competitorSubs, int minAffluenceReviews) {
        if (COMPETITOR.equals(r.getCategory())) {
            return !competitorSubs.contains(r.getSubCategory());
        }
        if (AFFLUENCE_PROXY.equals(r.getCategory())) {
            return r.getReviewCount() == null || r.getReviewCount() < minAffluenceReviews;
        }
        return false;
    }
}
