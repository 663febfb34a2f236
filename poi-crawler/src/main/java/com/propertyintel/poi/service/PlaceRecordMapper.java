package com.propertyintel.poi.service;

import com.propertyintel.poi.model.PlaceDetail;
import com.propertyintel.poi.model.PlaceRecord;
import com.propertyintel.poi.rules.PopularityScorer;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Assembles the persisted dataset row from a fetched detail, the search that found it,
 * and derived fields. Pure: never fetches or retries.
 */
public class PlaceRecordMapper {

    private static final String PRICE_MARKER = "$";
    private static final int MAX_PRICE_LEVEL = 4;

    private final PopularityScorer scorer;
    private final Map<String, Map<String, Integer>> bufferRadii;
    private final Clock clock;

    /**
     * @param bufferRadii category → sub-category → radius; categories without an entry
     *                    fall back to the query's radius hint
     */
    public PlaceRecordMapper(PopularityScorer scorer, Map<String, Map<String, Integer>> bufferRadii, Clock clock) {
        this.scorer = scorer;
        this.bufferRadii = bufferRadii == null ? Map.of() : Map.copyOf(bufferRadii);
        this.clock = clock;
    }

    /**
     * @param searchTypes type tags captured from the search response
     * @param subCategory sub-category after classification
     * @param radiusHint  the query's own radius, may be null
     */
    public PlaceRecord build(PlaceDetail detail,
                             Collection<String> searchTypes,
                             String category,
                             String subCategory,
                             String zoneName,
                             String keyword,
                             Integer radiusHint) {
        List<String> types = searchTypes == null ? List.of() : List.copyOf(searchTypes);

        return PlaceRecord.builder()
                .placeId(detail.getPlaceId())
                .name(detail.getName() == null ? "" : detail.getName())
                .category(category)
                .subCategory(subCategory)
                .latitude(detail.getLatitude())
                .longitude(detail.getLongitude())
                .address(detail.getFormattedAddress())
                .vicinity(detail.getVicinity())
                .rating(detail.getRating())
                .reviewCount(detail.getReviewCount() == null ? 0 : detail.getReviewCount())
                .website(detail.getWebsite())
                .phone(detail.getPhone())
                .priceLevel(priceSymbols(detail.getPriceLevel()))
                .types(String.join(", ", types))
                .operational(isOperational(detail.getBusinessStatus()))
                .searchZone(zoneName)
                .searchKeyword(keyword)
                .openNow(detail.getOpenNow())
                .timestamp(LocalDateTime.now(clock).toString())
                .popularityScore(scorer.score(detail.getRating(), detail.getReviewCount()))
                .bufferRadiusM(bufferRadius(category, subCategory, radiusHint))
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * e.g. 2 → "$$". Display convenience only.
     */
    String priceSymbols(Integer priceLevel) {
        if (priceLevel == null || priceLevel <= 0) return "";
        return PRICE_MARKER.repeat(Math.min(priceLevel, MAX_PRICE_LEVEL));
    }

    private boolean isOperational(String businessStatus) {
        return businessStatus == null || "OPERATIONAL".equals(businessStatus);
    }

    Integer bufferRadius(String category, String subCategory, Integer radiusHint) {
        Map<String, Integer> table = bufferRadii.get(category);
        if (table != null) {
            return table.get(subCategory);
        }
        return radiusHint;
    }
}
