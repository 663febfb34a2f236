package com.propertyintel.poi.service;

import com.propertyintel.poi.config.PoiCrawlerProperties;
import com.propertyintel.poi.model.PlaceRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Log-only run summaries: counters, category breakdown and estimated provider cost.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CrawlReportLogger {

    private final PoiCrawlerProperties properties;

    public double estimatedCostUsd(Map<String, Integer> stats) {
        PoiCrawlerProperties.Pricing pricing = properties.getPricing();
        return stats.getOrDefault(CrawlEngine.NEARBY_SEARCH_CALLS, 0) * pricing.getNearbySearchPerCall()
                + stats.getOrDefault(CrawlEngine.PLACE_DETAILS_CALLS, 0) * pricing.getPlaceDetailsPerCall();
    }

    public void logCrawlSummary(Map<String, Integer> stats, int apiCalls) {
        log.info("── Crawl summary ──");
        stats.forEach((key, value) -> log.info("  {}: {}", key, value));
        log.info("  total API calls: {}", apiCalls);
        log.info("  estimated cost: ${}", String.format("%.2f", estimatedCostUsd(stats)));
    }

    public void logDatasetBreakdown(String title, Collection<PlaceRecord> records) {
        log.info("── {}: {} records ──", title, records.size());
        breakdown(records, PlaceRecord::getCategory)
                .forEach((cat, count) -> log.info("  {}: {}", cat, count));
        breakdown(records, PlaceRecord::getSubCategory)
                .forEach((sub, count) -> log.debug("    {}: {}", sub, count));
    }

    private Map<String, Long> breakdown(Collection<PlaceRecord> records, Function<PlaceRecord, String> key) {
        return records.stream().collect(Collectors.groupingBy(
                r -> key.apply(r) == null ? "(none)" : key.apply(r), TreeMap::new, Collectors.counting()));
    }
}
