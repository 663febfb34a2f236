package com.propertyintel.poi.model;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Checkpointable state of a crawl.
 *
 * Owned by the crawl engine for the duration of a run. Every mutation goes through
 * this object's monitor so query tasks running in parallel see a single writer:
 * <ul>
 *   <li>records only grow, keyed by place_id, inserted whole or not at all</li>
 *   <li>a place_id is claimed before its detail fetch, so it is fetched at most once per run</li>
 *   <li>completed zones are kept in completion order</li>
 * </ul>
 */
public class CrawlProgress {

    private final Set<String> completedZones = new LinkedHashSet<>();
    private final Map<String, PlaceRecord> records = new LinkedHashMap<>();
    private final Map<String, Integer> stats = new TreeMap<>();

    // Not persisted: a restart may retry details that failed in the previous process.
    private final Set<String> claimedIds = new HashSet<>();

    private int apiCalls;

    public static CrawlProgress empty() {
        return new CrawlProgress();
    }

    public static CrawlProgress restore(Collection<String> completedZones,
                                        Collection<PlaceRecord> records,
                                        Map<String, Integer> stats,
                                        int apiCalls) {
        CrawlProgress progress = new CrawlProgress();
        if (completedZones != null) progress.completedZones.addAll(completedZones);
        if (records != null) {
            for (PlaceRecord record : records) {
                progress.records.putIfAbsent(record.getPlaceId(), record);
            }
        }
        if (stats != null) progress.stats.putAll(stats);
        progress.apiCalls = apiCalls;
        return progress;
    }

    // ── Zones ────────────────────────────────────────────────────────────────

    public synchronized boolean isZoneCompleted(String zoneName) {
        return completedZones.contains(zoneName);
    }

    public synchronized void markZoneCompleted(String zoneName) {
        completedZones.add(zoneName);
    }

    public synchronized List<String> getCompletedZones() {
        return List.copyOf(completedZones);
    }

    // ── Records ──────────────────────────────────────────────────────────────

    public synchronized boolean hasRecord(String placeId) {
        return records.containsKey(placeId);
    }

    /**
     * Reserve the right to fetch detail for a place.
     *
     * @return false if the place is already recorded or another task claimed it first
     */
    public synchronized boolean claim(String placeId) {
        if (records.containsKey(placeId)) return false;
        return claimedIds.add(placeId);
    }

    /**
     * @return true if the record was inserted, false if its place_id was already present
     */
    public synchronized boolean putIfAbsent(PlaceRecord record) {
        return records.putIfAbsent(record.getPlaceId(), record) == null;
    }

    public synchronized int recordCount() {
        return records.size();
    }

    /** Snapshot in insertion order. */
    public synchronized Map<String, PlaceRecord> getRecords() {
        return new LinkedHashMap<>(records);
    }

    // ── Counters ─────────────────────────────────────────────────────────────

    public synchronized void increment(String stat) {
        add(stat, 1);
    }

    public synchronized void add(String stat, int delta) {
        stats.merge(stat, delta, Integer::sum);
    }

    public synchronized int stat(String stat) {
        return stats.getOrDefault(stat, 0);
    }

    public synchronized Map<String, Integer> getStats() {
        return new TreeMap<>(stats);
    }

    public synchronized void addApiCalls(int calls) {
        apiCalls += calls;
    }

    public synchronized int getApiCalls() {
        return apiCalls;
    }
}
