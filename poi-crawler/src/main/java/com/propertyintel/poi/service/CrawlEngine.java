package com.propertyintel.poi.service;

import com.propertyintel.poi.exception.PersistenceException;
import com.propertyintel.poi.exception.ProviderException;
import com.propertyintel.poi.model.CrawlPlan;
import com.propertyintel.poi.model.CrawlProgress;
import com.propertyintel.poi.model.CrawlState;
import com.propertyintel.poi.model.PlaceCandidate;
import com.propertyintel.poi.model.PlaceDetail;
import com.propertyintel.poi.model.PlaceRecord;
import com.propertyintel.poi.model.Query;
import com.propertyintel.poi.model.Zone;
import com.propertyintel.poi.output.CheckpointStore;
import com.propertyintel.poi.rules.RelevanceFilter;
import com.propertyintel.poi.rules.SubCategoryClassifier;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives the zones × queries crawl.
 *
 * A zone is the unit of checkpointing: it is marked complete and the checkpoint saved
 * only once every query for it has finished, so a restart redoes at most one zone.
 * Cancellation is honoured between queries; a cancelled zone is left incomplete.
 *
 * With parallelism &gt; 1 the queries of a zone run on a fixed pool. All tasks share the
 * rate limiter and write through {@link CrawlProgress}, whose claim-then-fetch keeps
 * detail lookups to one per place_id per run.
 */
@Slf4j
public class CrawlEngine {

    public static final String FILTERED_IRRELEVANT = "filtered_irrelevant";
    public static final String DETAIL_FAILED = "detail_failed";
    public static final String SEARCH_FAILED = "search_failed";
    public static final String DUPLICATES_AVOIDED = "duplicates_avoided";
    public static final String NEARBY_SEARCH_CALLS = "nearby_search_calls";
    public static final String PLACE_DETAILS_CALLS = "place_details_calls";

    /** Called after a zone's checkpoint has been saved. */
    @FunctionalInterface
    public interface ZoneListener {
        void zoneCompleted(Zone zone, CrawlProgress progress);
    }

    private final PlaceSearchClient searchClient;
    private final RelevanceFilter relevanceFilter;
    private final SubCategoryClassifier classifier;
    private final PlaceRecordMapper recordMapper;
    private final CheckpointStore checkpointStore;
    private final int maxPages;
    private final int parallelism;

    private final AtomicReference<CrawlState> state = new AtomicReference<>(CrawlState.IDLE);
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private volatile String currentZone;

    public CrawlEngine(PlaceSearchClient searchClient,
                       RelevanceFilter relevanceFilter,
                       SubCategoryClassifier classifier,
                       PlaceRecordMapper recordMapper,
                       CheckpointStore checkpointStore,
                       int maxPages,
                       int parallelism) {
        this.searchClient = searchClient;
        this.relevanceFilter = relevanceFilter;
        this.classifier = classifier;
        this.recordMapper = recordMapper;
        this.checkpointStore = checkpointStore;
        this.maxPages = Math.max(1, maxPages);
        this.parallelism = Math.max(1, parallelism);
    }

    public CrawlState getState() {
        return state.get();
    }

    /** Zone being crawled, null when not running. */
    public String getCurrentZone() {
        return currentZone;
    }

    public boolean isRunning() {
        return state.get() == CrawlState.RUNNING;
    }

    /**
     * Request a stop. The running crawl finishes its in-flight queries and returns
     * without marking the current zone complete.
     */
    public void cancel() {
        if (isRunning()) {
            log.info("Cancellation requested (current zone: {})", currentZone);
            cancelRequested.set(true);
        }
    }

    public CrawlProgress run(CrawlPlan plan, CrawlProgress progress) {
        return run(plan, progress, (zone, p) -> { });
    }

    /**
     * Crawl every zone of the plan not already completed in {@code progress}.
     *
     * @return the same progress instance, mutated
     * @throws IllegalStateException if a crawl is already running on this engine
     * @throws PersistenceException  if a checkpoint cannot be saved; the state becomes FAILED
     */
    public CrawlProgress run(CrawlPlan plan, CrawlProgress progress, ZoneListener listener) {
        CrawlState previous = state.get();
        if (previous == CrawlState.RUNNING || !state.compareAndSet(previous, CrawlState.RUNNING)) {
            throw new IllegalStateException("A crawl is already running on this engine");
        }
        cancelRequested.set(false);

        ExecutorService executor = parallelism > 1
                ? Executors.newFixedThreadPool(parallelism, queryThreadFactory())
                : null;

        try {
            int zoneIndex = 0;
            for (Zone zone : plan.zones()) {
                zoneIndex++;
                if (progress.isZoneCompleted(zone.name())) {
                    log.info("[{}/{}] Skipping zone {} (already completed)", zoneIndex, plan.zones().size(), zone.name());
                    continue;
                }
                if (stopRequested()) {
                    return interrupted(progress);
                }

                currentZone = zone.name();
                log.info("[{}/{}] Crawling zone {} ({}, {}, r={}m)", zoneIndex, plan.zones().size(),
                        zone.name(), zone.latitude(), zone.longitude(), zone.radiusM());

                int before = progress.recordCount();
                boolean finished = executor == null
                        ? crawlZoneSequential(zone, plan, progress)
                        : crawlZoneParallel(zone, plan, progress, executor);
                if (!finished) {
                    return interrupted(progress);
                }

                progress.markZoneCompleted(zone.name());
                saveCheckpoint(progress);
                log.info("Zone {} complete: {} new records ({} total)",
                        zone.name(), progress.recordCount() - before, progress.recordCount());

                listener.zoneCompleted(zone, progress);
            }

            state.set(CrawlState.COMPLETED);
            log.info("Crawl completed: {} zones, {} records, {} API calls",
                    progress.getCompletedZones().size(), progress.recordCount(), progress.getApiCalls());
            return progress;

        } catch (RuntimeException e) {
            state.set(CrawlState.FAILED);
            throw e;
        } finally {
            currentZone = null;
            if (executor != null) executor.shutdownNow();
        }
    }

    // ── Zone processing ──────────────────────────────────────────────────────

    private boolean crawlZoneSequential(Zone zone, CrawlPlan plan, CrawlProgress progress) {
        for (Query query : plan.queries()) {
            if (stopRequested()) return false;
            crawlQuery(zone, query, plan, progress);
        }
        return true;
    }

    private boolean crawlZoneParallel(Zone zone, CrawlPlan plan, CrawlProgress progress, ExecutorService executor) {
        AtomicBoolean skipped = new AtomicBoolean();
        List<Future<?>> futures = new ArrayList<>();
        for (Query query : plan.queries()) {
            futures.add(executor.submit(() -> {
                if (stopRequested()) {
                    skipped.set(true);
                    return;
                }
                crawlQuery(zone, query, plan, progress);
            }));
        }

        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException re) throw re;
                throw new IllegalStateException("Query task failed in zone " + zone.name(), cause);
            }
        }
        return !skipped.get() && !stopRequested();
    }

    private void crawlQuery(Zone zone, Query query, CrawlPlan plan, CrawlProgress progress) {
        Zone searchZone = zone.withRadius(query.radiusM());
        progress.increment("searches_" + query.category());

        PlaceSearchClient.PageIterator pages = searchClient.pages(searchZone, query.keyword(), maxPages);
        List<PlaceCandidate> candidates = new ArrayList<>();
        try {
            while (pages.hasNext()) {
                candidates.addAll(pages.next().candidates());
            }
        } catch (ProviderException e) {
            log.warn("Search '{}' in {} failed: {}", query.keyword(), zone.name(), e.getMessage());
            progress.increment(SEARCH_FAILED);
            recordNearbyCalls(progress, pages.callsMade());
            return;
        }
        recordNearbyCalls(progress, pages.callsMade());

        log.debug("'{}' in {}: {} candidates from {} call(s)",
                query.keyword(), zone.name(), candidates.size(), pages.callsMade());

        for (PlaceCandidate candidate : candidates) {
            processCandidate(candidate, zone, query, plan, progress);
        }
    }

    private void processCandidate(PlaceCandidate candidate, Zone zone, Query query,
                                  CrawlPlan plan, CrawlProgress progress) {
        String placeId = candidate.placeId();
        if (progress.hasRecord(placeId)) return;

        if (plan.excludedPlaceIds().contains(placeId)) {
            progress.increment(DUPLICATES_AVOIDED);
            return;
        }

        if (!relevanceFilter.isRelevant(candidate.name(), candidate.types(), query.category())) {
            progress.increment(FILTERED_IRRELEVANT);
            return;
        }

        if (!progress.claim(placeId)) return;

        Optional<PlaceDetail> detail = searchClient.fetchDetail(placeId, () -> {
            progress.increment(PLACE_DETAILS_CALLS);
            progress.addApiCalls(1);
        });
        if (detail.isEmpty()) {
            progress.increment(DETAIL_FAILED);
            return;
        }

        PlaceDetail d = detail.get();
        String name = d.getName() != null ? d.getName() : candidate.name();
        String subCategory = classifier.refine(name, candidate.types(), query.category(), query.subCategory());
        if (d.getPlaceId() == null) d.setPlaceId(placeId);

        PlaceRecord record = recordMapper.build(d, candidate.types(), query.category(), subCategory,
                zone.name(), query.keyword(), query.radiusM());

        if (progress.putIfAbsent(record)) {
            progress.increment("found_" + query.category());
            progress.increment("found_" + subCategory);
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private void recordNearbyCalls(CrawlProgress progress, int calls) {
        progress.add(NEARBY_SEARCH_CALLS, calls);
        progress.addApiCalls(calls);
    }

    private void saveCheckpoint(CrawlProgress progress) {
        try {
            checkpointStore.save(progress);
        } catch (PersistenceException e) {
            log.error("Checkpoint save failed, stopping crawl: {}", e.getMessage());
            throw e;
        }
    }

    private boolean stopRequested() {
        return cancelRequested.get() || Thread.currentThread().isInterrupted();
    }

    private CrawlProgress interrupted(CrawlProgress progress) {
        state.set(CrawlState.INTERRUPTED);
        log.warn("Crawl interrupted: {} zones completed, {} records saved to {}",
                progress.getCompletedZones().size(), progress.recordCount(), checkpointStore.getCheckpointPath());
        return progress;
    }

    private static ThreadFactory queryThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "crawl-query-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
