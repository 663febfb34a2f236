package com.propertyintel.poi.service;

import com.propertyintel.poi.config.PoiCrawlerProperties;
import com.propertyintel.poi.exception.ConfigurationException;
import com.propertyintel.poi.model.CrawlPlan;
import com.propertyintel.poi.model.CrawlProgress;
import com.propertyintel.poi.model.CrawlRun;
import com.propertyintel.poi.model.CrawlState;
import com.propertyintel.poi.model.MergeResult;
import com.propertyintel.poi.model.PlaceRecord;
import com.propertyintel.poi.model.Query;
import com.propertyintel.poi.model.Zone;
import com.propertyintel.poi.output.CheckpointStore;
import com.propertyintel.poi.output.DatasetCsvWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Orchestrates a crawl: validate, load catalog, resume from checkpoint, crawl,
 * write the dataset, clear the checkpoint.
 *
 * Also hosts the offline dataset operations (merge, clean), which never call the
 * place-search API.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PlaceCrawlService {

    private final PoiCrawlerProperties properties;
    private final CatalogCsvLoader catalogLoader;
    private final CrawlEngine engine;
    private final CheckpointStore checkpointStore;
    private final DatasetCsvWriter csvWriter;
    private final DatasetReconciler reconciler;
    private final DatasetCleaner cleaner;
    private final CrawlReportLogger reportLogger;
    private final Clock clock;

    private final AtomicBoolean runSlot = new AtomicBoolean();
    private volatile CrawlRun lastRun;

    /**
     * Reserve the single crawl slot, validate configuration and build the crawl plan.
     * Makes no API calls. On success the slot stays held until {@link #execute} returns,
     * so the caller must execute the plan.
     *
     * @throws ConfigurationException on a missing API key, bad catalog or bad exclusion dataset
     * @throws IllegalStateException  if a crawl is already prepared or running
     */
    public CrawlPlan preparePlan() {
        if (!runSlot.compareAndSet(false, true)) {
            throw new IllegalStateException("A crawl is already running");
        }
        try {
            return buildPlan();
        } catch (RuntimeException e) {
            runSlot.set(false);
            throw e;
        }
    }

    private CrawlPlan buildPlan() {
        if (!StringUtils.hasText(properties.getApi().getKey())) {
            throw new ConfigurationException(
                    "No Places API key configured (set GOOGLE_MAPS_API_KEY or poi-crawler.api.key)");
        }

        List<Zone> zones = catalogLoader.loadZones(Paths.get(properties.getCatalog().getZonesFile()));
        List<Query> queries = catalogLoader.loadQueries(Paths.get(properties.getCatalog().getQueriesFile()));

        Set<String> excluded = Set.of();
        String excludeDataset = properties.getCrawl().getExcludeDataset();
        if (StringUtils.hasText(excludeDataset)) {
            excluded = reconciler.loadDataset(Paths.get(excludeDataset)).stream()
                    .map(PlaceRecord::getPlaceId)
                    .collect(Collectors.toSet());
            log.info("Excluding {} place ids already present in {}", excluded.size(), excludeDataset);
        }

        CrawlPlan plan = new CrawlPlan(zones, queries, excluded);
        log.info("Crawl plan: {} zones × {} queries = {} searches", zones.size(), queries.size(), plan.totalSearches());
        return plan;
    }

    public CrawlRun crawl() {
        return execute(preparePlan());
    }

    /**
     * Run a plan from {@link #preparePlan} to completion, cancellation or failure and
     * release the crawl slot. The outcome is on the returned run.
     *
     * @throws IllegalStateException if no plan has been prepared
     */
    public CrawlRun execute(CrawlPlan plan) {
        if (!runSlot.get()) {
            throw new IllegalStateException("No crawl has been prepared");
        }
        try {
            return runPlan(plan);
        } finally {
            runSlot.set(false);
        }
    }

    private CrawlRun runPlan(CrawlPlan plan) {
        CrawlRun run = CrawlRun.builder()
                .runId(UUID.randomUUID().toString())
                .startedAt(LocalDateTime.now(clock))
                .status(CrawlState.RUNNING)
                .zonesTotal(plan.zones().size())
                .build();
        lastRun = run;

        String prefix = properties.getOutput().getFilePrefix();
        Path partialPath = csvWriter.timestampedPath(prefix, "partial");
        CrawlProgress progress = CrawlProgress.empty();

        try {
            progress = checkpointStore.load().orElseGet(CrawlProgress::empty);
            CrawlProgress restored = progress;
            run.setZonesResumed((int) plan.zones().stream().filter(z -> restored.isZoneCompleted(z.name())).count());
            if (run.getZonesResumed() > 0) {
                log.info("Resuming: {} of {} zones already completed, {} records restored",
                        run.getZonesResumed(), plan.zones().size(), progress.recordCount());
            }

            engine.run(plan, progress, (zone, p) -> {
                run.setZonesCompleted(p.getCompletedZones().size());
                if (properties.getOutput().isWritePartial()) {
                    csvWriter.write(p.getRecords().values(), partialPath);
                }
            });

            if (engine.getState() == CrawlState.COMPLETED) {
                List<PlaceRecord> records = new ArrayList<>(progress.getRecords().values());
                Path output = csvWriter.writeTimestamped(records, prefix, null);
                run.setOutputFile(output.toString());
                checkpointStore.clear();
                reportLogger.logDatasetBreakdown("Crawl dataset", records);
            } else {
                run.setOutputFile(csvWriter.writeTimestamped(progress.getRecords().values(), prefix, "partial").toString());
            }
            run.setStatus(engine.getState());

        } catch (Exception e) {
            log.error("Crawl failed: {}", e.getMessage(), e);
            run.setStatus(CrawlState.FAILED);
            run.setErrorMessage(e.getMessage());
        } finally {
            run.setCompletedAt(LocalDateTime.now(clock));
            run.setZonesCompleted(progress.getCompletedZones().size());
            run.setRecordsFound(progress.recordCount());
            run.setApiCalls(progress.getApiCalls());
            run.setStats(progress.getStats());
            reportLogger.logCrawlSummary(progress.getStats(), progress.getApiCalls());
            log.info("Run {} finished with status {} ({} records, output: {})",
                    run.getRunId(), run.getStatus(), run.getRecordsFound(), run.getOutputFile());
        }
        return run;
    }

    public void cancel() {
        engine.cancel();
    }

    public boolean isRunning() {
        return runSlot.get();
    }

    public CrawlRun getLastRun() {
        return lastRun;
    }

    public String getCurrentZone() {
        return engine.getCurrentZone();
    }

    // ── Dataset operations ───────────────────────────────────────────────────

    /**
     * Merge datasets in order of precedence and write the result.
     *
     * @return path of the merged CSV
     */
    public Path merge(List<Path> inputs) {
        if (inputs.size() < 2) {
            throw new ConfigurationException("Merging needs at least two datasets, got " + inputs.size());
        }
        List<List<PlaceRecord>> datasets = inputs.stream().map(reconciler::loadDataset).toList();
        MergeResult result = reconciler.mergeAll(datasets);

        Path output = csvWriter.writeTimestamped(result.records(), properties.getOutput().getFilePrefix(), "COMPLETE");
        reportLogger.logDatasetBreakdown("Merged dataset", result.records());
        return output;
    }

    /**
     * @return path of the cleaned CSV
     */
    public Path clean(Path input) {
        List<PlaceRecord> cleaned = cleaner.clean(reconciler.loadDataset(input));
        Path output = csvWriter.writeTimestamped(cleaned, properties.getOutput().getFilePrefix(), "CLEAN");
        reportLogger.logDatasetBreakdown("Cleaned dataset", cleaned);
        return output;
    }
}
