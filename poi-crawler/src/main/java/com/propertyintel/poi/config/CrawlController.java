package com.propertyintel.poi.config;

import com.propertyintel.poi.exception.ConfigurationException;
import com.propertyintel.poi.model.CrawlPlan;
import com.propertyintel.poi.model.CrawlRun;
import com.propertyintel.poi.service.PlaceCrawlService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class CrawlController {

    private final PlaceCrawlService crawlService;

    // ── Crawl control ─────────────────────────────────────────────────────────

    /**
     * Validate configuration and start a crawl in the background.
     * Resumes from the checkpoint when one exists.
     */
    @PostMapping("/crawl/trigger")
    public ResponseEntity<Map<String, Object>> trigger() {
        try {
            CrawlPlan plan = crawlService.preparePlan();
            new Thread(() -> crawlService.execute(plan), "manual-crawl").start();
            return ResponseEntity.accepted().body(Map.of(
                    "status", "accepted",
                    "zones", plan.zones().size(),
                    "queries", plan.queries().size()));
        } catch (ConfigurationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/crawl/cancel")
    public ResponseEntity<Map<String, String>> cancel() {
        if (!crawlService.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "No crawl is running"));
        }
        crawlService.cancel();
        return ResponseEntity.accepted().body(Map.of("status", "cancelling"));
    }

    @GetMapping("/crawl/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "property-intel-poi-crawler");
        body.put("version", "1.0.0");
        body.put("running", crawlService.isRunning());
        if (crawlService.getCurrentZone() != null) {
            body.put("currentZone", crawlService.getCurrentZone());
        }
        CrawlRun lastRun = crawlService.getLastRun();
        if (lastRun != null) {
            body.put("lastRun", lastRun);
        }
        return ResponseEntity.ok(body);
    }

    // ── Dataset operations ────────────────────────────────────────────────────

    /**
     * Merge datasets; earlier files win on overlapping place ids.
     *
     * POST /datasets/merge?input=main.csv&amp;input=supplementary.csv
     */
    @PostMapping("/datasets/merge")
    public ResponseEntity<?> merge(@RequestParam("input") List<String> inputs) {
        try {
            Path output = crawlService.merge(inputs.stream().map(Paths::get).toList());
            return ResponseEntity.ok(Map.of("output", output.toString()));
        } catch (ConfigurationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Merge failed for {}: {}", inputs, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * POST /datasets/clean?input=poi_dataset_20250805_095802.csv
     */
    @PostMapping("/datasets/clean")
    public ResponseEntity<?> clean(@RequestParam String input) {
        try {
            Path output = crawlService.clean(Paths.get(input));
            return ResponseEntity.ok(Map.of("output", output.toString()));
        } catch (ConfigurationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Clean failed for {}: {}", input, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }
}
