package com.propertyintel.poi.scheduler;

import com.propertyintel.poi.config.PoiCrawlerProperties;
import com.propertyintel.poi.service.PlaceCrawlService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;

/**
 * Runs the configured startup action once the application is ready.
 *
 * poi-crawler.startup.action = NONE | CRAWL | MERGE | CLEAN
 * (STARTUP_ACTION env var). With NONE the crawler waits for HTTP triggers.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StartupTaskRunner {

    private final PlaceCrawlService crawlService;
    private final PoiCrawlerProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        PoiCrawlerProperties.Startup startup = properties.getStartup();
        switch (startup.getAction()) {
            case NONE -> log.info("Crawler ready. Trigger with POST /crawl/trigger");
            case CRAWL -> runSafely("crawl", crawlService::crawl);
            case MERGE -> runSafely("merge", () ->
                    crawlService.merge(startup.getMergeInputs().stream().map(Paths::get).toList()));
            case CLEAN -> runSafely("clean", () -> crawlService.clean(Paths.get(startup.getCleanInput())));
        }
    }

    private void runSafely(String action, Runnable task) {
        log.info("STARTUP_ACTION={}, running now", action);
        try {
            task.run();
        } catch (Exception e) {
            log.error("Startup {} failed: {}", action, e.getMessage(), e);
        }
    }
}
