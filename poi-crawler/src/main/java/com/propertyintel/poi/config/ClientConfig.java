package com.propertyintel.poi.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.poi.exception.TransientProviderException;
import com.propertyintel.poi.output.CheckpointStore;
import com.propertyintel.poi.rules.PopularityScorer;
import com.propertyintel.poi.rules.RelevanceFilter;
import com.propertyintel.poi.rules.RelevanceProfile;
import com.propertyintel.poi.rules.SubCategoryClassifier;
import com.propertyintel.poi.service.CallRateLimiter;
import com.propertyintel.poi.service.CrawlEngine;
import com.propertyintel.poi.service.PlaceRecordMapper;
import com.propertyintel.poi.service.PlaceSearchClient;
import com.propertyintel.poi.service.PlaceSearchProvider;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;

/**
 * Wiring for the crawl pipeline. The engine and its collaborators are plain classes
 * so tests can build them without a Spring context.
 */
@Configuration
@Slf4j
public class ClientConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public RestTemplate placesRestTemplate(RestTemplateBuilder builder, PoiCrawlerProperties properties) {
        PoiCrawlerProperties.Api api = properties.getApi();
        return builder
                .setConnectTimeout(Duration.ofMillis(api.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(api.getReadTimeoutMs()))
                .build();
    }

    @Bean
    public Retry placesApiRetry(PoiCrawlerProperties properties) {
        PoiCrawlerProperties.Api.Retry cfg = properties.getApi().getRetry();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(cfg.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Duration.ofMillis(cfg.getWaitDurationMs()), cfg.getBackoffMultiplier()))
                .retryExceptions(TransientProviderException.class)
                .build();

        Retry retry = Retry.of("placesApi", config);
        retry.getEventPublisher().onRetry(event -> log.warn("Retrying Places API call (attempt {}): {}",
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }

    @Bean
    public CallRateLimiter callRateLimiter(PoiCrawlerProperties properties) {
        return new CallRateLimiter(properties.getApi().getRequestsPerSecond());
    }

    @Bean
    public PlaceSearchClient placeSearchClient(PlaceSearchProvider provider,
                                               CallRateLimiter rateLimiter,
                                               Retry placesApiRetry,
                                               PoiCrawlerProperties properties) {
        return new PlaceSearchClient(provider, rateLimiter, placesApiRetry,
                properties.getApi().getPageTokenDelayMs(), properties.getApi().getMaxPages());
    }

    @Bean
    public RelevanceFilter relevanceFilter(PoiCrawlerProperties properties) {
        PoiCrawlerProperties.Crawl crawl = properties.getCrawl();
        RelevanceProfile profile = switch (crawl.getProfile()) {
            case COMPREHENSIVE -> RelevanceProfile.comprehensive();
            case COMMUNITY -> RelevanceProfile.community();
        };
        log.info("Relevance profile: {}", profile.name());
        return new RelevanceFilter(profile.withExtraExclusions(
                crawl.getExtraIrrelevantTypes(), crawl.getExtraIrrelevantNamePatterns()));
    }

    @Bean
    public SubCategoryClassifier subCategoryClassifier() {
        return SubCategoryClassifier.defaults();
    }

    @Bean
    public PlaceRecordMapper placeRecordMapper(PopularityScorer scorer, PoiCrawlerProperties properties, Clock clock) {
        return new PlaceRecordMapper(scorer, properties.getCrawl().getBufferRadii(), clock);
    }

    @Bean
    public CheckpointStore checkpointStore(PoiCrawlerProperties properties, ObjectMapper objectMapper, Clock clock) {
        return new CheckpointStore(Paths.get(properties.getCheckpoint().getPath()), objectMapper, clock);
    }

    @Bean
    public CrawlEngine crawlEngine(PlaceSearchClient searchClient,
                                   RelevanceFilter relevanceFilter,
                                   SubCategoryClassifier classifier,
                                   PlaceRecordMapper recordMapper,
                                   CheckpointStore checkpointStore,
                                   PoiCrawlerProperties properties) {
        return new CrawlEngine(searchClient, relevanceFilter, classifier, recordMapper, checkpointStore,
                properties.getApi().getMaxPages(), properties.getCrawl().getParallelism());
    }
}
