package com.propertyintel.poi.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "poi-crawler")
@Data
public class PoiCrawlerProperties {

    private Api api = new Api();
    private Catalog catalog = new Catalog();
    private Crawl crawl = new Crawl();
    private Checkpoint checkpoint = new Checkpoint();
    private Output output = new Output();
    private Cleaning cleaning = new Cleaning();
    private Pricing pricing = new Pricing();
    private Startup startup = new Startup();

    @Data
    public static class Api {
        private String baseUrl = "https://maps.googleapis.com/maps/api/place";
        private String key;
        /** Result language, e.g. "id" for Indonesian. Provider default when blank. */
        private String language;
        private double requestsPerSecond = 10.0;
        /** Continuation tokens are not valid immediately after they are issued */
        private long pageTokenDelayMs = 2000;
        private int maxPages = 3;
        private int connectTimeoutMs = 10_000;
        private int readTimeoutMs = 30_000;
        private Retry retry = new Retry();

        @Data
        public static class Retry {
            private int maxAttempts = 3;
            private long waitDurationMs = 500;
            private double backoffMultiplier = 2.0;
        }
    }

    @Data
    public static class Catalog {
        private String zonesFile = "search_zones.csv";
        private String queriesFile = "queries.csv";
    }

    @Data
    public static class Crawl {
        private FilterProfile profile = FilterProfile.COMPREHENSIVE;
        private int parallelism = 1;
        /** Prior dataset whose place ids must not be fetched again */
        private String excludeDataset;
        private List<String> extraIrrelevantTypes = new ArrayList<>();
        private List<String> extraIrrelevantNamePatterns = new ArrayList<>();
        /** category → sub-category → buffer radius in metres */
        private Map<String, Map<String, Integer>> bufferRadii = defaultBufferRadii();

        public enum FilterProfile {
            COMPREHENSIVE, COMMUNITY
        }

        private static Map<String, Map<String, Integer>> defaultBufferRadii() {
            Map<String, Integer> competitor = new LinkedHashMap<>();
            competitor.put("Clinic+Grooming", 3000);
            competitor.put("Emergency_Hospital", 3000);
            competitor.put("Clinic_Only", 2000);
            competitor.put("Grooming_Only", 1500);
            competitor.put("Pet_Hotel", 1500);
            Map<String, Map<String, Integer>> radii = new LinkedHashMap<>();
            radii.put("Competitor", competitor);
            return radii;
        }
    }

    @Data
    public static class Checkpoint {
        private String path = "batch_progress.json";
    }

    @Data
    public static class Output {
        private String outputDir = "output";
        private String filePrefix = "poi_dataset";
        /** Write a *_partial.csv snapshot after every completed zone */
        private boolean writePartial = true;
    }

    @Data
    public static class Cleaning {
        private boolean requireOperational = true;
        private List<String> competitorSubCategories = new ArrayList<>(List.of(
                "Clinic_Only", "Clinic+Grooming", "Grooming_Only", "Pet_Hotel", "Emergency_Hospital"));
        private int minAffluenceReviews = 10;
    }

    @Data
    public static class Pricing {
        private double nearbySearchPerCall = 0.032;
        private double placeDetailsPerCall = 0.017;
    }

    @Data
    public static class Startup {
        private Action action = Action.NONE;
        private List<String> mergeInputs = new ArrayList<>();
        private String cleanInput;

        public enum Action {
            NONE, CRAWL, MERGE, CLEAN
        }
    }
}
