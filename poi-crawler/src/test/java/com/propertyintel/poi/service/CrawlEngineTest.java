package com.propertyintel.poi.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.poi.exception.PersistenceException;
import com.propertyintel.poi.exception.TransientProviderException;
import com.propertyintel.poi.model.CrawlPlan;
import com.propertyintel.poi.model.CrawlProgress;
import com.propertyintel.poi.model.CrawlState;
import com.propertyintel.poi.model.PlaceRecord;
import com.propertyintel.poi.model.Query;
import com.propertyintel.poi.model.Zone;
import com.propertyintel.poi.output.CheckpointStore;
import com.propertyintel.poi.rules.PopularityScorer;
import com.propertyintel.poi.rules.RelevanceFilter;
import com.propertyintel.poi.rules.RelevanceProfile;
import com.propertyintel.poi.rules.SubCategoryClassifier;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.propertyintel.poi.service.StubPlaceSearchProvider.candidate;
import static com.propertyintel.poi.service.StubPlaceSearchProvider.detailOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class CrawlEngineTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2025-08-05T09:58:02Z"), ZoneOffset.UTC);

    private static final Zone Z1 = new Zone("Z1", -6.26, 106.81, 5000);
    private static final Zone Z2 = new Zone("Z2", -6.18, 106.83, 4000);
    private static final Zone Z3 = new Zone("Z3", -6.22, 106.90, 6000);

    private static final Query VET = new Query("vet clinic", "Competitor", "Clinic_General");
    private static final Query GROOM = new Query("pet grooming", "Competitor", "Grooming_Only");

    @TempDir
    Path tempDir;

    private StubPlaceSearchProvider provider;

    @BeforeEach
    void setUp() {
        provider = new StubPlaceSearchProvider();
    }

    private CheckpointStore store(String name) {
        return new CheckpointStore(tempDir.resolve(name), new ObjectMapper(), FIXED_CLOCK);
    }

    private CrawlEngine engine(CheckpointStore store, int parallelism) {
        return engine(store, parallelism, new PlaceSearchClient(provider, new CallRateLimiter(10_000), 0, 3));
    }

    private CrawlEngine engine(CheckpointStore store, int parallelism, PlaceSearchClient client) {
        PlaceRecordMapper mapper = new PlaceRecordMapper(new PopularityScorer(),
                Map.of("Competitor", Map.of("Clinic_Only", 2000, "Grooming_Only", 1500)), FIXED_CLOCK);
        return new CrawlEngine(client, new RelevanceFilter(RelevanceProfile.comprehensive()),
                SubCategoryClassifier.defaults(), mapper, store, 3, parallelism);
    }

    @Nested
    @DisplayName("single zone scenarios")
    class Scenarios {

        @Test
        @DisplayName("vet clinic in Z1 becomes a Competitor record scored 0.09")
        void vetClinicScenario() {
            // given
            provider.page("Z1", "vet clinic", candidate("P1", "Happy Paws Vet", "veterinary_care"))
                    .detail(detailOf("P1", "Happy Paws Vet", 4.5, 100));

            // when
            CrawlProgress progress = engine(store("cp.json"), 1)
                    .run(new CrawlPlan(List.of(Z1), List.of(VET)), CrawlProgress.empty());

            // then
            PlaceRecord record = progress.getRecords().get("P1");
            assertThat(record).isNotNull();
            assertThat(record.getCategory()).isEqualTo("Competitor");
            assertThat(record.getSubCategory()).isEqualTo("Clinic_Only");
            assertThat(record.getPopularityScore()).isEqualTo(0.09);
            assertThat(record.getBufferRadiusM()).isEqualTo(2000);
            assertThat(record.getSearchZone()).isEqualTo("Z1");
            assertThat(record.getSearchKeyword()).isEqualTo("vet clinic");
            assertThat(record.getTypes()).isEqualTo("veterinary_care");
            assertThat(progress.stat("found_Competitor")).isEqualTo(1);
            assertThat(progress.stat("found_Clinic_Only")).isEqualTo(1);
            assertThat(progress.stat("searches_Competitor")).isEqualTo(1);
        }

        @Test
        @DisplayName("parking candidate is filtered without a detail call")
        void parkingIsFilteredBeforeDetail() {
            provider.page("Z1", "vet clinic", candidate("PARK", "Vet Clinic Parking", "parking"))
                    .detail(detailOf("PARK", "Vet Clinic Parking", 4.0, 50));

            CrawlProgress progress = engine(store("cp.json"), 1)
                    .run(new CrawlPlan(List.of(Z1), List.of(VET)), CrawlProgress.empty());

            assertThat(progress.stat(CrawlEngine.FILTERED_IRRELEVANT)).isEqualTo(1);
            assertThat(provider.detailCalls("PARK")).isZero();
            assertThat(progress.recordCount()).isZero();
        }

        @Test
        @DisplayName("a place found by several queries and zones is fetched once")
        void duplicatesFetchedOnce() {
            provider.page("Z1", "vet clinic", candidate("P1", "Vet", "veterinary_care"))
                    .page("Z1", "pet grooming", candidate("P1", "Vet", "veterinary_care"))
                    .page("Z2", "vet clinic", candidate("P1", "Vet", "veterinary_care"))
                    .detail(detailOf("P1", "Vet", 4.0, 10));

            CrawlProgress progress = engine(store("cp.json"), 1)
                    .run(new CrawlPlan(List.of(Z1, Z2), List.of(VET, GROOM)), CrawlProgress.empty());

            assertThat(provider.detailCalls("P1")).isEqualTo(1);
            assertThat(progress.recordCount()).isEqualTo(1);
            assertThat(progress.stat(CrawlEngine.PLACE_DETAILS_CALLS)).isEqualTo(1);
        }

        @Test
        @DisplayName("ids from a prior dataset are skipped and counted")
        void excludedIdsSkipped() {
            provider.page("Z1", "vet clinic",
                            candidate("OLD", "Old Vet", "veterinary_care"),
                            candidate("NEW", "New Vet", "veterinary_care"))
                    .detail(detailOf("OLD", "Old Vet", 4.0, 10))
                    .detail(detailOf("NEW", "New Vet", 4.0, 10));

            CrawlProgress progress = engine(store("cp.json"), 1)
                    .run(new CrawlPlan(List.of(Z1), List.of(VET), Set.of("OLD")), CrawlProgress.empty());

            assertThat(progress.getRecords()).containsOnlyKeys("NEW");
            assertThat(progress.stat(CrawlEngine.DUPLICATES_AVOIDED)).isEqualTo(1);
            assertThat(provider.detailCalls("OLD")).isZero();
        }

        @Test
        @DisplayName("missing detail is counted and the place is not recorded")
        void missingDetailCounted() {
            provider.page("Z1", "vet clinic", candidate("GONE", "Closed Vet", "veterinary_care"));

            CrawlProgress progress = engine(store("cp.json"), 1)
                    .run(new CrawlPlan(List.of(Z1), List.of(VET)), CrawlProgress.empty());

            assertThat(progress.stat(CrawlEngine.DETAIL_FAILED)).isEqualTo(1);
            assertThat(progress.recordCount()).isZero();
        }

        @Test
        @DisplayName("query radius overrides the zone radius and becomes the buffer hint")
        void queryRadiusOverride() {
            List<Integer> radii = new ArrayList<>();
            provider.onSearch((zone, keyword) -> radii.add(zone.radiusM()))
                    .page("Z1", "masjid", candidate("M1", "Masjid Raya", "mosque"))
                    .detail(detailOf("M1", "Masjid Raya", 4.8, 900));

            Query mosque = new Query("masjid", "Community_Infrastructure", "Mosque", 1000);
            CrawlProgress progress = engine(store("cp.json"), 1)
                    .run(new CrawlPlan(List.of(Z1), List.of(mosque)), CrawlProgress.empty());

            assertThat(radii).containsExactly(1000);
            assertThat(progress.getRecords().get("M1").getBufferRadiusM()).isEqualTo(1000);
        }
    }

    @Nested
    @DisplayName("provider failures")
    class ProviderFailures {

        @Test
        @DisplayName("a failed search is counted and the crawl carries on")
        void failedSearchDoesNotStopCrawl() {
            provider.failSearch("Z1", "vet clinic")
                    .page("Z1", "pet grooming", candidate("G1", "Groomer", "pet_store"))
                    .detail(detailOf("G1", "Groomer", 4.0, 20));

            CrawlEngine engine = engine(store("cp.json"), 1);
            CrawlProgress progress = engine.run(new CrawlPlan(List.of(Z1), List.of(VET, GROOM)), CrawlProgress.empty());

            assertThat(engine.getState()).isEqualTo(CrawlState.COMPLETED);
            assertThat(progress.stat(CrawlEngine.SEARCH_FAILED)).isEqualTo(1);
            assertThat(progress.getRecords()).containsOnlyKeys("G1");
            assertThat(progress.getCompletedZones()).containsExactly("Z1");
        }

        @Test
        @DisplayName("retried requests are counted as API calls")
        void retriesCounted() {
            provider.page("Z1", "vet clinic", candidate("P1", "Happy Paws Vet", "veterinary_care"))
                    .detail(detailOf("P1", "Happy Paws Vet", 4.5, 100))
                    .throttle("Z1|vet clinic", 2)
                    .throttle("P1", 1);
            Retry retry = Retry.of("test", RetryConfig.custom()
                    .maxAttempts(3)
                    .waitDuration(Duration.ofMillis(1))
                    .retryExceptions(TransientProviderException.class)
                    .build());
            PlaceSearchClient retrying = new PlaceSearchClient(provider, new CallRateLimiter(10_000), retry, 0, 3);

            CrawlProgress progress = engine(store("cp.json"), 1, retrying)
                    .run(new CrawlPlan(List.of(Z1), List.of(VET)), CrawlProgress.empty());

            assertThat(progress.getRecords()).containsOnlyKeys("P1");
            assertThat(progress.stat(CrawlEngine.NEARBY_SEARCH_CALLS)).isEqualTo(3);
            assertThat(progress.stat(CrawlEngine.PLACE_DETAILS_CALLS)).isEqualTo(2);
            assertThat(progress.getApiCalls()).isEqualTo(5);
            assertThat(provider.nearbyCalls()).isEqualTo(3);
            assertThat(provider.detailCalls("P1")).isEqualTo(2);
        }

        @Test
        @DisplayName("pages before a failed continuation are kept")
        void continuationFailureKeepsEarlierPages() {
            provider.page("Z1", "vet clinic", candidate("A", "Vet A", "veterinary_care"))
                    .page("Z1", "vet clinic", candidate("B", "Vet B", "veterinary_care"))
                    .failPage("Z1", "vet clinic", 1)
                    .detail(detailOf("A", "Vet A", 4.0, 10));

            CrawlProgress progress = engine(store("cp.json"), 1)
                    .run(new CrawlPlan(List.of(Z1), List.of(VET)), CrawlProgress.empty());

            assertThat(progress.getRecords()).containsOnlyKeys("A");
            assertThat(progress.stat(CrawlEngine.NEARBY_SEARCH_CALLS)).isEqualTo(2);
        }

        @Test
        @DisplayName("a checkpoint write failure fails the crawl")
        void checkpointFailureIsFatal() {
            CheckpointStore failing = mock(CheckpointStore.class);
            doThrow(new PersistenceException("disk full")).when(failing).save(any());
            CrawlEngine engine = engine(failing, 1);

            assertThatThrownBy(() -> engine.run(new CrawlPlan(List.of(Z1, Z2), List.of(VET)), CrawlProgress.empty()))
                    .isInstanceOf(PersistenceException.class);
            assertThat(engine.getState()).isEqualTo(CrawlState.FAILED);
        }
    }

    @Nested
    @DisplayName("checkpoint and resume")
    class Resume {

        private void populate() {
            for (Zone zone : List.of(Z1, Z2, Z3)) {
                provider.page(zone.name(), "vet clinic",
                                candidate(zone.name() + "-V1", "Vet " + zone.name(), "veterinary_care"),
                                candidate("SHARED", "Shared Vet", "veterinary_care"))
                        .page(zone.name(), "vet clinic",
                                candidate(zone.name() + "-V2", "Vet 24 Jam " + zone.name(), "veterinary_care"))
                        .page(zone.name(), "pet grooming",
                                candidate(zone.name() + "-G1", "Grooming " + zone.name(), "pet_store"),
                                candidate(zone.name() + "-P", "Parking " + zone.name(), "parking"));
                provider.detail(detailOf(zone.name() + "-V1", "Vet " + zone.name(), 4.2, 300))
                        .detail(detailOf(zone.name() + "-V2", "Vet 24 Jam " + zone.name(), 4.9, 2000))
                        .detail(detailOf(zone.name() + "-G1", "Grooming " + zone.name(), 3.0, 40));
            }
            provider.detail(detailOf("SHARED", "Shared Vet", 4.0, 500));
        }

        @Test
        @DisplayName("each completed zone is checkpointed")
        void checkpointAfterEachZone() {
            populate();
            CheckpointStore store = store("cp.json");
            List<List<String>> seen = new ArrayList<>();

            engine(store, 1).run(new CrawlPlan(List.of(Z1, Z2), List.of(VET, GROOM)), CrawlProgress.empty(),
                    (zone, p) -> seen.add(store.load().orElseThrow().getCompletedZones()));

            assertThat(seen).containsExactly(List.of("Z1"), List.of("Z1", "Z2"));
        }

        @Test
        @DisplayName("interrupt then resume yields the same records as an uninterrupted run")
        void resumeMatchesUninterruptedRun() {
            populate();
            CrawlPlan plan = new CrawlPlan(List.of(Z1, Z2, Z3), List.of(VET, GROOM));

            // uninterrupted reference
            CrawlProgress reference = engine(store("reference.json"), 1).run(plan, CrawlProgress.empty());

            // interrupted during Z2, after its first query
            CheckpointStore store = store("resumed.json");
            CrawlEngine first = engine(store, 1);
            provider.onSearch((zone, keyword) -> {
                if (zone.name().equals("Z2")) first.cancel();
            });
            first.run(plan, CrawlProgress.empty());
            assertThat(first.getState()).isEqualTo(CrawlState.INTERRUPTED);
            assertThat(store.load().orElseThrow().getCompletedZones()).containsExactly("Z1");

            // restart from the checkpoint in a fresh engine
            provider.onSearch((zone, keyword) -> { });
            CrawlEngine second = engine(store, 1);
            CrawlProgress resumed = second.run(plan, store.load().orElseThrow());

            assertThat(second.getState()).isEqualTo(CrawlState.COMPLETED);
            assertThat(new ArrayList<>(resumed.getRecords().values()))
                    .containsExactlyElementsOf(reference.getRecords().values());
            assertThat(resumed.getStats()).isEqualTo(reference.getStats());
            assertThat(resumed.getCompletedZones()).containsExactly("Z1", "Z2", "Z3");
        }

        @Test
        @DisplayName("completed zones are not searched again")
        void completedZonesSkipped() {
            populate();
            CrawlProgress restored = CrawlProgress.restore(List.of("Z1"), List.of(), Map.of(), 0);

            engine(store("cp.json"), 1).run(new CrawlPlan(List.of(Z1), List.of(VET)), restored);

            assertThat(provider.nearbyCalls()).isZero();
        }
    }

    @Nested
    @DisplayName("parallel queries")
    class Parallel {

        @Test
        @DisplayName("parallel crawl records the same places with one detail call each")
        void parallelMatchesSequential() throws Exception {
            List<Query> queries = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                String keyword = "kw" + i;
                queries.add(new Query(keyword, "Competitor", "Clinic_General"));
                provider.page("Z1", keyword,
                        candidate("SHARED", "Shared Vet", "veterinary_care"),
                        candidate("U" + i, "Vet " + i, "veterinary_care"));
                provider.detail(detailOf("U" + i, "Vet " + i, 4.0, 100));
            }
            provider.detail(detailOf("SHARED", "Shared Vet", 4.0, 100));

            CrawlEngine engine = engine(store("cp.json"), 4);
            CrawlProgress progress = engine.run(new CrawlPlan(List.of(Z1), queries), CrawlProgress.empty());

            assertThat(engine.getState()).isEqualTo(CrawlState.COMPLETED);
            assertThat(progress.recordCount()).isEqualTo(9);
            assertThat(provider.detailCalls("SHARED")).isEqualTo(1);
            assertThat(provider.totalDetailCalls()).isEqualTo(9);
            assertThat(Files.exists(tempDir.resolve("cp.json"))).isTrue();
        }
    }
}
