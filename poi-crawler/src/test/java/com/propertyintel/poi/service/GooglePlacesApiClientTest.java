package com.propertyintel.poi.service;

import com.propertyintel.poi.config.PoiCrawlerProperties;
import com.propertyintel.poi.exception.ProviderException;
import com.propertyintel.poi.exception.TransientProviderException;
import com.propertyintel.poi.model.PlaceDetail;
import com.propertyintel.poi.model.SearchPage;
import com.propertyintel.poi.model.SearchResult;
import com.propertyintel.poi.model.Zone;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GooglePlacesApiClientTest {

    private static final String BASE = "https://places.test/api";
    private static final Zone ZONE = new Zone("Kemang", -6.26, 106.81, 4000);

    private MockRestServiceServer server;
    private GooglePlacesApiClient client;
    private CallRateLimiter limiter;
    private PlaceSearchClient searchClient;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        PoiCrawlerProperties properties = new PoiCrawlerProperties();
        properties.getApi().setBaseUrl(BASE);
        properties.getApi().setKey("test-key");

        Retry retry = Retry.of("placesApi", RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(TransientProviderException.class)
                .build());

        client = new GooglePlacesApiClient(restTemplate, properties);
        limiter = mock(CallRateLimiter.class);
        searchClient = new PlaceSearchClient(client, limiter, retry, 0, 3);
    }

    private static String nearbyJson(String status, String token) {
        return """
                {
                  "status": "%s",
                  %s
                  "results": [
                    {"place_id": "P1", "name": "Happy Paws Vet", "types": ["veterinary_care", "point_of_interest"]},
                    {"place_id": "", "name": "No id"}
                  ]
                }
                """.formatted(status, token == null ? "" : "\"next_page_token\": \"" + token + "\",");
    }

    @Nested
    @DisplayName("nearby search")
    class NearbySearch {

        @Test
        @DisplayName("sends location, radius, keyword and key and maps the results")
        void mapsResults() {
            server.expect(requestTo(startsWith(BASE + "/nearbysearch/json")))
                    .andExpect(method(HttpMethod.GET))
                    .andExpect(queryParam("location", "-6.26,106.81"))
                    .andExpect(queryParam("radius", "4000"))
                    .andExpect(queryParam("keyword", "vet"))
                    .andExpect(queryParam("key", "test-key"))
                    .andRespond(withSuccess(nearbyJson("OK", "TOKEN-2"), MediaType.APPLICATION_JSON));

            SearchPage page = client.nearbySearch(ZONE, "vet", null);

            assertThat(page.candidates()).hasSize(1);
            assertThat(page.candidates().get(0).placeId()).isEqualTo("P1");
            assertThat(page.candidates().get(0).types()).containsExactly("veterinary_care", "point_of_interest");
            assertThat(page.candidates().get(0).sourceZone()).isEqualTo("Kemang");
            assertThat(page.nextPageToken()).isEqualTo("TOKEN-2");
            server.verify();
        }

        @Test
        @DisplayName("ZERO_RESULTS is an empty page")
        void zeroResults() {
            server.expect(requestTo(startsWith(BASE + "/nearbysearch/json")))
                    .andRespond(withSuccess("{\"status\": \"ZERO_RESULTS\", \"results\": []}", MediaType.APPLICATION_JSON));

            SearchPage page = client.nearbySearch(ZONE, "vet", null);

            assertThat(page.candidates()).isEmpty();
            assertThat(page.hasNextPage()).isFalse();
        }

        @Test
        @DisplayName("OVER_QUERY_LIMIT is transient")
        void throttlingIsTransient() {
            server.expect(ExpectedCount.once(), requestTo(startsWith(BASE + "/nearbysearch/json")))
                    .andRespond(withSuccess("{\"status\": \"OVER_QUERY_LIMIT\"}", MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> client.nearbySearch(ZONE, "vet", null))
                    .isInstanceOf(TransientProviderException.class);
            server.verify();
        }

        @Test
        @DisplayName("INVALID_REQUEST on a page token is transient")
        void pageTokenIsTransient() {
            server.expect(ExpectedCount.once(), requestTo(startsWith(BASE + "/nearbysearch/json")))
                    .andExpect(queryParam("pagetoken", "TOKEN-2"))
                    .andRespond(withSuccess("{\"status\": \"INVALID_REQUEST\"}", MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> client.nearbySearch(ZONE, "vet", "TOKEN-2"))
                    .isInstanceOf(TransientProviderException.class);
            server.verify();
        }

        @Test
        @DisplayName("INVALID_REQUEST on a first page is permanent")
        void invalidRequestNotRetried() {
            server.expect(ExpectedCount.once(), requestTo(startsWith(BASE + "/nearbysearch/json")))
                    .andRespond(withSuccess("{\"status\": \"INVALID_REQUEST\"}", MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> client.nearbySearch(ZONE, "vet", null))
                    .isInstanceOf(ProviderException.class)
                    .isNotInstanceOf(TransientProviderException.class);
            server.verify();
        }

        @Test
        @DisplayName("REQUEST_DENIED fails without retry")
        void deniedNotRetried() {
            server.expect(ExpectedCount.once(), requestTo(startsWith(BASE + "/nearbysearch/json")))
                    .andRespond(withSuccess("{\"status\": \"REQUEST_DENIED\", \"error_message\": \"bad key\"}",
                            MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> client.nearbySearch(ZONE, "vet", null))
                    .isInstanceOf(ProviderException.class)
                    .hasMessageContaining("REQUEST_DENIED")
                    .hasMessageContaining("bad key");
            server.verify();
        }

        @Test
        @DisplayName("HTTP 429 and 503 are transient")
        void httpErrorsAreTransient() {
            server.expect(requestTo(startsWith(BASE + "/nearbysearch/json")))
                    .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
            server.expect(requestTo(startsWith(BASE + "/nearbysearch/json")))
                    .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

            assertThatThrownBy(() -> client.nearbySearch(ZONE, "vet", null))
                    .isInstanceOf(TransientProviderException.class);
            assertThatThrownBy(() -> client.nearbySearch(ZONE, "vet", null))
                    .isInstanceOf(TransientProviderException.class);
            server.verify();
        }
    }

    @Nested
    @DisplayName("retried through PlaceSearchClient")
    class Retried {

        @Test
        @DisplayName("every retry takes a rate-limit slot and counts as a call")
        void throttlingRetriesAreRateLimitedAndCounted() {
            server.expect(ExpectedCount.times(2), requestTo(startsWith(BASE + "/nearbysearch/json")))
                    .andRespond(withSuccess("{\"status\": \"OVER_QUERY_LIMIT\"}", MediaType.APPLICATION_JSON));
            server.expect(requestTo(startsWith(BASE + "/nearbysearch/json")))
                    .andRespond(withSuccess(nearbyJson("OK", null), MediaType.APPLICATION_JSON));

            SearchResult result = searchClient.searchAll(ZONE, "vet");

            assertThat(result.candidates()).hasSize(1);
            assertThat(result.callsMade()).isEqualTo(3);
            verify(limiter, times(3)).acquire();
            server.verify();
        }

        @Test
        @DisplayName("a not-yet-valid page token is retried")
        void pageTokenRetried() {
            server.expect(requestTo(startsWith(BASE + "/nearbysearch/json")))
                    .andExpect(queryParam("pagetoken", "TOKEN-2"))
                    .andRespond(withSuccess("{\"status\": \"INVALID_REQUEST\"}", MediaType.APPLICATION_JSON));
            server.expect(requestTo(startsWith(BASE + "/nearbysearch/json")))
                    .andExpect(queryParam("pagetoken", "TOKEN-2"))
                    .andRespond(withSuccess(nearbyJson("OK", null), MediaType.APPLICATION_JSON));

            SearchPage page = searchClient.searchPage(ZONE, "vet", "TOKEN-2");

            assertThat(page.candidates()).hasSize(1);
            verify(limiter, times(2)).acquire();
            server.verify();
        }

        @Test
        @DisplayName("HTTP 429 is retried up to the attempt limit")
        void tooManyRequestsExhaustsRetries() {
            server.expect(ExpectedCount.times(3), requestTo(startsWith(BASE + "/nearbysearch/json")))
                    .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
            AtomicInteger attempts = new AtomicInteger();

            assertThatThrownBy(() -> searchClient.searchPage(ZONE, "vet", null, attempts::incrementAndGet))
                    .isInstanceOf(TransientProviderException.class);
            assertThat(attempts).hasValue(3);
            verify(limiter, times(3)).acquire();
            server.verify();
        }

        @Test
        @DisplayName("permanent errors are sent once")
        void deniedSentOnce() {
            server.expect(ExpectedCount.once(), requestTo(startsWith(BASE + "/nearbysearch/json")))
                    .andRespond(withSuccess("{\"status\": \"REQUEST_DENIED\"}", MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> searchClient.searchPage(ZONE, "vet", null))
                    .isInstanceOf(ProviderException.class)
                    .isNotInstanceOf(TransientProviderException.class);
            verify(limiter, times(1)).acquire();
            server.verify();
        }

        @Test
        @DisplayName("a detail lookup after HTTP 503 counts both requests")
        void detailRetryCounted() {
            server.expect(requestTo(startsWith(BASE + "/details/json")))
                    .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
            server.expect(requestTo(startsWith(BASE + "/details/json")))
                    .andRespond(withSuccess("{\"status\": \"OK\", \"result\": {\"place_id\": \"P1\", \"name\": \"Vet\"}}",
                            MediaType.APPLICATION_JSON));
            AtomicInteger attempts = new AtomicInteger();

            Optional<PlaceDetail> detail = searchClient.fetchDetail("P1", attempts::incrementAndGet);

            assertThat(detail).map(PlaceDetail::getName).contains("Vet");
            assertThat(attempts).hasValue(2);
            verify(limiter, times(2)).acquire();
            server.verify();
        }
    }

    @Nested
    @DisplayName("place details")
    class Details {

        @Test
        @DisplayName("maps every requested field")
        void mapsDetail() {
            server.expect(requestTo(startsWith(BASE + "/details/json")))
                    .andExpect(queryParam("place_id", "P1"))
                    .andRespond(withSuccess("""
                            {
                              "status": "OK",
                              "result": {
                                "place_id": "P1",
                                "name": "Happy Paws Vet",
                                "formatted_address": "Jl. Kemang Raya 1",
                                "vicinity": "Kemang",
                                "geometry": {"location": {"lat": -6.26, "lng": 106.81}},
                                "rating": 4.5,
                                "user_ratings_total": 100,
                                "website": "https://happypaws.test",
                                "formatted_phone_number": "021 123",
                                "price_level": 2,
                                "business_status": "OPERATIONAL",
                                "opening_hours": {"open_now": true}
                              }
                            }
                            """, MediaType.APPLICATION_JSON));

            Optional<PlaceDetail> detail = client.placeDetail("P1", List.of("place_id", "name"));

            assertThat(detail).isPresent();
            PlaceDetail d = detail.get();
            assertThat(d.getName()).isEqualTo("Happy Paws Vet");
            assertThat(d.getLatitude()).isEqualTo(-6.26);
            assertThat(d.getLongitude()).isEqualTo(106.81);
            assertThat(d.getReviewCount()).isEqualTo(100);
            assertThat(d.getPriceLevel()).isEqualTo(2);
            assertThat(d.getPhone()).isEqualTo("021 123");
            assertThat(d.getOpenNow()).isTrue();
        }

        @Test
        @DisplayName("NOT_FOUND is an empty result")
        void notFound() {
            server.expect(requestTo(startsWith(BASE + "/details/json")))
                    .andRespond(withSuccess("{\"status\": \"NOT_FOUND\"}", MediaType.APPLICATION_JSON));

            assertThat(client.placeDetail("GONE", List.of("place_id"))).isEmpty();
        }
    }
}
