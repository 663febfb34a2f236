package com.propertyintel.poi.service;

import com.propertyintel.poi.config.PoiCrawlerProperties;
import com.propertyintel.poi.exception.ProviderException;
import com.propertyintel.poi.exception.TransientProviderException;
import com.propertyintel.poi.model.NearbySearchResponse;
import com.propertyintel.poi.model.PlaceCandidate;
import com.propertyintel.poi.model.PlaceDetail;
import com.propertyintel.poi.model.PlaceDetailsResponse;
import com.propertyintel.poi.model.SearchPage;
import com.propertyintel.poi.model.Zone;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Thin client over the Google Places web service (Nearby Search + Place Details).
 *
 * One HTTP request per call. Throttling statuses, 429/5xx responses, I/O failures and
 * not-yet-valid page tokens raise {@link TransientProviderException}, which
 * {@link PlaceSearchClient} retries; anything else is a plain {@link ProviderException}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GooglePlacesApiClient implements PlaceSearchProvider {

    private static final Set<String> SUCCESS_STATUSES = Set.of("OK", "ZERO_RESULTS");
    private static final Set<String> TRANSIENT_STATUSES = Set.of("OVER_QUERY_LIMIT", "UNKNOWN_ERROR");

    private final RestTemplate restTemplate;
    private final PoiCrawlerProperties properties;

    @Override
    public SearchPage nearbySearch(Zone zone, String keyword, String pageToken) {
        boolean continuation = StringUtils.hasText(pageToken);
        UriComponentsBuilder builder = UriComponentsBuilder
                .fromHttpUrl(properties.getApi().getBaseUrl() + "/nearbysearch/json");

        if (continuation) {
            builder.queryParam("pagetoken", pageToken);
        } else {
            builder.queryParam("location", zone.latitude() + "," + zone.longitude())
                    .queryParam("radius", zone.radiusM())
                    .queryParam("keyword", keyword);
        }

        String description = String.format("nearbysearch '%s' in %s%s",
                keyword, zone.name(), continuation ? " (next page)" : "");
        URI uri = withLanguageAndKey(builder);

        NearbySearchResponse response = get(uri, NearbySearchResponse.class, description);
        checkStatus(response.getStatus(), response.getErrorMessage(), description, continuation);

        List<PlaceCandidate> candidates = response.getResults() == null ? List.of() : response.getResults().stream()
                .filter(result -> StringUtils.hasText(result.getPlaceId()))
                .map(result -> new PlaceCandidate(result.getPlaceId(), result.getName(), result.getTypes(),
                        zone.name(), keyword))
                .toList();

        log.debug("{} returned {} results (status {})", description, candidates.size(), response.getStatus());
        return new SearchPage(candidates, response.getNextPageToken());
    }

    @Override
    public Optional<PlaceDetail> placeDetail(String placeId, List<String> fields) {
        UriComponentsBuilder builder = UriComponentsBuilder
                .fromHttpUrl(properties.getApi().getBaseUrl() + "/details/json")
                .queryParam("place_id", placeId)
                .queryParam("fields", String.join(",", fields));

        String description = "details " + placeId;
        URI uri = withLanguageAndKey(builder);

        PlaceDetailsResponse response = get(uri, PlaceDetailsResponse.class, description);
        if (!"NOT_FOUND".equals(response.getStatus())) {
            checkStatus(response.getStatus(), response.getErrorMessage(), description, false);
        }

        if (response.getResult() == null) {
            log.debug("{}: no result (status {})", description, response.getStatus());
            return Optional.empty();
        }
        return Optional.of(toDetail(response.getResult(), placeId));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private URI withLanguageAndKey(UriComponentsBuilder builder) {
        PoiCrawlerProperties.Api api = properties.getApi();
        if (StringUtils.hasText(api.getLanguage())) {
            builder.queryParam("language", api.getLanguage());
        }
        if (StringUtils.hasText(api.getKey())) {
            builder.queryParam("key", api.getKey());
        }
        return builder.encode().build().toUri();
    }

    private <T> T get(URI uri, Class<T> type, String description) {
        log.debug("Calling Places API: {}", description);
        try {
            T response = restTemplate.getForObject(uri, type);
            if (response == null) {
                throw new ProviderException("Empty response body for " + description);
            }
            return response;

        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Rate limited (429) by Places API on {}", description);
            throw new TransientProviderException("HTTP 429 for " + description, e);

        } catch (HttpServerErrorException e) {
            throw new TransientProviderException("HTTP " + e.getStatusCode().value() + " for " + description, e);

        } catch (ResourceAccessException e) {
            throw new TransientProviderException("I/O failure for " + description + ": " + e.getMessage(), e);

        } catch (RestClientException e) {
            throw new ProviderException("Places API call failed for " + description + ": " + e.getMessage(), e);
        }
    }

    private void checkStatus(String status, String errorMessage, String description, boolean continuation) {
        if (status != null && SUCCESS_STATUSES.contains(status)) return;

        String message = String.format("%s returned status %s%s", description, status,
                errorMessage != null ? " (" + errorMessage + ")" : "");

        // a fresh page token answers INVALID_REQUEST until the provider has materialised the page
        if (TRANSIENT_STATUSES.contains(status) || (continuation && "INVALID_REQUEST".equals(status))) {
            throw new TransientProviderException(message);
        }
        throw new ProviderException(message);
    }

    private PlaceDetail toDetail(PlaceDetailsResponse.Result raw, String requestedId) {
        Double lat = null;
        Double lng = null;
        if (raw.getGeometry() != null && raw.getGeometry().getLocation() != null) {
            lat = raw.getGeometry().getLocation().getLat();
            lng = raw.getGeometry().getLocation().getLng();
        }

        return PlaceDetail.builder()
                .placeId(StringUtils.hasText(raw.getPlaceId()) ? raw.getPlaceId() : requestedId)
                .name(raw.getName())
                .formattedAddress(raw.getFormattedAddress())
                .vicinity(raw.getVicinity())
                .latitude(lat)
                .longitude(lng)
                .rating(raw.getRating())
                .reviewCount(raw.getUserRatingsTotal())
                .website(raw.getWebsite())
                .phone(raw.getFormattedPhoneNumber())
                .priceLevel(raw.getPriceLevel())
                .businessStatus(raw.getBusinessStatus())
                .openNow(raw.getOpeningHours() != null ? raw.getOpeningHours().getOpenNow() : null)
                .build();
    }
}
