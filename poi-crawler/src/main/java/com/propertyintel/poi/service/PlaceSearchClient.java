package com.propertyintel.poi.service;

import com.propertyintel.poi.exception.ProviderException;
import com.propertyintel.poi.model.PlaceCandidate;
import com.propertyintel.poi.model.PlaceDetail;
import com.propertyintel.poi.model.SearchPage;
import com.propertyintel.poi.model.SearchResult;
import com.propertyintel.poi.model.Zone;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Rate-limited, retried, paginated access to a {@link PlaceSearchProvider}.
 *
 * Every attempt, retries included, takes a slot from the shared rate limiter and is
 * reported to the caller's attempt hook, so call statistics count real requests.
 * Only {@link com.propertyintel.poi.exception.TransientProviderException}s are retried.
 *
 * Pagination is capped at maxPages per (zone, keyword) to bound cost regardless of
 * how many results the provider holds. Each continuation fetch waits pageTokenDelayMs
 * first, on top of rate limiting, because fresh tokens are not immediately valid.
 */
@Slf4j
public class PlaceSearchClient {

    /** Only what a dataset row needs; every extra field costs money. */
    public static final List<String> DETAIL_FIELDS = List.of(
            "place_id", "name", "formatted_address", "geometry",
            "rating", "user_ratings_total", "website",
            "opening_hours", "formatted_phone_number", "price_level",
            "business_status", "vicinity");

    private final PlaceSearchProvider provider;
    private final CallRateLimiter rateLimiter;
    private final Retry retry;
    private final long pageTokenDelayMs;
    private final int defaultMaxPages;

    public PlaceSearchClient(PlaceSearchProvider provider, CallRateLimiter rateLimiter, Retry retry,
                             long pageTokenDelayMs, int defaultMaxPages) {
        this.provider = provider;
        this.rateLimiter = rateLimiter;
        this.retry = retry;
        this.pageTokenDelayMs = pageTokenDelayMs;
        this.defaultMaxPages = defaultMaxPages;
    }

    /** Single attempt per call. */
    public PlaceSearchClient(PlaceSearchProvider provider, CallRateLimiter rateLimiter,
                             long pageTokenDelayMs, int defaultMaxPages) {
        this(provider, rateLimiter, Retry.of("singleAttempt", RetryConfig.custom().maxAttempts(1).build()),
                pageTokenDelayMs, defaultMaxPages);
    }

    public int getDefaultMaxPages() {
        return defaultMaxPages;
    }

    public SearchPage searchPage(Zone zone, String keyword, String pageToken) {
        return searchPage(zone, keyword, pageToken, () -> { });
    }

    /**
     * Fetch exactly one page, retrying transient failures.
     *
     * @param onAttempt run once per request sent, after its rate-limit slot is taken
     * @throws ProviderException when the last attempt fails
     */
    public SearchPage searchPage(Zone zone, String keyword, String pageToken, Runnable onAttempt) {
        try {
            return retry.executeSupplier(() -> {
                rateLimiter.acquire();
                onAttempt.run();
                return provider.nearbySearch(zone, keyword, pageToken);
            });
        } catch (ProviderException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProviderException("Search failed for '" + keyword + "' in " + zone.name() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Lazily fetched pages for one (zone, keyword). Iteration ends when the provider
     * returns no token, maxPages is reached, a continuation fetch fails, or the thread
     * is interrupted. A failure on the first page is thrown from hasNext().
     */
    public PageIterator pages(Zone zone, String keyword, int maxPages) {
        return new PageIterator(zone, keyword, maxPages);
    }

    public SearchResult searchAll(Zone zone, String keyword) {
        return searchAll(zone, keyword, defaultMaxPages);
    }

    /**
     * Collect every page for a (zone, keyword). Pages gathered before a failed
     * continuation are kept.
     *
     * @throws ProviderException only when the first page fails
     */
    public SearchResult searchAll(Zone zone, String keyword, int maxPages) {
        PageIterator pages = pages(zone, keyword, maxPages);
        List<PlaceCandidate> candidates = new ArrayList<>();
        while (pages.hasNext()) {
            candidates.addAll(pages.next().candidates());
        }
        return new SearchResult(candidates, pages.callsMade());
    }

    public Optional<PlaceDetail> fetchDetail(String placeId) {
        return fetchDetail(placeId, () -> { });
    }

    /**
     * @param onAttempt run once per request sent, retries included
     * @return empty when the provider has no detail or the call failed; the caller
     *         skips enrichment for that candidate
     */
    public Optional<PlaceDetail> fetchDetail(String placeId, Runnable onAttempt) {
        try {
            return retry.executeSupplier(() -> {
                rateLimiter.acquire();
                onAttempt.run();
                return provider.placeDetail(placeId, DETAIL_FIELDS);
            });
        } catch (RuntimeException e) {
            log.warn("Error fetching details for place_id '{}': {}", placeId, e.getMessage());
            return Optional.empty();
        }
    }

    private boolean pause(long ms) {
        if (ms <= 0) return !Thread.currentThread().isInterrupted();
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ── Pagination ───────────────────────────────────────────────────────────

    public final class PageIterator implements Iterator<SearchPage> {

        private final Zone zone;
        private final String keyword;
        private final int maxPages;

        private SearchPage buffered;
        private String nextToken;
        private int pagesFetched;
        private int callsMade;
        private boolean exhausted;

        private PageIterator(Zone zone, String keyword, int maxPages) {
            this.zone = zone;
            this.keyword = keyword;
            this.maxPages = maxPages;
        }

        public int callsMade() {
            return callsMade;
        }

        @Override
        public boolean hasNext() {
            if (buffered == null && !exhausted) {
                advance();
            }
            return buffered != null;
        }

        @Override
        public SearchPage next() {
            if (!hasNext()) throw new NoSuchElementException();
            SearchPage page = buffered;
            buffered = null;
            return page;
        }

        private void advance() {
            if (pagesFetched >= maxPages || (pagesFetched > 0 && nextToken == null)) {
                exhausted = true;
                return;
            }

            SearchPage page;
            if (pagesFetched == 0) {
                page = searchPage(zone, keyword, null, () -> callsMade++);
            } else {
                if (!pause(pageTokenDelayMs)) {
                    exhausted = true;
                    return;
                }
                try {
                    page = searchPage(zone, keyword, nextToken, () -> callsMade++);
                } catch (ProviderException e) {
                    log.warn("Pagination error for '{}' in {} after {} page(s): {}",
                            keyword, zone.name(), pagesFetched, e.getMessage());
                    exhausted = true;
                    return;
                }
            }

            pagesFetched++;
            nextToken = page.hasNextPage() ? page.nextPageToken() : null;
            buffered = page;
        }
    }
}
