package com.propertyintel.poi.service;

import com.propertyintel.poi.exception.ProviderException;
import com.propertyintel.poi.model.PlaceDetail;
import com.propertyintel.poi.model.SearchPage;
import com.propertyintel.poi.model.Zone;

import java.util.List;
import java.util.Optional;

/**
 * External place-search capability. Rate limits, pricing and authentication are
 * the implementation's concern; callers never retry through this interface.
 */
public interface PlaceSearchProvider {

    /**
     * One page of nearby results. When pageToken is given the other arguments
     * identify the original search but the token alone selects the page.
     *
     * @throws ProviderException on transport failure or an error status
     */
    SearchPage nearbySearch(Zone zone, String keyword, String pageToken);

    /**
     * Enriched detail restricted to the given fields.
     *
     * @return empty when the provider knows no such place
     * @throws ProviderException on transport failure or an error status
     */
    Optional<PlaceDetail> placeDetail(String placeId, List<String> fields);
}
