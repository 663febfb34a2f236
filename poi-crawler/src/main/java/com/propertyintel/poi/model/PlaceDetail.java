package com.propertyintel.poi.model;

import lombok.Builder;
import lombok.Data;

/**
 * Enriched place fetched once per unique place_id.
 */
@Data
@Builder(toBuilder = true)
public class PlaceDetail {

    private String placeId;
    private String name;
    private String formattedAddress;
    private String vicinity;
    private Double latitude;
    private Double longitude;
    private Double rating;
    private Integer reviewCount;
    private String website;
    private String phone;

    /** Ordinal 0-4 when the provider knows it */
    private Integer priceLevel;

    /** OPERATIONAL | CLOSED_TEMPORARILY | CLOSED_PERMANENTLY, null when unknown */
    private String businessStatus;

    private Boolean openNow;
}
