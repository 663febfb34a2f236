package com.propertyintel.poi.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Raw DTO matching the Place Details JSON structure.
 * Only the fields in the requested allow-list are ever populated.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlaceDetailsResponse {

    private String status;

    @JsonProperty("error_message")
    private String errorMessage;

    private Result result;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Result {

        @JsonProperty("place_id")
        private String placeId;

        private String name;

        @JsonProperty("formatted_address")
        private String formattedAddress;

        private String vicinity;

        private Geometry geometry;

        private Double rating;

        @JsonProperty("user_ratings_total")
        private Integer userRatingsTotal;

        private String website;

        @JsonProperty("formatted_phone_number")
        private String formattedPhoneNumber;

        @JsonProperty("price_level")
        private Integer priceLevel;

        @JsonProperty("business_status")
        private String businessStatus;

        @JsonProperty("opening_hours")
        private OpeningHours openingHours;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Geometry {
        private LatLng location;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LatLng {
        private Double lat;
        private Double lng;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OpeningHours {

        @JsonProperty("open_now")
        private Boolean openNow;
    }
}
