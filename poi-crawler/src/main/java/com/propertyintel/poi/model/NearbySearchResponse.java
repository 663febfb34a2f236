package com.propertyintel.poi.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw DTO matching the Places Nearby Search JSON structure.
 * Kept separate from the domain model to isolate API coupling.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class NearbySearchResponse {

    private String status;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("next_page_token")
    private String nextPageToken;

    private List<Result> results = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Result {

        @JsonProperty("place_id")
        private String placeId;

        private String name;

        private List<String> types = new ArrayList<>();
    }
}
