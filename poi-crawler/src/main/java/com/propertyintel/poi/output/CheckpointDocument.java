package com.propertyintel.poi.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.propertyintel.poi.model.PlaceRecord;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * On-disk shape of a crawl checkpoint. Unknown properties are ignored so a
 * checkpoint written by a newer minor revision of the same schema still loads.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CheckpointDocument {

    private int schemaVersion;
    private String savedAt;
    private List<String> completedZones = new ArrayList<>();
    private Map<String, PlaceRecord> records = new LinkedHashMap<>();
    private Map<String, Integer> stats = new TreeMap<>();
    private int apiCalls;
}
