package com.propertyintel.poi.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Summary of one crawl invocation, logged at the end of the run and exposed on /crawl/status.
 */
@Data
@Builder
public class CrawlRun {

    private String runId;           // UUID
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private CrawlState status;
    private int zonesTotal;
    private int zonesCompleted;
    private int zonesResumed;       // already done in the restored checkpoint
    private int recordsFound;
    private int apiCalls;
    private Map<String, Integer> stats;
    private String outputFile;
    private String errorMessage;    // null on success
}
