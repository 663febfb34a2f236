package com.propertyintel.poi.model;

public enum CrawlState {
    IDLE,
    RUNNING,
    COMPLETED,
    INTERRUPTED,
    FAILED
}
