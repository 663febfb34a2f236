package com.propertyintel.poi.model;

/**
 * Named circular search region. Immutable once loaded from the catalog.
 */
public record Zone(String name, double latitude, double longitude, int radiusM) {

    /** Largest radius the provider accepts for a nearby search. */
    public static final int MAX_RADIUS_M = 50_000;

    /**
     * Same zone searched with a different radius, used when a query carries its own radius.
     */
    public Zone withRadius(Integer overrideRadiusM) {
        if (overrideRadiusM == null || overrideRadiusM == radiusM) return this;
        return new Zone(name, latitude, longitude, overrideRadiusM);
    }
}
