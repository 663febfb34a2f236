package com.propertyintel.poi.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted dataset row. place_id is the primary key of every dataset and the
 * dedup key throughout the pipeline.
 *
 * Field order mirrors the output column order, which downstream GIS imports rely on.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PlaceRecord {

    private String placeId;
    private String name;

    // ── Classification ──────────────────────────────────────────────────────
    private String category;

    /** Post-classification sub-category */
    private String subCategory;

    // ── Location ────────────────────────────────────────────────────────────
    private Double latitude;
    private Double longitude;
    private String address;
    private String vicinity;

    // ── Detail ──────────────────────────────────────────────────────────────
    private Double rating;
    private Integer reviewCount;
    private String website;
    private String phone;

    /** "$" repeated price-level times, empty when unknown */
    private String priceLevel;

    /** Search-time type tags joined with ", " */
    private String types;

    private boolean operational;

    // ── Lineage ─────────────────────────────────────────────────────────────
    private String searchZone;
    private String searchKeyword;
    private Boolean openNow;
    private String timestamp;

    // ── Derived ─────────────────────────────────────────────────────────────
    private double popularityScore;

    /** Visualisation buffer, absent for categories without a radius table */
    private Integer bufferRadiusM;
}
