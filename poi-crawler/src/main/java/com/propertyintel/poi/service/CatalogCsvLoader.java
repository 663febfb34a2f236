package com.propertyintel.poi.service;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import com.propertyintel.poi.exception.ConfigurationException;
import com.propertyintel.poi.model.Query;
import com.propertyintel.poi.model.Zone;
import com.propertyintel.poi.output.CsvHeader;
import com.propertyintel.poi.util.GeoValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * Loads the search catalog: zones (zone_name, latitude, longitude, radius) and
 * queries (keyword, category, sub_category, optional radius).
 *
 * Every problem is reported as a {@link ConfigurationException} so a bad catalog
 * stops the crawl before the first API call.
 */
@Component
@Slf4j
public class CatalogCsvLoader {

    static final List<String> ZONE_COLUMNS = List.of("zone_name", "latitude", "longitude", "radius");
    static final List<String> QUERY_COLUMNS = List.of("keyword", "category", "sub_category");

    public List<Zone> loadZones(Path path) {
        List<Zone> zones = readRows(path, ZONE_COLUMNS, (c, row) -> {
            String name = required(c, row, "zone_name", path);
            double lat = number(c, row, "latitude", path);
            double lng = number(c, row, "longitude", path);
            int radius = radius(c, row, path);

            if (!GeoValidator.isValidLatitude(lat) || !GeoValidator.isValidLongitude(lng)) {
                throw new ConfigurationException(String.format(
                        "%s: zone %s has invalid coordinates (%s, %s)", path, name, lat, lng));
            }
            if (!GeoValidator.isValidRadius(radius, Zone.MAX_RADIUS_M)) {
                throw new ConfigurationException(String.format(
                        "%s: zone %s radius %d outside 1..%d", path, name, radius, Zone.MAX_RADIUS_M));
            }
            return new Zone(name, lat, lng, radius);
        });

        Set<String> names = new HashSet<>();
        for (Zone zone : zones) {
            if (!names.add(zone.name())) {
                throw new ConfigurationException(path + ": duplicate zone_name " + zone.name());
            }
        }

        log.info("Loaded {} search zones from {}", zones.size(), path);
        return zones;
    }

    public List<Query> loadQueries(Path path) {
        List<Query> queries = readRows(path, QUERY_COLUMNS, (c, row) -> {
            Integer radius = null;
            if (c.has("radius") && c.get(row, "radius") != null) {
                radius = radius(c, row, path);
                if (!GeoValidator.isValidRadius(radius, Zone.MAX_RADIUS_M)) {
                    throw new ConfigurationException(String.format(
                            "%s: query radius %d outside 1..%d", path, radius, Zone.MAX_RADIUS_M));
                }
            }
            return new Query(
                    required(c, row, "keyword", path),
                    required(c, row, "category", path),
                    required(c, row, "sub_category", path),
                    radius);
        });

        log.info("Loaded {} search queries from {}", queries.size(), path);
        return queries;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private <T> List<T> readRows(Path path, List<String> columns, BiFunction<CsvHeader, String[], T> mapper) {
        if (!Files.exists(path)) {
            throw new ConfigurationException("Catalog file not found: " + path);
        }

        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVReader reader = CsvHeader.openReader(in)) {

            String[] header = reader.readNext();
            if (header == null) {
                throw new ConfigurationException("Catalog file is empty: " + path);
            }
            CsvHeader c = CsvHeader.of(header, path.toString());
            c.require(columns);

            List<T> rows = new ArrayList<>();
            String[] row;
            while ((row = reader.readNext()) != null) {
                if (isBlank(row)) continue;
                rows.add(mapper.apply(c, row));
            }
            if (rows.isEmpty()) {
                throw new ConfigurationException("Catalog file has no rows: " + path);
            }
            return rows;

        } catch (IOException | CsvValidationException e) {
            throw new ConfigurationException("Cannot read catalog " + path + ": " + e.getMessage(), e);
        }
    }

    private String required(CsvHeader c, String[] row, String column, Path path) {
        String value = c.get(row, column);
        if (value == null) {
            throw new ConfigurationException(path + ": blank " + column + " in row " + String.join(",", row));
        }
        return value;
    }

    private double number(CsvHeader c, String[] row, String column, Path path) {
        String raw = required(c, row, column, path);
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(path + ": " + column + " is not a number: " + raw);
        }
    }

    private int radius(CsvHeader c, String[] row, Path path) {
        double value = number(c, row, "radius", path);
        try {
            return Math.toIntExact(Math.round(value));
        } catch (ArithmeticException e) {
            throw new ConfigurationException(path + ": radius out of range: " + value);
        }
    }

    private boolean isBlank(String[] row) {
        for (String cell : row) {
            if (cell != null && !cell.isBlank()) return false;
        }
        return true;
    }
}
