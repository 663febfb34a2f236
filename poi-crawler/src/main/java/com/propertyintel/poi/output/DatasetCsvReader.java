package com.propertyintel.poi.output;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import com.propertyintel.poi.exception.ConfigurationException;
import com.propertyintel.poi.model.PlaceRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a dataset written by {@link DatasetCsvWriter} (or by earlier tooling with the
 * same column set). Extra columns are ignored; missing required columns are a
 * configuration error.
 */
@Component
@Slf4j
public class DatasetCsvReader {

    public List<PlaceRecord> read(Path path) {
        if (!Files.exists(path)) {
            throw new ConfigurationException("Dataset file not found: " + path);
        }

        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVReader reader = CsvHeader.openReader(in)) {

            String[] header = reader.readNext();
            if (header == null) {
                throw new ConfigurationException("Dataset file is empty: " + path);
            }
            CsvHeader columns = CsvHeader.of(header, path.toString());
            columns.require(DatasetColumns.HEADERS);

            List<PlaceRecord> records = new ArrayList<>();
            int skipped = 0;
            String[] row;
            while ((row = reader.readNext()) != null) {
                String placeId = columns.get(row, DatasetColumns.PLACE_ID);
                if (placeId == null) {
                    skipped++;
                    continue;
                }
                records.add(toRecord(columns, row));
            }

            log.info("Loaded {} records from {} ({} rows without place_id skipped)", records.size(), path, skipped);
            return records;

        } catch (IOException | CsvValidationException e) {
            throw new ConfigurationException("Cannot read dataset " + path + ": " + e.getMessage(), e);
        }
    }

    private PlaceRecord toRecord(CsvHeader c, String[] row) {
        Integer reviews = c.getInt(row, "review_count");
        return PlaceRecord.builder()
                .placeId(c.get(row, "place_id"))
                .name(c.get(row, "name"))
                .category(c.get(row, "category"))
                .subCategory(c.get(row, "sub_category"))
                .latitude(c.getDouble(row, "latitude"))
                .longitude(c.getDouble(row, "longitude"))
                .address(c.get(row, "address"))
                .vicinity(c.get(row, "vicinity"))
                .rating(c.getDouble(row, "rating"))
                .reviewCount(reviews == null ? 0 : reviews)
                .website(c.get(row, "website"))
                .phone(c.get(row, "phone"))
                .priceLevel(c.get(row, "price_level"))
                .types(c.get(row, "types"))
                .operational(Boolean.TRUE.equals(c.getBoolean(row, "is_operational")))
                .searchZone(c.get(row, "search_zone"))
                .searchKeyword(c.get(row, "search_keyword"))
                .openNow(c.getBoolean(row, "is_open_now"))
                .timestamp(c.get(row, "timestamp"))
                .popularityScore(orZero(c.getDouble(row, "popularity_score")))
                .bufferRadiusM(c.getInt(row, "buffer_radius_m"))
                .build();
    }

    private double orZero(Double d) {
        return d == null ? 0.0 : d;
    }
}
