package com.propertyintel.poi.output;

import com.opencsv.CSVWriter;
import com.propertyintel.poi.config.PoiCrawlerProperties;
import com.propertyintel.poi.exception.PersistenceException;
import com.propertyintel.poi.model.PlaceRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;

/**
 * Writes datasets as CSV with the fixed column set of {@link DatasetColumns}.
 *
 * Output path pattern: {outputDir}/{prefix}_{yyyyMMdd_HHmmss}[_{suffix}].csv
 * e.g. output/poi_dataset_20250805_095802.csv
 *
 * Load into QGIS as a delimited text layer: X = longitude, Y = latitude, EPSG:4326.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DatasetCsvWriter {

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final PoiCrawlerProperties properties;
    private final Clock clock;

    /**
     * Write to a new timestamped file in the configured output directory.
     *
     * @param suffix appended after the timestamp, e.g. "partial"; may be null
     */
    public Path writeTimestamped(Collection<PlaceRecord> records, String prefix, String suffix) {
        Path outputPath = timestampedPath(prefix, suffix);
        write(records, outputPath);
        return outputPath;
    }

    /**
     * Path a timestamped write would use now, without writing anything.
     */
    public Path timestampedPath(String prefix, String suffix) {
        String filename = prefix + "_" + LocalDateTime.now(clock).format(FILE_STAMP)
                + (suffix == null ? "" : "_" + suffix) + ".csv";
        return Paths.get(properties.getOutput().getOutputDir()).resolve(filename);
    }

    /**
     * @throws PersistenceException when the file cannot be written
     */
    public void write(Collection<PlaceRecord> records, Path outputPath) {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) ensureDirectory(parent);

        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(
                     out,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {

            writer.writeNext(DatasetColumns.HEADERS.toArray(new String[0]));

            for (PlaceRecord r : records) {
                writer.writeNext(toRow(r));
            }

            log.info("Written {} records to CSV: {}", records.size(), outputPath);

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new PersistenceException("CSV write failed: " + outputPath, e);
        }
    }

    private String[] toRow(PlaceRecord r) {
        return new String[]{
                str(r.getPlaceId()),
                str(r.getName()),
                str(r.getCategory()),
                str(r.getSubCategory()),
                str(r.getLatitude()),
                str(r.getLongitude()),
                str(r.getAddress()),
                str(r.getVicinity()),
                str(r.getRating()),
                str(r.getReviewCount()),
                str(r.getWebsite()),
                str(r.getPhone()),
                str(r.getPriceLevel()),
                str(r.getTypes()),
                str(r.isOperational()),
                str(r.getSearchZone()),
                str(r.getSearchKeyword()),
                str(r.getOpenNow()),
                str(r.getTimestamp()),
                str(r.getPopularityScore()),
                str(r.getBufferRadiusM())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new PersistenceException("Cannot create output directory: " + dir, e);
        }
    }
}
