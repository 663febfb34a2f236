package com.propertyintel.poi.service;

import com.propertyintel.poi.exception.IntegrityException;
import com.propertyintel.poi.model.MergeResult;
import com.propertyintel.poi.model.PlaceRecord;
import com.propertyintel.poi.output.DatasetCsvReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Combines independently produced datasets (e.g. a main crawl and a supplementary
 * crawl) into one, keyed by place_id. The primary dataset wins on overlap.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DatasetReconciler {

    /** category, sub_category, then most popular first. */
    public static final Comparator<PlaceRecord> DATASET_ORDER = Comparator
            .comparing(PlaceRecord::getCategory, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(PlaceRecord::getSubCategory, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(PlaceRecord::getPopularityScore, Comparator.reverseOrder());

    private final DatasetCsvReader csvReader;

    /**
     * @throws IntegrityException if the result would contain a place_id twice, which
     *                            only happens when an input was not unique to begin with
     */
    public MergeResult merge(List<PlaceRecord> primary, List<PlaceRecord> secondary) {
        Set<String> primaryIds = primary.stream().map(PlaceRecord::getPlaceId).collect(Collectors.toSet());

        List<PlaceRecord> combined = new ArrayList<>(primary);
        int overlap = 0;
        for (PlaceRecord record : secondary) {
            if (primaryIds.contains(record.getPlaceId())) {
                overlap++;
            } else {
                combined.add(record);
            }
        }

        verifyUnique(combined);
        combined.sort(DATASET_ORDER);

        log.info("Merged datasets: primary={}, secondary={}, overlap={}, final={}",
                primary.size(), secondary.size(), overlap, combined.size());

        return new MergeResult(List.copyOf(combined), primary.size(), secondary.size(), overlap, combined.size());
    }

    /**
     * Left-to-right fold of {@link #merge}. Earlier datasets win on overlap.
     */
    public MergeResult mergeAll(List<List<PlaceRecord>> datasets) {
        if (datasets.isEmpty()) {
            return new MergeResult(List.of(), 0, 0, 0, 0);
        }

        List<PlaceRecord> acc = datasets.get(0);
        int secondaryTotal = 0;
        int overlapTotal = 0;
        MergeResult result = merge(acc, List.of());
        for (List<PlaceRecord> next : datasets.subList(1, datasets.size())) {
            result = merge(result.records(), next);
            secondaryTotal += result.secondarySize();
            overlapTotal += result.overlapSize();
        }
        return new MergeResult(result.records(), acc.size(), secondaryTotal, overlapTotal, result.finalSize());
    }

    /**
     * Read a dataset file, keeping the first occurrence of any repeated place_id.
     */
    public List<PlaceRecord> loadDataset(Path path) {
        List<PlaceRecord> rows = csvReader.read(path);
        Map<String, PlaceRecord> unique = new LinkedHashMap<>();
        for (PlaceRecord row : rows) {
            unique.putIfAbsent(row.getPlaceId(), row);
        }
        int dropped = rows.size() - unique.size();
        if (dropped > 0) {
            log.warn("{} contains {} repeated place_id row(s); kept the first of each", path, dropped);
        }
        return new ArrayList<>(unique.values());
    }

    public List<PlaceRecord> sorted(List<PlaceRecord> records) {
        List<PlaceRecord> copy = new ArrayList<>(records);
        copy.sort(DATASET_ORDER);
        return copy;
    }

    private void verifyUnique(List<PlaceRecord> records) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (PlaceRecord record : records) {
            if (!seen.add(record.getPlaceId())) {
                duplicates.add(record.getPlaceId());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new IntegrityException("Merged dataset has duplicate place_ids:", duplicates);
        }
    }
}
