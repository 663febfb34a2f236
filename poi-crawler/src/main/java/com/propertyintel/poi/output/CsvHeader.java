package com.propertyintel.poi.output;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.propertyintel.poi.exception.ConfigurationException;

import java.io.Reader;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Column-name lookup over a CSV header row. Blank cells read as null.
 */
public final class CsvHeader {

    private final Map<String, Integer> index;
    private final String source;

    private CsvHeader(Map<String, Integer> index, String source) {
        this.index = index;
        this.source = source;
    }

    /**
     * Reader matching what {@link DatasetCsvWriter} produces: quotes are doubled and
     * backslashes are literal.
     */
    public static CSVReader openReader(Reader in) {
        return new CSVReaderBuilder(in)
                .withCSVParser(new RFC4180ParserBuilder().build())
                .build();
    }

    public static CsvHeader of(String[] header, String source) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            String name = header[i] == null ? "" : header[i].trim();
            // tolerate a UTF-8 BOM on the first column
            if (i == 0 && name.startsWith("﻿")) name = name.substring(1);
            index.putIfAbsent(name, i);
        }
        return new CsvHeader(index, source);
    }

    /**
     * @throws ConfigurationException naming every missing column
     */
    public void require(Collection<String> columns) {
        List<String> missing = columns.stream().filter(c -> !index.containsKey(c)).toList();
        if (!missing.isEmpty()) {
            throw new ConfigurationException(source + " is missing required columns: " + missing);
        }
    }

    public boolean has(String column) {
        return index.containsKey(column);
    }

    public String get(String[] row, String column) {
        Integer i = index.get(column);
        if (i == null || i >= row.length || row[i] == null) return null;
        String v = row[i].trim();
        return v.isEmpty() ? null : v;
    }

    public Double getDouble(String[] row, String column) {
        String v = get(row, column);
        if (v == null) return null;
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Accepts "1500" as well as "1500.0", which spreadsheet round-trips produce.
     */
    public Integer getInt(String[] row, String column) {
        Double d = getDouble(row, column);
        return d == null ? null : (int) Math.round(d);
    }

    /**
     * Case-insensitive true/false; anything else is null.
     */
    public Boolean getBoolean(String[] row, String column) {
        String v = get(row, column);
        if (v == null) return null;
        return switch (v.toLowerCase(Locale.ROOT)) {
            case "true" -> Boolean.TRUE;
            case "false" -> Boolean.FALSE;
            default -> null;
        };
    }
}
