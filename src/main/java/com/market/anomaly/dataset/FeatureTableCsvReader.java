package com.market.anomaly.dataset;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.market.anomaly.engine.table.FeatureTable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a feature table from CSV with a header row.
 *
 * The first column is the row index and must start with an ISO date
 * ({@code 2024-03-05} or {@code 2024-03-05 00:00:00}). Every other column is kept
 * as raw text; empty cells become {@code null}. No numeric conversion happens here.
 */
@Component
public class FeatureTableCsvReader {

    private final CsvMapper csvMapper;

    public FeatureTableCsvReader() {
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.csvMapper.enable(CsvParser.Feature.TRIM_SPACES);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    public FeatureTable read(String csv) {
        try (Reader reader = new StringReader(csv)) {
            return read(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read feature CSV", e);
        }
    }

    /**
     * @throws IllegalArgumentException if the header is missing or an index cell is not a date
     */
    public FeatureTable read(Reader reader) throws IOException {
        List<String[]> lines;
        try (MappingIterator<String[]> it = csvMapper.readerFor(String[].class)
                .with(CsvSchema.emptySchema())
                .readValues(reader)) {
            lines = it.readAll();
        }

        if (lines.isEmpty() || lines.get(0).length == 0) {
            throw new IllegalArgumentException("CSV has no header row");
        }
        String[] header = lines.get(0);
        int width = header.length;

        List<LocalDate> index = new ArrayList<>(lines.size() - 1);
        List<List<Object>> columns = new ArrayList<>(width - 1);
        for (int c = 1; c < width; c++) columns.add(new ArrayList<>(lines.size() - 1));

        for (int lineNo = 1; lineNo < lines.size(); lineNo++) {
            String[] line = lines.get(lineNo);
            if (line.length == 1 && line[0].isEmpty()) continue; // blank line
            if (line.length > width) {
                throw new IllegalArgumentException(String.format(
                        "Line %d has %d cells but the header has %d", lineNo + 1, line.length, width));
            }
            index.add(parseDate(line[0], lineNo + 1));
            for (int c = 1; c < width; c++) {
                String cell = c < line.length ? line[c] : null;
                columns.get(c - 1).add(cell == null || cell.isEmpty() ? null : cell);
            }
        }

        FeatureTable table = FeatureTable.withIndex(index);
        for (int c = 1; c < width; c++) {
            table.column(header[c].trim(), columns.get(c - 1));
        }
        return table;
    }

    private static LocalDate parseDate(String raw, int lineNo) {
        String text = raw == null ? "" : raw.trim();
        if (text.length() > 10) {
            text = text.substring(0, 10);
        }
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Line " + lineNo + ": '" + raw + "' is not an ISO date", e);
        }
    }
}
