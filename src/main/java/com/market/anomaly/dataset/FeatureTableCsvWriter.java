package com.market.anomaly.dataset;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.market.anomaly.engine.table.CellValues;
import com.market.anomaly.engine.table.FeatureTable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a feature table (typically a scored one) as CSV.
 *
 * The first column is {@code date}; missing cells, NaN included, are written empty.
 */
@Component
public class FeatureTableCsvWriter {

    public static final String INDEX_COLUMN = "date";

    private final CsvMapper csvMapper = new CsvMapper();

    public String write(FeatureTable table) {
        List<String> names = table.getColumnNames();
        CsvSchema.Builder schema = CsvSchema.builder();
        schema.addColumn(INDEX_COLUMN);
        for (String name : names) schema.addColumn(name);

        List<List<String>> rows = new ArrayList<>(table.rowCount());
        for (int row = 0; row < table.rowCount(); row++) {
            List<String> cells = new ArrayList<>(names.size() + 1);
            cells.add(table.getDate(row) == null ? "" : table.getDate(row).toString());
            for (String name : names) {
                Object cell = table.get(name, row);
                cells.add(CellValues.isMissing(cell) ? "" : String.valueOf(cell));
            }
            rows.add(cells);
        }

        StringWriter out = new StringWriter();
        try (SequenceWriter writer = csvMapper.writer(schema.setUseHeader(true).build()).writeValues(out)) {
            for (List<String> row : rows) {
                writer.write(row);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render feature table as CSV", e);
        }
        return out.toString();
    }
}
