package com.flagship.finance_ledger.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.finance_ledger.account.ChartRow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads chart of accounts files into raw {@link ChartRow}s.
 *
 * Rows are not validated here: a row missing a column comes back with a null field
 * and is reported by the import with its position.
 */
@Component
@RequiredArgsConstructor
public class ChartFileReader {

    private static final CsvSchema HEADER_SCHEMA = CsvSchema.emptySchema().withHeader();

    private final CsvMapper csvMapper;
    private final ObjectMapper objectMapper;

    /**
     * CSV with a header line naming the {@code name} and {@code type} columns.
     * Row positions count data lines only, starting at 1.
     */
    public List<ChartRow> readCsv(Reader reader) throws IOException {
        List<ChartRow> rows = new ArrayList<>();
        try (MappingIterator<Map<String, String>> lines = csvMapper
                .readerFor(new TypeReference<Map<String, String>>() { })
                .with(HEADER_SCHEMA)
                .with(CsvParser.Feature.TRIM_SPACES)
                .with(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
                .readValues(reader)) {
            while (lines.hasNextValue()) {
                Map<String, String> line = lines.nextValue();
                rows.add(ChartRow.of(line.get("name"), line.get("type")));
            }
        }
        return rows;
    }

    /**
     * JSON array of {@code {"name": ..., "type": ...}} objects.
     */
    public List<ChartRow> readJson(Reader reader) throws IOException {
        List<ChartRow> rows = objectMapper.readValue(reader, new TypeReference<List<ChartRow>>() { });
        return rows != null ? rows : List.of();
    }
}
