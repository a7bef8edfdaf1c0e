package com.clickstream.analytics.parser;

import com.clickstream.analytics.domain.DomainModels.Event;
import com.clickstream.analytics.domain.DomainModels.FieldNames;
import com.clickstream.analytics.domain.EventTable;
import com.clickstream.analytics.exception.CsvIoException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class TelemetryCsvParser {
    private static final Logger log = LoggerFactory.getLogger(TelemetryCsvParser.class);
    private static final String PANDAS_INDEX_PREFIX = "Unnamed:";

    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
            .build();

    public ParseResult read(Path path, FieldNames fields) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            ParseResult result = parse(reader, fields);
            log.info("Read {} events from {} ({} unparseable timestamps)", result.table().size(), path, result.unparseableTimestamps());
            return result;
        } catch (IOException e) {
            throw new CsvIoException("Cannot read telemetry file " + path, e);
        }
    }

    public ParseResult parse(Reader reader, FieldNames fields) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> rows = csvMapper.readerForMapOf(String.class).with(schema).readValues(reader)) {
            List<Event> events = new ArrayList<>();
            int badTimestamps = 0;
            int badValues = 0;
            while (rows.hasNext()) {
                Map<String, String> row = rows.next();
                String rawTs = row.get(fields.timestamp());
                var ts = TimestampParser.parse(rawTs);
                if (ts == null && rawTs != null && !rawTs.isBlank()) badTimestamps++;

                String rawValue = row.get(fields.value());
                Double value = parseValue(rawValue);
                if (value == null && rawValue != null && !rawValue.isBlank()) badValues++;

                events.add(Event.of(
                        text(row.get(fields.user())),
                        text(row.get(fields.session())),
                        ts,
                        text(row.get(fields.action())),
                        value,
                        category(row.get(fields.category()))));
            }
            if (badTimestamps > 0) {
                log.warn("{} rows carry an unparseable timestamp and are excluded from ordering-sensitive metrics", badTimestamps);
            }
            if (badValues > 0) {
                log.warn("{} rows carry a non-numeric value, treated as missing", badValues);
            }
            return new ParseResult(EventTable.of(headerColumns((CsvSchema) rows.getParserSchema()), events), badTimestamps, badValues);
        }
    }

    private Set<String> headerColumns(CsvSchema schema) {
        Set<String> columns = new LinkedHashSet<>();
        if (schema == null) return columns;
        for (CsvSchema.Column column : schema) {
            String name = column.getName();
            if (name.isBlank() || name.startsWith(PANDAS_INDEX_PREFIX)) continue;
            columns.add(name);
        }
        return columns;
    }

    private Double parseValue(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private String text(String raw) {
        return raw == null ? "" : raw.trim();
    }

    private String category(String raw) {
        return (raw == null || raw.isBlank()) ? FieldNames.UNKNOWN_CATEGORY : raw.trim();
    }

    public record ParseResult(EventTable table, int unparseableTimestamps, int unparseableValues) {}
}
