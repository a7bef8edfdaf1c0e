package com.clickstream.analytics.export;

import com.clickstream.analytics.analytics.AnalyticsModels.AnalyticsReport;
import com.clickstream.analytics.exception.CsvIoException;
import com.clickstream.analytics.export.ReportTables.CsvTable;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Component
public class ReportCsvWriter {
    private static final Logger log = LoggerFactory.getLogger(ReportCsvWriter.class);

    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();

    public ExportSummary writeAll(AnalyticsReport report, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new CsvIoException("Cannot create output directory " + outputDir, e);
        }

        List<Path> written = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (CsvTable table : ReportTables.all(report)) {
            Path target = outputDir.resolve(table.fileName());
            try {
                write(table, target);
                written.add(target);
                log.info("Saved {} ({} rows)", target, table.rows().size());
            } catch (CsvIoException e) {
                failed.add(table.fileName());
                log.warn("Failed to save {}: {}", target, e.getMessage(), e);
            }
        }
        return new ExportSummary(written, failed);
    }

    public void write(CsvTable table, Path target) {
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            write(table, writer);
        } catch (IOException e) {
            throw new CsvIoException("Cannot write report " + target, e);
        }
    }

    public void write(CsvTable table, Writer writer) throws IOException {
        try (SequenceWriter rows = csvMapper.writer().writeValues(writer)) {
            rows.write(table.columns().toArray(new String[0]));
            for (List<Object> row : table.rows()) {
                rows.write(row.stream().map(this::cell).toArray(String[]::new));
            }
        }
    }

    private String cell(Object value) {
        if (value == null) return "";
        if (value instanceof Double d && d.isNaN()) return "";
        return value.toString();
    }

    public record ExportSummary(List<Path> written, List<String> failed) {}
}
