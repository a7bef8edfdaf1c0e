package com.clickstream.analytics.cli;

import com.clickstream.analytics.analytics.AnalyticsModels.AnalyticsReport;
import com.clickstream.analytics.analytics.ClickstreamAnalyzer;
import com.clickstream.analytics.analytics.ClickstreamAnalyzer.AnalysisOptions;
import com.clickstream.analytics.export.ReportCsvWriter;
import com.clickstream.analytics.export.ReportCsvWriter.ExportSummary;
import com.clickstream.analytics.parser.TelemetryCsvParser;
import com.clickstream.analytics.parser.TelemetryCsvParser.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

@Component
public class BatchReportRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(BatchReportRunner.class);
    static final String DEFAULT_OUTPUT = "./output";

    private final TelemetryCsvParser parser;
    private final ClickstreamAnalyzer analyzer;
    private final ReportCsvWriter writer;

    public BatchReportRunner(TelemetryCsvParser parser, ClickstreamAnalyzer analyzer, ReportCsvWriter writer) {
        this.parser = parser;
        this.analyzer = analyzer;
        this.writer = writer;
    }

    @Override
    public void run(ApplicationArguments args) {
        String input = firstValue(args, "input");
        if (input == null) return;
        String output = firstValue(args, "output");
        run(Path.of(input), Path.of(output == null ? DEFAULT_OUTPUT : output));
    }

    public ExportSummary run(Path input, Path outputDir) {
        AnalysisOptions options = analyzer.defaultOptions();
        log.info("Reading telemetry from {} (funnel {})", input, options.steps());
        ParseResult parsed = parser.read(input, options.fields());

        AnalyticsReport report = analyzer.analyze(parsed.table(), options);
        ExportSummary summary = writer.writeAll(report, outputDir);
        log.info("Wrote {} report files to {}, {} failed", summary.written().size(), outputDir, summary.failed().size());
        return summary;
    }

    private String firstValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return (values == null || values.isEmpty()) ? null : values.get(0);
    }
}
