package com.civicbiz.catalog.ingest.service;

import com.civicbiz.catalog.ingest.model.ScrapeRunReport;
import com.civicbiz.catalog.ingest.model.StateResult;
import com.civicbiz.catalog.ingest.model.TierResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class ScrapeReportExporter {
    private static final Logger log = LoggerFactory.getLogger(ScrapeReportExporter.class);
    static final String[] CSV_HEADER = {"tier", "state", "target", "processed", "success", "failed"};

    private final ObjectMapper objectMapper;

    public ScrapeReportExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void writeJson(ScrapeRunReport report, Path path) throws IOException {
        createParent(path);
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(writer, report);
        }
        log.info("Wrote JSON report for run {} to {}", report.runId(), path);
    }

    public void writeCsv(ScrapeRunReport report, Path path) throws IOException {
        createParent(path);
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writeCsv(report, writer);
        }
        log.info("Wrote CSV report for run {} to {}", report.runId(), path);
    }

    public void writeCsv(ScrapeRunReport report, Writer writer) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(CSV_HEADER)
            .setRecordSeparator("\n")
            .build();
        CSVPrinter printer = new CSVPrinter(writer, format);
        for (TierResult tier : report.tiers()) {
            for (StateResult state : tier.states()) {
                printer.printRecord(
                    tier.tier(),
                    state.stateCode(),
                    state.target(),
                    state.processed(),
                    state.success(),
                    state.failed()
                );
            }
        }
        printer.flush();
    }

    private void createParent(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
