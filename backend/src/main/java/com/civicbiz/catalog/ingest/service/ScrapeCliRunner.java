package com.civicbiz.catalog.ingest.service;

import com.civicbiz.catalog.config.PipelineProperties;
import com.civicbiz.catalog.ingest.dedup.DeduplicationEngine;
import com.civicbiz.catalog.ingest.model.BusinessRecord;
import com.civicbiz.catalog.ingest.model.CatalogFilter;
import com.civicbiz.catalog.ingest.model.DuplicateGroup;
import com.civicbiz.catalog.ingest.model.DuplicateMember;
import com.civicbiz.catalog.ingest.model.ScrapeRunReport;
import com.civicbiz.catalog.ingest.model.ScrapeRunRequest;
import com.civicbiz.catalog.ingest.model.StateResult;
import com.civicbiz.catalog.ingest.model.TierResult;
import com.civicbiz.catalog.ingest.persistence.CatalogSink;
import com.civicbiz.catalog.ingest.quality.DataQualityReportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

@Component
public class ScrapeCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeCliRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_CONFIGURATION = 2;

    private final PipelineProperties properties;
    private final ScrapeOrchestratorService orchestratorService;
    private final ScrapeReportExporter reportExporter;
    private final CatalogSink catalog;
    private final DeduplicationEngine deduplicationEngine;
    private final DataQualityReportService qualityReportService;
    private final ConfigurableApplicationContext applicationContext;

    public ScrapeCliRunner(
        PipelineProperties properties,
        ScrapeOrchestratorService orchestratorService,
        ScrapeReportExporter reportExporter,
        CatalogSink catalog,
        DeduplicationEngine deduplicationEngine,
        DataQualityReportService qualityReportService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.reportExporter = reportExporter;
        this.catalog = catalog;
        this.deduplicationEngine = deduplicationEngine;
        this.qualityReportService = qualityReportService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }
        int exitCode = execute();
        if (properties.getCli().isExitAfterRun()) {
            int code = SpringApplication.exit(applicationContext, () -> exitCode);
            System.exit(code);
        }
    }

    public int execute() {
        PipelineProperties.Cli cli = properties.getCli();
        try {
            return switch (cli.getMode()) {
                case "scrape" -> runScrape(cli);
                case "dedup" -> runDedup();
                default -> throw new ConfigurationException("Unknown CLI mode: " + cli.getMode());
            };
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            return EXIT_CONFIGURATION;
        }
    }

    private int runScrape(PipelineProperties.Cli cli) {
        ScrapeRunRequest request = new ScrapeRunRequest(cli.getTargetCount(), cli.getTier(), cli.getState(), cli.isDryRun());
        ScrapeRunReport report = orchestratorService.run(request);

        if (report.dryRun()) {
            report.plan().tiers().forEach(tier -> log.info(
                "Plan tier {}: states={}, target={}, workItems={}",
                tier.tier(),
                tier.states().size(),
                tier.target(),
                tier.workItems()
            ));
        } else {
            log.info(
                "Scrape run {} finished with status {}: processed={}, success={}, failed={}, successRate={}%, completionRate={}%",
                report.runId(),
                report.status(),
                report.totalProcessed(),
                report.totalSuccess(),
                report.totalFailed(),
                report.successRate(),
                report.completionRate()
            );
            for (TierResult tier : report.tiers()) {
                for (StateResult state : tier.states()) {
                    log.info(
                        "Summary tier {} {}: target={}, processed={}, success={}, failed={}, duplicates={}, errors={}",
                        tier.tier(),
                        state.stateCode(),
                        state.target(),
                        state.processed(),
                        state.success(),
                        state.failed(),
                        state.duplicatesSkipped(),
                        state.errors().size()
                    );
                }
            }
        }
        exportReports(report, cli);
        return ScrapeOrchestratorService.STATUS_FAILED.equals(report.status()) ? EXIT_FAILED : EXIT_OK;
    }

    private int runDedup() {
        List<BusinessRecord> records = catalog.query(CatalogFilter.activeCatalog());
        List<DuplicateGroup> groups = deduplicationEngine.findDuplicateGroups(records);
        for (DuplicateGroup group : groups) {
            log.info(
                "Duplicate group around {} (confidence {}): {}",
                group.representativeId(),
                String.format("%.3f", group.confidence()),
                group.members().stream().map(DuplicateMember::name).toList()
            );
        }
        qualityReportService.generate(records);
        return EXIT_OK;
    }

    private void exportReports(ScrapeRunReport report, PipelineProperties.Cli cli) {
        try {
            if (cli.getReportJson() != null && !cli.getReportJson().isBlank()) {
                reportExporter.writeJson(report, Path.of(cli.getReportJson().trim()));
            }
            if (cli.getReportCsv() != null && !cli.getReportCsv().isBlank()) {
                reportExporter.writeCsv(report, Path.of(cli.getReportCsv().trim()));
            }
        } catch (IOException e) {
            log.warn("Failed to write scrape report", e);
        }
    }
}
