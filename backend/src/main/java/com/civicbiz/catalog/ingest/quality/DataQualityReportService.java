package com.civicbiz.catalog.ingest.quality;

import com.civicbiz.catalog.ingest.dedup.DeduplicationEngine;
import com.civicbiz.catalog.ingest.model.BusinessRecord;
import com.civicbiz.catalog.ingest.model.CatalogFilter;
import com.civicbiz.catalog.ingest.model.DataQualityReport;
import com.civicbiz.catalog.ingest.model.DuplicateGroup;
import com.civicbiz.catalog.ingest.model.ValidationResult;
import com.civicbiz.catalog.ingest.persistence.CatalogSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class DataQualityReportService {
    private static final Logger log = LoggerFactory.getLogger(DataQualityReportService.class);
    static final int INFO_SCORE_BELOW = 70;

    private final CatalogSink catalog;
    private final DataQualityValidator validator;
    private final DeduplicationEngine deduplicationEngine;

    public DataQualityReportService(
        CatalogSink catalog,
        DataQualityValidator validator,
        DeduplicationEngine deduplicationEngine
    ) {
        this.catalog = catalog;
        this.validator = validator;
        this.deduplicationEngine = deduplicationEngine;
    }

    public DataQualityReport generate() {
        return generate(catalog.query(CatalogFilter.activeCatalog()));
    }

    public DataQualityReport generate(List<BusinessRecord> records) {
        List<DuplicateGroup> groups = deduplicationEngine.findDuplicateGroups(records);
        return build(records, groups.size());
    }

    DataQualityReport build(List<BusinessRecord> records, int duplicateGroups) {
        int valid = 0;
        int critical = 0;
        int warning = 0;
        int info = 0;
        long scoreTotal = 0;
        for (ValidationResult result : validator.validateAll(records).values()) {
            scoreTotal += result.score();
            if (result.isValid()) {
                valid++;
            } else {
                critical++;
            }
            if (!result.warnings().isEmpty()) {
                warning++;
            }
            if (result.score() < INFO_SCORE_BELOW) {
                info++;
            }
        }
        int total = records.size();
        double average = total == 0 ? 0.0 : (double) scoreTotal / total;
        DataQualityReport report = new DataQualityReport(
            total,
            valid,
            total - valid,
            duplicateGroups,
            average,
            new DataQualityReport.IssueCounts(critical, warning, info)
        );
        log.info(
            "Data quality report: total={}, valid={}, invalid={}, duplicateGroups={}, averageScore={}",
            report.totalBusinesses(),
            report.validBusinesses(),
            report.invalidBusinesses(),
            report.duplicateGroups(),
            String.format("%.1f", report.averageQualityScore())
        );
        return report;
    }
}
