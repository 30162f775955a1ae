package com.civicbiz.catalog.ingest.api;

import com.civicbiz.catalog.ingest.dedup.DeduplicationEngine;
import com.civicbiz.catalog.ingest.dedup.DuplicateMergeService;
import com.civicbiz.catalog.ingest.model.CatalogFilter;
import com.civicbiz.catalog.ingest.model.DataQualityReport;
import com.civicbiz.catalog.ingest.model.DuplicateGroup;
import com.civicbiz.catalog.ingest.model.ScrapePlan;
import com.civicbiz.catalog.ingest.model.ScrapeRunRequest;
import com.civicbiz.catalog.ingest.persistence.CatalogSink;
import com.civicbiz.catalog.ingest.quality.DataQualityReportService;
import com.civicbiz.catalog.ingest.service.ScrapePlanner;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class CatalogController {
    private final CatalogSink catalog;
    private final DeduplicationEngine deduplicationEngine;
    private final DuplicateMergeService mergeService;
    private final DataQualityReportService qualityReportService;
    private final ScrapePlanner planner;

    public CatalogController(
        CatalogSink catalog,
        DeduplicationEngine deduplicationEngine,
        DuplicateMergeService mergeService,
        DataQualityReportService qualityReportService,
        ScrapePlanner planner
    ) {
        this.catalog = catalog;
        this.deduplicationEngine = deduplicationEngine;
        this.mergeService = mergeService;
        this.qualityReportService = qualityReportService;
        this.planner = planner;
    }

    @GetMapping("/catalog/duplicates")
    public List<DuplicateGroup> duplicates(@RequestParam(name = "threshold", required = false) Double threshold) {
        double resolved = threshold == null ? deduplicationEngine.defaultThreshold() : threshold;
        if (resolved < 0 || resolved > 1) {
            throw new ResponseStatusException(BAD_REQUEST, "threshold must be between 0 and 1");
        }
        return deduplicationEngine.findDuplicateGroups(catalog.query(CatalogFilter.activeCatalog()), resolved);
    }

    @PostMapping("/catalog/duplicates/merge")
    public DuplicateMergeService.MergeResult merge(@RequestBody MergeRequest request) {
        if (request == null || request.representativeId() == null || request.keepId() == null) {
            throw new ResponseStatusException(BAD_REQUEST, "representativeId and keepId are required");
        }
        DuplicateGroup group = mergeService.groupOf(request.representativeId(), request.memberIds());
        return mergeService.merge(group, request.keepId());
    }

    @GetMapping("/catalog/quality-report")
    public DataQualityReport qualityReport() {
        return qualityReportService.generate();
    }

    @GetMapping("/scrape/plan")
    public ScrapePlan plan(
        @RequestParam(name = "tier", required = false) Integer tier,
        @RequestParam(name = "state", required = false) String state,
        @RequestParam(name = "targetCount", required = false) Integer targetCount
    ) {
        return planner.plan(new ScrapeRunRequest(targetCount, tier, state, true));
    }

    public record MergeRequest(Long representativeId, List<Long> memberIds, Long keepId) {
    }
}
