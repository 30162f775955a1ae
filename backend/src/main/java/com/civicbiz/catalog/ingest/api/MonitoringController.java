package com.civicbiz.catalog.ingest.api;

import com.civicbiz.catalog.ingest.model.ErrorSummary;
import com.civicbiz.catalog.ingest.model.ScrapingMetrics;
import com.civicbiz.catalog.ingest.model.SyncLogEntry;
import com.civicbiz.catalog.ingest.service.MonitoringService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/monitoring")
public class MonitoringController {
    private final MonitoringService monitoringService;

    public MonitoringController(MonitoringService monitoringService) {
        this.monitoringService = monitoringService;
    }

    @GetMapping("/metrics")
    public ScrapingMetrics metrics() {
        return monitoringService.metrics();
    }

    @GetMapping("/logs")
    public List<SyncLogEntry> logs(
        @RequestParam(name = "limit", defaultValue = "100") int limit,
        @RequestParam(name = "level", required = false) String level
    ) {
        return monitoringService.recentLogs(limit, level);
    }

    @GetMapping("/errors")
    public ErrorSummary errors(@RequestParam(name = "hours", defaultValue = "24") int hours) {
        return monitoringService.errorSummary(hours);
    }
}
