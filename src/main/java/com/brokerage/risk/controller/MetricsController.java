package com.brokerage.risk.controller;

import com.brokerage.risk.model.RiskMetricsSnapshot;
import com.brokerage.risk.repository.RiskMetricsRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/metrics")
@Tag(name = "Metrics", description = "Periodic risk metrics snapshots for dashboards")
public class MetricsController {

    private final RiskMetricsRepository riskMetricsRepository;

    public MetricsController(RiskMetricsRepository riskMetricsRepository) {
        this.riskMetricsRepository = riskMetricsRepository;
    }

    @GetMapping("/snapshots")
    @Operation(summary = "List metrics snapshots",
               description = "Newest first; since is epoch milliseconds")
    public ResponseEntity<List<RiskMetricsSnapshot>> getSnapshots(
            @RequestParam(required = false) Long since,
            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(riskMetricsRepository.findSince(since, Math.max(0, limit)));
    }

    @GetMapping("/snapshots/latest")
    @Operation(summary = "Latest metrics snapshot")
    public ResponseEntity<RiskMetricsSnapshot> getLatestSnapshot() {
        return riskMetricsRepository.findLatest()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
