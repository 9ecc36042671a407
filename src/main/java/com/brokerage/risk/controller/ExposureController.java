package com.brokerage.risk.controller;

import com.brokerage.risk.model.EntityType;
import com.brokerage.risk.model.Exposure;
import com.brokerage.risk.model.RiskLevel;
import com.brokerage.risk.service.ExposureAggregator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/exposures")
@Tag(name = "Exposures", description = "Live per-client and per-symbol exposure aggregates")
public class ExposureController {

    private final ExposureAggregator exposureAggregator;

    public ExposureController(ExposureAggregator exposureAggregator) {
        this.exposureAggregator = exposureAggregator;
    }

    @GetMapping("/clients")
    @Operation(summary = "List client exposures",
               description = "Largest exposure first. Optionally only clients at or above a risk level.")
    public ResponseEntity<List<Exposure>> getClientExposures(
            @RequestParam(required = false) RiskLevel minRiskLevel,
            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(list(EntityType.CLIENT, minRiskLevel, limit));
    }

    @GetMapping("/symbols")
    @Operation(summary = "List symbol exposures",
               description = "Largest exposure first. Optionally only symbols at or above a risk level.")
    public ResponseEntity<List<Exposure>> getSymbolExposures(
            @RequestParam(required = false) RiskLevel minRiskLevel,
            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(list(EntityType.SYMBOL, minRiskLevel, limit));
    }

    @GetMapping("/{entityType}/{entityId}")
    @Operation(summary = "Get one exposure",
               description = "entityType is CLIENT or SYMBOL (case-insensitive)")
    public ResponseEntity<?> getExposure(@PathVariable String entityType, @PathVariable String entityId) {
        EntityType type;
        try {
            type = EntityType.valueOf(entityType.toUpperCase());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown entity type: " + entityType));
        }
        if (type == EntityType.SYSTEM) {
            return ResponseEntity.badRequest().body(Map.of("error", "SYSTEM has no exposure"));
        }
        return exposureAggregator.snapshot(type, entityId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private List<Exposure> list(EntityType entityType, RiskLevel minRiskLevel, int limit) {
        return exposureAggregator.snapshotAll(entityType).stream()
                .filter(e -> minRiskLevel == null || e.getRiskLevel().ordinal() >= minRiskLevel.ordinal())
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }
}
