package com.brokerage.risk.controller;

import com.brokerage.risk.model.EngineStatus;
import com.brokerage.risk.service.RiskMonitorScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/engine")
@Tag(name = "Engine", description = "Pipeline status")
public class EngineController {

    private final RiskMonitorScheduler scheduler;

    public EngineController(RiskMonitorScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @GetMapping("/status")
    @Operation(summary = "Engine status",
               description = "Running flag, committed feed marker, counters since startup and thresholds in effect")
    public ResponseEntity<EngineStatus> getStatus() {
        return ResponseEntity.ok(scheduler.status());
    }
}
