package com.brokerage.risk.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Bulk acknowledgement request")
public record AcknowledgeRequest(
        @Schema(description = "Alerts to acknowledge; unknown ids are ignored", example = "[\"3f2c9a4e-5b1d-3c7a-9e2f-1a2b3c4d5e6f\"]")
        List<String> alertIds,
        @Schema(description = "Who acknowledged the alerts", example = "risk-desk", defaultValue = "ops")
        String acknowledgedBy) {

    public String acknowledgedByOrDefault() {
        return acknowledgedBy == null || acknowledgedBy.isBlank() ? "ops" : acknowledgedBy;
    }
}
