package com.incident.rca.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Already-parsed incident inputs. Any of logs, metrics and design may be absent;
 * the matching analyzer is then skipped.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Incident signals submitted for root-cause analysis")
public class IncidentRequest {

    @Schema(description = "Free-text incident summary", example = "Checkout returning 500s after deploy abc123")
    private String description;

    @Schema(description = "Raw log text")
    private String logs;

    @Schema(description = "Named numeric time series")
    private Map<String, List<MetricSample>> metrics;

    @Schema(description = "Architecture graph")
    private ServiceGraph design;

    public boolean hasLogs() {
        return logs != null;
    }

    public boolean hasMetrics() {
        return metrics != null;
    }

    public boolean hasDesign() {
        return design != null;
    }

    public boolean hasAnyInput() {
        return hasLogs() || hasMetrics() || hasDesign();
    }
}
