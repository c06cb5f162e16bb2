package com.incident.rca.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One point of a named numeric time series")
public class MetricSample {

    @JsonAlias({"ts", "time"})
    @Schema(description = "Sample timestamp (epoch seconds or any monotonic tick)", example = "1700000000")
    private long timestamp;

    @Schema(description = "Sample value; null or NaN samples are skipped", example = "0.42")
    private Double value;

    public static MetricSample of(long timestamp, Double value) {
        return new MetricSample(timestamp, value);
    }
}
