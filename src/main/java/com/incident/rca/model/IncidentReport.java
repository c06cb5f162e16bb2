package com.incident.rca.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

@Value
@Schema(description = "Pipeline run together with its postmortem")
public class IncidentReport {

    PipelineRun run;

    Postmortem postmortem;
}
