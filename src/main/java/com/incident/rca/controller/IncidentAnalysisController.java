package com.incident.rca.controller;

import com.incident.rca.model.IncidentReport;
import com.incident.rca.model.IncidentRequest;
import com.incident.rca.model.PipelineRun;
import com.incident.rca.model.Postmortem;
import com.incident.rca.service.PipelineOrchestrationService;
import com.incident.rca.service.PostmortemService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/incidents")
@Tag(name = "Incidents", description = "Submit incident signals for root-cause analysis")
public class IncidentAnalysisController {

    private static final String MISSING_INPUT = "At least one of logs, metrics or design must be supplied";

    private final PipelineOrchestrationService orchestrationService;
    private final PostmortemService postmortemService;

    public IncidentAnalysisController(PipelineOrchestrationService orchestrationService,
                                      PostmortemService postmortemService) {
        this.orchestrationService = orchestrationService;
        this.postmortemService = postmortemService;
    }

    @Operation(summary = "Analyze an incident",
            description = "Runs the log, metric and design analyzers concurrently over the supplied inputs, " +
                    "correlates their evidence and returns the frozen pipeline run: per-analyzer results, " +
                    "ranked root-cause candidates with scores and supporting evidence, and the run status " +
                    "(COMPLETE / DEGRADED / FAILED).")
    @ApiResponse(responseCode = "200", description = "Frozen pipeline run",
            content = @Content(schema = @Schema(implementation = PipelineRun.class)))
    @ApiResponse(responseCode = "400", description = "No input supplied or unreadable body")
    @PostMapping("/analyze")
    public ResponseEntity<?> analyze(@RequestBody IncidentRequest request) {
        if (!request.hasAnyInput()) {
            return ResponseEntity.badRequest().body(Map.of("error", MISSING_INPUT));
        }
        PipelineRun run = orchestrationService.run(request);
        return ResponseEntity.ok(run);
    }

    @Operation(summary = "Analyze an incident and compose a postmortem",
            description = "Same analysis as /analyze, followed by a Markdown postmortem with sections " +
                    "What Happened, Impact, Root Cause, Evidence, Timeline and Action Items.")
    @ApiResponse(responseCode = "200", description = "Pipeline run with its postmortem",
            content = @Content(schema = @Schema(implementation = IncidentReport.class)))
    @ApiResponse(responseCode = "400", description = "No input supplied or unreadable body")
    @PostMapping("/report")
    public ResponseEntity<?> report(@RequestBody IncidentRequest request) {
        if (!request.hasAnyInput()) {
            return ResponseEntity.badRequest().body(Map.of("error", MISSING_INPUT));
        }
        PipelineRun run = orchestrationService.run(request);
        Postmortem postmortem = postmortemService.compose(run);
        return ResponseEntity.ok(new IncidentReport(run, postmortem));
    }
}
