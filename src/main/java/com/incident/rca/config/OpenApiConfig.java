package com.incident.rca.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI incidentRcaOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Incident RCA API")
                        .version("1.0.0")
                        .description(
                                "Root-cause analysis for production incidents.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Submit logs, metrics and/or a service graph via `POST /api/v1/incidents/analyze`\n" +
                                "2. Log, metric and design analyzers run concurrently; a failing analyzer never blocks the others\n" +
                                "3. Optional reasoning backend enriches findings (bounded by timeout, degrades on failure)\n" +
                                "4. Evidence is attributed to service graph nodes and scored (0-1)\n" +
                                "5. Run status: **COMPLETE**, **DEGRADED** (partial evidence) or **FAILED** (no evidence)\n\n" +
                                "**Evidence kinds:**\n" +
                                "- `metric_anomaly`: samples with |z| above the configured threshold\n" +
                                "- `log_error`, `stack_trace`, `log_anomaly`, `log_summary`: log scan findings\n" +
                                "- `spof`, `scalability_risk`: structural risks in the service graph\n" +
                                "- `narrative`: reasoning backend summaries\n\n" +
                                "`POST /api/v1/incidents/report` additionally returns a Markdown postmortem.")
                        .contact(new Contact().name("SRE Tooling Team")));
    }
}
