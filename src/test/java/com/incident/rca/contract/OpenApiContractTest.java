package com.incident.rca.contract;

import com.incident.rca.testutil.TestDataFactory;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract test that validates the OpenAPI document structure and the analyze round trip.
 * Ensures all endpoints and critical schemas are present,
 * protecting consumers from accidental schema drift.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> paths = json.read("$.paths");

        // Incident endpoints
        assertThat(paths).containsKey("/api/v1/incidents/analyze");
        assertThat(paths).containsKey("/api/v1/incidents/report");

        // Config endpoints
        assertThat(paths).containsKey("/api/v1/config/analysis");
        assertThat(paths).containsKey("/api/v1/config/scoring");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> schemas = json.read("$.components.schemas");

        assertThat(schemas).containsKey("IncidentRequest");
        assertThat(schemas).containsKey("PipelineRun");
        assertThat(schemas).containsKey("EvidenceRecord");
        assertThat(schemas).containsKey("RootCauseHypothesis");
        assertThat(schemas).containsKey("Postmortem");
    }

    @Test
    void openApiSpec_evidenceSchema_hasRequiredFields() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());

        Map<String, Object> props = json.read("$.components.schemas.EvidenceRecord.properties");
        assertThat(props).containsKey("source");
        assertThat(props).containsKey("kind");
        assertThat(props).containsKey("severity");
        assertThat(props).containsKey("description");
        assertThat(props).containsKey("attributes");
        assertThat(props).containsKey("confidence");
    }

    @Test
    void analyze_fullRequest_rankedHypothesis() {
        ResponseEntity<String> response = restTemplate.postForEntity(
                "/api/v1/incidents/analyze", TestDataFactory.fullRequest(), String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        DocumentContext json = JsonPath.parse(response.getBody());
        assertThat(json.read("$.status", String.class)).isEqualTo("COMPLETE");
        assertThat(json.read("$.hypothesis.candidates[0].component", String.class)).isEqualTo("orders-db");
        assertThat(json.read("$.hypothesis.candidates[0].topSource", String.class)).isEqualTo("DESIGN");
    }

    @Test
    void report_fullRequest_templatePostmortem() {
        ResponseEntity<String> response = restTemplate.postForEntity(
                "/api/v1/incidents/report", TestDataFactory.fullRequest(), String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        DocumentContext json = JsonPath.parse(response.getBody());
        assertThat(json.read("$.postmortem.generatedBy", String.class)).isEqualTo("TEMPLATE");
        assertThat(json.read("$.postmortem.markdown", String.class)).contains("## Action Items");
    }
}
