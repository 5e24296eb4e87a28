package com.vortex.firewall.contract;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.vortex.firewall.config.TestAerospikeConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract test that validates the OpenAPI document structure.
 * Ensures all endpoints and critical schemas are present,
 * protecting consumers from accidental schema drift.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestAerospikeConfig.class)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    private DocumentContext apiDocs() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        return JsonPath.parse(response.getBody());
    }

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        Map<String, Object> paths = apiDocs().read("$.paths");

        // Alert endpoints
        assertThat(paths).containsKey("/api/v1/alerts");
        assertThat(paths).containsKey("/api/v1/alerts/campaign/{campaignId}");

        // Baseline endpoint
        assertThat(paths).containsKey("/api/v1/baselines/{campaignId}");

        // Scan endpoints
        assertThat(paths).containsKey("/api/v1/scans/last");
        assertThat(paths).containsKey("/api/v1/scans/run");

        // Config endpoint
        assertThat(paths).containsKey("/api/v1/config/thresholds");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        Map<String, Object> schemas = apiDocs().read("$.components.schemas");

        assertThat(schemas).containsKey("AlertRecord");
        assertThat(schemas).containsKey("BaselineRecord");
        assertThat(schemas).containsKey("ScanSummary");
    }

    @Test
    void openApiSpec_alertAndScanSchemas_haveRequiredFields() {
        DocumentContext json = apiDocs();

        Map<String, Object> alertProps = json.read("$.components.schemas.AlertRecord.properties");
        assertThat(alertProps).containsKeys("alertId", "alertType", "message", "resourceId",
                "severity", "action", "createdAt");

        Map<String, Object> scanProps = json.read("$.components.schemas.ScanSummary.properties");
        assertThat(scanProps).containsKeys("scanId", "campaignsScanned", "campaignsFailed",
                "findings", "aborted", "stoppedEarly");
    }

    @Test
    void lastScan_beforeAnyScan_returns404() {
        ResponseEntity<String> response = restTemplate.getForEntity("/api/v1/scans/last", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }
}
