package com.wcoptimizer.controller;

import com.wcoptimizer.graph.GraphStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class WcOptimizerIntegrationTest {

    @Autowired TestRestTemplate restTemplate;

    @MockBean GraphStore graphStore;

    private ResponseEntity<Map> upload(String category, String filename, String csv) {
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("file", new ByteArrayResource(csv.getBytes(StandardCharsets.UTF_8)) {
            @Override
            public String getFilename() {
                return filename;
            }
        });
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        return restTemplate.postForEntity("/api/v1/files/upload?category=" + category,
            new HttpEntity<>(body, headers), Map.class);
    }

    private ResponseEntity<Map> tool(String name, Map<String, Object> args) {
        return restTemplate.postForEntity("/api/v1/tools/" + name, args, Map.class);
    }

    @Test
    void tools_listsTheWholeCatalogue() {
        ResponseEntity<List> resp = restTemplate.getForEntity("/api/v1/tools", List.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody()).hasSize(42);
        assertThat(resp.getHeaders().getFirst("X-Request-ID")).isNotBlank();
    }

    @Test
    void unknownTool_isClientErrorWithRequestId() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Request-ID", "req-42");

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/tools/get_everything",
            new HttpEntity<>(Map.of(), headers), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(resp.getBody()).containsEntry("code", "UNKNOWN_ANALYSIS");
        assertThat(resp.getBody()).containsEntry("request_id", "req-42");
    }

    @Test
    void arAging_withoutLedgerIsInsufficientDataNotAnError() {
        ResponseEntity<Map> resp = tool("get_ar_aging", Map.of());

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody()).containsEntry("status", "insufficient_data");
        assertThat((List<String>) resp.getBody().get("missing")).containsExactly("ar_ledger");
    }

    @Test
    void uploadedInventory_drivesReorderAlerts() {
        ResponseEntity<Map> uploaded = upload("inventory", "inventory.csv",
            "product_id,location_id,qty_on_hand,reorder_point\n"
                + "A,W1,80,100\n"
                + "B,W1,110,100\n"
                + "C,W1,130,100\n");

        assertThat(uploaded.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(uploaded.getBody()).containsEntry("table", "inventory_snapshot");
        assertThat(uploaded.getBody()).containsEntry("valid", true);

        ResponseEntity<Map> alerts = restTemplate.getForEntity("/api/v1/analytics/reorder-alerts", Map.class);

        assertThat(alerts.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(alerts.getBody()).containsEntry("critical_count", 1);
        assertThat(alerts.getBody()).containsEntry("warning_count", 1);
    }

    @Test
    void upload_unknownCategoryIsRejected() {
        ResponseEntity<Map> resp = upload("warehouses", "w.csv", "id\n1\n");

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(resp.getBody()).containsEntry("code", "INVALID_CATEGORY");
    }

    @Test
    void sqlQuery_writeKeywordIsBlocked() {
        ResponseEntity<Map> resp = tool("run_sql_query", Map.of("sql", "DROP TABLE products"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(resp.getBody()).containsEntry("code", "WRITE_BLOCKED");
    }

    @Test
    void databaseQuery_readOnlySelectReturnsRows() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/database/query",
            Map.of("sql", "SELECT 1 AS one"), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody()).containsEntry("row_count", 1);
        assertThat(resp.getBody()).containsEntry("truncated", false);
    }

    @Test
    void databaseQuery_blankSqlFailsValidation() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/database/query",
            Map.of("sql", ""), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @Test
    void forecast_missingSkuIsRejected() {
        ResponseEntity<Map> resp = tool("forecast_demand", Map.of("horizon_days", 10));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(resp.getBody()).containsEntry("code", "INVALID_PARAMETER");
    }

    @Test
    void templates_describeRequiredColumns() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/templates/suppliers", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat((List<String>) resp.getBody().get("required_columns")).containsExactly("supplier_id", "supplier_name");
        assertThat(resp.getBody()).containsEntry("destination", "tabular+graph");
    }
}
