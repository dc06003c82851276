package com.wcoptimizer.service;

import com.wcoptimizer.dto.UploadHistoryResponse;
import com.wcoptimizer.dto.UploadResponse;
import com.wcoptimizer.exception.DatasetLoadException;
import com.wcoptimizer.exception.InvalidCategoryException;
import com.wcoptimizer.graph.InMemoryGraphStore;
import com.wcoptimizer.service.GraphSyncService.SyncOutcome;
import com.wcoptimizer.support.TabularFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static com.wcoptimizer.catalog.DatasetCategory.SUPPLIERS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DatasetIngestServiceTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-06-01T08:30:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Mock
    GraphSyncService graphSync;

    TabularFixtures fixtures;
    DatasetIngestService ingestService;
    DatasetService datasetService;

    @BeforeEach
    void setUp() {
        fixtures = new TabularFixtures(tempDir);
        ingestService = new DatasetIngestService(fixtures.store(), graphSync, FIXED);
        datasetService = new DatasetService(fixtures.store(), new AvailabilityResolver(fixtures.store()),
            new InMemoryGraphStore(), FIXED);
    }

    @AfterEach
    void tearDown() throws Exception {
        fixtures.close();
    }

    @Test
    void replace_loadsTableSyncsGraphAndLogsUpload() {
        when(graphSync.sync(SUPPLIERS)).thenReturn(new SyncOutcome(true, null));
        Path csv = fixtures.writeCsv("suppliers.csv",
            "supplier_id,supplier_name,country",
            "S1,Alpha,DE",
            "S2,Beta,US");

        UploadResponse response = ingestService.replace(SUPPLIERS, csv, "suppliers.csv");

        assertThat(response.getRows()).isEqualTo(2);
        assertThat(response.isValid()).isTrue();
        assertThat(response.getMissingColumns()).isNull();
        assertThat(response.getDestination()).isEqualTo("tabular+graph");
        assertThat(response.getGraphSynced()).isTrue();

        UploadHistoryResponse history = datasetService.versionHistory();
        assertThat(history.getUploads()).hasSize(1);
        UploadHistoryResponse.Upload upload = history.getUploads().get(0);
        assertThat(upload.getCategory()).isEqualTo("suppliers");
        assertThat(upload.getStatus()).isEqualTo("loaded");
        assertThat(upload.getUploadedAt()).isNotNull();
        assertThat(upload.getFilename()).isEqualTo("suppliers.csv");
    }

    @Test
    void replace_missingRequiredColumnsKeepsDataButSkipsGraph() {
        Path csv = fixtures.writeCsv("suppliers.csv",
            "supplier_id,country",
            "S1,DE");

        UploadResponse response = ingestService.replace(SUPPLIERS, csv, "suppliers.csv");

        assertThat(response.isValid()).isFalse();
        assertThat(response.getMissingColumns()).containsExactly("supplier_name");
        assertThat(response.getGraphSynced()).isFalse();
        assertThat(response.getGraphNote()).contains("required columns missing");
        assertThat(fixtures.store().rowCount(SUPPLIERS)).isEqualTo(1);
        verify(graphSync, never()).sync(any());
    }

    @Test
    void upload_tabularOnlyCategoryHasNoGraphOutcome() {
        MockMultipartFile file = new MockMultipartFile("file", "customers.csv", "text/csv",
            "customer_id,customer_name\nC1,Acme\nC2,Globex\n".getBytes(StandardCharsets.UTF_8));

        UploadResponse response = ingestService.upload("customers", file);

        assertThat(response.getRows()).isEqualTo(2);
        assertThat(response.getDestination()).isEqualTo("tabular");
        assertThat(response.getGraphSynced()).isNull();
        verify(graphSync, never()).sync(any());
    }

    @Test
    void upload_rejectsUnknownCategoryAndNonCsvFiles() {
        MockMultipartFile xlsx = new MockMultipartFile("file", "customers.xlsx", "application/octet-stream",
            new byte[] {1, 2, 3});
        MockMultipartFile empty = new MockMultipartFile("file", "customers.csv", "text/csv", new byte[0]);

        assertThatThrownBy(() -> ingestService.upload("warehouses", xlsx))
            .isInstanceOf(InvalidCategoryException.class);
        assertThatThrownBy(() -> ingestService.upload("customers", xlsx))
            .isInstanceOf(DatasetLoadException.class);
        assertThatThrownBy(() -> ingestService.upload("customers", empty))
            .isInstanceOf(DatasetLoadException.class);
    }
}
