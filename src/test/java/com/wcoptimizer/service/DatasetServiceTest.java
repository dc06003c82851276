package com.wcoptimizer.service;

import com.wcoptimizer.dto.AnalysisResult;
import com.wcoptimizer.dto.DataQualityResponse;
import com.wcoptimizer.dto.DatabaseStatusResponse;
import com.wcoptimizer.dto.DatasetStatusResponse;
import com.wcoptimizer.dto.InsufficientDataResponse;
import com.wcoptimizer.dto.ResetResponse;
import com.wcoptimizer.dto.UploadHistoryResponse;
import com.wcoptimizer.exception.GraphStoreUnavailableException;
import com.wcoptimizer.graph.GraphStore;
import com.wcoptimizer.support.TabularFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static com.wcoptimizer.catalog.DatasetCategory.CUSTOMERS;
import static com.wcoptimizer.catalog.DatasetCategory.PRODUCTS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DatasetServiceTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Mock
    GraphStore graph;

    TabularFixtures fixtures;
    DatasetService datasetService;

    @BeforeEach
    void setUp() {
        fixtures = new TabularFixtures(tempDir);
        datasetService = new DatasetService(fixtures.store(), new AvailabilityResolver(fixtures.store()), graph, FIXED);
    }

    @AfterEach
    void tearDown() throws Exception {
        fixtures.close();
    }

    @Test
    void qualityScore_penalisesNullColumnsAndCapsDuplicatePenalty() {
        assertThat(DatasetService.qualityScore(0, 0)).isEqualTo(100);
        assertThat(DatasetService.qualityScore(2, 3)).isEqualTo(84);
        assertThat(DatasetService.qualityScore(0, 500)).isEqualTo(80);
        assertThat(DatasetService.qualityScore(30, 10)).isZero();
    }

    @Test
    void dataQuality_reportsNullsAndDuplicates() {
        fixtures.load(CUSTOMERS,
            "customer_id,customer_name,region",
            "C1,Acme,",
            "C1,Acme,",
            "C2,Globex,West");

        DataQualityResponse response = (DataQualityResponse) datasetService.dataQuality();

        DataQualityResponse.TableQuality customers = response.getTables().get(0);
        assertThat(customers.getTable()).isEqualTo("customers");
        assertThat(customers.getRows()).isEqualTo(3);
        assertThat(customers.getNullCounts()).containsOnlyKeys("region");
        assertThat(customers.getDuplicateRows()).isEqualTo(1);
        assertThat(customers.getQualityScore()).isEqualTo(93);
    }

    @Test
    void dataQuality_withNothingLoadedIsInsufficient() {
        AnalysisResult result = datasetService.dataQuality();

        assertThat(result).isInstanceOf(InsufficientDataResponse.class);
    }

    @Test
    void datasetStatus_listsEveryCategory() {
        fixtures.load(PRODUCTS,
            "product_id,product_name,unit_cost,unit_price",
            "P1,Widget,2.5,4.0");

        DatasetStatusResponse status = datasetService.datasetStatus();

        assertThat(status.getTotal()).isEqualTo(9);
        assertThat(status.getUploaded()).isEqualTo(1);
    }

    @Test
    void versionHistory_withoutUploadLogShowsCurrentTables() {
        fixtures.load(PRODUCTS,
            "product_id,product_name,unit_cost,unit_price",
            "P1,Widget,2.5,4.0");

        UploadHistoryResponse history = datasetService.versionHistory();

        assertThat(history.getNote()).isNotBlank();
        assertThat(history.getUploads()).extracting(UploadHistoryResponse.Upload::getCategory)
            .containsExactly("products");
    }

    @Test
    void reset_reportsGraphThatCouldNotBeCleared() {
        fixtures.load(CUSTOMERS, "customer_id,customer_name", "C1,Acme");
        doThrow(new GraphStoreUnavailableException("refused", null)).when(graph).clear();

        ResetResponse response = datasetService.reset();

        assertThat(response.getDroppedTables()).containsExactly("customers");
        assertThat(response.isGraphCleared()).isFalse();
        assertThat(response.getGraphNote()).contains("refused");
        assertThat(fixtures.store().tableExists(CUSTOMERS)).isFalse();
    }

    @Test
    void databaseStatus_marksUnreachableGraph() {
        fixtures.load(CUSTOMERS, "customer_id,customer_name", "C1,Acme");
        when(graph.stats()).thenThrow(new GraphStoreUnavailableException("refused", null));

        DatabaseStatusResponse status = datasetService.databaseStatus();

        assertThat(status.getTabular().getStatus()).isEqualTo("connected");
        assertThat(status.getTabular().getTables()).containsEntry("customers", 1L);
        assertThat(status.getGraph().getStatus()).isEqualTo("unavailable");
        assertThat(status.getCheckedAt()).isEqualTo(FIXED.instant());
    }
}
