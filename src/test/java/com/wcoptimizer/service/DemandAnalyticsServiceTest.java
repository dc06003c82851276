package com.wcoptimizer.service;

import com.wcoptimizer.dto.AnomalyResponse;
import com.wcoptimizer.dto.NotFoundResponse;
import com.wcoptimizer.exception.InvalidParameterException;
import com.wcoptimizer.support.TabularFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static com.wcoptimizer.catalog.DatasetCategory.SALES_TRANSACTIONS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DemandAnalyticsServiceTest {

    @TempDir
    Path tempDir;

    TabularFixtures fixtures;
    DemandAnalyticsService demand;

    @BeforeEach
    void setUp() {
        fixtures = new TabularFixtures(tempDir);
        demand = new DemandAnalyticsService(fixtures.store(), new AvailabilityResolver(fixtures.store()));
    }

    @AfterEach
    void tearDown() throws Exception {
        fixtures.close();
    }

    @Test
    void anomalies_constantColumnYieldsNoAnomalies() {
        fixtures.load(SALES_TRANSACTIONS,
            "transaction_date,product_id,qty_sold,total_revenue",
            "2024-05-01,A,5,50",
            "2024-05-02,A,5,50",
            "2024-05-03,B,5,50");

        AnomalyResponse response = (AnomalyResponse) demand.anomalies("sales_transactions", "qty_sold", 2.0);

        assertThat(response.getObservations()).isEqualTo(3L);
        assertThat(response.getStdDev()).isZero();
        assertThat(response.getAnomaliesFound()).isZero();
        assertThat(response.getAnomalies()).isEmpty();
    }

    @Test
    void anomalies_flagsValuesBeyondThreshold() {
        fixtures.load(SALES_TRANSACTIONS,
            "transaction_date,product_id,qty_sold,total_revenue",
            "2024-05-01,A,10,100",
            "2024-05-02,A,10,100",
            "2024-05-03,A,10,100",
            "2024-05-04,A,10,100",
            "2024-05-05,A,10,100",
            "2024-05-06,A,10,100",
            "2024-05-07,A,10,100",
            "2024-05-08,A,10,100",
            "2024-05-09,A,10,100",
            "2024-05-10,A,100,1000");

        AnomalyResponse response = (AnomalyResponse) demand.anomalies("sales_transactions", "qty_sold", 2.0);

        assertThat(response.getMean()).isEqualTo(19.0);
        assertThat(response.getStdDev()).isEqualTo(27.0);
        assertThat(response.getAnomalies()).singleElement().satisfies(a -> {
            assertThat(a.getValue()).isEqualTo(100.0);
            assertThat(a.getZScore()).isEqualTo(3.0);
            assertThat(a.getRow()).containsKey("product_id").doesNotContainKey("z_score");
        });
    }

    @Test
    void anomalies_rejectsNonNumericColumn() {
        fixtures.load(SALES_TRANSACTIONS,
            "transaction_date,product_id,qty_sold,total_revenue",
            "2024-05-01,A,5,50");

        assertThatThrownBy(() -> demand.anomalies("sales_transactions", "product_id", 2.0))
            .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void forecast_unknownSkuIsNotFound() {
        fixtures.load(SALES_TRANSACTIONS,
            "transaction_date,product_id,qty_sold,total_revenue",
            "2024-05-01,A,5,50");

        assertThat(demand.forecast("ZZZ", 30, 7)).isInstanceOf(NotFoundResponse.class);
    }
}
