package com.wcoptimizer.service;

import com.wcoptimizer.config.WcOptimizerProperties;
import com.wcoptimizer.dto.AnalysisResult;
import com.wcoptimizer.dto.DeadStockResponse;
import com.wcoptimizer.dto.EoqResponse;
import com.wcoptimizer.dto.InsufficientDataResponse;
import com.wcoptimizer.dto.InventoryAgingResponse;
import com.wcoptimizer.dto.OverstockResponse;
import com.wcoptimizer.dto.ReorderAlertsResponse;
import com.wcoptimizer.dto.SafetyStockResponse;
import com.wcoptimizer.dto.SmartReorderResponse;
import com.wcoptimizer.dto.StockoutRiskResponse;
import com.wcoptimizer.support.TabularFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static com.wcoptimizer.catalog.DatasetCategory.INVENTORY_SNAPSHOT;
import static com.wcoptimizer.catalog.DatasetCategory.PRODUCTS;
import static com.wcoptimizer.catalog.DatasetCategory.SALES_TRANSACTIONS;
import static org.assertj.core.api.Assertions.assertThat;

class InventoryPolicyServiceTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-05-30T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    TabularFixtures fixtures;
    InventoryPolicyService inventory;

    @BeforeEach
    void setUp() {
        fixtures = new TabularFixtures(tempDir);
        inventory = new InventoryPolicyService(fixtures.store(), new AvailabilityResolver(fixtures.store()),
            new WcOptimizerProperties(), FIXED);
    }

    @AfterEach
    void tearDown() throws Exception {
        fixtures.close();
    }

    @Test
    void reorderAlerts_ranksByCoverageAndSkipsHealthyStock() {
        fixtures.load(INVENTORY_SNAPSHOT,
            "product_id,location_id,qty_on_hand,reorder_point",
            "A,W1,80,100",
            "B,W1,110,100",
            "C,W1,130,100",
            "D,W1,50,100");

        ReorderAlertsResponse response = (ReorderAlertsResponse) inventory.reorderAlerts();

        assertThat(response.getAlerts()).extracting(ReorderAlertsResponse.Alert::getSku)
            .containsExactly("D", "A", "B");
        assertThat(response.getAlerts()).extracting(ReorderAlertsResponse.Alert::getSeverity)
            .containsExactly("critical", "critical", "warning");
        assertThat(response.getCriticalCount()).isEqualTo(2);
        assertThat(response.getWarningCount()).isEqualTo(1);
    }

    @Test
    void reorderAlerts_needsReorderPointColumn() {
        fixtures.load(INVENTORY_SNAPSHOT,
            "product_id,qty_on_hand",
            "A,80");

        AnalysisResult result = inventory.reorderAlerts();

        assertThat(result).isInstanceOf(InsufficientDataResponse.class);
        assertThat(((InsufficientDataResponse) result).getMissing())
            .containsExactly("inventory_snapshot.reorder_point");
    }

    @Test
    void deadStock_countsOnlyDaysStrictlyBeyondThreshold() {
        fixtures.load(INVENTORY_SNAPSHOT,
            "product_id,qty_on_hand,unit_cost",
            "P1,10,5.0",
            "P2,20,2.0",
            "P3,5,1.0",
            "P4,0,1.0");
        fixtures.load(SALES_TRANSACTIONS,
            "transaction_date,product_id,qty_sold,total_revenue",
            "2024-03-01,P1,1,10.0",
            "2024-01-15,P2,1,10.0",
            "2024-02-29,P2,2,20.0",
            "2024-05-01,P4,1,10.0");

        DeadStockResponse response = (DeadStockResponse) inventory.deadStock(90);

        assertThat(response.getBasis()).isEqualTo("last_sale_date");
        assertThat(response.getAsOf()).isEqualTo(LocalDate.of(2024, 5, 30));
        assertThat(response.getItems()).extracting(DeadStockResponse.Item::getSku)
            .containsExactly("P2", "P3");
        DeadStockResponse.Item p2 = response.getItems().get(0);
        assertThat(p2.getDaysIdle()).isEqualTo(91L);
        assertThat(p2.getValueAtRisk()).isEqualTo(40.0);
        assertThat(response.getItems().get(1).isNeverSold()).isTrue();
        assertThat(response.getTotalValueAtRisk()).isEqualTo(45.0);
    }

    @Test
    void deadStock_withoutSalesFallsBackToMovementDays() {
        fixtures.load(INVENTORY_SNAPSHOT,
            "product_id,qty_on_hand,inventory_value,days_since_last_movement",
            "P1,10,50.0,120",
            "P2,10,80.0,30");

        DeadStockResponse response = (DeadStockResponse) inventory.deadStock(90);

        assertThat(response.getBasis()).isEqualTo("days_since_last_movement");
        assertThat(response.getNote()).isNotBlank();
        assertThat(response.getItems()).extracting(DeadStockResponse.Item::getSku).containsExactly("P1");
    }

    @Test
    void deadStock_withoutSalesOrMovementDaysIsInsufficient() {
        fixtures.load(INVENTORY_SNAPSHOT,
            "product_id,qty_on_hand",
            "P1,10");

        AnalysisResult result = inventory.deadStock(90);

        assertThat(result).isInstanceOf(InsufficientDataResponse.class);
        assertThat(((InsufficientDataResponse) result).getMissing()).containsExactly("sales_transactions");
    }

    @Test
    void stockoutRisk_listsPositionsInsideHorizonByDaysOfSupply() {
        fixtures.load(INVENTORY_SNAPSHOT,
            "product_id,location_id,qty_on_hand,days_of_supply,stock_status",
            "A,W1,5,3.5,low_stock",
            "B,W1,50,20.0,ok",
            "C,W1,0,0.0,stockout",
            "D,W1,10,13.9,ok");

        StockoutRiskResponse response = (StockoutRiskResponse) inventory.stockoutRisk(14);

        assertThat(response.getHorizonDays()).isEqualTo(14);
        assertThat(response.getItems()).extracting(StockoutRiskResponse.Item::getSku)
            .containsExactly("C", "A", "D");
        assertThat(response.getCount()).isEqualTo(3);
    }

    @Test
    void overstock_matchesStatusCaseInsensitivelyByValue() {
        fixtures.load(INVENTORY_SNAPSHOT,
            "product_id,qty_on_hand,stock_status,inventory_value",
            "A,100,overstock,500",
            "B,10,ok,50",
            "C,300,Overstock,900");

        OverstockResponse response = (OverstockResponse) inventory.overstock();

        assertThat(response.getItems()).extracting(OverstockResponse.Item::getSku).containsExactly("C", "A");
        assertThat(response.getTotalValue()).isEqualTo(1400.0);
        assertThat(response.getItems().get(0).getReorderPoint()).isNull();
    }

    @Test
    void aging_bucketsIdleDaysWithInclusiveUpperBounds() {
        fixtures.load(INVENTORY_SNAPSHOT,
            "product_id,qty_on_hand,inventory_value,days_since_last_movement",
            "A,10,100,10",
            "B,5,50,45",
            "C,2,20,75",
            "D,1,10,200",
            "E,4,40,30");

        InventoryAgingResponse response = (InventoryAgingResponse) inventory.aging();

        assertThat(response.getDetails()).extracting(InventoryAgingResponse.SkuAge::getSku)
            .containsExactly("D", "C", "B", "E", "A");
        assertThat(response.getAgingBuckets()).extracting(InventoryAgingResponse.Bucket::getBucket)
            .containsExactly("0-30d", "31-60d", "61-90d", "90+d");
        assertThat(response.getAgingBuckets()).extracting(InventoryAgingResponse.Bucket::getSkuCount)
            .containsExactly(2, 1, 1, 1);
        InventoryAgingResponse.Bucket fresh = response.getAgingBuckets().get(0);
        assertThat(fresh.getTotalUnits()).isEqualTo(14.0);
        assertThat(fresh.getTotalValue()).isEqualTo(140.0);
    }

    @Test
    void smartReorder_ordersByStatusPriorityThenCoverage() {
        fixtures.load(INVENTORY_SNAPSHOT,
            "product_id,qty_on_hand,reorder_point,days_of_supply,stock_status",
            "A,20,100,6,low_stock",
            "B,0,100,0,stockout",
            "C,30,100,4,low_stock",
            "D,200,100,40,ok",
            "E,50,100,9,ok");
        fixtures.load(PRODUCTS,
            "product_id,product_name,unit_cost,unit_price,economic_order_qty,lead_time_days",
            "C,Cee,1,2,250,21");

        SmartReorderResponse response = (SmartReorderResponse) inventory.smartReorder(3);

        assertThat(response.getRecommendations()).extracting(SmartReorderResponse.Recommendation::getSku)
            .containsExactly("B", "C", "A");
        assertThat(response.getRecommendations()).extracting(SmartReorderResponse.Recommendation::getPriority)
            .containsExactly(1, 2, 2);
        SmartReorderResponse.Recommendation c = response.getRecommendations().get(1);
        assertThat(c.getRecommendedQty()).isEqualTo(250L);
        assertThat(c.getQtyBasis()).isEqualTo("product_eoq");
        assertThat(c.getLeadTimeDays()).isEqualTo(21.0);
        assertThat(response.getRecommendations().get(0).getRecommendedQty()).isEqualTo(100L);
        assertThat(response.getRecommendations().get(0).getQtyBasis()).isEqualTo("default_order_quantity");
    }

    @Test
    void safetyStock_defaultsDeviationAndLeadTimeWhenUnknown() {
        fixtures.load(SALES_TRANSACTIONS,
            "transaction_date,product_id,qty_sold,total_revenue",
            "2024-05-01,X,7,70",
            "2024-05-01,Y,10,100",
            "2024-05-02,Y,20,200",
            "2024-05-03,Y,30,300");
        fixtures.load(PRODUCTS,
            "product_id,product_name,unit_cost,unit_price,lead_time_days",
            "Y,Why,4,8,9");

        SafetyStockResponse response = (SafetyStockResponse) inventory.safetyStock(List.of("X", "Y"), 0.99);

        assertThat(response.getZScore()).isEqualTo(2.33);
        SafetyStockResponse.SkuSafetyStock x = response.getResults().get(0);
        assertThat(x.getDemandStdDev()).isEqualTo(50.0);
        assertThat(x.getLeadTimeDays()).isEqualTo(14.0);
        assertThat(x.getSafetyStock()).isEqualTo(436L);
        assertThat(x.getNote()).contains("std dev defaulted to 50.0").contains("lead time defaulted to 14 days");
        SafetyStockResponse.SkuSafetyStock y = response.getResults().get(1);
        assertThat(y.getDemandStdDev()).isEqualTo(10.0);
        assertThat(y.getLeadTimeDays()).isEqualTo(9.0);
        assertThat(y.getSafetyStock()).isEqualTo(70L);
        assertThat(y.getNote()).isNull();
    }

    @Test
    void eoq_defaultsUnitCostAndHandlesSkusWithoutSales() {
        fixtures.load(SALES_TRANSACTIONS,
            "transaction_date,product_id,qty_sold,total_revenue",
            "2024-05-01,X,5,50",
            "2024-05-02,X,5,50");

        EoqResponse response = (EoqResponse) inventory.eoq(List.of("X", "Q"), 50.0, 0.25);

        EoqResponse.SkuEoq x = response.getResults().get(0);
        assertThat(x.getAnnualDemand()).isEqualTo(1825.0);
        assertThat(x.getUnitCost()).isEqualTo(10.0);
        assertThat(x.getHoldingCostPerUnit()).isEqualTo(2.5);
        assertThat(x.getEoq()).isEqualTo(270L);
        assertThat(x.getNote()).contains("unit cost defaulted to 10.0");
        EoqResponse.SkuEoq q = response.getResults().get(1);
        assertThat(q.getEoq()).isZero();
        assertThat(q.getNote()).contains("no sales history");
    }

    @Test
    void reorderPriority_ordersStockoutsFirst() {
        assertThat(InventoryPolicyService.reorderPriority("Stockout")).isEqualTo(1);
        assertThat(InventoryPolicyService.reorderPriority("low_stock")).isEqualTo(2);
        assertThat(InventoryPolicyService.reorderPriority("ok")).isEqualTo(3);
        assertThat(InventoryPolicyService.reorderPriority(null)).isEqualTo(3);
    }
}
