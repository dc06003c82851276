package com.wcoptimizer.service;

import com.wcoptimizer.exception.GraphStoreUnavailableException;
import com.wcoptimizer.graph.GraphStats;
import com.wcoptimizer.graph.GraphStore;
import com.wcoptimizer.graph.InMemoryGraphStore;
import com.wcoptimizer.graph.SupplierNode;
import com.wcoptimizer.service.GraphSyncService.SyncOutcome;
import com.wcoptimizer.support.TabularFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;

import java.nio.file.Path;

import static com.wcoptimizer.catalog.DatasetCategory.CUSTOMERS;
import static com.wcoptimizer.catalog.DatasetCategory.PURCHASE_ORDERS;
import static com.wcoptimizer.catalog.DatasetCategory.SUPPLIERS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;

class GraphSyncServiceTest {

    @TempDir
    Path tempDir;

    TabularFixtures fixtures;
    InMemoryGraphStore graph;
    GraphSyncService graphSync;

    @BeforeEach
    void setUp() {
        fixtures = new TabularFixtures(tempDir);
        fixtures.load(SUPPLIERS,
            "supplier_id,supplier_name,avg_lead_time_days,risk_score",
            "S1,Alpha,10,0.8",
            "S2,Beta,20,0.6");
        fixtures.load(PURCHASE_ORDERS,
            "po_id,supplier_id,product_id,qty_ordered",
            "PO1,S1,P1,10",
            "PO2,S1,P1,5",
            "PO3,S1,P2,5",
            "PO4,S2,P2,5",
            "PO5,S3,P3,5");
        graph = new InMemoryGraphStore();
        graphSync = new GraphSyncService(new SupplyNetworkReader(fixtures.store()), graph);
    }

    @AfterEach
    void tearDown() throws Exception {
        fixtures.close();
    }

    @Test
    void sync_isIdempotentAcrossReplays() {
        graphSync.sync(SUPPLIERS);
        graphSync.sync(PURCHASE_ORDERS);
        GraphStats first = graph.stats();

        graphSync.sync(SUPPLIERS);
        SyncOutcome again = graphSync.sync(PURCHASE_ORDERS);

        assertThat(again.synced()).isTrue();
        assertThat(graph.stats()).isEqualTo(first);
        assertThat(first).isEqualTo(new GraphStats(3, 3, 4));
    }

    @Test
    void sync_fallsBackToRiskScoreWhenRatingIsAbsent() {
        graphSync.sync(SUPPLIERS);

        assertThat(graph.suppliersByLeadTime())
            .extracting(SupplierNode::supplierId, SupplierNode::rating)
            .containsExactly(
                tuple("S2", 0.6),
                tuple("S1", 0.8));
    }

    @Test
    void sync_skipsCategoriesThatAreNotMirrored() {
        SyncOutcome outcome = graphSync.sync(CUSTOMERS);

        assertThat(outcome.synced()).isNull();
        assertThat(graph.stats()).isEqualTo(new GraphStats(0, 0, 0));
    }

    @Test
    void sync_reportsUnavailableGraphWithoutThrowing() {
        GraphStore down = Mockito.mock(GraphStore.class);
        doThrow(new GraphStoreUnavailableException("connection refused", null))
            .when(down).upsertSupplyLinks(anyList());
        GraphSyncService failing = new GraphSyncService(new SupplyNetworkReader(fixtures.store()), down);

        SyncOutcome outcome = failing.sync(PURCHASE_ORDERS);

        assertThat(outcome.synced()).isFalse();
        assertThat(outcome.note()).contains("tabular data was saved");
    }
}
