package com.wcoptimizer.catalog;

import com.wcoptimizer.exception.InvalidCategoryException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatasetCategoryTest {

    @Test
    void fromName_acceptsTableNamesAndAliases() {
        assertThat(DatasetCategory.fromName("sales_transactions")).isEqualTo(DatasetCategory.SALES_TRANSACTIONS);
        assertThat(DatasetCategory.fromName(" Sales ")).isEqualTo(DatasetCategory.SALES_TRANSACTIONS);
        assertThat(DatasetCategory.fromName("ap")).isEqualTo(DatasetCategory.AP_LEDGER);
        assertThat(DatasetCategory.fromName("pos")).isEqualTo(DatasetCategory.PURCHASE_ORDERS);
    }

    @Test
    void fromName_rejectsUnknownCategoryListingValidOnes() {
        assertThatThrownBy(() -> DatasetCategory.fromName("warehouses"))
            .isInstanceOf(InvalidCategoryException.class)
            .hasMessageContaining("inventory_snapshot");
    }

    @Test
    void onlySuppliersAndPurchaseOrdersAreMirroredToTheGraph() {
        assertThat(DatasetCategory.values())
            .filteredOn(DatasetCategory::isGraphSynced)
            .containsExactlyInAnyOrder(DatasetCategory.SUPPLIERS, DatasetCategory.PURCHASE_ORDERS);
        assertThat(DatasetCategory.SUPPLIERS.destination()).isEqualTo("tabular+graph");
        assertThat(DatasetCategory.SHIPMENTS.destination()).isEqualTo("tabular");
    }
}
