package com.wcoptimizer.service;

import com.wcoptimizer.graph.SupplierNode;
import com.wcoptimizer.graph.SupplyLink;
import com.wcoptimizer.repository.Rows;
import com.wcoptimizer.repository.TabularStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

import static com.wcoptimizer.catalog.DatasetCategory.PURCHASE_ORDERS;
import static com.wcoptimizer.catalog.DatasetCategory.SUPPLIERS;

/**
 * Reads the supplier network from the tabular store: supplier nodes from the
 * supplier master and SUPPLIES links from distinct purchase-order pairs.
 */
@Component
@RequiredArgsConstructor
public class SupplyNetworkReader {

    private static final List<String> SUPPLIER_COLUMNS = List.of(
        "supplier_name", "avg_lead_time_days", "rating", "risk_score", "on_time_delivery_rate", "country");

    private final TabularStore store;

    /** Rating is the {@code rating} column, or {@code risk_score} when the upload has no rating. */
    public List<SupplierNode> suppliers() {
        if (!store.tableExists(SUPPLIERS)) {
            return List.of();
        }
        return store.query("supplierMaster",
                Map.of("columns", store.projection(SUPPLIERS, SUPPLIER_COLUMNS)), Map.of(),
                (rs, i) -> {
                    Double rating = Rows.nullableDouble(rs, "rating");
                    return new SupplierNode(
                        Rows.string(rs, "supplier_key"),
                        Rows.string(rs, "supplier_name"),
                        Rows.nullableDouble(rs, "avg_lead_time_days"),
                        rating != null ? rating : Rows.nullableDouble(rs, "risk_score"),
                        Rows.nullableDouble(rs, "on_time_delivery_rate"),
                        Rows.string(rs, "country"));
                })
            .stream()
            .filter(s -> s.supplierId() != null)
            .toList();
    }

    public List<SupplyLink> links() {
        if (!store.tableExists(PURCHASE_ORDERS)) {
            return List.of();
        }
        return store.query("supplyLinks", Map.of(),
            (rs, i) -> new SupplyLink(Rows.string(rs, "supplier_id"), Rows.string(rs, "product_id")));
    }
}
