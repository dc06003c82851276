package com.wcoptimizer.service;

import com.wcoptimizer.catalog.DatasetCategory;
import com.wcoptimizer.exception.GraphStoreUnavailableException;
import com.wcoptimizer.graph.GraphStore;
import com.wcoptimizer.graph.SupplierNode;
import com.wcoptimizer.graph.SupplyLink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

import static com.wcoptimizer.catalog.DatasetCategory.SUPPLIERS;

/**
 * Mirrors supplier and purchase-order tables into the graph after they are
 * replaced. A failed sync leaves the tabular data in place and is reported,
 * not thrown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphSyncService {

    private final SupplyNetworkReader reader;
    private final GraphStore graph;

    public SyncOutcome sync(DatasetCategory category) {
        if (!category.isGraphSynced()) {
            return SyncOutcome.skipped();
        }
        try {
            int written = category == SUPPLIERS ? syncSuppliers() : syncSupplyLinks();
            log.info("Graph sync complete | category={} | rows={}", category.getTableName(), written);
            return new SyncOutcome(true, null);
        } catch (GraphStoreUnavailableException e) {
            log.warn("Graph sync failed | category={} | reason={}", category.getTableName(), e.getMessage());
            return new SyncOutcome(false, "Graph sync failed; tabular data was saved. " + e.getMessage());
        }
    }

    int syncSuppliers() {
        List<SupplierNode> suppliers = reader.suppliers();
        graph.upsertSuppliers(suppliers);
        return suppliers.size();
    }

    int syncSupplyLinks() {
        List<SupplyLink> links = reader.links();
        graph.upsertSupplyLinks(links);
        return links.size();
    }

    /** Whether the graph reflects the upload; {@code synced} is null when the category is not mirrored. */
    public record SyncOutcome(Boolean synced, String note) {

        static SyncOutcome skipped() {
            return new SyncOutcome(null, null);
        }
    }
}
