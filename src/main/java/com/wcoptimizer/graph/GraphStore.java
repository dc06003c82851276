package com.wcoptimizer.graph;

import java.util.List;
import java.util.Optional;

/**
 * Supplier and product nodes joined by SUPPLIES edges. Writes are keyed merges,
 * so replaying the same rows leaves the graph unchanged.
 * <p>
 * Every operation throws {@link com.wcoptimizer.exception.GraphStoreUnavailableException}
 * when the store cannot be reached.
 */
public interface GraphStore {

    void upsertSuppliers(List<SupplierNode> suppliers);

    void upsertSupplyLinks(List<SupplyLink> links);

    List<SupplyEdge> supplierNetwork();

    List<SingleSource> singleSourceProducts(int limit);

    /** Empty when no supplier with this id exists. */
    Optional<SupplierImpact> suppliedProducts(String supplierId);

    List<SupplierNode> suppliersOf(String productId);

    /** Suppliers with no edge to the product, best rating first, then shortest lead time. */
    List<SupplierNode> alternativeSuppliers(String productId, int limit);

    List<SupplierNode> suppliersByLeadTime();

    GraphStats stats();

    void clear();
}
