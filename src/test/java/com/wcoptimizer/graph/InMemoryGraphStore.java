package com.wcoptimizer.graph;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Keyed-merge graph held in maps, mirroring the MERGE semantics of the Neo4j store.
 */
public class InMemoryGraphStore implements GraphStore {

    private final Map<String, SupplierNode> suppliers = new TreeMap<>();
    private final Set<String> products = new TreeSet<>();
    private final Set<SupplyLink> links = new LinkedHashSet<>();

    @Override
    public void upsertSuppliers(List<SupplierNode> nodes) {
        nodes.forEach(node -> suppliers.put(node.supplierId(), node));
    }

    @Override
    public void upsertSupplyLinks(List<SupplyLink> edges) {
        for (SupplyLink link : edges) {
            suppliers.putIfAbsent(link.supplierId(),
                new SupplierNode(link.supplierId(), null, null, null, null, null));
            products.add(link.productId());
            links.add(link);
        }
    }

    @Override
    public List<SupplyEdge> supplierNetwork() {
        return links.stream()
            .map(l -> {
                SupplierNode s = suppliers.get(l.supplierId());
                return new SupplyEdge(s.supplierId(), s.supplierName(), s.leadTime(), l.productId());
            })
            .sorted(Comparator.comparing(SupplyEdge::supplierId).thenComparing(SupplyEdge::productId))
            .toList();
    }

    @Override
    public List<SingleSource> singleSourceProducts(int limit) {
        return products.stream()
            .map(p -> links.stream().filter(l -> l.productId().equals(p)).toList())
            .filter(edges -> edges.size() == 1)
            .map(edges -> {
                SupplierNode s = suppliers.get(edges.get(0).supplierId());
                return new SingleSource(edges.get(0).productId(), s.supplierId(), s.supplierName());
            })
            .limit(limit)
            .toList();
    }

    @Override
    public Optional<SupplierImpact> suppliedProducts(String supplierId) {
        SupplierNode s = suppliers.get(supplierId);
        if (s == null) {
            return Optional.empty();
        }
        List<String> supplied = links.stream()
            .filter(l -> l.supplierId().equals(supplierId))
            .map(SupplyLink::productId)
            .sorted()
            .toList();
        return Optional.of(new SupplierImpact(s.supplierId(), s.supplierName(), supplied));
    }

    @Override
    public List<SupplierNode> suppliersOf(String productId) {
        return links.stream()
            .filter(l -> l.productId().equals(productId))
            .map(l -> suppliers.get(l.supplierId()))
            .sorted(Comparator.comparing(SupplierNode::supplierId))
            .toList();
    }

    @Override
    public List<SupplierNode> alternativeSuppliers(String productId, int limit) {
        Set<String> current = new TreeSet<>();
        links.stream().filter(l -> l.productId().equals(productId)).forEach(l -> current.add(l.supplierId()));
        return suppliers.values().stream()
            .filter(s -> !current.contains(s.supplierId()))
            .sorted(Comparator.comparing((SupplierNode s) -> s.rating() != null ? s.rating() : -1.0).reversed()
                .thenComparing(s -> s.leadTime() != null ? s.leadTime() : 1.0e9)
                .thenComparing(SupplierNode::supplierId))
            .limit(limit)
            .toList();
    }

    @Override
    public List<SupplierNode> suppliersByLeadTime() {
        return suppliers.values().stream()
            .sorted(Comparator.comparing((SupplierNode s) -> s.leadTime() != null ? s.leadTime() : -1.0).reversed()
                .thenComparing(SupplierNode::supplierId))
            .toList();
    }

    @Override
    public GraphStats stats() {
        return new GraphStats(suppliers.size(), products.size(), links.size());
    }

    @Override
    public void clear() {
        suppliers.clear();
        products.clear();
        links.clear();
    }
}
