package com.wcoptimizer.service;

import com.wcoptimizer.catalog.Analysis;
import com.wcoptimizer.catalog.Requirement;
import com.wcoptimizer.dto.AlternativeSuppliersResponse;
import com.wcoptimizer.dto.AnalysisResult;
import com.wcoptimizer.dto.LeadTimeVariabilityResponse;
import com.wcoptimizer.dto.NotFoundResponse;
import com.wcoptimizer.dto.RippleEffectResponse;
import com.wcoptimizer.dto.SingleSourceRiskResponse;
import com.wcoptimizer.dto.SupplierNetworkResponse;
import com.wcoptimizer.exception.GraphStoreUnavailableException;
import com.wcoptimizer.exception.InvalidParameterException;
import com.wcoptimizer.graph.GraphStore;
import com.wcoptimizer.graph.SingleSource;
import com.wcoptimizer.graph.SupplierImpact;
import com.wcoptimizer.graph.SupplierNode;
import com.wcoptimizer.graph.SupplyEdge;
import com.wcoptimizer.graph.SupplyLink;
import com.wcoptimizer.service.AvailabilityResolver.Availability;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static com.wcoptimizer.catalog.DatasetCategory.PURCHASE_ORDERS;
import static com.wcoptimizer.catalog.DatasetCategory.SUPPLIERS;

/**
 * Supplier-network questions. The graph store answers first; when it is down or
 * holds nothing, the same answer is computed from the tabular supplier master
 * and purchase orders and labelled with its source.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SupplierNetworkService {

    static final int ALTERNATIVES_LIMIT = 5;
    static final String UNAVAILABLE_NOTE = "Graph store unavailable; computed from tabular data.";
    static final String EMPTY_GRAPH_NOTE = "Graph store holds no supplier data; computed from tabular data.";

    private static final Comparator<SupplierNode> BY_RATING_THEN_LEAD_TIME =
        Comparator.comparing(SupplierNode::rating, Comparator.nullsLast(Comparator.<Double>reverseOrder()))
            .thenComparing(SupplierNode::leadTime, Comparator.nullsLast(Comparator.<Double>naturalOrder()))
            .thenComparing(SupplierNode::supplierId);

    private final GraphStore graph;
    private final SupplyNetworkReader reader;
    private final AvailabilityResolver availability;

    public AnalysisResult network() {
        GraphAttempt<List<SupplyEdge>> attempt = tryGraph("supplier network", graph::supplierNetwork, List::isEmpty);
        if (attempt.hit()) {
            return networkResponse(attempt.value(), "graph", null);
        }
        Availability inputs = availability.check(Requirement.of(PURCHASE_ORDERS));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.GET_SUPPLIER_NETWORK.getToolName());
        }
        Map<String, SupplierNode> suppliers = suppliersById();
        List<SupplyEdge> edges = reader.links().stream()
            .map(link -> {
                SupplierNode s = suppliers.get(link.supplierId());
                return new SupplyEdge(link.supplierId(), s != null ? s.supplierName() : null,
                    s != null ? s.leadTime() : null, link.productId());
            })
            .sorted(Comparator.comparing(SupplyEdge::supplierName, Comparator.nullsLast(Comparator.<String>naturalOrder()))
                .thenComparing(SupplyEdge::supplierId)
                .thenComparing(SupplyEdge::productId))
            .toList();
        return networkResponse(edges, "tabular", attempt.note());
    }

    public AnalysisResult singleSourceRisks(int limit) {
        if (limit < 1) {
            throw new InvalidParameterException("limit must be >= 1");
        }
        GraphAttempt<List<SingleSource>> attempt =
            tryGraph("single source products", () -> graph.singleSourceProducts(limit), List::isEmpty);
        if (attempt.hit()) {
            return singleSourceResponse(attempt.value(), "graph", null);
        }
        Availability inputs = availability.check(Requirement.of(PURCHASE_ORDERS));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.FIND_SINGLE_SOURCE_RISKS.getToolName());
        }
        return singleSourceResponse(tabularSingleSources(reader.links(), suppliersById(), limit),
            "tabular", attempt.note());
    }

    /** Products that lose their supply if the given supplier fails. */
    public AnalysisResult rippleEffect(String supplierId) {
        GraphAttempt<Optional<SupplierImpact>> attempt =
            tryGraph("supplied products", () -> graph.suppliedProducts(supplierId), Optional::isEmpty);
        if (attempt.hit()) {
            return rippleResponse(attempt.value().get(), "graph", null);
        }
        Availability inputs = availability.check(Requirement.of(PURCHASE_ORDERS));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.RIPPLE_EFFECT_ANALYSIS.getToolName());
        }
        SupplierNode known = suppliersById().get(supplierId);
        List<String> products = reader.links().stream()
            .filter(link -> supplierId.equals(link.supplierId()))
            .map(SupplyLink::productId)
            .distinct()
            .sorted()
            .toList();
        if (known == null && products.isEmpty()) {
            return NotFoundResponse.builder()
                .analysis(Analysis.RIPPLE_EFFECT_ANALYSIS.getToolName())
                .message("Supplier " + supplierId + " not found")
                .build();
        }
        SupplierImpact impact = new SupplierImpact(supplierId, known != null ? known.supplierName() : null, products);
        return rippleResponse(impact, "tabular", attempt.note());
    }

    public AnalysisResult leadTimeVariability() {
        GraphAttempt<List<SupplierNode>> attempt =
            tryGraph("suppliers by lead time", graph::suppliersByLeadTime, List::isEmpty);
        if (attempt.hit()) {
            return leadTimeResponse(attempt.value(), "graph", null);
        }
        Availability inputs = availability.check(Requirement.of(SUPPLIERS));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.GET_LEAD_TIME_VARIABILITY.getToolName());
        }
        List<SupplierNode> suppliers = reader.suppliers().stream()
            .sorted(Comparator.comparing(SupplierNode::leadTime, Comparator.nullsLast(Comparator.<Double>reverseOrder()))
                .thenComparing(SupplierNode::supplierId))
            .toList();
        return leadTimeResponse(suppliers, "tabular", attempt.note());
    }

    public AnalysisResult alternatives(String sku) {
        GraphAttempt<Candidates> attempt = tryGraph("alternative suppliers",
            () -> new Candidates(graph.suppliersOf(sku), graph.alternativeSuppliers(sku, ALTERNATIVES_LIMIT)),
            Candidates::isEmpty);
        if (attempt.hit()) {
            return alternativesResponse(sku, attempt.value(), "graph", null);
        }
        Availability inputs = availability.check(Requirement.of(PURCHASE_ORDERS));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.FIND_ALTERNATIVE_SUPPLIERS.getToolName());
        }
        return alternativesResponse(sku, tabularCandidates(sku, reader.links(), suppliersById()),
            "tabular", attempt.note());
    }

    static List<SingleSource> tabularSingleSources(List<SupplyLink> links, Map<String, SupplierNode> suppliers,
                                                   int limit) {
        Map<String, Set<String>> suppliersByProduct = new TreeMap<>();
        links.forEach(link -> suppliersByProduct
            .computeIfAbsent(link.productId(), k -> new TreeSet<>())
            .add(link.supplierId()));
        return suppliersByProduct.entrySet().stream()
            .filter(e -> e.getValue().size() == 1)
            .limit(limit)
            .map(e -> {
                String supplierId = e.getValue().iterator().next();
                SupplierNode s = suppliers.get(supplierId);
                return new SingleSource(e.getKey(), supplierId, s != null ? s.supplierName() : null);
            })
            .toList();
    }

    /**
     * Current suppliers are those with a purchase-order link to the product; every
     * other known supplier is an alternative.
     */
    static Candidates tabularCandidates(String sku, List<SupplyLink> links, Map<String, SupplierNode> suppliers) {
        Set<String> current = links.stream()
            .filter(link -> sku.equals(link.productId()))
            .map(SupplyLink::supplierId)
            .collect(Collectors.toCollection(TreeSet::new));

        Map<String, SupplierNode> all = new LinkedHashMap<>(suppliers);
        links.forEach(link -> all.putIfAbsent(link.supplierId(),
            new SupplierNode(link.supplierId(), null, null, null, null, null)));

        List<SupplierNode> currentNodes = current.stream().map(all::get).toList();
        List<SupplierNode> alternatives = all.values().stream()
            .filter(s -> !current.contains(s.supplierId()))
            .sorted(BY_RATING_THEN_LEAD_TIME)
            .limit(ALTERNATIVES_LIMIT)
            .toList();
        return new Candidates(currentNodes, alternatives);
    }

    private <T> GraphAttempt<T> tryGraph(String operation, Supplier<T> call, Predicate<T> isEmpty) {
        try {
            T value = call.get();
            if (!isEmpty.test(value)) {
                return new GraphAttempt<>(value, null);
            }
            log.warn("Graph returned no data, using tabular fallback | {}", operation);
            return new GraphAttempt<>(null, EMPTY_GRAPH_NOTE);
        } catch (GraphStoreUnavailableException e) {
            log.warn("Graph unavailable, using tabular fallback | {} | {}", operation, e.getMessage());
            return new GraphAttempt<>(null, UNAVAILABLE_NOTE);
        }
    }

    private Map<String, SupplierNode> suppliersById() {
        return reader.suppliers().stream()
            .collect(Collectors.toMap(SupplierNode::supplierId, Function.identity(), (a, b) -> a, LinkedHashMap::new));
    }

    private static SupplierNetworkResponse networkResponse(List<SupplyEdge> edges, String source, String note) {
        return SupplierNetworkResponse.builder()
            .source(source)
            .note(note)
            .relationships(edges.size())
            .network(edges.stream()
                .map(e -> SupplierNetworkResponse.Edge.builder()
                    .supplierId(e.supplierId())
                    .supplierName(e.supplierName())
                    .leadTime(e.leadTime())
                    .productId(e.productId())
                    .build())
                .toList())
            .build();
    }

    private static SingleSourceRiskResponse singleSourceResponse(List<SingleSource> risks, String source,
                                                                 String note) {
        return SingleSourceRiskResponse.builder()
            .source(source)
            .note(note)
            .total(risks.size())
            .risks(risks.stream()
                .map(r -> SingleSourceRiskResponse.Risk.builder()
                    .productId(r.productId())
                    .soleSupplierId(r.supplierId())
                    .soleSupplier(r.supplierName())
                    .risk("high")
                    .build())
                .toList())
            .build();
    }

    private static RippleEffectResponse rippleResponse(SupplierImpact impact, String source, String note) {
        return RippleEffectResponse.builder()
            .source(source)
            .note(note)
            .supplierId(impact.supplierId())
            .supplier(impact.supplierName())
            .impacted(impact.productIds())
            .count(impact.productIds().size())
            .severity(WorkingCapitalMath.rippleSeverity(impact.productIds().size()))
            .build();
    }

    private static LeadTimeVariabilityResponse leadTimeResponse(List<SupplierNode> suppliers, String source,
                                                                String note) {
        return LeadTimeVariabilityResponse.builder()
            .source(source)
            .note(note)
            .suppliers(suppliers.stream()
                .map(s -> LeadTimeVariabilityResponse.SupplierLeadTime.builder()
                    .supplierId(s.supplierId())
                    .supplierName(s.supplierName())
                    .leadTime(s.leadTime())
                    .rating(s.rating())
                    .build())
                .toList())
            .build();
    }

    private static AlternativeSuppliersResponse alternativesResponse(String sku, Candidates candidates,
                                                                     String source, String note) {
        List<AlternativeSuppliersResponse.Candidate> alternatives = new ArrayList<>();
        candidates.alternatives().forEach(s -> alternatives.add(candidate(s)));
        return AlternativeSuppliersResponse.builder()
            .source(source)
            .note(note)
            .productId(sku)
            .current(candidates.current().isEmpty() ? null : candidate(candidates.current().get(0)))
            .alternatives(alternatives)
            .build();
    }

    private static AlternativeSuppliersResponse.Candidate candidate(SupplierNode s) {
        return AlternativeSuppliersResponse.Candidate.builder()
            .supplierId(s.supplierId())
            .supplierName(s.supplierName())
            .leadTime(s.leadTime())
            .rating(s.rating())
            .country(s.country())
            .build();
    }

    record Candidates(List<SupplierNode> current, List<SupplierNode> alternatives) {

        boolean isEmpty() {
            return current.isEmpty() && alternatives.isEmpty();
        }
    }

    private record GraphAttempt<T>(T value, String note) {

        boolean hit() {
            return value != null;
        }
    }
}
