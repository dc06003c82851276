package com.wcoptimizer.service;

import com.wcoptimizer.catalog.Analysis;
import com.wcoptimizer.catalog.Requirement;
import com.wcoptimizer.dto.AbcXyzResponse;
import com.wcoptimizer.dto.AnalysisResult;
import com.wcoptimizer.dto.ParetoResponse;
import com.wcoptimizer.exception.InvalidParameterException;
import com.wcoptimizer.repository.Rows;
import com.wcoptimizer.repository.TabularStore;
import com.wcoptimizer.service.AvailabilityResolver.Availability;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.wcoptimizer.catalog.DatasetCategory.INVENTORY_SNAPSHOT;
import static com.wcoptimizer.catalog.DatasetCategory.PRODUCTS;
import static com.wcoptimizer.catalog.DatasetCategory.SALES_TRANSACTIONS;
import static com.wcoptimizer.service.WorkingCapitalMath.round1;
import static com.wcoptimizer.service.WorkingCapitalMath.round2;

/**
 * Pareto (ABC) and demand-variability (XYZ) classification, recomputed per call.
 */
@Service
@RequiredArgsConstructor
public class ClassificationService {

    static final int PARETO_ROWS = 50;
    private static final List<String> PRODUCT_COLUMNS = List.of("product_name", "category", "abc_class", "xyz_class");

    private final TabularStore store;
    private final AvailabilityResolver availability;

    public AnalysisResult pareto(String dimension) {
        String dim = dimension == null ? "revenue" : dimension.trim().toLowerCase(Locale.ROOT);
        String query;
        Availability inputs;
        switch (dim) {
            case "revenue" -> {
                query = "paretoRevenue";
                inputs = availability.check(Requirement.of(SALES_TRANSACTIONS));
            }
            case "quantity" -> {
                query = "paretoQuantity";
                inputs = availability.check(Requirement.of(SALES_TRANSACTIONS));
            }
            case "inventory_value" -> {
                query = "paretoInventoryValue";
                inputs = availability.check(Requirement.of(INVENTORY_SNAPSHOT, "inventory_value"));
            }
            default -> throw new InvalidParameterException(
                "dimension must be one of: revenue, inventory_value, quantity");
        }
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.GET_PARETO_ANALYSIS.getToolName());
        }

        List<SkuValue> values = store.query(query, Map.of(),
            (rs, i) -> new SkuValue(Rows.string(rs, "sku"), Rows.doubleOr(rs, "value", 0.0)));
        List<RankedSku> ranked = rankByValue(values);
        int driving = (int) ranked.stream().filter(r -> r.cumulativePct() <= 80.0).count();
        double total = values.stream().mapToDouble(SkuValue::value).sum();

        return ParetoResponse.builder()
            .dimension(dim)
            .totalSkus(ranked.size())
            .skusDriving80Pct(driving)
            .pctOfSkus(ranked.isEmpty() ? 0.0 : round1(driving * 100.0 / ranked.size()))
            .totalValue(round2(total))
            .paretoData(ranked.stream()
                .limit(PARETO_ROWS)
                .map(r -> ParetoResponse.Entry.builder()
                    .rank(r.rank())
                    .sku(r.sku())
                    .value(round2(r.value()))
                    .cumulativePct(round2(r.cumulativePct()))
                    .abcClass(String.valueOf(r.abcClass()))
                    .build())
                .toList())
            .build();
    }

    /**
     * Product-master letters win over computed ones. SKUs with sales are ranked
     * by revenue; products that carry both master letters but have no sales
     * follow, ordered by segment. Either source alone is enough.
     */
    public AnalysisResult abcXyz(int limit) {
        if (limit < 1) {
            throw new InvalidParameterException("limit must be >= 1");
        }
        boolean hasSales = availability.isAvailable(SALES_TRANSACTIONS);
        Map<String, ProductClass> master = productClasses();
        boolean hasMasterClasses = master.values().stream().anyMatch(ProductClass::fullyClassified);
        if (!hasSales && !hasMasterClasses) {
            return availability.check(Requirement.of(SALES_TRANSACTIONS))
                .toResponse(Analysis.GET_ABC_XYZ_CLASSIFICATION.getToolName());
        }

        Map<String, DemandProfile> profiles = new HashMap<>();
        List<SkuValue> revenues = new ArrayList<>();
        if (hasSales) {
            store.query("skuDemandProfile", Map.of(), (rs, i) -> new DemandProfile(
                    Rows.string(rs, "sku"),
                    Rows.doubleOr(rs, "revenue", 0.0),
                    Rows.doubleOr(rs, "mean_qty", 0.0),
                    Rows.doubleOr(rs, "std_qty", 0.0)))
                .forEach(p -> {
                    profiles.put(p.sku(), p);
                    revenues.add(new SkuValue(p.sku(), p.revenue()));
                });
        }

        Map<String, Integer> matrix = new LinkedHashMap<>();
        for (char abc : new char[] {'A', 'B', 'C'}) {
            for (char xyz : new char[] {'X', 'Y', 'Z'}) {
                matrix.put("" + abc + xyz, 0);
            }
        }

        List<AbcXyzResponse.Entry> entries = new ArrayList<>();
        for (RankedSku ranked : rankByValue(revenues)) {
            DemandProfile profile = profiles.get(ranked.sku());
            ProductClass product = master.get(ranked.sku());
            char computedXyz = WorkingCapitalMath.xyzClass(profile.meanQty(), profile.stdQty());

            String abc = product != null && product.abcClass() != null
                ? product.abcClass() : String.valueOf(ranked.abcClass());
            String xyz = product != null && product.xyzClass() != null
                ? product.xyzClass() : String.valueOf(computedXyz);
            matrix.merge(abc + xyz, 1, Integer::sum);

            entries.add(AbcXyzResponse.Entry.builder()
                .sku(ranked.sku())
                .productName(product != null ? product.productName() : null)
                .category(product != null ? product.category() : null)
                .revenue(round2(ranked.value()))
                .cumulativePct(round2(ranked.cumulativePct()))
                .coefficientOfVariation(round2(
                    WorkingCapitalMath.coefficientOfVariation(profile.meanQty(), profile.stdQty())))
                .abcClass(abc)
                .xyzClass(xyz)
                .segment(abc + xyz)
                .classificationSource(source(product))
                .build());
        }

        master.values().stream()
            .filter(p -> !profiles.containsKey(p.sku()) && p.fullyClassified())
            .sorted(Comparator.comparing(ProductClass::abcClass)
                .thenComparing(ProductClass::xyzClass)
                .thenComparing(ProductClass::sku))
            .forEach(product -> {
                matrix.merge(product.abcClass() + product.xyzClass(), 1, Integer::sum);
                entries.add(AbcXyzResponse.Entry.builder()
                    .sku(product.sku())
                    .productName(product.productName())
                    .category(product.category())
                    .abcClass(product.abcClass())
                    .xyzClass(product.xyzClass())
                    .segment(product.abcClass() + product.xyzClass())
                    .classificationSource(source(product))
                    .build());
            });

        return AbcXyzResponse.builder()
            .totalSkus(entries.size())
            .matrix(matrix)
            .skus(entries.stream().limit(limit).toList())
            .build();
    }

    /**
     * Sorts by value descending with SKU ascending as the tie-break and assigns
     * ABC letters from the running cumulative share. A zero total puts every SKU in C.
     */
    static List<RankedSku> rankByValue(List<SkuValue> values) {
        List<SkuValue> sorted = values.stream()
            .sorted(Comparator.comparingDouble(SkuValue::value).reversed()
                .thenComparing(SkuValue::sku, Comparator.nullsLast(Comparator.naturalOrder())))
            .toList();
        double total = sorted.stream().mapToDouble(SkuValue::value).sum();

        List<RankedSku> ranked = new ArrayList<>(sorted.size());
        double cumulative = 0.0;
        int rank = 0;
        for (SkuValue v : sorted) {
            cumulative += v.value();
            double pct = total > 0 ? cumulative * 100.0 / total : 100.0;
            ranked.add(new RankedSku(++rank, v.sku(), v.value(), pct, WorkingCapitalMath.abcClass(pct)));
        }
        return ranked;
    }

    private Map<String, ProductClass> productClasses() {
        if (!availability.isAvailable(PRODUCTS)) {
            return Map.of();
        }
        Map<String, ProductClass> bySku = new HashMap<>();
        store.query("productAttributes", Map.of("columns", store.projection(PRODUCTS, PRODUCT_COLUMNS)), Map.of(),
                (rs, i) -> new ProductClass(
                    Rows.string(rs, "sku"),
                    Rows.string(rs, "product_name"),
                    Rows.string(rs, "category"),
                    classLetter(Rows.string(rs, "abc_class"), "ABC"),
                    classLetter(Rows.string(rs, "xyz_class"), "XYZ")))
            .forEach(p -> bySku.putIfAbsent(p.sku(), p));
        return bySku;
    }

    private static String classLetter(String raw, String allowed) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String letter = raw.trim().substring(0, 1).toUpperCase(Locale.ROOT);
        return allowed.contains(letter) ? letter : null;
    }

    private static String source(ProductClass product) {
        if (product == null || (product.abcClass() == null && product.xyzClass() == null)) {
            return "computed";
        }
        return product.abcClass() != null && product.xyzClass() != null ? "product_master" : "mixed";
    }

    record SkuValue(String sku, double value) {}

    record RankedSku(int rank, String sku, double value, double cumulativePct, char abcClass) {}

    private record DemandProfile(String sku, double revenue, double meanQty, double stdQty) {}

    private record ProductClass(String sku, String productName, String category, String abcClass, String xyzClass) {
        boolean fullyClassified() {
            return sku != null && abcClass != null && xyzClass != null;
        }
    }
}
