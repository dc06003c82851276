package com.wcoptimizer.service;

import com.wcoptimizer.catalog.Analysis;
import com.wcoptimizer.catalog.Requirement;
import com.wcoptimizer.config.WcOptimizerProperties;
import com.wcoptimizer.dto.AnalysisResult;
import com.wcoptimizer.dto.DeadStockResponse;
import com.wcoptimizer.dto.EoqResponse;
import com.wcoptimizer.dto.InventoryAgingResponse;
import com.wcoptimizer.dto.InventoryTurnoverResponse;
import com.wcoptimizer.dto.OverstockResponse;
import com.wcoptimizer.dto.ReorderAlertsResponse;
import com.wcoptimizer.dto.SafetyStockResponse;
import com.wcoptimizer.dto.SmartReorderResponse;
import com.wcoptimizer.dto.StockoutRiskResponse;
import com.wcoptimizer.exception.InvalidParameterException;
import com.wcoptimizer.repository.Rows;
import com.wcoptimizer.repository.TabularStore;
import com.wcoptimizer.service.AvailabilityResolver.Availability;
import com.wcoptimizer.service.WorkingCapitalMath.ReorderSeverity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

import static com.wcoptimizer.catalog.DatasetCategory.INVENTORY_SNAPSHOT;
import static com.wcoptimizer.catalog.DatasetCategory.PRODUCTS;
import static com.wcoptimizer.catalog.DatasetCategory.SALES_TRANSACTIONS;
import static com.wcoptimizer.service.WorkingCapitalMath.round1;
import static com.wcoptimizer.service.WorkingCapitalMath.round2;

/**
 * Inventory policy: reorder signals, buffer and lot sizing, and stock health.
 * Policy defaults (unit cost, lead time, demand deviation, order quantity) come
 * from {@link WcOptimizerProperties.Policy}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryPolicyService {

    private static final List<String> AGING_BUCKETS = List.of("0-30d", "31-60d", "61-90d", "90+d");

    private final TabularStore store;
    private final AvailabilityResolver availability;
    private final WcOptimizerProperties properties;
    private final Clock clock;

    public AnalysisResult reorderAlerts() {
        Availability inputs = availability.check(Requirement.of(INVENTORY_SNAPSHOT, "reorder_point"));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.GET_REORDER_ALERTS.getToolName());
        }
        String columns = store.projection(INVENTORY_SNAPSHOT,
            List.of("location_id", "qty_on_hand", "reorder_point", "safety_stock_target", "days_of_supply"));

        List<ReorderAlertsResponse.Alert> alerts = store.query("reorderPositions", Map.of("columns", columns),
                Map.of("warning_factor", WorkingCapitalMath.WARNING_FACTOR),
                (rs, i) -> {
                    double onHand = Rows.doubleOr(rs, "qty_on_hand", 0.0);
                    double reorderPoint = Rows.doubleOr(rs, "reorder_point", 0.0);
                    OptionalDouble ratio = WorkingCapitalMath.coverageRatio(onHand, reorderPoint);
                    return ReorderAlertsResponse.Alert.builder()
                        .sku(Rows.string(rs, "sku"))
                        .locationId(Rows.string(rs, "location_id"))
                        .qtyOnHand(onHand)
                        .reorderPoint(reorderPoint)
                        .safetyStockTarget(Rows.nullableDouble(rs, "safety_stock_target"))
                        .daysOfSupply(Rows.nullableDouble(rs, "days_of_supply"))
                        .coverageRatio(ratio.isPresent() ? round2(ratio.getAsDouble()) : null)
                        .severity(WorkingCapitalMath.reorderSeverity(onHand, reorderPoint).label())
                        .build();
                })
            .stream()
            .filter(a -> !ReorderSeverity.OK.label().equals(a.getSeverity()))
            .sorted(Comparator.comparing(ReorderAlertsResponse.Alert::getCoverageRatio,
                    Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(ReorderAlertsResponse.Alert::getSku, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(ReorderAlertsResponse.Alert::getLocationId, Comparator.nullsLast(Comparator.naturalOrder())))
            .toList();

        return ReorderAlertsResponse.builder()
            .criticalCount((int) alerts.stream().filter(a -> ReorderSeverity.CRITICAL.label().equals(a.getSeverity())).count())
            .warningCount((int) alerts.stream().filter(a -> ReorderSeverity.WARNING.label().equals(a.getSeverity())).count())
            .alerts(alerts)
            .build();
    }

    public AnalysisResult smartReorder(int limit) {
        requirePositive("limit", limit);
        Availability inputs = availability.check(
            Requirement.of(INVENTORY_SNAPSHOT, "reorder_point", "days_of_supply", "stock_status"));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.GET_SMART_REORDER_RECOMMENDATIONS.getToolName());
        }

        Map<String, String> fragments = new LinkedHashMap<>();
        if (availability.isAvailable(PRODUCTS)) {
            fragments.put("product_join",
                "LEFT JOIN products p ON CAST(i.product_id AS VARCHAR) = CAST(p.product_id AS VARCHAR)");
            fragments.put("order_qty", store.columnOrNull(PRODUCTS, "p", "economic_order_qty"));
            fragments.put("lead_time", store.columnOrNull(PRODUCTS, "p", "lead_time_days"));
        } else {
            fragments.put("product_join", "");
            fragments.put("order_qty", "NULL");
            fragments.put("lead_time", "NULL");
        }

        int defaultQty = properties.getPolicy().getDefaultOrderQuantity();
        List<SmartReorderResponse.Recommendation> recommendations = store.query("smartReorderCandidates",
                fragments, Map.of(),
                (rs, i) -> {
                    String status = Rows.string(rs, "stock_status");
                    Double productEoq = Rows.nullableDouble(rs, "product_eoq");
                    boolean hasEoq = productEoq != null && productEoq > 0;
                    return SmartReorderResponse.Recommendation.builder()
                        .sku(Rows.string(rs, "sku"))
                        .stockStatus(status)
                        .priority(reorderPriority(status))
                        .qtyOnHand(Rows.doubleOr(rs, "qty_on_hand", 0.0))
                        .reorderPoint(Rows.doubleOr(rs, "reorder_point", 0.0))
                        .daysOfSupply(Rows.nullableDouble(rs, "days_of_supply"))
                        .recommendedQty(hasEoq ? Math.round(productEoq) : defaultQty)
                        .qtyBasis(hasEoq ? "product_eoq" : "default_order_quantity")
                        .leadTimeDays(Rows.nullableDouble(rs, "lead_time_days"))
                        .build();
                })
            .stream()
            .sorted(Comparator.comparingInt(SmartReorderResponse.Recommendation::getPriority)
                .thenComparing(SmartReorderResponse.Recommendation::getDaysOfSupply,
                    Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(SmartReorderResponse.Recommendation::getSku,
                    Comparator.nullsLast(Comparator.naturalOrder())))
            .limit(limit)
            .toList();

        return SmartReorderResponse.builder()
            .count(recommendations.size())
            .recommendations(recommendations)
            .build();
    }

    public AnalysisResult safetyStock(List<String> skus, double serviceLevel) {
        List<String> targets = boundedSkus(skus);
        Availability inputs = availability.check(Requirement.of(SALES_TRANSACTIONS));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.CALCULATE_SAFETY_STOCK.getToolName());
        }
        WcOptimizerProperties.Policy policy = properties.getPolicy();
        double z = WorkingCapitalMath.zScore(serviceLevel);

        List<SafetyStockResponse.SkuSafetyStock> results = new ArrayList<>();
        for (String sku : targets) {
            List<String> notes = new ArrayList<>();
            OptionalDouble measured = WorkingCapitalMath.sampleStdDev(dailyDemand(sku));
            double sigma = measured.orElse(policy.getDefaultDemandStdDev());
            if (measured.isEmpty()) {
                notes.add("fewer than 2 days of sales; demand std dev defaulted to " + policy.getDefaultDemandStdDev());
            }
            Optional<Double> productLeadTime = productNumber(sku, "lead_time_days");
            double leadTime = productLeadTime.orElse((double) policy.getDefaultLeadTimeDays());
            if (productLeadTime.isEmpty()) {
                notes.add("lead time defaulted to " + policy.getDefaultLeadTimeDays() + " days");
            }
            results.add(SafetyStockResponse.SkuSafetyStock.builder()
                .sku(sku)
                .demandStdDev(round2(sigma))
                .leadTimeDays(leadTime)
                .safetyStock(WorkingCapitalMath.safetyStock(z, sigma, leadTime))
                .note(notes.isEmpty() ? null : String.join("; ", notes))
                .build());
        }
        return SafetyStockResponse.builder()
            .serviceLevel(serviceLevel)
            .zScore(z)
            .results(results)
            .build();
    }

    public AnalysisResult eoq(List<String> skus, double orderCost, double holdingCostPct) {
        if (orderCost < 0 || holdingCostPct < 0) {
            throw new InvalidParameterException("order_cost and holding_cost_pct must be >= 0");
        }
        List<String> targets = boundedSkus(skus);
        Availability inputs = availability.check(Requirement.of(SALES_TRANSACTIONS));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.CALCULATE_EOQ.getToolName());
        }
        double defaultUnitCost = properties.getPolicy().getDefaultUnitCost();

        List<EoqResponse.SkuEoq> results = new ArrayList<>();
        for (String sku : targets) {
            List<String> notes = new ArrayList<>();
            List<Double> daily = dailyDemand(sku);
            if (daily.isEmpty()) {
                notes.add("no sales history");
            }
            double totalQty = daily.stream().mapToDouble(Double::doubleValue).sum();
            double annualDemand = WorkingCapitalMath.annualizedDemand(totalQty, daily.size());
            Optional<Double> productCost = productNumber(sku, "unit_cost");
            double unitCost = productCost.orElse(defaultUnitCost);
            if (productCost.isEmpty()) {
                notes.add("unit cost defaulted to " + defaultUnitCost);
            }
            double holding = unitCost * holdingCostPct;
            results.add(EoqResponse.SkuEoq.builder()
                .sku(sku)
                .annualDemand(round1(annualDemand))
                .unitCost(unitCost)
                .holdingCostPerUnit(round2(holding))
                .eoq(WorkingCapitalMath.eoq(annualDemand, orderCost, holding))
                .note(notes.isEmpty() ? null : String.join("; ", notes))
                .build());
        }
        return EoqResponse.builder()
            .orderCost(orderCost)
            .holdingCostPct(holdingCostPct)
            .results(results)
            .build();
    }

    public AnalysisResult turnover(int limit) {
        requirePositive("limit", limit);
        Availability inputs = availability.check(
            Requirement.of(INVENTORY_SNAPSHOT, "inventory_value"), Requirement.of(SALES_TRANSACTIONS));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.GET_INVENTORY_TURNOVER.getToolName());
        }
        List<InventoryTurnoverResponse.SkuTurnover> skus = store.query("inventoryTurnover", Map.of(),
                (rs, i) -> {
                    double value = Rows.doubleOr(rs, "inventory_value", 0.0);
                    double revenue = Rows.doubleOr(rs, "revenue", 0.0);
                    return InventoryTurnoverResponse.SkuTurnover.builder()
                        .sku(Rows.string(rs, "sku"))
                        .qtyOnHand(Rows.doubleOr(rs, "qty_on_hand", 0.0))
                        .inventoryValue(round2(value))
                        .unitsSold(Rows.doubleOr(rs, "units_sold", 0.0))
                        .revenue(round2(revenue))
                        .turnoverRatio(value > 0 ? round2(revenue / value) : 0.0)
                        .build();
                })
            .stream()
            .sorted(Comparator.comparingDouble(InventoryTurnoverResponse.SkuTurnover::getTurnoverRatio).reversed()
                .thenComparing(InventoryTurnoverResponse.SkuTurnover::getSku,
                    Comparator.nullsLast(Comparator.naturalOrder())))
            .limit(limit)
            .toList();
        return InventoryTurnoverResponse.builder()
            .count(skus.size())
            .skus(skus)
            .build();
    }

    public AnalysisResult aging() {
        Availability inputs = availability.check(Requirement.of(INVENTORY_SNAPSHOT, "days_since_last_movement"));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.GET_INVENTORY_AGING.getToolName());
        }
        List<InventoryAgingResponse.SkuAge> details = idlePositions().stream()
            .sorted(Comparator.comparingDouble(InventoryAgingResponse.SkuAge::getDaysIdle).reversed()
                .thenComparing(InventoryAgingResponse.SkuAge::getSku, Comparator.nullsLast(Comparator.naturalOrder())))
            .toList();

        List<InventoryAgingResponse.Bucket> buckets = AGING_BUCKETS.stream()
            .map(bucket -> {
                List<InventoryAgingResponse.SkuAge> members = details.stream()
                    .filter(d -> bucket.equals(d.getBucket()))
                    .toList();
                return InventoryAgingResponse.Bucket.builder()
                    .bucket(bucket)
                    .skuCount(members.size())
                    .totalUnits(members.stream().mapToDouble(InventoryAgingResponse.SkuAge::getQtyOnHand).sum())
                    .totalValue(round2(members.stream()
                        .mapToDouble(d -> d.getInventoryValue() != null ? d.getInventoryValue() : 0.0)
                        .sum()))
                    .build();
            })
            .toList();

        return InventoryAgingResponse.builder()
            .agingBuckets(buckets)
            .details(details)
            .build();
    }

    /**
     * Stock with no sale in more than {@code days} days, or never sold. Without
     * sales history, falls back to the snapshot's days-since-last-movement.
     */
    public AnalysisResult deadStock(int days) {
        if (days < 0) {
            throw new InvalidParameterException("days must be >= 0");
        }
        LocalDate today = LocalDate.now(clock);
        Availability inventory = availability.check(Requirement.of(INVENTORY_SNAPSHOT));
        if (!inventory.satisfied()) {
            return inventory.toResponse(Analysis.GET_DEAD_STOCK.getToolName());
        }

        List<DeadStockResponse.Item> items;
        String basis;
        String note = null;
        if (availability.isAvailable(SALES_TRANSACTIONS)) {
            basis = "last_sale_date";
            boolean hasUnitCost = store.hasColumns(INVENTORY_SNAPSHOT, "unit_cost");
            if (!hasUnitCost) {
                note = "inventory_snapshot has no unit_cost; value uses default unit cost "
                    + properties.getPolicy().getDefaultUnitCost();
            }
            String unitCost = hasUnitCost
                ? "COALESCE(unit_cost, CAST(:default_unit_cost AS DOUBLE))"
                : "CAST(:default_unit_cost AS DOUBLE)";
            items = store.query("lastSaleBySku", Map.of("unit_cost", unitCost),
                    Map.of("default_unit_cost", properties.getPolicy().getDefaultUnitCost()),
                    (rs, i) -> {
                        LocalDate lastSale = Rows.date(rs, "last_sale_date");
                        return DeadStockResponse.Item.builder()
                            .sku(Rows.string(rs, "sku"))
                            .qtyOnHand(Rows.doubleOr(rs, "qty_on_hand", 0.0))
                            .valueAtRisk(round2(Rows.doubleOr(rs, "value_at_risk", 0.0)))
                            .lastSaleDate(lastSale)
                            .daysIdle(lastSale != null ? ChronoUnit.DAYS.between(lastSale, today) : null)
                            .neverSold(lastSale == null)
                            .build();
                    })
                .stream()
                .filter(item -> item.isNeverSold() || item.getDaysIdle() > days)
                .toList();
        } else if (store.hasColumns(INVENTORY_SNAPSHOT, "days_since_last_movement")) {
            basis = "days_since_last_movement";
            note = "sales_transactions not loaded; idle days read from inventory_snapshot.days_since_last_movement";
            items = idlePositions().stream()
                .filter(p -> p.getQtyOnHand() > 0 && p.getDaysIdle() > days)
                .map(p -> DeadStockResponse.Item.builder()
                    .sku(p.getSku())
                    .qtyOnHand(p.getQtyOnHand())
                    .valueAtRisk(p.getInventoryValue() != null ? round2(p.getInventoryValue()) : 0.0)
                    .daysIdle(Math.round(p.getDaysIdle()))
                    .neverSold(false)
                    .build())
                .toList();
        } else {
            return availability.check(Requirement.of(SALES_TRANSACTIONS))
                .toResponse(Analysis.GET_DEAD_STOCK.getToolName());
        }

        List<DeadStockResponse.Item> sorted = items.stream()
            .sorted(Comparator.comparingDouble(DeadStockResponse.Item::getValueAtRisk).reversed()
                .thenComparing(DeadStockResponse.Item::getSku, Comparator.nullsLast(Comparator.naturalOrder())))
            .toList();
        return DeadStockResponse.builder()
            .thresholdDays(days)
            .asOf(today)
            .basis(basis)
            .note(note)
            .count(sorted.size())
            .totalValueAtRisk(round2(sorted.stream().mapToDouble(DeadStockResponse.Item::getValueAtRisk).sum()))
            .items(sorted)
            .build();
    }

    public AnalysisResult overstock() {
        Availability inputs = availability.check(
            Requirement.of(INVENTORY_SNAPSHOT, "stock_status", "inventory_value"));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.GET_OVERSTOCK_ANALYSIS.getToolName());
        }
        String columns = store.projection(INVENTORY_SNAPSHOT,
            List.of("location_id", "qty_on_hand", "reorder_point", "inventory_value", "days_of_supply"));
        List<OverstockResponse.Item> items = store.query("overstockPositions", Map.of("columns", columns), Map.of(),
            (rs, i) -> OverstockResponse.Item.builder()
                .sku(Rows.string(rs, "sku"))
                .locationId(Rows.string(rs, "location_id"))
                .qtyOnHand(Rows.doubleOr(rs, "qty_on_hand", 0.0))
                .reorderPoint(Rows.nullableDouble(rs, "reorder_point"))
                .inventoryValue(round2(Rows.doubleOr(rs, "inventory_value", 0.0)))
                .daysOfSupply(Rows.nullableDouble(rs, "days_of_supply"))
                .build());
        return OverstockResponse.builder()
            .count(items.size())
            .totalValue(round2(items.stream().mapToDouble(OverstockResponse.Item::getInventoryValue).sum()))
            .items(items)
            .build();
    }

    public AnalysisResult stockoutRisk(int horizonDays) {
        requirePositive("horizon_days", horizonDays);
        Availability inputs = availability.check(Requirement.of(INVENTORY_SNAPSHOT, "days_of_supply"));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.GET_STOCKOUT_RISK.getToolName());
        }
        String columns = store.projection(INVENTORY_SNAPSHOT,
            List.of("location_id", "qty_on_hand", "days_of_supply", "stock_status"));
        List<StockoutRiskResponse.Item> items = store.query("stockoutPositions", Map.of("columns", columns),
            Map.of("horizon", horizonDays),
            (rs, i) -> StockoutRiskResponse.Item.builder()
                .sku(Rows.string(rs, "sku"))
                .locationId(Rows.string(rs, "location_id"))
                .qtyOnHand(Rows.doubleOr(rs, "qty_on_hand", 0.0))
                .daysOfSupply(Rows.doubleOr(rs, "days_of_supply", 0.0))
                .stockStatus(Rows.string(rs, "stock_status"))
                .build());
        return StockoutRiskResponse.builder()
            .horizonDays(horizonDays)
            .count(items.size())
            .items(items)
            .build();
    }

    static int reorderPriority(String stockStatus) {
        String status = stockStatus == null ? "" : stockStatus.trim().toLowerCase(Locale.ROOT);
        return switch (status) {
            case "stockout" -> 1;
            case "low_stock" -> 2;
            default -> 3;
        };
    }

    private List<InventoryAgingResponse.SkuAge> idlePositions() {
        return store.query("inventoryIdleDays",
            Map.of("value", store.aggregateOrNull(INVENTORY_SNAPSHOT, "SUM", "inventory_value")), Map.of(),
            (rs, i) -> {
                double idle = Rows.doubleOr(rs, "days_idle", 0.0);
                Double value = Rows.nullableDouble(rs, "inventory_value");
                return InventoryAgingResponse.SkuAge.builder()
                    .sku(Rows.string(rs, "sku"))
                    .qtyOnHand(Rows.doubleOr(rs, "qty_on_hand", 0.0))
                    .inventoryValue(value != null ? round2(value) : null)
                    .daysIdle(idle)
                    .bucket(WorkingCapitalMath.agingBucket(idle))
                    .build();
            });
    }

    private List<Double> dailyDemand(String sku) {
        return store.query("dailyDemandForSku", Map.of("sku", sku), (rs, i) -> Rows.doubleOr(rs, "qty", 0.0));
    }

    /** A numeric attribute from the product master, when loaded and populated. */
    private Optional<Double> productNumber(String sku, String column) {
        if (!availability.isAvailable(PRODUCTS, column)) {
            return Optional.empty();
        }
        return store.queryForOptional("productAttributesForSku",
                Map.of("columns", store.projection(PRODUCTS, List.of(column))), Map.of("sku", sku),
                (rs, i) -> Optional.ofNullable(Rows.nullableDouble(rs, column)))
            .flatMap(v -> v);
    }

    private List<String> boundedSkus(List<String> skus) {
        if (skus == null || skus.isEmpty()) {
            throw new InvalidParameterException("skus must contain at least one product id");
        }
        int max = properties.getQuery().getMaxSkusPerCall();
        List<String> distinct = skus.stream().distinct().toList();
        if (distinct.size() > max) {
            log.info("SKU list truncated | requested={} | max={}", distinct.size(), max);
            return distinct.subList(0, max);
        }
        return distinct;
    }

    private static void requirePositive(String name, int value) {
        if (value < 1) {
            throw new InvalidParameterException(name + " must be >= 1");
        }
    }
}
