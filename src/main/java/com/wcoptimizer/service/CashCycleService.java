package com.wcoptimizer.service;

import com.wcoptimizer.catalog.Analysis;
import com.wcoptimizer.catalog.DatasetCategory;
import com.wcoptimizer.catalog.Requirement;
import com.wcoptimizer.config.WcOptimizerProperties;
import com.wcoptimizer.dto.AnalysisResult;
import com.wcoptimizer.dto.ArAgingResponse;
import com.wcoptimizer.dto.CarryingCostResponse;
import com.wcoptimizer.dto.CccSimulationResponse;
import com.wcoptimizer.dto.DpoAnalysisResponse;
import com.wcoptimizer.dto.DsoAnalysisResponse;
import com.wcoptimizer.dto.KpiSummaryResponse;
import com.wcoptimizer.dto.WorkingCapitalSummaryResponse;
import com.wcoptimizer.exception.InvalidParameterException;
import com.wcoptimizer.repository.Rows;
import com.wcoptimizer.repository.TabularStore;
import com.wcoptimizer.service.AvailabilityResolver.Availability;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.Stream;

import static com.wcoptimizer.catalog.DatasetCategory.AP_LEDGER;
import static com.wcoptimizer.catalog.DatasetCategory.AR_LEDGER;
import static com.wcoptimizer.catalog.DatasetCategory.CUSTOMERS;
import static com.wcoptimizer.catalog.DatasetCategory.INVENTORY_SNAPSHOT;
import static com.wcoptimizer.catalog.DatasetCategory.SALES_TRANSACTIONS;
import static com.wcoptimizer.catalog.DatasetCategory.SUPPLIERS;
import static com.wcoptimizer.service.WorkingCapitalMath.round1;
import static com.wcoptimizer.service.WorkingCapitalMath.round2;

@Slf4j
@Service
@RequiredArgsConstructor
public class CashCycleService {

    static final String FORMULA = "CCC = DIO + DSO - DPO";
    static final int WORKING_CAPITAL_TOP_SKUS = 50;
    static final int PARTY_BREAKDOWN_LIMIT = 20;
    static final String NO_AR_WEIGHT = "ar_ledger has no invoice amount with a known days_to_pay.";
    static final String NO_AP_WEIGHT = "ap_ledger has no invoice amount with a known actual_days_to_pay.";
    private static final List<String> AGING_ORDER = List.of("Current", "1-30 days", "31-60 days", "61-90 days");

    private final TabularStore store;
    private final AvailabilityResolver availability;
    private final WcOptimizerProperties properties;
    private final Clock clock;

    public AnalysisResult kpiSummary() {
        boolean anyInput = Stream.of(INVENTORY_SNAPSHOT, SALES_TRANSACTIONS, AR_LEDGER, AP_LEDGER)
            .anyMatch(availability::isAvailable);
        if (!anyInput) {
            return availability.check(
                    Requirement.of(INVENTORY_SNAPSHOT), Requirement.of(SALES_TRANSACTIONS),
                    Requirement.of(AR_LEDGER), Requirement.of(AP_LEDGER))
                .toResponse(Analysis.GET_KPI_SUMMARY.getToolName());
        }

        Metric dio = dio();
        Metric dso = dso();
        Metric dpo = dpo();
        double ccc = WorkingCapitalMath.ccc(dio.value(), dso.value(), dpo.value());
        log.debug("KPI summary | dio={} | dso={} | dpo={} | ccc={}", dio.value(), dso.value(), dpo.value(), ccc);

        return KpiSummaryResponse.builder()
            .generatedAt(Instant.now(clock))
            .formula(FORMULA)
            .unit("days")
            .dio(dio.value())
            .dioNote(dio.note())
            .dso(dso.value())
            .dsoNote(dso.note())
            .dpo(dpo.value())
            .dpoNote(dpo.note())
            .ccc(ccc)
            .build();
    }

    Metric dio() {
        Availability inputs = availability.check(
            Requirement.of(INVENTORY_SNAPSHOT, "inventory_value"),
            Requirement.of(SALES_TRANSACTIONS, "total_cost"));
        if (!inputs.satisfied()) {
            return Metric.missing(inputs.message());
        }
        double inventoryValue = currentInventoryValue();
        Totals cogs = totals("cogsTotals", "cogs");
        if (cogs.amount() <= 0) {
            return Metric.missing("sales_transactions has no positive total_cost; DIO reported as 0.");
        }
        return Metric.of(WorkingCapitalMath.dio(inventoryValue, cogs.amount(), cogs.days()));
    }

    Metric dso() {
        Availability inputs = availability.check(Requirement.of(AR_LEDGER, "days_to_pay", "invoice_amount"));
        if (!inputs.satisfied()) {
            return Metric.missing(inputs.message());
        }
        return weighted("arWeightedDays")
            .map(Metric::of)
            .orElseGet(() -> Metric.missing(NO_AR_WEIGHT));
    }

    Metric dpo() {
        Availability inputs = availability.check(Requirement.of(AP_LEDGER, "actual_days_to_pay", "invoice_amount"));
        if (!inputs.satisfied()) {
            return Metric.missing(inputs.message());
        }
        return weighted("apWeightedDays")
            .map(Metric::of)
            .orElseGet(() -> Metric.missing(NO_AP_WEIGHT));
    }

    /**
     * Cash released by the given day deltas at the daily revenue rate. Annual
     * revenue comes from the caller, else observed sales, else configuration.
     */
    public AnalysisResult simulate(double dioReduction, double dsoReduction, double dpoIncrease,
                                   Optional<Double> annualRevenue) {
        double revenue;
        String basis;
        if (annualRevenue.isPresent() && annualRevenue.get() > 0) {
            revenue = annualRevenue.get();
            basis = "supplied";
        } else {
            OptionalDouble observed = observedAnnualRevenue();
            if (observed.isPresent()) {
                revenue = observed.getAsDouble();
                basis = "observed_sales";
            } else {
                revenue = properties.getPolicy().getFallbackAnnualRevenue();
                basis = "configured_default";
            }
        }

        double daily = revenue / 365.0;
        double totalDays = dioReduction + dsoReduction + dpoIncrease;
        return CccSimulationResponse.builder()
            .annualRevenue(round2(revenue))
            .revenueBasis(basis)
            .dailyRevenue(round2(daily))
            .totalDaysSaved(totalDays)
            .totalCashFreed(round2(totalDays * daily))
            .breakdown(List.of(
                lever("Reduce DIO by " + dioReduction + "d", dioReduction, daily),
                lever("Reduce DSO by " + dsoReduction + "d", dsoReduction, daily),
                lever("Increase DPO by " + dpoIncrease + "d", dpoIncrease, daily)))
            .build();
    }

    public AnalysisResult workingCapitalSummary() {
        Availability inputs = availability.check(Requirement.of(INVENTORY_SNAPSHOT, "inventory_value"));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.GET_WORKING_CAPITAL_SUMMARY.getToolName());
        }
        double total = currentInventoryValue();
        long totalUnits = store.queryForOptional("currentInventoryValue", Map.of(),
                (rs, i) -> Rows.longOr(rs, "total_units", 0L))
            .orElse(0L);
        List<WorkingCapitalSummaryResponse.SkuCash> skus = store.query("workingCapitalBySku",
            Map.of("limit", WORKING_CAPITAL_TOP_SKUS),
            (rs, i) -> {
                double cash = Rows.doubleOr(rs, "trapped_cash", 0.0);
                return WorkingCapitalSummaryResponse.SkuCash.builder()
                    .sku(Rows.string(rs, "sku"))
                    .totalUnits(Rows.longOr(rs, "total_units", 0L))
                    .trappedCash(round2(cash))
                    .sharePct(total > 0 ? round1(cash / total * 100.0) : 0.0)
                    .build();
            });
        return WorkingCapitalSummaryResponse.builder()
            .totalTrappedCash(round2(total))
            .totalUnits(totalUnits)
            .skuCount(skus.size())
            .topSkus(skus)
            .build();
    }

    public AnalysisResult carryingCost(double holdingCostPct) {
        if (holdingCostPct < 0) {
            throw new InvalidParameterException("holding_cost_pct must be >= 0");
        }
        Availability inputs = availability.check(Requirement.of(INVENTORY_SNAPSHOT, "inventory_value"));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.GET_CARRYING_COST_ANALYSIS.getToolName());
        }
        double value = currentInventoryValue();
        double annual = value * holdingCostPct;
        return CarryingCostResponse.builder()
            .inventoryValue(round2(value))
            .holdingCostPct(holdingCostPct)
            .annualCarryingCost(round2(annual))
            .monthlyCarryingCost(round2(annual / 12.0))
            .dailyCarryingCost(round2(annual / 365.0))
            .build();
    }

    public AnalysisResult arAging() {
        Availability inputs = availability.check(
            Requirement.of(AR_LEDGER, "invoice_amount", "aging_bucket", "paid_date"));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.GET_AR_AGING.getToolName());
        }
        List<ArAgingResponse.Bucket> buckets = store.query("arAgingBuckets", Map.of(),
                (rs, i) -> ArAgingResponse.Bucket.builder()
                    .bucket(Rows.string(rs, "bucket"))
                    .invoices(Rows.longOr(rs, "invoices", 0L))
                    .totalAmount(round2(Rows.doubleOr(rs, "amount", 0.0)))
                    .outstanding(round2(Rows.doubleOr(rs, "outstanding", 0.0)))
                    .build())
            .stream()
            .sorted(Comparator.comparingInt((ArAgingResponse.Bucket b) -> agingRank(b.getBucket()))
                .thenComparing(ArAgingResponse.Bucket::getBucket))
            .toList();

        Map<String, String> fragments = Map.of(
            "dispute", store.flag(AR_LEDGER, "dispute_flag"),
            "write_off", store.flag(AR_LEDGER, "write_off_flag"));
        return store.queryForOptional("arExposure", fragments, Map.of(),
                (rs, i) -> ArAgingResponse.builder()
                    .agingBuckets(buckets)
                    .totalOutstanding(round2(Rows.doubleOr(rs, "total_outstanding", 0.0)))
                    .disputes(ArAgingResponse.Exposure.builder()
                        .count(Rows.longOr(rs, "disputed_count", 0L))
                        .amount(round2(Rows.doubleOr(rs, "disputed_amount", 0.0)))
                        .build())
                    .writeOffs(ArAgingResponse.Exposure.builder()
                        .count(Rows.longOr(rs, "write_off_count", 0L))
                        .amount(round2(Rows.doubleOr(rs, "write_off_amount", 0.0)))
                        .build())
                    .build())
            .orElseThrow();
    }

    public AnalysisResult dsoAnalysis() {
        Availability inputs = availability.check(Requirement.of(AR_LEDGER, "invoice_amount", "days_to_pay"));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.GET_DSO_ANALYSIS.getToolName());
        }
        Optional<Double> overall = weighted("arWeightedDays");
        List<DsoAnalysisResponse.CustomerDays> byCustomer = store.query("dsoByCustomer",
            partyFragments(CUSTOMERS, "ar", "customer_id", "customer_name", "segment"),
            Map.of("limit", PARTY_BREAKDOWN_LIMIT),
            (rs, i) -> DsoAnalysisResponse.CustomerDays.builder()
                .customerId(Rows.string(rs, "party_id"))
                .customerName(Rows.string(rs, "party_name"))
                .segment(Rows.string(rs, "party_detail"))
                .invoices(Rows.longOr(rs, "invoices", 0L))
                .totalBilled(round2(Rows.doubleOr(rs, "amount", 0.0)))
                .weightedDso(roundedOrNull(Rows.nullableDouble(rs, "weighted_days")))
                .build());
        return DsoAnalysisResponse.builder()
            .overallDso(overall.map(WorkingCapitalMath::round1).orElse(null))
            .dsoNote(overall.isPresent() ? null : NO_AR_WEIGHT)
            .byCustomer(byCustomer)
            .build();
    }

    public AnalysisResult dpoAnalysis() {
        Availability inputs = availability.check(Requirement.of(AP_LEDGER, "invoice_amount", "actual_days_to_pay"));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.GET_DPO_ANALYSIS.getToolName());
        }
        Optional<Double> overall = weighted("apWeightedDays");
        List<DpoAnalysisResponse.SupplierDays> bySupplier = store.query("dpoBySupplier",
            partyFragments(SUPPLIERS, "ap", "supplier_id", "supplier_name", "contracted_payment_days"),
            Map.of("limit", PARTY_BREAKDOWN_LIMIT),
            (rs, i) -> DpoAnalysisResponse.SupplierDays.builder()
                .supplierId(Rows.string(rs, "party_id"))
                .supplierName(Rows.string(rs, "party_name"))
                .contractedPaymentDays(Rows.nullableDouble(rs, "party_detail"))
                .invoices(Rows.longOr(rs, "invoices", 0L))
                .totalInvoiced(round2(Rows.doubleOr(rs, "amount", 0.0)))
                .weightedDpo(roundedOrNull(Rows.nullableDouble(rs, "weighted_days")))
                .build());
        return DpoAnalysisResponse.builder()
            .overallDpo(overall.map(WorkingCapitalMath::round1).orElse(null))
            .dpoNote(overall.isPresent() ? null : NO_AP_WEIGHT)
            .bySupplier(bySupplier)
            .build();
    }

    double currentInventoryValue() {
        return store.queryForOptional("currentInventoryValue", Map.of(),
                (rs, i) -> Rows.doubleOr(rs, "total_value", 0.0))
            .orElse(0.0);
    }

    /** Revenue per observed day × 365, when sales exist and are positive. */
    OptionalDouble observedAnnualRevenue() {
        if (!availability.isAvailable(SALES_TRANSACTIONS)) {
            return OptionalDouble.empty();
        }
        Totals revenue = totals("revenueTotals", "revenue");
        if (revenue.amount() <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(revenue.amount() / Math.max(revenue.days(), 1L) * 365.0);
    }

    private Optional<Double> weighted(String query) {
        return store.queryForOptional(query, Map.of(),
                (rs, i) -> WorkingCapitalMath.weightedDays(
                    Rows.doubleOr(rs, "weighted", 0.0), Rows.doubleOr(rs, "amount", 0.0)))
            .filter(OptionalDouble::isPresent)
            .map(OptionalDouble::getAsDouble);
    }

    private Totals totals(String query, String amountColumn) {
        return store.queryForOptional(query, Map.of(),
                (rs, i) -> new Totals(Rows.doubleOr(rs, amountColumn, 0.0), Rows.longOr(rs, "days", 0L)))
            .orElse(new Totals(0.0, 0L));
    }

    /**
     * Name and detail columns come from the master table when it is loaded;
     * otherwise the breakdown is by id only.
     */
    private Map<String, String> partyFragments(DatasetCategory master, String ledgerAlias, String key,
                                               String nameColumn, String detailColumn) {
        if (!availability.isAvailable(master, key, nameColumn)) {
            return Map.of("party_name", "NULL", "party_detail", "NULL", "party_join", "");
        }
        String join = "LEFT JOIN " + master.getTableName() + " m ON CAST(" + ledgerAlias + "." + key
            + " AS VARCHAR) = CAST(m." + key + " AS VARCHAR)";
        return Map.of(
            "party_name", store.columnOrNull(master, "m", nameColumn),
            "party_detail", store.columnOrNull(master, "m", detailColumn),
            "party_join", join);
    }

    private static CccSimulationResponse.Lever lever(String action, double days, double dailyRevenue) {
        return CccSimulationResponse.Lever.builder()
            .action(action)
            .days(days)
            .cash(round2(days * dailyRevenue))
            .build();
    }

    /** Zero-amount groups have no weighted mean; they stay null rather than 0. */
    private static Double roundedOrNull(Double value) {
        return value != null ? round1(value) : null;
    }

    private static int agingRank(String bucket) {
        int rank = AGING_ORDER.indexOf(bucket);
        return rank >= 0 ? rank : AGING_ORDER.size();
    }

    record Metric(double value, String note) {
        static Metric of(double value) {
            return new Metric(round1(value), null);
        }

        static Metric missing(String note) {
            return new Metric(0.0, note);
        }
    }

    private record Totals(double amount, long days) {}
}
