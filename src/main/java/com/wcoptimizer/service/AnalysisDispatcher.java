package com.wcoptimizer.service;

import com.wcoptimizer.catalog.Analysis;
import com.wcoptimizer.catalog.AnalysisArguments;
import com.wcoptimizer.catalog.DatasetCategory;
import com.wcoptimizer.dto.AnalysisDescriptor;
import com.wcoptimizer.dto.AnalysisResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves a named analysis, binds its arguments and runs it. Every analysis
 * either returns a result or a structured insufficient-data answer; only bad
 * arguments and store failures surface as exceptions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisDispatcher {

    private final CashCycleService cashCycle;
    private final ClassificationService classification;
    private final InventoryPolicyService inventory;
    private final DemandAnalyticsService demand;
    private final SupplierRiskService supplierRisk;
    private final SupplierNetworkService supplierNetwork;
    private final DatasetService datasets;
    private final QueryGateService queryGate;

    public List<AnalysisDescriptor> describe() {
        return Arrays.stream(Analysis.values())
            .map(AnalysisDispatcher::descriptor)
            .toList();
    }

    public AnalysisResult run(String name, Map<String, Object> arguments) {
        Analysis analysis = Analysis.fromToolName(name);
        AnalysisArguments args = new AnalysisArguments(analysis, arguments);
        long start = System.currentTimeMillis();
        AnalysisResult result = dispatch(analysis, args);
        log.info("Analysis complete | name={} | result={} | latencyMs={}",
            analysis.getToolName(), result.getClass().getSimpleName(), System.currentTimeMillis() - start);
        return result;
    }

    private AnalysisResult dispatch(Analysis analysis, AnalysisArguments args) {
        return switch (analysis) {
            case GET_FULL_DASHBOARD -> datasets.fullDashboard();
            case GET_KPI_SUMMARY -> cashCycle.kpiSummary();
            case GET_DATA_QUALITY_REPORT -> datasets.dataQuality();

            case GET_REORDER_ALERTS -> inventory.reorderAlerts();
            case GET_SMART_REORDER_RECOMMENDATIONS -> inventory.smartReorder(args.integer("limit"));
            case CALCULATE_SAFETY_STOCK ->
                inventory.safetyStock(args.stringList("skus"), args.number("service_level"));
            case CALCULATE_EOQ -> inventory.eoq(args.stringList("skus"), args.number("order_cost"),
                args.number("holding_cost_pct"));
            case GET_INVENTORY_TURNOVER -> inventory.turnover(args.integer("limit"));
            case GET_INVENTORY_AGING -> inventory.aging();
            case GET_DEAD_STOCK -> inventory.deadStock(args.integer("days"));
            case GET_OVERSTOCK_ANALYSIS -> inventory.overstock();
            case GET_STOCKOUT_RISK -> inventory.stockoutRisk(args.integer("horizon_days"));
            case GET_ABC_XYZ_CLASSIFICATION -> classification.abcXyz(args.integer("limit"));

            case SIMULATE_CCC_IMPROVEMENT -> cashCycle.simulate(args.number("dio_reduction"),
                args.number("dso_reduction"), args.number("dpo_increase"), args.optionalNumber("annual_revenue"));
            case GET_WORKING_CAPITAL_SUMMARY -> cashCycle.workingCapitalSummary();
            case GET_CARRYING_COST_ANALYSIS -> cashCycle.carryingCost(args.number("holding_cost_pct"));
            case GET_PARETO_ANALYSIS -> classification.pareto(args.string("dimension"));
            case GET_AR_AGING -> cashCycle.arAging();
            case GET_DSO_ANALYSIS -> cashCycle.dsoAnalysis();
            case GET_DPO_ANALYSIS -> cashCycle.dpoAnalysis();

            case FORECAST_DEMAND -> demand.forecast(args.string("sku"), args.integer("horizon_days"),
                args.integer("window"));
            case DETECT_ANOMALIES -> demand.anomalies(args.string("table"), args.string("column"),
                args.number("z_threshold"));
            case GET_REVENUE_TRENDS -> demand.revenueTrends(args.string("granularity"));
            case GET_SALES_VELOCITY -> demand.velocity(args.integer("limit"));
            case GET_TOP_SKUS -> demand.topSkus(args.integer("limit"));
            case GET_CUSTOMER_CONCENTRATION -> demand.customerConcentration(args.integer("limit"));
            case GET_SEASONALITY_ANALYSIS -> demand.seasonality(args.optionalString("sku").orElse(null));

            case GET_SUPPLIER_RISK_SCORES -> supplierRisk.riskScores();
            case GET_SUPPLIER_PERFORMANCE -> supplierRisk.performance();
            case GET_SUPPLIER_CONCENTRATION -> supplierRisk.concentration();
            case GET_SUPPLIER_NETWORK -> supplierNetwork.network();
            case FIND_SINGLE_SOURCE_RISKS -> supplierNetwork.singleSourceRisks(args.integer("limit"));
            case RIPPLE_EFFECT_ANALYSIS -> supplierNetwork.rippleEffect(args.string("supplier_id"));
            case GET_LEAD_TIME_VARIABILITY -> supplierNetwork.leadTimeVariability();
            case FIND_ALTERNATIVE_SUPPLIERS -> supplierNetwork.alternatives(args.string("sku"));

            case LIST_UPLOADS -> datasets.datasetStatus();
            case GET_SCHEMA_INFO -> datasets.schemaInfo(args.string("table"));
            case RUN_SQL_QUERY -> queryGate.run(args.string("sql"));
            case GET_VERSION_HISTORY -> datasets.versionHistory();
            case TRIGGER_DATABASE_REFRESH -> datasets.databaseStatus();
            case GET_SHIPMENT_TRACKING -> datasets.shipmentTracking(args.optionalString("status").orElse(null));
            case GET_PRODUCT_CATALOG -> datasets.productCatalog(args.optionalString("category").orElse(null),
                args.optionalString("abc_class").orElse(null));
        };
    }

    private static AnalysisDescriptor descriptor(Analysis analysis) {
        return AnalysisDescriptor.builder()
            .name(analysis.getToolName())
            .group(analysis.getGroup().name().toLowerCase(Locale.ROOT))
            .description(analysis.getDescription())
            .requires(analysis.getRequires().stream().map(DatasetCategory::getTableName).toList())
            .parameters(analysis.getParameters().stream()
                .map(p -> AnalysisDescriptor.Parameter.builder()
                    .name(p.name())
                    .type(p.type().jsonType())
                    .required(p.required())
                    .defaultValue(p.defaultValue())
                    .description(p.description())
                    .build())
                .toList())
            .build();
    }
}
