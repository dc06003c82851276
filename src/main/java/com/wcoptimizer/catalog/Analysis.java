package com.wcoptimizer.catalog;

import com.wcoptimizer.exception.UnknownAnalysisException;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.wcoptimizer.catalog.DatasetCategory.AP_LEDGER;
import static com.wcoptimizer.catalog.DatasetCategory.AR_LEDGER;
import static com.wcoptimizer.catalog.DatasetCategory.INVENTORY_SNAPSHOT;
import static com.wcoptimizer.catalog.DatasetCategory.PRODUCTS;
import static com.wcoptimizer.catalog.DatasetCategory.PURCHASE_ORDERS;
import static com.wcoptimizer.catalog.DatasetCategory.SALES_TRANSACTIONS;
import static com.wcoptimizer.catalog.DatasetCategory.SHIPMENTS;
import static com.wcoptimizer.catalog.DatasetCategory.SUPPLIERS;
import static com.wcoptimizer.catalog.ParameterSpec.Type.INTEGER;
import static com.wcoptimizer.catalog.ParameterSpec.Type.NUMBER;
import static com.wcoptimizer.catalog.ParameterSpec.Type.STRING;
import static com.wcoptimizer.catalog.ParameterSpec.Type.STRING_ARRAY;
import static com.wcoptimizer.catalog.ParameterSpec.optional;
import static com.wcoptimizer.catalog.ParameterSpec.required;

/**
 * The fixed catalogue of named analyses callers may invoke.
 */
@Getter
public enum Analysis {

    // Dashboard
    GET_FULL_DASHBOARD("get_full_dashboard", Group.DASHBOARD,
        "Summary block for every uploaded dataset", List.of()),
    GET_KPI_SUMMARY("get_kpi_summary", Group.DASHBOARD,
        "Cash conversion cycle with DIO, DSO and DPO", List.of(INVENTORY_SNAPSHOT, SALES_TRANSACTIONS, AR_LEDGER, AP_LEDGER)),
    GET_DATA_QUALITY_REPORT("get_data_quality_report", Group.DASHBOARD,
        "Null counts, duplicate rows and a quality score per table", List.of()),

    // Inventory
    GET_REORDER_ALERTS("get_reorder_alerts", Group.INVENTORY,
        "SKUs below or near their reorder point", List.of(INVENTORY_SNAPSHOT)),
    GET_SMART_REORDER_RECOMMENDATIONS("get_smart_reorder_recommendations", Group.INVENTORY,
        "Prioritized reorder list with recommended quantities", List.of(INVENTORY_SNAPSHOT),
        optional("limit", INTEGER, 20, "Maximum recommendations")),
    CALCULATE_SAFETY_STOCK("calculate_safety_stock", Group.INVENTORY,
        "Safety stock from demand variability and lead time", List.of(SALES_TRANSACTIONS),
        required("skus", STRING_ARRAY, "Product ids to size"),
        optional("service_level", NUMBER, 0.95, "Target service level: 0.90, 0.95 or 0.99")),
    CALCULATE_EOQ("calculate_eoq", Group.INVENTORY,
        "Economic order quantity per SKU", List.of(SALES_TRANSACTIONS),
        required("skus", STRING_ARRAY, "Product ids to size"),
        optional("order_cost", NUMBER, 50.0, "Fixed cost per order"),
        optional("holding_cost_pct", NUMBER, 0.25, "Annual holding cost as a fraction of unit cost")),
    GET_INVENTORY_TURNOVER("get_inventory_turnover", Group.INVENTORY,
        "Revenue over current inventory value per SKU", List.of(INVENTORY_SNAPSHOT, SALES_TRANSACTIONS),
        optional("limit", INTEGER, 50, "Maximum SKUs")),
    GET_INVENTORY_AGING("get_inventory_aging", Group.INVENTORY,
        "Inventory by days since last movement", List.of(INVENTORY_SNAPSHOT)),
    GET_DEAD_STOCK("get_dead_stock", Group.INVENTORY,
        "Stock with no sale within the threshold", List.of(INVENTORY_SNAPSHOT),
        optional("days", INTEGER, 90, "Days without a sale")),
    GET_OVERSTOCK_ANALYSIS("get_overstock_analysis", Group.INVENTORY,
        "SKUs flagged as overstocked", List.of(INVENTORY_SNAPSHOT)),
    GET_STOCKOUT_RISK("get_stockout_risk", Group.INVENTORY,
        "SKUs whose days of supply fall inside the horizon", List.of(INVENTORY_SNAPSHOT),
        optional("horizon_days", INTEGER, 14, "Days of supply horizon")),
    GET_ABC_XYZ_CLASSIFICATION("get_abc_xyz_classification", Group.INVENTORY,
        "Revenue tier and demand variability per SKU", List.of(PRODUCTS, SALES_TRANSACTIONS),
        optional("limit", INTEGER, 100, "Maximum SKUs listed")),

    // Cash cycle
    SIMULATE_CCC_IMPROVEMENT("simulate_ccc_improvement", Group.CASH_CYCLE,
        "Cash freed by shortening the cash conversion cycle", List.of(),
        optional("dio_reduction", NUMBER, 0.0, "Days taken off DIO"),
        optional("dso_reduction", NUMBER, 0.0, "Days taken off DSO"),
        optional("dpo_increase", NUMBER, 0.0, "Days added to DPO"),
        optional("annual_revenue", NUMBER, null, "Annual revenue; estimated from sales when omitted")),
    GET_WORKING_CAPITAL_SUMMARY("get_working_capital_summary", Group.CASH_CYCLE,
        "Cash trapped in current inventory", List.of(INVENTORY_SNAPSHOT)),
    GET_CARRYING_COST_ANALYSIS("get_carrying_cost_analysis", Group.CASH_CYCLE,
        "Annual and monthly cost of holding current inventory", List.of(INVENTORY_SNAPSHOT),
        optional("holding_cost_pct", NUMBER, 0.25, "Annual holding cost rate")),
    GET_PARETO_ANALYSIS("get_pareto_analysis", Group.CASH_CYCLE,
        "SKUs driving 80% of a dimension", List.of(SALES_TRANSACTIONS),
        optional("dimension", STRING, "revenue", "revenue, inventory_value or quantity")),
    GET_AR_AGING("get_ar_aging", Group.CASH_CYCLE,
        "Receivables by aging bucket with disputes and write-offs", List.of(AR_LEDGER)),
    GET_DSO_ANALYSIS("get_dso_analysis", Group.CASH_CYCLE,
        "Weighted DSO overall and per customer", List.of(AR_LEDGER)),
    GET_DPO_ANALYSIS("get_dpo_analysis", Group.CASH_CYCLE,
        "Weighted DPO overall and per supplier", List.of(AP_LEDGER)),

    // Demand
    FORECAST_DEMAND("forecast_demand", Group.DEMAND,
        "Moving-average demand forecast for one SKU", List.of(SALES_TRANSACTIONS),
        required("sku", STRING, "Product id"),
        optional("horizon_days", INTEGER, 30, "Days to project"),
        optional("window", INTEGER, 7, "Moving-average window in days")),
    DETECT_ANOMALIES("detect_anomalies", Group.DEMAND,
        "Rows whose value lies beyond a Z-score threshold", List.of(),
        optional("table", STRING, "sales_transactions", "Dataset table to scan"),
        optional("column", STRING, "qty_sold", "Numeric column to score"),
        optional("z_threshold", NUMBER, 2.0, "Absolute Z-score threshold")),
    GET_REVENUE_TRENDS("get_revenue_trends", Group.DEMAND,
        "Revenue per period with period-over-period growth", List.of(SALES_TRANSACTIONS),
        optional("granularity", STRING, "monthly", "daily, weekly or monthly")),
    GET_SALES_VELOCITY("get_sales_velocity", Group.DEMAND,
        "Units sold per selling day per SKU", List.of(SALES_TRANSACTIONS),
        optional("limit", INTEGER, 30, "Maximum SKUs")),
    GET_TOP_SKUS("get_top_skus", Group.DEMAND,
        "Top SKUs by revenue", List.of(SALES_TRANSACTIONS),
        optional("limit", INTEGER, 20, "Maximum SKUs")),
    GET_CUSTOMER_CONCENTRATION("get_customer_concentration", Group.DEMAND,
        "Revenue share of the top customers", List.of(SALES_TRANSACTIONS),
        optional("limit", INTEGER, 10, "Number of top customers")),
    GET_SEASONALITY_ANALYSIS("get_seasonality_analysis", Group.DEMAND,
        "Month-of-year demand index", List.of(SALES_TRANSACTIONS),
        optional("sku", STRING, null, "Restrict to one product id")),

    // Supplier
    GET_SUPPLIER_RISK_SCORES("get_supplier_risk_scores", Group.SUPPLIER,
        "Composite risk score per supplier", List.of(SUPPLIERS)),
    GET_SUPPLIER_PERFORMANCE("get_supplier_performance", Group.SUPPLIER,
        "Supplier master ordered by on-time delivery", List.of(SUPPLIERS)),
    GET_SUPPLIER_CONCENTRATION("get_supplier_concentration", Group.SUPPLIER,
        "Purchase value share per supplier", List.of(PURCHASE_ORDERS)),
    GET_SUPPLIER_NETWORK("get_supplier_network", Group.SUPPLIER,
        "Every supplier to product relationship", List.of(SUPPLIERS, PURCHASE_ORDERS)),
    FIND_SINGLE_SOURCE_RISKS("find_single_source_risks", Group.SUPPLIER,
        "Products with exactly one supplier", List.of(PURCHASE_ORDERS),
        optional("limit", INTEGER, 50, "Maximum products")),
    RIPPLE_EFFECT_ANALYSIS("ripple_effect_analysis", Group.SUPPLIER,
        "Products impacted if a supplier fails", List.of(PURCHASE_ORDERS),
        required("supplier_id", STRING, "Failed supplier id")),
    GET_LEAD_TIME_VARIABILITY("get_lead_time_variability", Group.SUPPLIER,
        "Suppliers by lead time", List.of(SUPPLIERS)),
    FIND_ALTERNATIVE_SUPPLIERS("find_alternative_suppliers", Group.SUPPLIER,
        "Best-rated suppliers not yet supplying a product", List.of(SUPPLIERS),
        required("sku", STRING, "Product id")),

    // Data
    LIST_UPLOADS("list_uploads", Group.DATA,
        "Upload status of every dataset", List.of()),
    GET_SCHEMA_INFO("get_schema_info", Group.DATA,
        "Columns, row count and sample rows of a table", List.of(),
        optional("table", STRING, "sales_transactions", "Dataset table")),
    RUN_SQL_QUERY("run_sql_query", Group.DATA,
        "Read-only SQL against the tabular store", List.of(),
        required("sql", STRING, "SELECT statement")),
    GET_VERSION_HISTORY("get_version_history", Group.DATA,
        "Upload log, newest first", List.of()),
    TRIGGER_DATABASE_REFRESH("trigger_database_refresh", Group.DATA,
        "Status of the tabular and graph stores", List.of()),
    GET_SHIPMENT_TRACKING("get_shipment_tracking", Group.DATA,
        "Shipments by status with in-transit detail", List.of(SHIPMENTS),
        optional("status", STRING, null, "In Transit, Delivered or Delayed")),
    GET_PRODUCT_CATALOG("get_product_catalog", Group.DATA,
        "Products filtered by category or ABC class", List.of(PRODUCTS),
        optional("category", STRING, null, "Product category"),
        optional("abc_class", STRING, null, "A, B or C"));

    private static final Map<String, Analysis> BY_TOOL_NAME = Arrays.stream(values())
        .collect(Collectors.toMap(Analysis::getToolName, Function.identity()));

    private final String toolName;
    private final Group group;
    private final String description;
    private final List<DatasetCategory> requires;
    private final List<ParameterSpec> parameters;

    Analysis(String toolName, Group group, String description, List<DatasetCategory> requires,
             ParameterSpec... parameters) {
        this.toolName = toolName;
        this.group = group;
        this.description = description;
        this.requires = requires;
        this.parameters = List.of(parameters);
    }

    public static Analysis fromToolName(String name) {
        Analysis analysis = name == null ? null : BY_TOOL_NAME.get(name.trim());
        if (analysis == null) {
            throw new UnknownAnalysisException(name);
        }
        return analysis;
    }

    public enum Group {
        DASHBOARD, INVENTORY, CASH_CYCLE, DEMAND, SUPPLIER, DATA
    }
}
