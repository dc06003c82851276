package com.wcoptimizer.service;

import com.wcoptimizer.catalog.Analysis;
import com.wcoptimizer.catalog.DatasetCategory;
import com.wcoptimizer.catalog.Requirement;
import com.wcoptimizer.dto.AnalysisResult;
import com.wcoptimizer.dto.DashboardResponse;
import com.wcoptimizer.dto.DataQualityResponse;
import com.wcoptimizer.dto.DatabaseStatusResponse;
import com.wcoptimizer.dto.DatasetStatusResponse;
import com.wcoptimizer.dto.DatasetTemplateResponse;
import com.wcoptimizer.dto.InsufficientDataResponse;
import com.wcoptimizer.dto.ProductCatalogResponse;
import com.wcoptimizer.dto.ResetResponse;
import com.wcoptimizer.dto.SchemaInfoResponse;
import com.wcoptimizer.dto.ShipmentTrackingResponse;
import com.wcoptimizer.dto.UploadHistoryResponse;
import com.wcoptimizer.exception.GraphStoreUnavailableException;
import com.wcoptimizer.exception.InvalidParameterException;
import com.wcoptimizer.exception.TabularStoreException;
import com.wcoptimizer.graph.GraphStats;
import com.wcoptimizer.graph.GraphStore;
import com.wcoptimizer.repository.Rows;
import com.wcoptimizer.repository.TabularStore;
import com.wcoptimizer.service.AvailabilityResolver.Availability;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.wcoptimizer.catalog.DatasetCategory.AR_LEDGER;
import static com.wcoptimizer.catalog.DatasetCategory.CUSTOMERS;
import static com.wcoptimizer.catalog.DatasetCategory.INVENTORY_SNAPSHOT;
import static com.wcoptimizer.catalog.DatasetCategory.PRODUCTS;
import static com.wcoptimizer.catalog.DatasetCategory.PURCHASE_ORDERS;
import static com.wcoptimizer.catalog.DatasetCategory.SALES_TRANSACTIONS;
import static com.wcoptimizer.catalog.DatasetCategory.SHIPMENTS;
import static com.wcoptimizer.catalog.DatasetCategory.SUPPLIERS;
import static com.wcoptimizer.service.WorkingCapitalMath.round1;
import static com.wcoptimizer.service.WorkingCapitalMath.round2;

/**
 * Dataset bookkeeping and store administration: status, history, schema,
 * quality, the cross-dataset dashboard and the two store-wide reset/status views.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatasetService {

    static final int HISTORY_ROWS = 50;
    static final int SAMPLE_ROWS = 5;
    static final int IN_TRANSIT_ROWS = 20;

    private static final List<String> CATALOG_COLUMNS = List.of("product_name", "category", "subcategory",
        "unit_cost", "unit_price", "supplier_id", "lead_time_days", "abc_class", "xyz_class");

    private final TabularStore store;
    private final AvailabilityResolver availability;
    private final GraphStore graph;
    private final Clock clock;

    public DatasetStatusResponse datasetStatus() {
        List<DatasetStatusResponse.Dataset> files = Arrays.stream(DatasetCategory.values())
            .map(category -> {
                boolean loaded = store.tableExists(category);
                return DatasetStatusResponse.Dataset.builder()
                    .category(category.getTableName())
                    .description(category.getDescription())
                    .status(loaded ? "uploaded" : "not_uploaded")
                    .rows(loaded ? store.rowCount(category) : null)
                    .destination(category.destination())
                    .build();
            })
            .toList();
        return DatasetStatusResponse.builder()
            .uploaded((int) files.stream().filter(f -> "uploaded".equals(f.getStatus())).count())
            .total(files.size())
            .files(files)
            .build();
    }

    public List<DatasetTemplateResponse> templates() {
        return Arrays.stream(DatasetCategory.values()).map(DatasetService::toTemplate).toList();
    }

    public DatasetTemplateResponse template(String category) {
        return toTemplate(DatasetCategory.fromName(category));
    }

    /** Upload log newest first; without a log, the current row count of each loaded table. */
    public UploadHistoryResponse versionHistory() {
        if (store.tableExists(TabularStore.UPLOAD_LOG_TABLE)) {
            List<UploadHistoryResponse.Upload> uploads = store.query("uploadHistory", Map.of("limit", HISTORY_ROWS),
                (rs, i) -> {
                    Timestamp at = rs.getTimestamp("upload_timestamp");
                    return UploadHistoryResponse.Upload.builder()
                        .id(Rows.nullableLong(rs, "id"))
                        .category(Rows.string(rs, "file_category"))
                        .filename(Rows.string(rs, "filename"))
                        .uploadedAt(at != null ? at.toLocalDateTime() : null)
                        .rowCount(Rows.longOr(rs, "row_count", 0L))
                        .status(Rows.string(rs, "status"))
                        .build();
                });
            return UploadHistoryResponse.builder().uploads(uploads).build();
        }
        List<UploadHistoryResponse.Upload> current = Arrays.stream(DatasetCategory.values())
            .filter(store::tableExists)
            .map(category -> UploadHistoryResponse.Upload.builder()
                .category(category.getTableName())
                .rowCount(store.rowCount(category))
                .status("current")
                .build())
            .toList();
        return UploadHistoryResponse.builder()
            .note("No upload log found; showing current table row counts.")
            .uploads(current)
            .build();
    }

    public AnalysisResult schemaInfo(String table) {
        DatasetCategory category = DatasetCategory.fromName(TabularStore.requireKnownTable(table));
        if (!store.tableExists(category)) {
            return availability.check(Requirement.of(category)).toResponse(Analysis.GET_SCHEMA_INFO.getToolName());
        }
        List<SchemaInfoResponse.Column> columns = store.columnTypes(category.getTableName()).entrySet().stream()
            .map(e -> SchemaInfoResponse.Column.builder().name(e.getKey()).type(e.getValue()).build())
            .toList();
        return SchemaInfoResponse.builder()
            .table(category.getTableName())
            .rowCount(store.rowCount(category))
            .columns(columns)
            .sample(store.sampleRows(category.getTableName(), SAMPLE_ROWS))
            .build();
    }

    public AnalysisResult dataQuality() {
        List<DataQualityResponse.TableQuality> tables = new ArrayList<>();
        for (DatasetCategory category : DatasetCategory.values()) {
            if (!store.tableExists(category)) {
                continue;
            }
            String table = category.getTableName();
            Map<String, Long> nulls = new LinkedHashMap<>();
            store.nullCounts(table).forEach((column, count) -> {
                if (count > 0) {
                    nulls.put(column, count);
                }
            });
            long duplicates = store.duplicateRows(table);
            tables.add(DataQualityResponse.TableQuality.builder()
                .table(table)
                .rows(store.rowCount(category))
                .columns(store.columnTypes(table).size())
                .nullCounts(nulls)
                .duplicateRows(duplicates)
                .qualityScore(qualityScore(nulls.size(), duplicates))
                .build());
        }
        if (tables.isEmpty()) {
            return noDatasets(Analysis.GET_DATA_QUALITY_REPORT);
        }
        return DataQualityResponse.builder().tables(tables).build();
    }

    static int qualityScore(int columnsWithNulls, long duplicateRows) {
        long penalty = 5L * columnsWithNulls + 2L * Math.min(duplicateRows, 10L);
        return (int) Math.max(0L, 100L - penalty);
    }

    public AnalysisResult fullDashboard() {
        DashboardResponse.DashboardResponseBuilder dashboard = DashboardResponse.builder().generatedAt(clock.instant());
        boolean any = false;

        if (availability.isAvailable(SALES_TRANSACTIONS)) {
            any = true;
            dashboard.revenue(store.queryForOptional("salesTotals", Map.of(
                    "total_cost", store.aggregateOrNull(SALES_TRANSACTIONS, "SUM", "total_cost"),
                    "gross_profit", store.aggregateOrNull(SALES_TRANSACTIONS, "SUM", "gross_profit")), Map.of(),
                (rs, i) -> DashboardResponse.Revenue.builder()
                    .totalRevenue(round2(Rows.doubleOr(rs, "total_revenue", 0.0)))
                    .totalCost(rounded(Rows.nullableDouble(rs, "total_cost")))
                    .grossProfit(rounded(Rows.nullableDouble(rs, "gross_profit")))
                    .transactions(Rows.longOr(rs, "transactions", 0L))
                    .uniqueProducts(Rows.longOr(rs, "unique_products", 0L))
                    .build()).orElse(null));
        }
        if (availability.isAvailable(INVENTORY_SNAPSHOT)) {
            any = true;
            dashboard.inventory(store.queryForOptional("inventoryTotals", Map.of(
                    "total_value", store.aggregateOrNull(INVENTORY_SNAPSHOT, "SUM", "inventory_value"),
                    "stockouts", statusCount("stockout"),
                    "overstocked", statusCount("overstock")), Map.of(),
                (rs, i) -> DashboardResponse.Inventory.builder()
                    .uniqueSkus(Rows.longOr(rs, "unique_skus", 0L))
                    .totalUnits(Rows.doubleOr(rs, "total_units", 0.0))
                    .totalValue(rounded(Rows.nullableDouble(rs, "total_value")))
                    .stockouts(Rows.nullableLong(rs, "stockouts"))
                    .overstocked(Rows.nullableLong(rs, "overstocked"))
                    .build()).orElse(null));
        }
        if (availability.isAvailable(SUPPLIERS)) {
            any = true;
            dashboard.suppliers(store.queryForOptional("supplierTotals", Map.of(
                    "avg_lead_time", store.aggregateOrNull(SUPPLIERS, "AVG", "avg_lead_time_days"),
                    "avg_otd_rate", store.aggregateOrNull(SUPPLIERS, "AVG", "on_time_delivery_rate")), Map.of(),
                (rs, i) -> {
                    Double leadTime = Rows.nullableDouble(rs, "avg_lead_time");
                    return DashboardResponse.Suppliers.builder()
                        .count(Rows.longOr(rs, "supplier_count", 0L))
                        .avgLeadTime(leadTime != null ? round1(leadTime) : null)
                        .avgOtdRate(rounded(Rows.nullableDouble(rs, "avg_otd_rate")))
                        .build();
                }).orElse(null));
        }
        if (availability.isAvailable(CUSTOMERS)) {
            any = true;
            dashboard.customers(store.queryForOptional("customerTotals", Map.of(
                    "ytd_revenue", store.aggregateOrNull(CUSTOMERS, "SUM", "ytd_revenue"),
                    "avg_days_to_pay", store.aggregateOrNull(CUSTOMERS, "AVG", "avg_days_to_pay")), Map.of(),
                (rs, i) -> {
                    Double daysToPay = Rows.nullableDouble(rs, "avg_days_to_pay");
                    return DashboardResponse.Customers.builder()
                        .count(Rows.longOr(rs, "customer_count", 0L))
                        .totalYtdRevenue(rounded(Rows.nullableDouble(rs, "total_ytd_revenue")))
                        .avgDaysToPay(daysToPay != null ? round1(daysToPay) : null)
                        .build();
                }).orElse(null));
        }
        if (availability.isAvailable(AR_LEDGER)) {
            any = true;
            dashboard.ar(store.queryForOptional("arTotals", Map.of(
                    "overdue", store.flag(AR_LEDGER, "is_overdue"),
                    "write_off", store.flag(AR_LEDGER, "write_off_flag")), Map.of(),
                (rs, i) -> DashboardResponse.Receivables.builder()
                    .totalInvoices(Rows.longOr(rs, "total_invoices", 0L))
                    .overdue(Rows.longOr(rs, "overdue", 0L))
                    .writeOffAmount(round2(Rows.doubleOr(rs, "write_off_amount", 0.0)))
                    .build()).orElse(null));
        }
        if (availability.isAvailable(PURCHASE_ORDERS)) {
            any = true;
            dashboard.purchaseOrders(store.queryForOptional("purchaseOrderTotals", Map.of(
                    "total_value", store.aggregateOrNull(PURCHASE_ORDERS, "SUM", "total_po_value")), Map.of(),
                (rs, i) -> DashboardResponse.PurchaseOrders.builder()
                    .count(Rows.longOr(rs, "po_count", 0L))
                    .totalQty(Rows.doubleOr(rs, "total_qty", 0.0))
                    .totalValue(rounded(Rows.nullableDouble(rs, "total_value")))
                    .build()).orElse(null));
        }

        return any ? dashboard.build() : noDatasets(Analysis.GET_FULL_DASHBOARD);
    }

    public AnalysisResult shipmentTracking(String status) {
        Availability inputs = availability.check(Requirement.of(SHIPMENTS, "status"));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.GET_SHIPMENT_TRACKING.getToolName());
        }
        boolean filtered = status != null && !status.isBlank();
        Map<String, String> fragments = Map.of(
            "total_qty", store.aggregateOrNull(SHIPMENTS, "SUM", "qty_shipped"),
            "total_freight", store.aggregateOrNull(SHIPMENTS, "SUM", "freight_cost"),
            "avg_delay", store.aggregateOrNull(SHIPMENTS, "AVG", "delay_days"),
            "status_filter", filtered ? "WHERE CAST(status AS VARCHAR) = :status" : "");
        Map<String, Object> params = filtered ? Map.of("status", status.trim()) : Map.of();

        List<ShipmentTrackingResponse.StatusSummary> summary = store.query("shipmentStatusSummary", fragments, params,
            (rs, i) -> ShipmentTrackingResponse.StatusSummary.builder()
                .status(Rows.string(rs, "status"))
                .count(Rows.longOr(rs, "shipments", 0L))
                .totalQty(Rows.nullableDouble(rs, "total_qty"))
                .totalFreight(rounded(Rows.nullableDouble(rs, "total_freight")))
                .avgDelay(rounded(Rows.nullableDouble(rs, "avg_delay")))
                .build());

        List<ShipmentTrackingResponse.Shipment> inTransit = null;
        if (!filtered) {
            String columns = store.projection(SHIPMENTS,
                List.of("product_id", "ship_date", "expected_arrival_date", "qty_shipped", "carrier"));
            inTransit = store.query("shipmentsInTransit", Map.of("columns", columns), Map.of("limit", IN_TRANSIT_ROWS),
                (rs, i) -> ShipmentTrackingResponse.Shipment.builder()
                    .shipmentId(Rows.string(rs, "shipment_id"))
                    .supplierId(Rows.string(rs, "supplier_id"))
                    .productId(Rows.string(rs, "product_id"))
                    .shipDate(Rows.date(rs, "ship_date"))
                    .expectedArrivalDate(Rows.date(rs, "expected_arrival_date"))
                    .qtyShipped(Rows.nullableDouble(rs, "qty_shipped"))
                    .carrier(Rows.string(rs, "carrier"))
                    .build());
        }

        return ShipmentTrackingResponse.builder()
            .statusFilter(filtered ? status.trim() : null)
            .summary(summary)
            .inTransit(inTransit)
            .build();
    }

    public AnalysisResult productCatalog(String category, String abcClass) {
        Availability inputs = availability.check(Requirement.of(PRODUCTS));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.GET_PRODUCT_CATALOG.getToolName());
        }
        List<String> conditions = new ArrayList<>();
        Map<String, Object> params = new LinkedHashMap<>();
        if (category != null && !category.isBlank()) {
            requireProductColumn("category");
            conditions.add("CAST(category AS VARCHAR) = :category");
            params.put("category", category.trim());
        }
        if (abcClass != null && !abcClass.isBlank()) {
            requireProductColumn("abc_class");
            conditions.add("UPPER(CAST(abc_class AS VARCHAR)) = :abc_class");
            params.put("abc_class", abcClass.trim().toUpperCase(Locale.ROOT));
        }
        String filter = conditions.isEmpty() ? "" : "WHERE " + String.join(" AND ", conditions);

        List<ProductCatalogResponse.Product> products = store.query("productCatalog",
            Map.of("columns", store.projection(PRODUCTS, CATALOG_COLUMNS), "filter", filter), params,
            (rs, i) -> ProductCatalogResponse.Product.builder()
                .productId(Rows.string(rs, "sku"))
                .productName(Rows.string(rs, "product_name"))
                .category(Rows.string(rs, "category"))
                .subcategory(Rows.string(rs, "subcategory"))
                .unitCost(Rows.nullableDouble(rs, "unit_cost"))
                .unitPrice(Rows.nullableDouble(rs, "unit_price"))
                .supplierId(Rows.string(rs, "supplier_id"))
                .leadTimeDays(Rows.nullableDouble(rs, "lead_time_days"))
                .abcClass(Rows.string(rs, "abc_class"))
                .xyzClass(Rows.string(rs, "xyz_class"))
                .build());
        return ProductCatalogResponse.builder()
            .total(products.size())
            .products(products)
            .build();
    }

    /** Row counts of both stores; an unreachable graph is reported, not thrown. */
    public DatabaseStatusResponse databaseStatus() {
        DatabaseStatusResponse.TabularStatus tabular;
        try {
            Map<String, Long> tables = new LinkedHashMap<>();
            for (String table : store.listTables()) {
                tables.put(table, store.rowCount(table));
            }
            tabular = DatabaseStatusResponse.TabularStatus.builder()
                .status("connected")
                .tableCount(tables.size())
                .tables(tables)
                .build();
        } catch (TabularStoreException e) {
            log.error("Tabular status check failed | {}", e.getMessage());
            tabular = DatabaseStatusResponse.TabularStatus.builder()
                .status("unavailable")
                .tables(Map.of())
                .build();
        }

        DatabaseStatusResponse.GraphStatus graphStatus;
        try {
            GraphStats stats = graph.stats();
            graphStatus = DatabaseStatusResponse.GraphStatus.builder()
                .status("connected")
                .suppliers(stats.suppliers())
                .products(stats.products())
                .relationships(stats.relationships())
                .build();
        } catch (GraphStoreUnavailableException e) {
            graphStatus = DatabaseStatusResponse.GraphStatus.builder()
                .status("unavailable")
                .reason(e.getMessage())
                .build();
        }

        return DatabaseStatusResponse.builder()
            .checkedAt(clock.instant())
            .tabular(tabular)
            .graph(graphStatus)
            .build();
    }

    public ResetResponse reset() {
        List<String> dropped = store.dropAll();
        log.warn("Database reset | droppedTables={}", dropped);
        try {
            graph.clear();
            return ResetResponse.builder().droppedTables(dropped).graphCleared(true).build();
        } catch (GraphStoreUnavailableException e) {
            return ResetResponse.builder()
                .droppedTables(dropped)
                .graphCleared(false)
                .graphNote("Graph store not cleared: " + e.getMessage())
                .build();
        }
    }

    private String statusCount(String status) {
        return store.hasColumns(INVENTORY_SNAPSHOT, "stock_status")
            ? "COUNT(*) FILTER (WHERE LOWER(CAST(stock_status AS VARCHAR)) = '" + status + "')"
            : "CAST(NULL AS BIGINT)";
    }

    private void requireProductColumn(String column) {
        if (!store.hasColumns(PRODUCTS, column)) {
            throw new InvalidParameterException("products has no '" + column + "' column to filter on");
        }
    }

    private static InsufficientDataResponse noDatasets(Analysis analysis) {
        return InsufficientDataResponse.builder()
            .analysis(analysis.getToolName())
            .message("No datasets loaded. Upload at least one dataset to enable this analysis.")
            .missing(DatasetCategory.tableNames())
            .build();
    }

    private static DatasetTemplateResponse toTemplate(DatasetCategory category) {
        return DatasetTemplateResponse.builder()
            .category(category.getTableName())
            .description(category.getDescription())
            .requiredColumns(category.getRequiredColumns())
            .optionalColumns(category.getOptionalColumns())
            .destination(category.destination())
            .build();
    }

    private static Double rounded(Double value) {
        return value != null ? round2(value) : null;
    }
}
