package com.wcoptimizer.catalog;

import com.wcoptimizer.exception.InvalidCategoryException;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The nine dataset kinds. Each maps to exactly one table; the table name doubles
 * as the only identifier ever interpolated into SQL for a dataset.
 */
@Getter
public enum DatasetCategory {

    PRODUCTS("products",
        List.of("product_id", "product_name", "unit_cost", "unit_price"),
        List.of("category", "subcategory", "supplier_id", "lead_time_days", "abc_class", "xyz_class",
            "reorder_point", "economic_order_qty", "safety_stock_target"),
        "Master product catalog"),
    CUSTOMERS("customers",
        List.of("customer_id", "customer_name"),
        List.of("segment", "region", "state", "credit_limit", "contracted_payment_days", "risk_score",
            "ytd_revenue", "avg_days_to_pay"),
        "Customer master with credit profiles"),
    SUPPLIERS("suppliers",
        List.of("supplier_id", "supplier_name"),
        List.of("category", "segment", "country", "contracted_payment_days", "avg_lead_time_days",
            "on_time_delivery_rate", "quality_rejection_rate", "risk_score", "rating", "annual_spend"),
        "Supplier master with performance metrics"),
    INVENTORY_SNAPSHOT("inventory_snapshot",
        List.of("product_id", "qty_on_hand"),
        List.of("snapshot_date", "location_id", "qty_in_transit", "qty_committed", "qty_available",
            "safety_stock_target", "reorder_point", "days_of_supply", "unit_cost", "inventory_value",
            "stock_status", "days_since_last_movement"),
        "Inventory positions per SKU per location"),
    SALES_TRANSACTIONS("sales_transactions",
        List.of("transaction_date", "product_id", "qty_sold", "total_revenue"),
        List.of("transaction_id", "customer_id", "location_id", "unit_price", "unit_cost", "total_cost",
            "gross_profit", "profit_margin", "channel", "is_promotional", "invoice_id"),
        "Individual sales transactions"),
    PURCHASE_ORDERS("purchase_orders",
        List.of("po_id", "supplier_id", "product_id", "qty_ordered"),
        List.of("po_date", "location_id", "qty_received", "unit_cost", "total_po_value",
            "expected_delivery_date", "actual_delivery_date", "po_status", "delay_days", "invoice_id"),
        "Replenishment purchase orders to suppliers"),
    AR_LEDGER("ar_ledger",
        List.of("invoice_id", "customer_id", "invoice_amount"),
        List.of("transaction_id", "invoice_date", "due_date", "paid_amount", "paid_date", "days_to_pay",
            "is_overdue", "days_overdue", "aging_bucket", "dispute_flag", "write_off_flag"),
        "Accounts receivable, drives DSO"),
    AP_LEDGER("ap_ledger",
        List.of("invoice_id", "supplier_id", "invoice_amount"),
        List.of("po_id", "invoice_date", "due_date", "paid_amount", "paid_date", "contracted_days",
            "actual_days_to_pay", "early_payment_discount", "payment_status", "dpo_contribution"),
        "Accounts payable, drives DPO"),
    SHIPMENTS("shipments",
        List.of("shipment_id", "po_id", "supplier_id"),
        List.of("product_id", "origin_location", "destination_location_id", "ship_date",
            "expected_arrival_date", "actual_arrival_date", "qty_shipped", "freight_cost", "carrier",
            "tracking_number", "status", "delay_days"),
        "In-transit tracking for supplier shipments");

    private static final Map<String, DatasetCategory> ALIASES = Map.of(
        "sales", SALES_TRANSACTIONS,
        "inventory", INVENTORY_SNAPSHOT,
        "ar", AR_LEDGER,
        "ap", AP_LEDGER,
        "pos", PURCHASE_ORDERS
    );

    private final String tableName;
    private final List<String> requiredColumns;
    private final List<String> optionalColumns;
    private final String description;

    DatasetCategory(String tableName, List<String> requiredColumns, List<String> optionalColumns,
                    String description) {
        this.tableName = tableName;
        this.requiredColumns = requiredColumns;
        this.optionalColumns = optionalColumns;
        this.description = description;
    }

    /** Suppliers and purchase orders are mirrored into the graph store after upload. */
    public boolean isGraphSynced() {
        return this == SUPPLIERS || this == PURCHASE_ORDERS;
    }

    public String destination() {
        return isGraphSynced() ? "tabular+graph" : "tabular";
    }

    public static DatasetCategory fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidCategoryException(String.valueOf(name), tableNames());
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        DatasetCategory alias = ALIASES.get(key);
        if (alias != null) {
            return alias;
        }
        return Arrays.stream(values())
            .filter(c -> c.tableName.equals(key))
            .findFirst()
            .orElseThrow(() -> new InvalidCategoryException(name, tableNames()));
    }

    public static List<String> tableNames() {
        return Arrays.stream(values()).map(DatasetCategory::getTableName).toList();
    }
}
