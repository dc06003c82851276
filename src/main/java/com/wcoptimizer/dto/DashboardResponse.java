package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One block per uploaded dataset; blocks for absent datasets are omitted.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DashboardResponse implements AnalysisResult {
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
    Revenue revenue;
    Inventory inventory;
    Suppliers suppliers;
    Customers customers;
    Receivables ar;
    PurchaseOrders purchaseOrders;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Revenue {
        double totalRevenue;
        Double totalCost;
        Double grossProfit;
        long transactions;
        long uniqueProducts;
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Inventory {
        long uniqueSkus;
        double totalUnits;
        Double totalValue;
        Long stockouts;
        Long overstocked;
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Suppliers {
        long count;
        Double avgLeadTime;
        Double avgOtdRate;
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Customers {
        long count;
        Double totalYtdRevenue;
        Double avgDaysToPay;
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Receivables {
        long totalInvoices;
        long overdue;
        double writeOffAmount;
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class PurchaseOrders {
        long count;
        double totalQty;
        Double totalValue;
    }
}
