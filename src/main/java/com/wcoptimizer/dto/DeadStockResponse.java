package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeadStockResponse implements AnalysisResult {
    int thresholdDays;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate asOf;
    /** "last_sale_date" when sales history drives the check, else "days_since_last_movement". */
    String basis;
    String note;
    int count;
    double totalValueAtRisk;
    List<Item> items;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Item {
        String sku;
        double qtyOnHand;
        double valueAtRisk;
        @JsonFormat(pattern = "yyyy-MM-dd")
        LocalDate lastSaleDate;
        Long daysIdle;
        boolean neverSold;
    }
}
