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
public class ShipmentTrackingResponse implements AnalysisResult {
    String statusFilter;
    List<StatusSummary> summary;
    List<Shipment> inTransit;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class StatusSummary {
        String status;
        long count;
        Double totalQty;
        Double totalFreight;
        Double avgDelay;
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Shipment {
        String shipmentId;
        String supplierId;
        String productId;
        @JsonFormat(pattern = "yyyy-MM-dd")
        LocalDate shipDate;
        @JsonFormat(pattern = "yyyy-MM-dd")
        LocalDate expectedArrivalDate;
        Double qtyShipped;
        String carrier;
    }
}
