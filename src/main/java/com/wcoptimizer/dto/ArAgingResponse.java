package com.wcoptimizer.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ArAgingResponse implements AnalysisResult {
    List<Bucket> agingBuckets;
    double totalOutstanding;
    Exposure disputes;
    Exposure writeOffs;

    @Value
    @Builder
    public static class Bucket {
        String bucket;
        long invoices;
        double totalAmount;
        double outstanding;
    }

    @Value
    @Builder
    public static class Exposure {
        long count;
        double amount;
    }
}
