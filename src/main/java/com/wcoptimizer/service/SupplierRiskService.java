package com.wcoptimizer.service;

import com.wcoptimizer.catalog.Analysis;
import com.wcoptimizer.catalog.Requirement;
import com.wcoptimizer.dto.AnalysisResult;
import com.wcoptimizer.dto.SupplierConcentrationResponse;
import com.wcoptimizer.dto.SupplierPerformanceResponse;
import com.wcoptimizer.dto.SupplierRiskResponse;
import com.wcoptimizer.repository.Rows;
import com.wcoptimizer.repository.TabularStore;
import com.wcoptimizer.service.AvailabilityResolver.Availability;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static com.wcoptimizer.catalog.DatasetCategory.PURCHASE_ORDERS;
import static com.wcoptimizer.catalog.DatasetCategory.SUPPLIERS;
import static com.wcoptimizer.service.WorkingCapitalMath.round1;
import static com.wcoptimizer.service.WorkingCapitalMath.round2;

/**
 * Supplier scoring from the supplier master and purchase-order spend.
 */
@Service
@RequiredArgsConstructor
public class SupplierRiskService {

    static final double DEFAULT_LEAD_TIME = 14.0;
    static final double DEFAULT_OTD_RATE = 0.9;
    static final double DEFAULT_REJECTION_RATE = 0.01;

    private static final List<String> MASTER_COLUMNS = List.of("supplier_name", "country", "avg_lead_time_days",
        "on_time_delivery_rate", "quality_rejection_rate", "risk_score", "rating");

    private final TabularStore store;
    private final AvailabilityResolver availability;

    /** Composite score per supplier; missing metrics take neutral defaults. */
    public AnalysisResult riskScores() {
        Availability inputs = availability.check(Requirement.of(SUPPLIERS));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.GET_SUPPLIER_RISK_SCORES.getToolName());
        }
        List<SupplierRiskResponse.SupplierScore> scores = master().stream()
            .map(s -> {
                double score = WorkingCapitalMath.supplierRisk(
                    s.getAvgLeadTimeDays() != null ? s.getAvgLeadTimeDays() : DEFAULT_LEAD_TIME,
                    s.getOnTimeDeliveryRate() != null ? s.getOnTimeDeliveryRate() : DEFAULT_OTD_RATE,
                    s.getQualityRejectionRate() != null ? s.getQualityRejectionRate() : DEFAULT_REJECTION_RATE);
                return SupplierRiskResponse.SupplierScore.builder()
                    .supplierId(s.getSupplierId())
                    .supplierName(s.getSupplierName())
                    .leadTime(s.getAvgLeadTimeDays())
                    .otdRate(s.getOnTimeDeliveryRate())
                    .qrr(s.getQualityRejectionRate())
                    .riskScore(score)
                    .riskLevel(WorkingCapitalMath.riskLevel(score))
                    .build();
            })
            .sorted(Comparator.comparingDouble(SupplierRiskResponse.SupplierScore::getRiskScore).reversed()
                .thenComparing(SupplierRiskResponse.SupplierScore::getSupplierId,
                    Comparator.nullsLast(Comparator.naturalOrder())))
            .toList();

        return SupplierRiskResponse.builder()
            .count(scores.size())
            .highRisk(countLevel(scores, "high"))
            .mediumRisk(countLevel(scores, "medium"))
            .lowRisk(countLevel(scores, "low"))
            .suppliers(scores)
            .build();
    }

    public AnalysisResult performance() {
        Availability inputs = availability.check(Requirement.of(SUPPLIERS));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.GET_SUPPLIER_PERFORMANCE.getToolName());
        }
        List<SupplierPerformanceResponse.SupplierMetrics> suppliers = master().stream()
            .sorted(Comparator.comparing(SupplierPerformanceResponse.SupplierMetrics::getOnTimeDeliveryRate,
                    Comparator.nullsLast(Comparator.reverseOrder()))
                .thenComparing(SupplierPerformanceResponse.SupplierMetrics::getSupplierId,
                    Comparator.nullsLast(Comparator.naturalOrder())))
            .toList();
        return SupplierPerformanceResponse.builder()
            .count(suppliers.size())
            .suppliers(suppliers)
            .build();
    }

    public AnalysisResult concentration() {
        Availability inputs = availability.check(Requirement.of(PURCHASE_ORDERS, "total_po_value"));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.GET_SUPPLIER_CONCENTRATION.getToolName());
        }
        List<SupplierConcentrationResponse.SupplierShare> suppliers = store.query("poValueBySupplier", Map.of(),
            (rs, i) -> {
                Double value = Rows.nullableDouble(rs, "po_value");
                Double share = Rows.nullableDouble(rs, "share_pct");
                return SupplierConcentrationResponse.SupplierShare.builder()
                    .supplierId(Rows.string(rs, "supplier_id"))
                    .orders(Rows.longOr(rs, "po_count", 0L))
                    .totalValue(value != null ? round2(value) : null)
                    .valuePct(share != null ? round2(share) : null)
                    .build();
            });
        double top3 = round1(suppliers.stream()
            .limit(3)
            .mapToDouble(s -> s.getValuePct() != null ? s.getValuePct() : 0.0)
            .sum());
        return SupplierConcentrationResponse.builder()
            .top3ValuePct(top3)
            .concentrationRisk(WorkingCapitalMath.concentrationRisk(top3))
            .suppliers(suppliers)
            .build();
    }

    private List<SupplierPerformanceResponse.SupplierMetrics> master() {
        return store.query("supplierMaster", Map.of("columns", store.projection(SUPPLIERS, MASTER_COLUMNS)), Map.of(),
            (rs, i) -> SupplierPerformanceResponse.SupplierMetrics.builder()
                .supplierId(Rows.string(rs, "supplier_key"))
                .supplierName(Rows.string(rs, "supplier_name"))
                .country(Rows.string(rs, "country"))
                .avgLeadTimeDays(Rows.nullableDouble(rs, "avg_lead_time_days"))
                .onTimeDeliveryRate(Rows.nullableDouble(rs, "on_time_delivery_rate"))
                .qualityRejectionRate(Rows.nullableDouble(rs, "quality_rejection_rate"))
                .riskScore(Rows.nullableDouble(rs, "risk_score"))
                .rating(Rows.nullableDouble(rs, "rating"))
                .build());
    }

    private static int countLevel(List<SupplierRiskResponse.SupplierScore> scores, String level) {
        return (int) scores.stream().filter(s -> level.equals(s.getRiskLevel())).count();
    }
}
