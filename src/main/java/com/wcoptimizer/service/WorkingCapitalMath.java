package com.wcoptimizer.service;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Closed-form working-capital and inventory formulas. Every division is guarded;
 * the guarded result is documented on each method.
 */
public final class WorkingCapitalMath {

    public static final double DEFAULT_Z = 1.65;
    static final Map<Double, Double> Z_SCORES = Map.of(0.90, 1.28, 0.95, 1.65, 0.99, 2.33);

    static final double WARNING_FACTOR = 1.2;
    static final double RISK_LEAD_TIME_BASELINE_DAYS = 5.0;

    private WorkingCapitalMath() {
    }

    /** Σ(days × amount) / Σ(amount); empty when Σ(amount) is zero. */
    public static OptionalDouble weightedDays(double weightedSum, double amountSum) {
        if (amountSum == 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(weightedSum / amountSum);
    }

    /** Inventory value over average daily COGS; 0 when daily COGS is 0. */
    public static double dio(double inventoryValue, double cogs, long cogsDays) {
        double dailyCogs = cogs / Math.max(cogsDays, 1L);
        return dailyCogs > 0 ? inventoryValue / dailyCogs : 0.0;
    }

    public static double ccc(double dio, double dso, double dpo) {
        return round1(dio + dso - dpo);
    }

    public static double zScore(double serviceLevel) {
        return Z_SCORES.entrySet().stream()
            .filter(e -> Math.abs(e.getKey() - serviceLevel) < 1e-9)
            .map(Map.Entry::getValue)
            .findFirst()
            .orElse(DEFAULT_Z);
    }

    /** Z × σ × √LT, rounded to whole units. */
    public static long safetyStock(double z, double demandStdDev, double leadTimeDays) {
        return Math.round(z * demandStdDev * Math.sqrt(Math.max(0.0, leadTimeDays)));
    }

    /** Sample standard deviation; empty with fewer than two observations. */
    public static OptionalDouble sampleStdDev(List<Double> values) {
        if (values.size() < 2) {
            return OptionalDouble.empty();
        }
        double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double squares = values.stream().mapToDouble(v -> (v - mean) * (v - mean)).sum();
        return OptionalDouble.of(Math.sqrt(squares / (values.size() - 1)));
    }

    public static double annualizedDemand(double totalQuantity, long observedDays) {
        return totalQuantity / Math.max(observedDays, 1L) * 365.0;
    }

    /** √(2DS/H), rounded; 0 when H ≤ 0. */
    public static long eoq(double annualDemand, double orderCost, double holdingCostPerUnit) {
        if (holdingCostPerUnit <= 0) {
            return 0L;
        }
        return Math.round(Math.sqrt(2.0 * annualDemand * orderCost / holdingCostPerUnit));
    }

    public static ReorderSeverity reorderSeverity(double onHand, double reorderPoint) {
        if (onHand < reorderPoint) {
            return ReorderSeverity.CRITICAL;
        }
        if (onHand < reorderPoint * WARNING_FACTOR) {
            return ReorderSeverity.WARNING;
        }
        return ReorderSeverity.OK;
    }

    /** on-hand / reorder point; empty when the reorder point is 0 (no ranking signal). */
    public static OptionalDouble coverageRatio(double onHand, double reorderPoint) {
        if (reorderPoint == 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(onHand / reorderPoint);
    }

    public static String agingBucket(double daysIdle) {
        if (daysIdle <= 30) {
            return "0-30d";
        }
        if (daysIdle <= 60) {
            return "31-60d";
        }
        if (daysIdle <= 90) {
            return "61-90d";
        }
        return "90+d";
    }

    public static char xyzClass(double mean, double stdDev) {
        double cv = coefficientOfVariation(mean, stdDev);
        if (cv < 0.5) {
            return 'X';
        }
        return cv < 1.0 ? 'Y' : 'Z';
    }

    /** σ / μ; 0 when the mean is 0. */
    public static double coefficientOfVariation(double mean, double stdDev) {
        return mean > 0 ? stdDev / mean : 0.0;
    }

    public static char abcClass(double cumulativePct) {
        if (cumulativePct <= 80.0) {
            return 'A';
        }
        return cumulativePct <= 95.0 ? 'B' : 'C';
    }

    /**
     * Composite supplier risk: 30% lead time above the 5-day baseline (×3, capped
     * at 100), 40% on-time shortfall (×200), 30% rejection rate (×1000).
     */
    public static double supplierRisk(double leadTimeDays, double onTimeRate, double rejectionRate) {
        double leadTimeScore = Math.min(100.0, Math.max(0.0, (leadTimeDays - RISK_LEAD_TIME_BASELINE_DAYS) * 3.0));
        double onTimeScore = Math.max(0.0, (1.0 - onTimeRate) * 200.0);
        double rejectionScore = rejectionRate * 1000.0;
        return round1(leadTimeScore * 0.3 + onTimeScore * 0.4 + rejectionScore * 0.3);
    }

    public static String riskLevel(double score) {
        if (score > 60) {
            return "high";
        }
        return score > 30 ? "medium" : "low";
    }

    public static String concentrationRisk(double topSharePct) {
        if (topSharePct > 80) {
            return "high";
        }
        return topSharePct > 50 ? "medium" : "low";
    }

    public static String rippleSeverity(int impacted) {
        if (impacted > 10) {
            return "high";
        }
        return impacted > 3 ? "medium" : "low";
    }

    /** Period-over-period growth in percent; 0 when the prior period is not positive. */
    public static double growthPct(double previous, double current) {
        return previous > 0 ? round1((current - previous) / previous * 100.0) : 0.0;
    }

    public static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    public enum ReorderSeverity {
        CRITICAL, WARNING, OK;

        public String label() {
            return name().toLowerCase();
        }
    }
}
