package com.wcoptimizer.service;

import com.wcoptimizer.catalog.Analysis;
import com.wcoptimizer.catalog.DatasetCategory;
import com.wcoptimizer.catalog.Requirement;
import com.wcoptimizer.dto.AnalysisResult;
import com.wcoptimizer.dto.AnomalyResponse;
import com.wcoptimizer.dto.CustomerConcentrationResponse;
import com.wcoptimizer.dto.DemandForecastResponse;
import com.wcoptimizer.dto.NotFoundResponse;
import com.wcoptimizer.dto.RevenueTrendResponse;
import com.wcoptimizer.dto.SalesVelocityResponse;
import com.wcoptimizer.dto.SeasonalityResponse;
import com.wcoptimizer.dto.TopSkusResponse;
import com.wcoptimizer.exception.InvalidParameterException;
import com.wcoptimizer.repository.Rows;
import com.wcoptimizer.repository.TabularStore;
import com.wcoptimizer.service.AvailabilityResolver.Availability;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static com.wcoptimizer.catalog.DatasetCategory.CUSTOMERS;
import static com.wcoptimizer.catalog.DatasetCategory.SALES_TRANSACTIONS;
import static com.wcoptimizer.service.WorkingCapitalMath.round1;
import static com.wcoptimizer.service.WorkingCapitalMath.round2;

/**
 * Demand-side analytics over sales history: forecasting, outliers, trends and
 * customer mix.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DemandAnalyticsService {

    static final double TREND_THRESHOLD = 0.10;
    private static final int ANOMALY_ROWS = 50;
    private static final Set<String> NUMERIC_TYPES = Set.of(
        "TINYINT", "SMALLINT", "INTEGER", "BIGINT", "HUGEINT", "UTINYINT", "USMALLINT", "UINTEGER",
        "UBIGINT", "FLOAT", "REAL", "DOUBLE");

    private final TabularStore store;
    private final AvailabilityResolver availability;

    /**
     * Trailing moving average of daily units. The window shrinks to the history
     * length; a trend is only called when two full windows are available.
     */
    public AnalysisResult forecast(String sku, int horizonDays, int window) {
        if (horizonDays < 1 || window < 1) {
            throw new InvalidParameterException("horizon_days and window must be >= 1");
        }
        Availability inputs = availability.check(Requirement.of(SALES_TRANSACTIONS));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.FORECAST_DEMAND.getToolName());
        }
        List<Double> daily = store.query("dailyDemandForSku", Map.of("sku", sku),
            (rs, i) -> Rows.doubleOr(rs, "qty", 0.0));
        if (daily.isEmpty()) {
            return NotFoundResponse.builder()
                .analysis(Analysis.FORECAST_DEMAND.getToolName())
                .message("No sales history for product " + sku)
                .build();
        }
        return projectDemand(sku, daily, horizonDays, window);
    }

    static DemandForecastResponse projectDemand(String sku, List<Double> daily, int horizonDays, int window) {
        int n = daily.size();
        int w = Math.min(window, n);
        double current = mean(daily.subList(n - w, n));
        Double prior = null;
        String trend = "stable";
        if (n >= 2 * w) {
            prior = mean(daily.subList(n - 2 * w, n - w));
            if (current > prior * (1 + TREND_THRESHOLD)) {
                trend = "increasing";
            } else if (current < prior * (1 - TREND_THRESHOLD)) {
                trend = "decreasing";
            }
        }
        return DemandForecastResponse.builder()
            .productId(sku)
            .historicalDays(n)
            .window(w)
            .horizonDays(horizonDays)
            .movingAverage(round2(current))
            .priorMovingAverage(prior != null ? round2(prior) : null)
            .trend(trend)
            .totalPredicted(round1(current * horizonDays))
            .build();
    }

    public AnalysisResult anomalies(String table, String column, double zThreshold) {
        if (zThreshold <= 0) {
            throw new InvalidParameterException("z_threshold must be > 0");
        }
        DatasetCategory category = categoryOf(table);
        Availability inputs = availability.check(Requirement.of(category));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.DETECT_ANOMALIES.getToolName());
        }
        String quoted = store.quoteColumn(category, column);
        String name = column.trim().toLowerCase(Locale.ROOT);
        String type = store.columnTypes(category.getTableName()).getOrDefault(name, "");
        if (!isNumeric(type)) {
            throw new InvalidParameterException("Column '" + name + "' is " + type + ", not numeric");
        }

        Map<String, String> fragments = Map.of("table", category.getTableName(), "column", quoted);
        Stats stats = store.queryForOptional("anomalyStats", fragments, Map.of(),
                (rs, i) -> new Stats(
                    Rows.longOr(rs, "observations", 0L),
                    Rows.doubleOr(rs, "mean", 0.0),
                    Rows.doubleOr(rs, "std_dev", 0.0)))
            .orElse(new Stats(0L, 0.0, 0.0));

        List<AnomalyResponse.Anomaly> anomalies = stats.stdDev() > 0
            ? store.query("anomalyScan", fragments, Map.of("threshold", zThreshold, "limit", ANOMALY_ROWS),
                (rs, i) -> {
                    Map<String, Object> row = Rows.toMap(rs);
                    row.remove("z_score");
                    return AnomalyResponse.Anomaly.builder()
                        .value(Rows.doubleOr(rs, name, 0.0))
                        .zScore(round2(Rows.doubleOr(rs, "z_score", 0.0)))
                        .row(row)
                        .build();
                })
            : List.of();
        log.debug("Anomaly scan | table={} | column={} | found={}", category.getTableName(), name, anomalies.size());

        return AnomalyResponse.builder()
            .table(category.getTableName())
            .column(name)
            .zThreshold(zThreshold)
            .observations(stats.observations())
            .mean(round2(stats.mean()))
            .stdDev(round2(stats.stdDev()))
            .anomaliesFound(anomalies.size())
            .anomalies(anomalies)
            .build();
    }

    public AnalysisResult revenueTrends(String granularity) {
        String grain = granularity == null ? "monthly" : granularity.trim().toLowerCase(Locale.ROOT);
        String period = switch (grain) {
            case "daily" -> "CAST(transaction_date AS DATE)";
            case "weekly" -> "CAST(DATE_TRUNC('week', CAST(transaction_date AS DATE)) AS DATE)";
            case "monthly" -> "CAST(DATE_TRUNC('month', CAST(transaction_date AS DATE)) AS DATE)";
            default -> throw new InvalidParameterException("granularity must be one of: daily, weekly, monthly");
        };
        Availability inputs = availability.check(Requirement.of(SALES_TRANSACTIONS));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.GET_REVENUE_TRENDS.getToolName());
        }

        List<RevenueTrendResponse.Period> trends = new ArrayList<>();
        Double previous = null;
        for (PeriodTotal total : store.query("revenueByPeriod", Map.of("period", period), Map.of(),
                (rs, i) -> new PeriodTotal(
                    Rows.date(rs, "period"),
                    Rows.doubleOr(rs, "revenue", 0.0),
                    Rows.doubleOr(rs, "units", 0.0),
                    Rows.longOr(rs, "transactions", 0L)))) {
            trends.add(RevenueTrendResponse.Period.builder()
                .period(total.period())
                .revenue(round2(total.revenue()))
                .units(total.units())
                .transactions(total.transactions())
                .growthPct(previous != null ? WorkingCapitalMath.growthPct(previous, total.revenue()) : null)
                .build());
            previous = total.revenue();
        }
        return RevenueTrendResponse.builder()
            .granularity(grain)
            .periods(trends.size())
            .trends(trends)
            .build();
    }

    public AnalysisResult velocity(int limit) {
        requirePositive(limit);
        Availability inputs = availability.check(Requirement.of(SALES_TRANSACTIONS));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.GET_SALES_VELOCITY.getToolName());
        }
        List<SalesVelocityResponse.SkuVelocity> skus = store.query("salesVelocity", Map.of("limit", limit),
            (rs, i) -> SalesVelocityResponse.SkuVelocity.builder()
                .sku(Rows.string(rs, "sku"))
                .totalUnits(Rows.doubleOr(rs, "total_units", 0.0))
                .sellingDays(Rows.longOr(rs, "selling_days", 0L))
                .unitsPerDay(round2(Rows.doubleOr(rs, "units_per_day", 0.0)))
                .build());
        return SalesVelocityResponse.builder()
            .count(skus.size())
            .skus(skus)
            .build();
    }

    public AnalysisResult topSkus(int limit) {
        requirePositive(limit);
        Availability inputs = availability.check(Requirement.of(SALES_TRANSACTIONS));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.GET_TOP_SKUS.getToolName());
        }
        List<TopSkusResponse.SkuSales> skus = store.query("topSkus",
            Map.of("profit", store.aggregateOrNull(SALES_TRANSACTIONS, "SUM", "gross_profit")),
            Map.of("limit", limit),
            (rs, i) -> {
                Double profit = Rows.nullableDouble(rs, "profit");
                return TopSkusResponse.SkuSales.builder()
                    .sku(Rows.string(rs, "sku"))
                    .revenue(round2(Rows.doubleOr(rs, "revenue", 0.0)))
                    .units(Rows.doubleOr(rs, "units", 0.0))
                    .profit(profit != null ? round2(profit) : null)
                    .transactions(Rows.longOr(rs, "transactions", 0L))
                    .build();
            });
        return TopSkusResponse.builder()
            .count(skus.size())
            .skus(skus)
            .build();
    }

    public AnalysisResult customerConcentration(int limit) {
        requirePositive(limit);
        Availability inputs = availability.check(Requirement.of(SALES_TRANSACTIONS, "customer_id"));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.GET_CUSTOMER_CONCENTRATION.getToolName());
        }
        Map<String, String> fragments = new LinkedHashMap<>();
        if (availability.isAvailable(CUSTOMERS)) {
            fragments.put("customer_name", "c.customer_name");
            fragments.put("customer_join", "LEFT JOIN (SELECT DISTINCT ON (customer_id) customer_id, customer_name "
                + "FROM customers) c ON CAST(s.customer_id AS VARCHAR) = CAST(c.customer_id AS VARCHAR)");
        } else {
            fragments.put("customer_name", "CAST(NULL AS VARCHAR)");
            fragments.put("customer_join", "");
        }

        List<CustomerConcentrationResponse.CustomerShare> customers = store.query("customerRevenue", fragments,
            Map.of("limit", limit),
            (rs, i) -> CustomerConcentrationResponse.CustomerShare.builder()
                .customerId(Rows.string(rs, "customer_id"))
                .customerName(Rows.string(rs, "customer_name"))
                .revenue(round2(Rows.doubleOr(rs, "revenue", 0.0)))
                .revenuePct(round2(Rows.doubleOr(rs, "revenue_pct", 0.0)))
                .uniqueProducts(Rows.longOr(rs, "unique_products", 0L))
                .build());
        double topShare = round1(customers.stream()
            .mapToDouble(CustomerConcentrationResponse.CustomerShare::getRevenuePct)
            .sum());

        return CustomerConcentrationResponse.builder()
            .topN(customers.size())
            .topNSharePct(topShare)
            .concentrationRisk(WorkingCapitalMath.concentrationRisk(topShare))
            .customers(customers)
            .build();
    }

    /** Month-of-year units with an index against the mean month, optionally for one SKU. */
    public AnalysisResult seasonality(String sku) {
        Availability inputs = availability.check(Requirement.of(SALES_TRANSACTIONS));
        if (!inputs.satisfied()) {
            return inputs.toResponse(Analysis.GET_SEASONALITY_ANALYSIS.getToolName());
        }
        boolean filtered = sku != null && !sku.isBlank();
        Map<String, String> fragments = Map.of("sku_filter",
            filtered ? "WHERE CAST(product_id AS VARCHAR) = :sku" : "");
        Map<String, Object> params = filtered ? Map.of("sku", sku.trim()) : Map.of();

        List<MonthTotal> totals = store.query("monthlyDemand", fragments, params,
            (rs, i) -> new MonthTotal(
                (int) Rows.longOr(rs, "month", 0L),
                Rows.doubleOr(rs, "units", 0.0),
                Rows.doubleOr(rs, "revenue", 0.0)));
        double average = totals.stream().mapToDouble(MonthTotal::units).average().orElse(0.0);

        List<SeasonalityResponse.Month> months = totals.stream()
            .map(t -> SeasonalityResponse.Month.builder()
                .month(t.month())
                .units(t.units())
                .revenue(round2(t.revenue()))
                .seasonalityIndex(average > 0 ? round2(t.units() / average) : 0.0)
                .build())
            .toList();

        return SeasonalityResponse.builder()
            .sku(filtered ? sku.trim() : null)
            .monthlyAverage(round2(average))
            .peakMonth(totals.stream().max(Comparator.comparingDouble(MonthTotal::units))
                .map(MonthTotal::month).orElse(null))
            .lowMonth(totals.stream().min(Comparator.comparingDouble(MonthTotal::units))
                .map(MonthTotal::month).orElse(null))
            .months(months)
            .build();
    }

    private static DatasetCategory categoryOf(String table) {
        return DatasetCategory.fromName(TabularStore.requireKnownTable(table));
    }

    static boolean isNumeric(String duckDbType) {
        String type = duckDbType.toUpperCase(Locale.ROOT);
        return NUMERIC_TYPES.contains(type) || type.startsWith("DECIMAL");
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private static void requirePositive(int limit) {
        if (limit < 1) {
            throw new InvalidParameterException("limit must be >= 1");
        }
    }

    private record Stats(long observations, double mean, double stdDev) {}

    private record PeriodTotal(LocalDate period, double revenue, double units, long transactions) {}

    private record MonthTotal(int month, double units, double revenue) {}
}
