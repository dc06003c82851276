package com.wcoptimizer.service;

import com.wcoptimizer.dto.DemandForecastResponse;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DemandProjectionTest {

    @Test
    void projectDemand_flagsIncreasingTrendAgainstPriorWindow() {
        List<Double> daily = List.of(10.0, 10.0, 10.0, 20.0, 20.0, 20.0);

        DemandForecastResponse forecast = DemandAnalyticsService.projectDemand("SKU-1", daily, 30, 3);

        assertThat(forecast.getMovingAverage()).isEqualTo(20.0);
        assertThat(forecast.getPriorMovingAverage()).isEqualTo(10.0);
        assertThat(forecast.getTrend()).isEqualTo("increasing");
        assertThat(forecast.getTotalPredicted()).isEqualTo(600.0);
    }

    @Test
    void projectDemand_withinTenPercentIsStable() {
        List<Double> daily = List.of(10.0, 10.0, 10.5, 10.5);

        DemandForecastResponse forecast = DemandAnalyticsService.projectDemand("SKU-1", daily, 7, 2);

        assertThat(forecast.getTrend()).isEqualTo("stable");
    }

    @Test
    void projectDemand_decreasingTrend() {
        List<Double> daily = List.of(30.0, 30.0, 10.0, 10.0);

        DemandForecastResponse forecast = DemandAnalyticsService.projectDemand("SKU-1", daily, 10, 2);

        assertThat(forecast.getTrend()).isEqualTo("decreasing");
        assertThat(forecast.getTotalPredicted()).isEqualTo(100.0);
    }

    @Test
    void projectDemand_shrinksWindowToHistoryAndSkipsTrend() {
        List<Double> daily = List.of(4.0, 6.0, 8.0);

        DemandForecastResponse forecast = DemandAnalyticsService.projectDemand("SKU-1", daily, 10, 30);

        assertThat(forecast.getWindow()).isEqualTo(3);
        assertThat(forecast.getHistoricalDays()).isEqualTo(3);
        assertThat(forecast.getMovingAverage()).isEqualTo(6.0);
        assertThat(forecast.getPriorMovingAverage()).isNull();
        assertThat(forecast.getTrend()).isEqualTo("stable");
    }
}
