package com.wcoptimizer.service;

import com.wcoptimizer.dto.AnalysisDescriptor;
import com.wcoptimizer.dto.AnalysisResult;
import com.wcoptimizer.dto.NotFoundResponse;
import com.wcoptimizer.exception.InvalidParameterException;
import com.wcoptimizer.exception.UnknownAnalysisException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnalysisDispatcherTest {

    @Mock CashCycleService cashCycle;
    @Mock ClassificationService classification;
    @Mock InventoryPolicyService inventory;
    @Mock DemandAnalyticsService demand;
    @Mock SupplierRiskService supplierRisk;
    @Mock SupplierNetworkService supplierNetwork;
    @Mock DatasetService datasets;
    @Mock QueryGateService queryGate;

    @InjectMocks
    AnalysisDispatcher dispatcher;

    @Test
    void run_appliesDeclaredDefaults() {
        AnalysisResult expected = NotFoundResponse.builder().analysis("get_dead_stock").build();
        when(inventory.deadStock(90)).thenReturn(expected);

        assertThat(dispatcher.run("get_dead_stock", null)).isSameAs(expected);
    }

    @Test
    void run_passesCallerArguments() {
        AnalysisResult expected = NotFoundResponse.builder().analysis("calculate_eoq").build();
        when(inventory.eoq(List.of("P1", "P2"), 75.0, 0.2)).thenReturn(expected);

        AnalysisResult result = dispatcher.run("calculate_eoq",
            Map.of("skus", List.of("P1", "P2"), "order_cost", 75, "holding_cost_pct", 0.2));

        assertThat(result).isSameAs(expected);
    }

    @Test
    void run_simulationWithoutRevenuePassesEmpty() {
        AnalysisResult expected = NotFoundResponse.builder().analysis("simulate_ccc_improvement").build();
        when(cashCycle.simulate(5.0, 0.0, 0.0, Optional.empty())).thenReturn(expected);

        assertThat(dispatcher.run("simulate_ccc_improvement", Map.of("dio_reduction", 5))).isSameAs(expected);
    }

    @Test
    void run_seasonalityWithoutSkuCoversAllProducts() {
        AnalysisResult expected = NotFoundResponse.builder().analysis("get_seasonality_analysis").build();
        when(demand.seasonality(null)).thenReturn(expected);

        assertThat(dispatcher.run("get_seasonality_analysis", Map.of())).isSameAs(expected);
    }

    @Test
    void run_rejectsUnknownNamesAndMissingArgumentsBeforeTouchingServices() {
        assertThatThrownBy(() -> dispatcher.run("drop_everything", Map.of()))
            .isInstanceOf(UnknownAnalysisException.class);
        assertThatThrownBy(() -> dispatcher.run("ripple_effect_analysis", Map.of()))
            .isInstanceOf(InvalidParameterException.class);
        verifyNoInteractions(supplierNetwork);
    }

    @Test
    void describe_exposesParametersWithDefaults() {
        List<AnalysisDescriptor> catalogue = dispatcher.describe();

        assertThat(catalogue).hasSize(42);
        AnalysisDescriptor forecast = catalogue.stream()
            .filter(d -> d.getName().equals("forecast_demand"))
            .findFirst()
            .orElseThrow();
        assertThat(forecast.getGroup()).isEqualTo("demand");
        assertThat(forecast.getRequires()).containsExactly("sales_transactions");
        assertThat(forecast.getParameters())
            .extracting(AnalysisDescriptor.Parameter::getName)
            .containsExactly("sku", "horizon_days", "window");
    }
}
