package com.wcoptimizer.service;

import com.wcoptimizer.config.WcOptimizerProperties;
import com.wcoptimizer.exception.InvalidParameterException;
import com.wcoptimizer.exception.QueryRejectedException;
import com.wcoptimizer.repository.TabularStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueryGateServiceTest {

    @Mock
    TabularStore store;

    QueryGateService queryGate;

    @BeforeEach
    void setUp() {
        WcOptimizerProperties properties = new WcOptimizerProperties();
        properties.getQuery().setMaxRows(2);
        queryGate = new QueryGateService(store, properties);
    }

    @Test
    void run_rejectsWriteKeywordsInAnyCase() {
        assertThatThrownBy(() -> queryGate.run("drop table products"))
            .isInstanceOf(QueryRejectedException.class)
            .hasMessageContaining("DROP");
        assertThatThrownBy(() -> queryGate.run("SELECT 1; Insert INTO x VALUES (1)"))
            .isInstanceOf(QueryRejectedException.class)
            .hasMessageContaining("INSERT");
        verify(store, never()).queryRaw(anyString(), anyInt());
    }

    @Test
    void run_rejectsKeywordsInsideIdentifiers() {
        assertThatThrownBy(() -> queryGate.run("SELECT created_at FROM products"))
            .isInstanceOf(QueryRejectedException.class)
            .hasMessageContaining("CREATE");
    }

    @Test
    void run_rejectsBlankSql() {
        assertThatThrownBy(() -> queryGate.run("  "))
            .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void run_capsRowsAndReportsTruncation() {
        List<Map<String, Object>> rows = List.of(Map.of("n", 1), Map.of("n", 2));
        when(store.queryRaw("SELECT n FROM range(5) t(n)", 2))
            .thenReturn(new TabularStore.RawResult(List.of("n"), rows, 5));

        var response = queryGate.run("SELECT n FROM range(5) t(n)");

        assertThat(response.getRowCount()).isEqualTo(2);
        assertThat(response.getTotalRows()).isEqualTo(5);
        assertThat(response.isTruncated()).isTrue();
        assertThat(response.getColumns()).containsExactly("n");
    }
}
