package com.wcoptimizer.service;

import com.wcoptimizer.config.WcOptimizerProperties;
import com.wcoptimizer.dto.SqlQueryResponse;
import com.wcoptimizer.exception.InvalidParameterException;
import com.wcoptimizer.exception.QueryRejectedException;
import com.wcoptimizer.repository.TabularStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Read-only gate for free-form SQL. Statements mentioning a write keyword
 * anywhere are refused before they reach the store, and results are capped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryGateService {

    static final List<String> BLOCKED_KEYWORDS =
        List.of("INSERT", "UPDATE", "DELETE", "DROP", "ALTER", "CREATE", "TRUNCATE");

    private final TabularStore store;
    private final WcOptimizerProperties properties;

    public SqlQueryResponse run(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new InvalidParameterException("sql must not be blank");
        }
        checkReadOnly(sql);
        int maxRows = properties.getQuery().getMaxRows();
        TabularStore.RawResult result = store.queryRaw(sql, maxRows);
        log.info("SQL query executed | rows={} | total={}", result.rows().size(), result.totalRows());
        return SqlQueryResponse.builder()
            .columns(result.columns())
            .rows(result.rows())
            .rowCount(result.rows().size())
            .totalRows(result.totalRows())
            .truncated(result.totalRows() > result.rows().size())
            .build();
    }

    /** Substring match, so identifiers such as {@code created_at} are refused too. */
    static void checkReadOnly(String sql) {
        String upper = sql.toUpperCase(Locale.ROOT);
        for (String keyword : BLOCKED_KEYWORDS) {
            if (upper.contains(keyword)) {
                log.warn("SQL query rejected | keyword={}", keyword);
                throw new QueryRejectedException(keyword);
            }
        }
    }
}
