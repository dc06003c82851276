package com.wcoptimizer.repository;

import com.wcoptimizer.catalog.DatasetCategory;
import com.wcoptimizer.exception.InvalidParameterException;
import com.wcoptimizer.exception.TabularStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Read access to the DuckDB tables holding the uploaded datasets.
 * <p>
 * Identifiers are never taken from callers verbatim: table names come from
 * {@link DatasetCategory} (plus the upload log) and column names are checked
 * against {@code information_schema} before being quoted into SQL. Values are
 * always bound parameters. Every {@link DataAccessException} leaves this class
 * as a {@link TabularStoreException}.
 */
@Slf4j
@Repository
public class TabularStore {

    public static final String UPLOAD_LOG_TABLE = "file_uploads";
    public static final String CURRENT_INVENTORY = "current_inventory";

    private static final Pattern FRAGMENT = Pattern.compile("\\$\\{([a-z_]+)}");
    private static final Set<String> INTERNAL_TABLES = Set.of(UPLOAD_LOG_TABLE);

    private final NamedParameterJdbcTemplate jdbc;
    private final SqlTemplateLoader sqlLoader;

    public TabularStore(NamedParameterJdbcTemplate jdbc, SqlTemplateLoader sqlLoader) {
        this.jdbc = jdbc;
        this.sqlLoader = sqlLoader;
    }

    public boolean tableExists(String table) {
        Long count = guarded("tableExists " + table, () -> jdbc.queryForObject(
            sqlLoader.load("tableExists"), new MapSqlParameterSource("table", table), Long.class));
        return count != null && count > 0;
    }

    public boolean tableExists(DatasetCategory category) {
        return tableExists(category.getTableName());
    }

    public List<String> listTables() {
        return guarded("listTables", () -> jdbc.queryForList(
            sqlLoader.load("listTables"), new MapSqlParameterSource(), String.class));
    }

    public long rowCount(DatasetCategory category) {
        return rowCount(category.getTableName());
    }

    public long rowCount(String table) {
        String name = requireKnownTable(table);
        Long count = guarded("rowCount " + name, () -> jdbc.queryForObject(
            "SELECT COUNT(*) FROM " + name, new MapSqlParameterSource(), Long.class));
        return count != null ? count : 0L;
    }

    /** Column name to declared type, in table order; empty when the table is absent. */
    public Map<String, String> columnTypes(String table) {
        String name = requireKnownTable(table);
        Map<String, String> types = new LinkedHashMap<>();
        guarded("columns " + name, () -> {
            jdbc.query(sqlLoader.load("tableColumns"), new MapSqlParameterSource("table", name),
                rs -> {
                    types.put(rs.getString("column_name").toLowerCase(Locale.ROOT), rs.getString("data_type"));
                });
            return null;
        });
        return types;
    }

    public Set<String> columns(DatasetCategory category) {
        return columnTypes(category.getTableName()).keySet();
    }

    public boolean hasColumns(DatasetCategory category, String... columns) {
        Set<String> present = columns(category);
        for (String column : columns) {
            if (!present.contains(column)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Quotes a caller-supplied column after confirming the table really has it.
     */
    public String quoteColumn(DatasetCategory category, String column) {
        String wanted = column == null ? "" : column.trim().toLowerCase(Locale.ROOT);
        if (!columns(category).contains(wanted)) {
            throw new InvalidParameterException(
                "Column '" + column + "' does not exist in " + category.getTableName());
        }
        return quote(wanted);
    }

    /**
     * Select list that yields every requested column, substituting {@code NULL}
     * for the optional ones the uploaded table does not carry.
     */
    public String projection(DatasetCategory category, List<String> wanted) {
        Set<String> present = columns(category);
        return wanted.stream()
            .map(c -> present.contains(c) ? quote(c) : "NULL AS " + quote(c))
            .collect(Collectors.joining(", "));
    }

    /**
     * Subquery for the current inventory snapshot: rows on the latest
     * {@code snapshot_date}, or the whole table when it carries no dates.
     */
    public String currentInventory() {
        if (columns(DatasetCategory.INVENTORY_SNAPSHOT).contains("snapshot_date")) {
            return "(SELECT * FROM inventory_snapshot WHERE snapshot_date = "
                + "(SELECT MAX(snapshot_date) FROM inventory_snapshot))";
        }
        return "(SELECT * FROM inventory_snapshot)";
    }

    /** {@code function("column")} when the table carries the column, else a typed NULL. */
    public String aggregateOrNull(DatasetCategory category, String function, String column) {
        return columns(category).contains(column)
            ? function + "(" + quote(column) + ")"
            : "CAST(NULL AS DOUBLE)";
    }

    /** {@code alias."column"} when the table carries the column, else NULL. */
    public String columnOrNull(DatasetCategory category, String alias, String column) {
        return columns(category).contains(column) ? alias + "." + quote(column) : "NULL";
    }

    /**
     * Predicate over a flag column stored as BOOLEAN, 0/1 or text; {@code FALSE}
     * when the column is absent.
     */
    public String flag(DatasetCategory category, String column) {
        return columns(category).contains(column)
            ? "LOWER(CAST(" + quote(column) + " AS VARCHAR)) IN ('true', '1', 'yes', 'y')"
            : "FALSE";
    }

    public <T> List<T> query(String name, Map<String, ?> params, RowMapper<T> mapper) {
        return query(name, Map.of(), params, mapper);
    }

    public <T> List<T> query(String name, Map<String, String> fragments, Map<String, ?> params,
                             RowMapper<T> mapper) {
        String sql = render(name, fragments);
        return guarded(name, () -> jdbc.query(sql, new MapSqlParameterSource(params), mapper));
    }

    public <T> Optional<T> queryForOptional(String name, Map<String, ?> params, RowMapper<T> mapper) {
        return queryForOptional(name, Map.of(), params, mapper);
    }

    public <T> Optional<T> queryForOptional(String name, Map<String, String> fragments,
                                            Map<String, ?> params, RowMapper<T> mapper) {
        return query(name, fragments, params, mapper).stream().findFirst();
    }

    /** Runs free-form read SQL and returns at most {@code maxRows} rows plus the total count. */
    public RawResult queryRaw(String sql, int maxRows) {
        return guarded("raw query", () -> jdbc.getJdbcOperations().query(sql, (ResultSet rs) -> {
            var meta = rs.getMetaData();
            List<String> columns = new ArrayList<>();
            for (int i = 1; i <= meta.getColumnCount(); i++) {
                columns.add(meta.getColumnLabel(i));
            }
            List<Map<String, Object>> rows = new ArrayList<>();
            long total = 0;
            while (rs.next()) {
                if (total < maxRows) {
                    rows.add(Rows.toMap(rs));
                }
                total++;
            }
            return new RawResult(columns, rows, total);
        }));
    }

    public List<Map<String, Object>> sampleRows(String table, int limit) {
        String name = requireKnownTable(table);
        return guarded("sample " + name, () -> jdbc.query(
            "SELECT * FROM " + name + " LIMIT :limit",
            new MapSqlParameterSource("limit", limit),
            (rs, i) -> Rows.toMap(rs)));
    }

    /** Null count per column, in table order. */
    public Map<String, Long> nullCounts(String table) {
        String name = requireKnownTable(table);
        List<String> cols = new ArrayList<>(columnTypes(name).keySet());
        if (cols.isEmpty()) {
            return Map.of();
        }
        String select = cols.stream()
            .map(c -> "COUNT(*) - COUNT(" + quote(c) + ") AS " + quote(c))
            .collect(Collectors.joining(", "));
        return guarded("nullCounts " + name, () -> jdbc.query(
            "SELECT " + select + " FROM " + name, new MapSqlParameterSource(), rs -> {
                Map<String, Long> counts = new LinkedHashMap<>();
                if (rs.next()) {
                    for (int i = 0; i < cols.size(); i++) {
                        counts.put(cols.get(i), rs.getLong(i + 1));
                    }
                }
                return counts;
            }));
    }

    public long duplicateRows(String table) {
        String name = requireKnownTable(table);
        Long dupes = guarded("duplicateRows " + name, () -> jdbc.queryForObject(
            "SELECT COUNT(*) - (SELECT COUNT(*) FROM (SELECT DISTINCT * FROM " + name + ")) FROM " + name,
            new MapSqlParameterSource(), Long.class));
        return dupes != null ? dupes : 0L;
    }

    /**
     * Drops the category's table and recreates it from a CSV file, letting DuckDB
     * infer the column types. Returns the loaded row count.
     */
    public long replaceFromCsv(DatasetCategory category, Path csv) {
        String table = category.getTableName();
        String source = csv.toAbsolutePath().toString().replace("'", "''");
        execute("DROP TABLE IF EXISTS " + table, new MapSqlParameterSource());
        execute("CREATE TABLE " + table + " AS SELECT * FROM read_csv_auto('" + source + "', header = true)",
            new MapSqlParameterSource());
        return rowCount(category);
    }

    public void recordUpload(String category, String filename, LocalDateTime uploadedAt, long rows, String status) {
        execute("CREATE TABLE IF NOT EXISTS " + UPLOAD_LOG_TABLE + " (id BIGINT, file_category VARCHAR, "
            + "filename VARCHAR, upload_timestamp TIMESTAMP, row_count BIGINT, status VARCHAR)",
            new MapSqlParameterSource());
        execute("INSERT INTO " + UPLOAD_LOG_TABLE + " SELECT COALESCE(MAX(id), 0) + 1, CAST(:category AS VARCHAR), "
                + "CAST(:filename AS VARCHAR), CAST(:uploadedAt AS TIMESTAMP), CAST(:rows AS BIGINT), "
                + "CAST(:status AS VARCHAR) FROM " + UPLOAD_LOG_TABLE,
            new MapSqlParameterSource()
                .addValue("category", category)
                .addValue("filename", filename)
                .addValue("uploadedAt", Timestamp.valueOf(uploadedAt))
                .addValue("rows", rows)
                .addValue("status", status));
    }

    /** Drops every dataset table and the upload log; returns the tables dropped. */
    public List<String> dropAll() {
        List<String> dropped = new ArrayList<>();
        for (String table : listTables()) {
            if (INTERNAL_TABLES.contains(table) || DatasetCategory.tableNames().contains(table)) {
                execute("DROP TABLE IF EXISTS " + table, new MapSqlParameterSource());
                dropped.add(table);
            }
        }
        return dropped;
    }

    private void execute(String sql, SqlParameterSource params) {
        guarded("execute", () -> jdbc.update(sql, params));
    }

    String render(String name, Map<String, String> fragments) {
        String template = sqlLoader.load(name);
        Matcher m = FRAGMENT.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String key = m.group(1);
            String replacement = CURRENT_INVENTORY.equals(key) ? currentInventory() : fragments.get(key);
            if (replacement == null) {
                throw new IllegalStateException("No fragment '" + key + "' supplied for query " + name);
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    public static String requireKnownTable(String table) {
        String name = table == null ? "" : table.trim().toLowerCase(Locale.ROOT);
        if (INTERNAL_TABLES.contains(name) || DatasetCategory.tableNames().contains(name)) {
            return name;
        }
        throw new InvalidParameterException("Unknown table '" + table + "'. Valid tables: "
            + DatasetCategory.tableNames());
    }

    static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    private <T> T guarded(String what, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            log.error("Tabular store failure | {} | {}", what, e.getMostSpecificCause().getMessage());
            throw new TabularStoreException("Tabular store query failed (" + what + "): "
                + e.getMostSpecificCause().getMessage(), e);
        }
    }

    public record RawResult(List<String> columns, List<Map<String, Object>> rows, long totalRows) {}
}
