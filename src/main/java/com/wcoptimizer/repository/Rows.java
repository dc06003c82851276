package com.wcoptimizer.repository;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Null-aware column readers for DuckDB result sets. DuckDB widens CSV integers to
 * BIGINT and may surface DECIMAL, so numeric reads go through {@link Number}.
 */
public final class Rows {

    private Rows() {
    }

    public static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        Object value = rs.getObject(column);
        return value instanceof Number n ? n.doubleValue() : null;
    }

    public static double doubleOr(ResultSet rs, String column, double fallback) throws SQLException {
        Double value = nullableDouble(rs, column);
        return value != null ? value : fallback;
    }

    public static Long nullableLong(ResultSet rs, String column) throws SQLException {
        Object value = rs.getObject(column);
        return value instanceof Number n ? n.longValue() : null;
    }

    public static long longOr(ResultSet rs, String column, long fallback) throws SQLException {
        Long value = nullableLong(rs, column);
        return value != null ? value : fallback;
    }

    public static String string(ResultSet rs, String column) throws SQLException {
        Object value = rs.getObject(column);
        return value != null ? value.toString() : null;
    }

    public static LocalDate date(ResultSet rs, String column) throws SQLException {
        Object value = rs.getObject(column);
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDate d) {
            return d;
        }
        if (value instanceof Date d) {
            return d.toLocalDate();
        }
        if (value instanceof Timestamp t) {
            return t.toLocalDateTime().toLocalDate();
        }
        if (value instanceof LocalDateTime t) {
            return t.toLocalDate();
        }
        return LocalDate.parse(value.toString().substring(0, 10));
    }

    /** Copies the current row into an ordered map with JSON-friendly values. */
    public static Map<String, Object> toMap(ResultSet rs) throws SQLException {
        var meta = rs.getMetaData();
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            row.put(meta.getColumnLabel(i), normalize(rs.getObject(i)));
        }
        return row;
    }

    static Object normalize(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean
                || value instanceof Integer || value instanceof Long || value instanceof Double
                || value instanceof Float || value instanceof Short || value instanceof Byte) {
            return value;
        }
        if (value instanceof BigDecimal d) {
            return d.doubleValue();
        }
        if (value instanceof BigInteger i) {
            return i.longValue();
        }
        if (value instanceof Date d) {
            return d.toLocalDate();
        }
        if (value instanceof Timestamp t) {
            return t.toLocalDateTime();
        }
        if (value instanceof LocalDate || value instanceof LocalDateTime || value instanceof OffsetDateTime) {
            return value;
        }
        return value.toString();
    }
}
