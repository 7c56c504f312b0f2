package org.iceforge.saga.analytics.service;

import java.math.BigDecimal;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.temporal.TemporalAccessor;
import java.util.*;

/**
 * Makes query values safe for JSON: NaN, infinities and blank or "nan" placeholder strings
 * become null, JDBC temporal types become ISO-8601 strings.
 */
public final class ResultSanitizer {
    private ResultSanitizer() {}

    public static Object clean(Object v) {
        if (v == null) return null;
        if (v instanceof Double d) return d.isNaN() || d.isInfinite() ? null : d;
        if (v instanceof Float f) return f.isNaN() || f.isInfinite() ? null : f;
        if (v instanceof String s) {
            String t = s.trim();
            return t.isEmpty() || t.equalsIgnoreCase("nan") ? null : s;
        }
        if (v instanceof Timestamp ts) return ts.toLocalDateTime().toString();
        if (v instanceof java.sql.Date d) return d.toLocalDate().toString();
        if (v instanceof Time t) return t.toLocalTime().toString();
        if (v instanceof TemporalAccessor) return v.toString();
        if (v instanceof byte[] b) return "(bytes:" + b.length + ")";
        if (v instanceof Map<?, ?> m) return cleanMap(m);
        if (v instanceof Collection<?> c) return c.stream().map(ResultSanitizer::clean).toList();
        return v;
    }

    public static Map<String, Object> cleanRow(Map<String, Object> row) {
        Map<String, Object> out = new LinkedHashMap<>();
        row.forEach((k, val) -> out.put(k, clean(val)));
        return out;
    }

    public static List<Map<String, Object>> cleanRows(List<Map<String, Object>> rows) {
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) out.add(cleanRow(row));
        return out;
    }

    /**
     * Sanitised value as a double, or null when absent, non-numeric or non-finite.
     */
    public static Double toDouble(Object v) {
        Object c = clean(v);
        if (c instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        if (c instanceof String s) {
            try {
                double d = Double.parseDouble(s.trim());
                return Double.isFinite(d) ? d : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static Long toLong(Object v) {
        Object c = clean(v);
        if (c instanceof BigDecimal bd) return bd.longValue();
        if (c instanceof Number n) return Double.isFinite(n.doubleValue()) ? n.longValue() : null;
        return null;
    }

    private static Map<String, Object> cleanMap(Map<?, ?> m) {
        Map<String, Object> out = new LinkedHashMap<>();
        m.forEach((k, val) -> out.put(String.valueOf(k), clean(val)));
        return out;
    }
}
