package org.iceforge.saga.analytics.service;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResultSanitizerTest {

    @Test
    void replacesNonFiniteAndPlaceholderValuesWithNull() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("a", Double.NaN);
        row.put("b", Double.POSITIVE_INFINITY);
        row.put("c", "nan");
        row.put("d", " ");
        row.put("e", Float.NEGATIVE_INFINITY);
        row.put("f", 4.5);

        Map<String, Object> clean = ResultSanitizer.cleanRow(row);

        assertThat(clean).containsEntry("a", null).containsEntry("b", null).containsEntry("c", null)
                .containsEntry("d", null).containsEntry("e", null).containsEntry("f", 4.5);
        assertThat(clean.keySet()).containsExactly("a", "b", "c", "d", "e", "f");
    }

    @Test
    void rendersTemporalValuesAsIsoStrings() {
        Timestamp ts = Timestamp.valueOf(LocalDateTime.of(2024, 12, 6, 10, 30));

        assertThat(ResultSanitizer.clean(ts)).isEqualTo("2024-12-06T10:30");
        assertThat(ResultSanitizer.clean(java.sql.Date.valueOf("2024-12-06"))).isEqualTo("2024-12-06");
    }

    @Test
    void cleansNestedStructures() {
        Object cleaned = ResultSanitizer.clean(Map.of("series", List.of(1.0, Double.NaN)));

        assertThat(cleaned).isEqualTo(Map.of("series", java.util.Arrays.asList(1.0, null)));
    }

    @Test
    void coercesNumbers() {
        assertThat(ResultSanitizer.toDouble(new BigDecimal("2.50"))).isEqualTo(2.5);
        assertThat(ResultSanitizer.toDouble("12")).isEqualTo(12.0);
        assertThat(ResultSanitizer.toDouble("abc")).isNull();
        assertThat(ResultSanitizer.toDouble("Infinity")).isNull();
        assertThat(ResultSanitizer.toLong(7.9)).isEqualTo(7L);
        assertThat(ResultSanitizer.toLong(Double.NaN)).isNull();
    }
}
