package org.iceforge.saga.analytics.model;

import org.iceforge.saga.analytics.service.AnalyticsValidationException;

public enum TimeWindow {
    ALL("all", null),
    ONE_MONTH("1m", "1 month"),
    THREE_MONTHS("3m", "3 months"),
    SIX_MONTHS("6m", "6 months"),
    ONE_YEAR("1y", "1 year");

    private final String code;
    private final String interval; // PostgreSQL interval literal body

    TimeWindow(String code, String interval) {
        this.code = code;
        this.interval = interval;
    }

    public String code() {
        return code;
    }

    public String interval() {
        return interval;
    }

    /**
     * Null or blank means {@link #ALL}.
     */
    public static TimeWindow fromCode(String code) {
        if (code == null || code.isBlank()) return ALL;
        String c = code.trim().toLowerCase();
        for (TimeWindow w : values()) {
            if (w.code.equals(c)) return w;
        }
        throw new AnalyticsValidationException("Unknown time filter: " + code);
    }
}
