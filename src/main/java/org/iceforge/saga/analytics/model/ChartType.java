package org.iceforge.saga.analytics.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ChartType {
    LINE, BAR, PIE, AREA, SCATTER, HISTOGRAM;

    /**
     * Case-insensitive lookup; anything unrecognised renders as a bar chart.
     */
    public static ChartType normalize(String requested) {
        if (requested == null) return BAR;
        String t = requested.trim().toUpperCase(Locale.ROOT);
        for (ChartType type : values()) {
            if (type.name().equals(t)) return type;
        }
        return BAR;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
