package org.iceforge.saga.analytics.web;

import java.util.List;

public record HistoryResponse<T>(boolean success, List<T> history) {

    public static <T> HistoryResponse<T> of(List<T> history) {
        return new HistoryResponse<>(true, history);
    }
}
