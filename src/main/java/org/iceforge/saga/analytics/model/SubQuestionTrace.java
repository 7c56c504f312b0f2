package org.iceforge.saga.analytics.model;

import java.time.LocalDateTime;

/**
 * One answered (or failed) sub-question, tagged with the question it was derived from.
 */
public record SubQuestionTrace(
        String overarchingQuestion,
        String subQuestion,
        String sqlResult,
        boolean success,
        LocalDateTime createdAt
) {}
