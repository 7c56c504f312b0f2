package org.iceforge.saga.analytics.web;

import org.iceforge.saga.analytics.model.SubQuestionResult;

import java.time.Instant;
import java.util.List;

public record AnalysisResponse(
        boolean success,
        String summary,
        List<String> questions,
        List<SubQuestionResult> results,
        Instant timestamp
) {}
