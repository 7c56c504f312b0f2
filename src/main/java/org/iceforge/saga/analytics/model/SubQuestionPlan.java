package org.iceforge.saga.analytics.model;

import java.util.List;

/**
 * Sub-questions extracted from a model response, and whether they came from the requested
 * JSON shape or from the line-based fallback.
 */
public record SubQuestionPlan(List<String> questions, Source source) {

    public enum Source { PARSED, FALLBACK }

    public SubQuestionPlan {
        questions = List.copyOf(questions);
    }

    public SubQuestionPlan limit(int max) {
        return questions.size() <= max ? this : new SubQuestionPlan(questions.subList(0, max), source);
    }
}
