package org.iceforge.saga.analytics.model;

import java.time.LocalDateTime;

public record VisualizationDigest(String userInput, String subQuestions, LocalDateTime createdAt) {}
