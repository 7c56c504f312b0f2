package org.iceforge.saga.analytics.web;

import java.time.Instant;

public record HealthResponse(String status, String database, Instant timestamp) {}
