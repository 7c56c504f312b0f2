package org.iceforge.saga.analytics.web;

import jakarta.validation.Valid;
import org.iceforge.saga.analytics.model.ChatExchange;
import org.iceforge.saga.analytics.model.VisualizationTrace;
import org.iceforge.saga.analytics.service.DecompositionOrchestrator;
import org.iceforge.saga.analytics.service.VisualizationOrchestrator;
import org.iceforge.saga.analytics.service.WarehouseQueryExecutor;
import org.iceforge.saga.analytics.service.memory.ConversationMemoryStore;
import org.iceforge.saga.analytics.service.memory.LogTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.Objects;

@RestController
@RequestMapping("/api")
public class AnalyticsController {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsController.class);

    static final int MAX_HISTORY = 100;

    private final DecompositionOrchestrator decomposition;
    private final VisualizationOrchestrator visualization;
    private final ConversationMemoryStore memory;
    private final WarehouseQueryExecutor executor;

    public AnalyticsController(DecompositionOrchestrator decomposition,
                               VisualizationOrchestrator visualization,
                               ConversationMemoryStore memory,
                               WarehouseQueryExecutor executor) {
        this.decomposition = Objects.requireNonNull(decomposition);
        this.visualization = Objects.requireNonNull(visualization);
        this.memory = Objects.requireNonNull(memory);
        this.executor = Objects.requireNonNull(executor);
    }

    @PostMapping("/text/analyze")
    public Mono<AnalysisResponse> analyze(@Valid @RequestBody QuestionRequest req) {
        return Mono.fromCallable(() -> {
                    var a = decomposition.analyze(req.getUserMessage());
                    return new AnalysisResponse(true, a.summary(), a.questions(), a.results(), Instant.now());
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/graphs/generate")
    public Mono<VisualizationResponse> generateGraphs(@Valid @RequestBody QuestionRequest req) {
        return Mono.fromCallable(() -> {
                    var v = visualization.generate(req.getUserMessage());
                    return new VisualizationResponse(true, v.charts(), v.questionsText(), Instant.now());
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/chat/history")
    public Mono<HistoryResponse<ChatExchange>> chatHistory(@RequestParam(defaultValue = "20") int limit) {
        return Mono.fromCallable(() -> HistoryResponse.of(memory.recent(LogTable.CHAT, clamp(limit))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/graphs/history")
    public Mono<HistoryResponse<VisualizationTrace>> graphHistory(@RequestParam(defaultValue = "20") int limit) {
        return Mono.fromCallable(() -> HistoryResponse.of(memory.recent(LogTable.VISUALIZATIONS, clamp(limit))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/health")
    public Mono<HealthResponse> health() {
        return Mono.fromCallable(() -> {
                    String database;
                    try {
                        executor.ping();
                        database = "connected";
                    } catch (DataAccessException e) {
                        log.warn("Health probe failed: {}", e.getMostSpecificCause().getMessage());
                        database = "unavailable";
                    }
                    return new HealthResponse("healthy", database, Instant.now());
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    static int clamp(int limit) {
        return Math.max(1, Math.min(MAX_HISTORY, limit));
    }
}
