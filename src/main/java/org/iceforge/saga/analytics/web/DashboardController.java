package org.iceforge.saga.analytics.web;

import jakarta.validation.Valid;
import org.iceforge.saga.analytics.model.DashboardBundle;
import org.iceforge.saga.analytics.model.FilterState;
import org.iceforge.saga.analytics.service.DashboardService;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Objects;

@RestController
@RequestMapping("/api/data")
public class DashboardController {

    private final DashboardService service;

    public DashboardController(DashboardService service) {
        this.service = Objects.requireNonNull(service);
    }

    /**
     * Dashboard for filters given as query parameters; list filters are comma-separated.
     * The bundle is wrapped in a one-element array, which is what the dashboard client reads.
     */
    @GetMapping
    public Mono<List<DashboardBundle>> get(@Valid @ModelAttribute FilterState filters) {
        return build(filters);
    }

    @PostMapping
    public Mono<List<DashboardBundle>> post(@Valid @RequestBody(required = false) FilterState filters) {
        return build(filters == null ? FilterState.none() : filters);
    }

    private Mono<List<DashboardBundle>> build(FilterState filters) {
        return Mono.fromCallable(() -> List.of(service.build(filters)))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
