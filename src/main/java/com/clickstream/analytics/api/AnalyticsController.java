package com.clickstream.analytics.api;

import com.clickstream.analytics.analytics.AnalyticsModels;
import com.clickstream.analytics.analytics.AnalyticsService;
import com.clickstream.analytics.features.FeatureModels;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/analytics")
public class AnalyticsController {
    private final AnalyticsService analyticsService;

    public AnalyticsController(AnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @PostMapping("/events")
    public ResponseEntity<AnalyticsModels.EventAck> ingest(@RequestBody AnalyticsModels.EventIngestRequest request) {
        return ResponseEntity.ok(analyticsService.ingest(request));
    }

    @PostMapping("/recompute")
    public ResponseEntity<Void> recompute() {
        analyticsService.recompute();
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/funnel")
    public ResponseEntity<List<AnalyticsModels.FunnelRow>> funnel(@RequestParam(required = false) List<String> steps) {
        return ResponseEntity.ok(analyticsService.funnel(steps));
    }

    @GetMapping("/transitions")
    public ResponseEntity<List<AnalyticsModels.TransitionRow>> transitions(@RequestParam(required = false) List<String> steps,
                                                                           @RequestParam(required = false) Boolean requireStepIncrease) {
        return ResponseEntity.ok(analyticsService.transitions(steps, requireStepIncrease));
    }

    @GetMapping("/conversion")
    public ResponseEntity<AnalyticsModels.ConversionTable> conversion(@RequestParam(required = false) List<String> steps) {
        return ResponseEntity.ok(analyticsService.conversion(steps));
    }

    @GetMapping("/kpis")
    public ResponseEntity<List<AnalyticsModels.DailyKpi>> kpis() {
        return ResponseEntity.ok(analyticsService.kpis());
    }

    @GetMapping("/sessions")
    public ResponseEntity<List<FeatureModels.SessionAggregate>> sessions() {
        return ResponseEntity.ok(analyticsService.sessions());
    }
}
