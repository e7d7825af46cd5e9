package com.tony.propsAnalytics.controller;

import com.tony.propsAnalytics.config.EdgeProperties;
import com.tony.propsAnalytics.exception.CacheMissException;
import com.tony.propsAnalytics.exception.InsufficientDataException;
import com.tony.propsAnalytics.model.EdgeResult;
import com.tony.propsAnalytics.model.StatCategory;
import com.tony.propsAnalytics.exception.InvalidOddsException;
import com.tony.propsAnalytics.model.EdgeAnalysis;
import com.tony.propsAnalytics.model.dto.EdgeAnalyticsRequest;
import com.tony.propsAnalytics.model.dto.EdgeScanReport;
import com.tony.propsAnalytics.model.dto.EdgeScanRequest;
import com.tony.propsAnalytics.model.dto.EvaluateRequest;
import com.tony.propsAnalytics.service.EdgeAnalyticsService;
import com.tony.propsAnalytics.service.EdgeEngine;
import com.tony.propsAnalytics.service.EdgeScanService;
import com.tony.propsAnalytics.service.ParlayRecommendationService;
import com.tony.propsAnalytics.service.PlayerStatsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/edges")
@RequiredArgsConstructor
public class EdgeController {

    private final EdgeEngine edgeEngine;
    private final EdgeScanService edgeScanService;
    private final ParlayRecommendationService parlayRecommendationService;
    private final PlayerStatsService playerStatsService;
    private final EdgeAnalyticsService edgeAnalyticsService;
    private final EdgeProperties edgeProperties;

    @PostMapping("/evaluate")
    public ResponseEntity<?> evaluate(@Valid @RequestBody EvaluateRequest request) {
        double threshold = request.getThreshold() != null ? request.getThreshold() : edgeProperties.getThreshold();
        try {
            EdgeResult result = edgeEngine.evaluate(request.getPlayerId(), request.getStatType(),
                    request.getObservations(), request.getLine(), threshold);
            return ResponseEntity.ok(result);
        } catch (InsufficientDataException e) {
            // Pas une erreur côté client : simplement pas de recommandation
            return ResponseEntity.ok(Map.of("status", "NO_EDGE", "message", "Pas d'edge disponible : " + e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/scan")
    public ResponseEntity<?> scan(@Valid @RequestBody EdgeScanRequest request) {
        if (StatCategory.fromCode(request.getStatType()).isEmpty()) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(Map.of("error", "Type de stat inconnu : " + request.getStatType()));
        }
        EdgeScanReport report = edgeScanService.scan(request.getLines(), request.getStatType(), request.getThreshold());
        if (!request.isWithParlays()) {
            return ResponseEntity.ok(report);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("report", report);
        body.put("parlays", parlayRecommendationService.recommend(report.edgeResults()));
        return ResponseEntity.ok(body);
    }

    // Scan + EV à la cote de marché, note de confiance, filtres et tri
    @PostMapping("/analytics")
    public ResponseEntity<?> analytics(@Valid @RequestBody EdgeAnalyticsRequest request) {
        if (StatCategory.fromCode(request.getStatType()).isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Type de stat inconnu : " + request.getStatType()));
        }
        try {
            EdgeScanReport report = edgeScanService.scan(request.getLines(), request.getStatType(), request.getThreshold());
            List<EdgeAnalysis> analyses = edgeAnalyticsService.analyze(report.getEvaluations(), request.getAmericanOdds());
            List<EdgeAnalysis> filtered = edgeAnalyticsService.filter(analyses, request.getFilter());
            return ResponseEntity.ok(edgeAnalyticsService.sort(filtered, request.getSortBy()));
        } catch (InvalidOddsException | IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    // Derniers matchs d'un joueur tels que servis par le cache (stale signalé)
    @GetMapping("/stats/{playerId}/{statType}")
    public ResponseEntity<?> recentStats(@PathVariable String playerId,
                                         @PathVariable String statType,
                                         @RequestParam(required = false) Integer lookback) {
        int games = lookback != null ? lookback : Math.max(edgeProperties.getWindow(), edgeProperties.getStreakLookback());
        try {
            return ResponseEntity.ok(playerStatsService.getRecentValues(playerId, statType, games));
        } catch (CacheMissException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "Données temporairement indisponibles pour " + e.getKey()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
