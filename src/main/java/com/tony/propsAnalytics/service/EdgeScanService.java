package com.tony.propsAnalytics.service;

import com.tony.propsAnalytics.cache.CachedResult;
import com.tony.propsAnalytics.config.EdgeProperties;
import com.tony.propsAnalytics.exception.CacheMissException;
import com.tony.propsAnalytics.exception.InsufficientDataException;
import com.tony.propsAnalytics.model.*;
import com.tony.propsAnalytics.model.dto.EdgeScanReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Scan d'un lot de lignes : stats (cache) -> moteur d'edge -> série -> historique des lignes.
 * Un joueur en erreur est classé (NO_DATA / UNAVAILABLE), il n'interrompt jamais le scan.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EdgeScanService {

    private final PlayerStatsService playerStatsService;
    private final EdgeEngine edgeEngine;
    private final StreakCalculator streakCalculator;
    private final LineHistoryTracker lineHistoryTracker;
    private final EdgeProperties properties;
    private final Clock clock;

    public EdgeScanReport scan(Map<String, Double> lines, String statType, Double threshold) {
        double effectiveThreshold = threshold != null ? threshold : properties.getThreshold();
        Instant now = clock.instant();

        log.info("🔎 Scan de {} ligne(s) {} (seuil {})", lines.size(), statType, effectiveThreshold);

        List<PropEvaluation> evaluations = new ArrayList<>();
        lines.forEach((playerId, line) -> evaluations.add(evaluateEntry(playerId, statType, line, effectiveThreshold, now)));

        List<PropEvaluation> edges = evaluations.stream()
                .filter(e -> e.getStatus() == PropEvaluation.Status.EDGE)
                .sorted(Comparator.comparingDouble((PropEvaluation e) -> e.getEdgeResult().getProbability()).reversed())
                .toList();

        // Séries actives hors edges (pas de doublon)
        List<PropEvaluation> streaks = evaluations.stream()
                .filter(e -> e.getStatus() != PropEvaluation.Status.EDGE)
                .filter(e -> e.getStreak() != null && e.getStreak().active())
                .toList();

        long unavailable = evaluations.stream().filter(e -> e.getStatus() == PropEvaluation.Status.UNAVAILABLE).count();
        long invalid = evaluations.stream().filter(e -> e.getStatus() == PropEvaluation.Status.INVALID).count();
        log.info("✅ Scan terminé : {} edge(s), {} série(s), {} indisponible(s), {} invalide(s)",
                edges.size(), streaks.size(), unavailable, invalid);

        return EdgeScanReport.builder()
                .statType(statType)
                .threshold(effectiveThreshold)
                .scannedAt(now)
                .evaluations(evaluations)
                .edges(edges)
                .streaks(streaks)
                .build();
    }

    // Une entrée mal formée est classée INVALID, le reste du lot continue
    private PropEvaluation evaluateEntry(String playerId, String statType, Double line, double threshold, Instant observedAt) {
        if (playerId == null || playerId.isBlank() || line == null || line.isNaN() || line.isInfinite()) {
            log.warn("⚠️ Entrée de scan ignorée : joueur '{}', ligne {}", playerId, line);
            return invalid(playerId, statType, line, "Entrée invalide : joueur et ligne numérique requis");
        }
        try {
            return evaluate(playerId, statType, line, threshold, observedAt);
        } catch (IllegalArgumentException e) {
            log.warn("⚠️ Entrée de scan rejetée pour {} {} : {}", playerId, statType, e.getMessage());
            return invalid(playerId, statType, line, "Entrée invalide : " + e.getMessage());
        }
    }

    private PropEvaluation invalid(String playerId, String statType, Double line, String message) {
        return PropEvaluation.builder()
                .playerId(playerId)
                .statType(statType)
                .line(line)
                .status(PropEvaluation.Status.INVALID)
                .message(message)
                .build();
    }

    public PropEvaluation evaluate(String playerId, String statType, double line, double threshold, Instant observedAt) {
        PropEvaluation.PropEvaluationBuilder result = PropEvaluation.builder()
                .playerId(playerId)
                .statType(statType)
                .line(line);

        // La ligne est historisée même si les stats sont indisponibles
        lineHistoryTracker.recordLine(playerId, statType, line, observedAt).ifPresent(result::lineChange);

        int lookback = Math.max(properties.getWindow(), properties.getStreakLookback());
        CachedResult stats;
        try {
            stats = playerStatsService.getRecentValues(playerId, statType, lookback);
        } catch (CacheMissException e) {
            log.warn("⚠️ Stats indisponibles pour {} {} : {}", playerId, statType, e.getMessage());
            return result.status(PropEvaluation.Status.UNAVAILABLE)
                    .message("Données temporairement indisponibles")
                    .build();
        }
        result.stale(stats.stale());
        result.streak(streakCalculator.calculate(stats.payload(), line, properties.getMinStreak()));

        try {
            EdgeResult edge = edgeEngine.evaluate(playerId, statType, stats.payload(), line, threshold);
            return result.edgeResult(edge)
                    .status(edge.isEdge() ? PropEvaluation.Status.EDGE : PropEvaluation.Status.NO_EDGE)
                    .build();
        } catch (InsufficientDataException e) {
            log.debug("Pas assez de matchs pour {} {} : {}", playerId, statType, e.getMessage());
            return result.status(PropEvaluation.Status.NO_DATA)
                    .message("Pas d'edge disponible : " + e.getMessage())
                    .build();
        }
    }
}
