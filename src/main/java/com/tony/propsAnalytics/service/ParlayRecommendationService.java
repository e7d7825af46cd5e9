package com.tony.propsAnalytics.service;

import com.tony.propsAnalytics.config.ParlayProperties;
import com.tony.propsAnalytics.model.EdgeResult;
import com.tony.propsAnalytics.model.ParlayLeg;
import com.tony.propsAnalytics.model.ParlayRecommendation;
import com.tony.propsAnalytics.model.ParlayResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Meilleures combinaisons de parlays (2, 3, 4, 6 sélections) à partir des edges détectés.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ParlayRecommendationService {

    private static final double EDGE_SCORE_WEIGHT = 10.0;

    private final ParlayEngine parlayEngine;
    private final ParlayProperties properties;

    public Map<Integer, List<ParlayRecommendation>> recommend(List<EdgeResult> edges) {
        Map<Integer, List<ParlayRecommendation>> recommendations = new LinkedHashMap<>();
        new TreeMap<>(properties.getSizes())
                .forEach((size, max) -> recommendations.put(size, findBest(edges, size, max)));
        return recommendations;
    }

    public List<ParlayRecommendation> findBest(List<EdgeResult> edges, int parlaySize, int maxRecommendations) {
        if (parlaySize < 2 || edges == null || edges.size() < parlaySize) {
            return List.of();
        }

        // Vivier : sélections à haute proba, les plus probables d'abord
        List<ParlayLeg> candidates = edges.stream()
                .filter(e -> e.getProbability() >= properties.getMinLegProbability())
                .sorted(Comparator.comparingDouble(EdgeResult::getProbability).reversed())
                .limit(properties.getMaxCandidates())
                .map(e -> ParlayLeg.fromEdge(e, properties.getDefaultLegOdds()))
                .toList();

        if (candidates.size() < parlaySize) {
            return List.of();
        }

        List<ParlayRecommendation> parlays = new ArrayList<>();
        combine(candidates, parlaySize, 0, new ArrayDeque<>(), parlays);

        parlays.sort(Comparator.comparingDouble(ParlayRecommendation::getScore).reversed());
        log.debug("{} combinaisons de {} sélections évaluées", parlays.size(), parlaySize);
        return parlays.stream().limit(maxRecommendations).toList();
    }

    private void combine(List<ParlayLeg> pool, int size, int start, Deque<ParlayLeg> current, List<ParlayRecommendation> out) {
        if (current.size() == size) {
            List<ParlayLeg> legs = new ArrayList<>(current);
            ParlayResult result = parlayEngine.calculate(legs);
            double score = result.getExpectedValue() + result.getEdgePercent() * EDGE_SCORE_WEIGHT;
            out.add(new ParlayRecommendation(legs, result, Math.round(score * 100.0) / 100.0));
            return;
        }
        for (int i = start; i <= pool.size() - (size - current.size()); i++) {
            current.addLast(pool.get(i));
            combine(pool, size, i + 1, current, out);
            current.removeLast();
        }
    }
}
