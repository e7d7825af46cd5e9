package com.tony.propsAnalytics.controller;

import com.tony.propsAnalytics.exception.InsufficientLegsException;
import com.tony.propsAnalytics.exception.InvalidOddsException;
import com.tony.propsAnalytics.exception.InvalidProbabilityException;
import com.tony.propsAnalytics.model.EdgeResult;
import com.tony.propsAnalytics.model.ParlayRecommendation;
import com.tony.propsAnalytics.model.dto.ParlayRequest;
import com.tony.propsAnalytics.service.ParlayEngine;
import com.tony.propsAnalytics.service.ParlayRecommendationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/parlays")
@RequiredArgsConstructor
public class ParlayController {

    private final ParlayEngine parlayEngine;
    private final ParlayRecommendationService recommendationService;

    @PostMapping("/calculate")
    public ResponseEntity<?> calculate(@RequestBody ParlayRequest request) {
        try {
            return ResponseEntity.ok(parlayEngine.calculate(request.getLegs(), request.getMarketAmericanOdds()));
        } catch (InsufficientLegsException | InvalidProbabilityException | InvalidOddsException | IllegalArgumentException e) {
            // Erreurs de saisie : jamais corrigées en silence
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/recommendations")
    public ResponseEntity<Map<Integer, List<ParlayRecommendation>>> recommend(@RequestBody List<EdgeResult> edges) {
        return ResponseEntity.ok(recommendationService.recommend(edges));
    }
}
