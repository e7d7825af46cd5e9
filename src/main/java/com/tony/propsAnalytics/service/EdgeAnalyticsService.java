package com.tony.propsAnalytics.service;

import com.tony.propsAnalytics.config.EdgeProperties;
import com.tony.propsAnalytics.exception.InvalidProbabilityException;
import com.tony.propsAnalytics.model.*;
import com.tony.propsAnalytics.model.dto.AnalyticsFilter;
import com.tony.propsAnalytics.model.dto.EdgeAnalyticsRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Analytics au-dessus des edges : espérance à la cote de marché, Kelly fractionné,
 * note de confiance A+..F, niveau de risque et mise conseillée. Filtres et tris tactiques.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EdgeAnalyticsService {

    private static final double DEFAULT_STAKE = 100.0;
    private static final double MAX_KELLY = 0.25;

    private final ParlayEngine parlayEngine;
    private final EdgeProperties properties;

    public ExpectedValue expectedValue(double probability, int americanOdds) {
        return expectedValue(probability, americanOdds, DEFAULT_STAKE);
    }

    /**
     * @param probability proba de gain en % (0-100)
     * @param americanOdds cote du marché, <= -100 ou >= 100
     */
    public ExpectedValue expectedValue(double probability, int americanOdds, double stake) {
        if (Double.isNaN(probability) || probability < 0.0 || probability > 100.0) {
            throw new InvalidProbabilityException("Probabilité hors [0, 100] : " + probability);
        }
        if (!(stake > 0) || Double.isInfinite(stake)) {
            throw new IllegalArgumentException("La mise doit être positive : " + stake);
        }
        double p = probability / 100.0;
        double decimal = parlayEngine.americanToDecimal(americanOdds);

        double payout = stake * (decimal - 1.0);
        double ev = p * payout - (1.0 - p) * stake;
        double implied = 1.0 / decimal;
        double kelly = (p * decimal - 1.0) / (decimal - 1.0);
        kelly = Math.max(0.0, Math.min(kelly, MAX_KELLY));

        return ExpectedValue.builder()
                .americanOdds(americanOdds)
                .stake(stake)
                .ev(round(ev))
                .evPercentage(round(ev / stake * 100.0))
                .marketEdge(round((p - implied) * 100.0))
                .impliedProbability(round(implied * 100.0))
                .kellyFraction(round(kelly * 100.0))
                .payout(round(payout))
                .positiveEv(ev > 0)
                .build();
    }

    /**
     * Score sur 100 : proba x 0.4, EV (max 25), edge de marché (max 20), série active (max 10).
     * La mise conseillée part du Kelly, pondéré par le risque et le score, puis bornée selon le score.
     */
    public ConfidenceAssessment confidence(double probability, ExpectedValue ev, StreakInfo streak) {
        double probScore = probability * 0.4;
        double evScore = ev.getEv() > 0 ? Math.min(25.0, Math.max(0.0, ev.getEvPercentage() * 2.5)) : 0.0;
        double edgeScore = ev.getMarketEdge() > 0 ? Math.min(20.0, Math.max(0.0, ev.getMarketEdge() * 1.33)) : 0.0;
        boolean activeStreak = streak != null && streak.active();
        double streakScore = activeStreak ? Math.min(10.0, streak.count() * 2.5) : 0.0;

        double score = round1(Math.min(100.0, Math.max(0.0, probScore + evScore + edgeScore + streakScore)));

        double riskFactors = 0.0;
        if (probability < 60) riskFactors += 2;
        else if (probability < 70) riskFactors += 1;
        if (ev.getEv() < 0) riskFactors += 2;
        else if (ev.getEv() < 5) riskFactors += 1;
        if (!activeStreak) riskFactors += 0.5;
        RiskTier tier = RiskTier.of(riskFactors);

        double kelly = ev.getKellyFraction() / 100.0;
        double baseStake = kelly * tier.getStakeMultiplier() * (score / 100.0);
        double stake = Math.max(minStake(score), Math.min(maxStake(score), baseStake));
        double stakePct = round(stake * 100.0);

        return ConfidenceAssessment.builder()
                .score(score)
                .grade(ConfidenceGrade.of(score))
                .riskTier(tier)
                .riskFactors(round1(riskFactors))
                .suggestedStakePct(stakePct)
                .units(round1(stake * 100.0))
                .stakeLabel(stakeLabel(stakePct))
                .probabilityContribution(round1(probScore))
                .evContribution(round1(evScore))
                .edgeContribution(round1(edgeScore))
                .streakContribution(round1(streakScore))
                .build();
    }

    /**
     * Enrichit les évaluations qui ont un résultat d'edge (EDGE ou NO_EDGE) ; les autres statuts sont ignorés.
     */
    public List<EdgeAnalysis> analyze(List<PropEvaluation> evaluations, Integer americanOdds) {
        int odds = americanOdds != null ? americanOdds : properties.getDefaultOdds();
        List<EdgeAnalysis> analyses = evaluations.stream()
                .filter(e -> e.getEdgeResult() != null)
                .map(e -> analyze(e, odds))
                .toList();
        log.info("📊 Analytics : {} prop(s) analysée(s) à {}, {} en EV positive", analyses.size(), odds,
                analyses.stream().filter(a -> a.getExpectedValue().isPositiveEv()).count());
        return analyses;
    }

    public List<EdgeAnalysis> filter(List<EdgeAnalysis> analyses, AnalyticsFilter filter) {
        if (filter == null) return analyses;
        ConfidenceGrade minGrade = filter.getMinGrade() == null ? null
                : ConfidenceGrade.fromLabel(filter.getMinGrade())
                        .orElseThrow(() -> new IllegalArgumentException("Note inconnue : " + filter.getMinGrade()));

        Stream<EdgeAnalysis> stream = analyses.stream();
        if (filter.getMinProbability() != null) {
            stream = stream.filter(a -> a.getProbability() >= filter.getMinProbability());
        }
        if (minGrade != null) {
            stream = stream.filter(a -> a.getConfidence().getGrade().isAtLeast(minGrade));
        }
        if (filter.getMinMarketEdge() != null) {
            stream = stream.filter(a -> a.getExpectedValue().getMarketEdge() >= filter.getMinMarketEdge());
        }
        if (filter.isPositiveEvOnly()) {
            stream = stream.filter(a -> a.getExpectedValue().isPositiveEv());
        }
        if (filter.getMinEv() != null) {
            stream = stream.filter(a -> a.getExpectedValue().getEv() >= filter.getMinEv());
        }
        return stream.toList();
    }

    // Tri décroissant : meilleur en premier
    public List<EdgeAnalysis> sort(List<EdgeAnalysis> analyses, EdgeAnalyticsRequest.SortBy sortBy) {
        Comparator<EdgeAnalysis> comparator = switch (sortBy == null ? EdgeAnalyticsRequest.SortBy.EV : sortBy) {
            case EV -> Comparator.comparingDouble((EdgeAnalysis a) -> a.getExpectedValue().getEv()).reversed();
            case MARKET_EDGE -> Comparator.comparingDouble((EdgeAnalysis a) -> a.getExpectedValue().getMarketEdge()).reversed();
            case PROBABILITY -> Comparator.comparingDouble(EdgeAnalysis::getProbability).reversed();
            case GRADE -> Comparator.comparing((EdgeAnalysis a) -> a.getConfidence().getGrade())
                    .thenComparing(Comparator.comparingDouble((EdgeAnalysis a) -> a.getConfidence().getScore()).reversed());
        };
        return analyses.stream().sorted(comparator).toList();
    }

    private EdgeAnalysis analyze(PropEvaluation evaluation, int odds) {
        EdgeResult edge = evaluation.getEdgeResult();
        ExpectedValue ev = expectedValue(edge.getProbability(), odds);
        return EdgeAnalysis.builder()
                .playerId(evaluation.getPlayerId())
                .statType(evaluation.getStatType())
                .line(edge.getLineValue())
                .pick(edge.getPick())
                .probability(edge.getProbability())
                .gap(edge.getGap())
                .edge(edge.isEdge())
                .streak(evaluation.getStreak())
                .expectedValue(ev)
                .confidence(confidence(edge.getProbability(), ev, evaluation.getStreak()))
                .build();
    }

    private double minStake(double score) {
        if (score >= 90) return 0.03;
        if (score >= 80) return 0.02;
        if (score >= 70) return 0.01;
        return 0.005;
    }

    private double maxStake(double score) {
        if (score >= 90) return 0.05;
        if (score >= 80) return 0.04;
        if (score >= 70) return 0.03;
        if (score >= 60) return 0.02;
        return 0.01;
    }

    private String stakeLabel(double stakePct) {
        if (stakePct >= 4) return "MAX BET";
        if (stakePct >= 3) return "Strong";
        if (stakePct >= 2) return "Standard";
        if (stakePct >= 1) return "Light";
        return "Minimal";
    }

    private double round(double val) { return Math.round(val * 100.0) / 100.0; }

    private double round1(double val) { return Math.round(val * 10.0) / 10.0; }
}
