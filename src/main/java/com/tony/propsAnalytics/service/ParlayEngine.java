package com.tony.propsAnalytics.service;

import com.tony.propsAnalytics.exception.InsufficientLegsException;
import com.tony.propsAnalytics.exception.InvalidOddsException;
import com.tony.propsAnalytics.exception.InvalidProbabilityException;
import com.tony.propsAnalytics.model.ParlayLeg;
import com.tony.propsAnalytics.model.ParlayResult;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Valorisation d'un parlay : proba combinée (sélections supposées indépendantes),
 * cote juste, retour pour 100 misés, espérance et edge vs marché.
 * Sans état : aucune donnée n'est conservée entre deux appels.
 */
@Service
public class ParlayEngine {

    private static final int MIN_LEGS = 2;
    // Cote plancher quand la proba combinée vaut 100% (cote juste infinie)
    static final int MAX_FAVORITE_ODDS = -100_000;
    // Plafond symétrique côté outsider : une cote juste au-delà ne tient pas dans un int
    static final int MAX_UNDERDOG_ODDS = 100_000;

    public ParlayResult calculate(List<ParlayLeg> legs) {
        return calculate(legs, null);
    }

    /**
     * @param marketAmericanOdds cote du parlay entier proposée par le marché ; prioritaire sur les cotes par sélection
     */
    public ParlayResult calculate(List<ParlayLeg> legs, Integer marketAmericanOdds) {
        if (legs == null || legs.size() < MIN_LEGS) {
            throw new InsufficientLegsException(legs == null ? 0 : legs.size());
        }

        double p = 1.0;
        for (ParlayLeg leg : legs) {
            double prob = leg.getProbability();
            if (Double.isNaN(prob) || prob <= 0.0 || prob > 100.0) {
                throw new InvalidProbabilityException(leg.getLabel(), prob);
            }
            p *= prob / 100.0;
        }
        if (p <= 0.0 || Double.isInfinite(100.0 / p)) {
            // Produit trop petit pour un double : cote et retour non représentables
            throw new InvalidProbabilityException("Probabilité combinée trop faible pour être représentée ("
                    + legs.size() + " sélections)");
        }

        Double marketDecimal = marketDecimal(legs, marketAmericanOdds);

        double payoutPer100;
        double expectedValue;
        double edgePercent;
        Double implied = null;
        Integer marketOdds = null;

        if (marketDecimal != null) {
            payoutPer100 = 100.0 * marketDecimal;
            implied = 1.0 / marketDecimal;
            edgePercent = (p - implied) * 100.0;
            expectedValue = (payoutPer100 - 100.0) * p - 100.0 * (1.0 - p);
            marketOdds = marketAmericanOdds != null ? marketAmericanOdds : decimalToAmerican(marketDecimal);
        } else {
            // Cote juste : espérance nulle par construction
            payoutPer100 = 100.0 / p;
            expectedValue = 0.0;
            edgePercent = 0.0;
        }

        return ParlayResult.builder()
                .legs(legs.size())
                .combinedProbability(round(p * 100.0))
                .americanOdds(fairAmericanOdds(p))
                .decimalPayoutPerUnit(round(payoutPer100))
                .expectedValue(round(expectedValue))
                .edgePercent(round(edgePercent))
                .marketAmericanOdds(marketOdds)
                .impliedProbability(implied != null ? round(implied * 100.0) : null)
                .build();
    }

    /**
     * Cote américaine juste : p >= 0.5 -> -100p/(1-p), sinon 100(1-p)/p. Arrondi à l'entier le plus proche,
     * borné à [-100000, +100000].
     */
    public int fairAmericanOdds(double p) {
        if (p <= 0.0 || p > 1.0) {
            throw new IllegalArgumentException("Probabilité hors ]0, 1] : " + p);
        }
        if (p >= 1.0) return MAX_FAVORITE_ODDS;
        double odds = p >= 0.5 ? -100.0 * p / (1.0 - p) : 100.0 * (1.0 - p) / p;
        return clampOdds(Math.round(odds));
    }

    public double americanToDecimal(int americanOdds) {
        if (americanOdds > -100 && americanOdds < 100) {
            throw new InvalidOddsException("Cote américaine invalide : " + americanOdds + " (attendu <= -100 ou >= 100)");
        }
        return americanOdds > 0 ? (americanOdds / 100.0) + 1.0 : (100.0 / Math.abs(americanOdds)) + 1.0;
    }

    public int decimalToAmerican(double decimal) {
        if (decimal >= 2.0) return clampOdds(Math.round((decimal - 1.0) * 100.0));
        return clampOdds(Math.round(-100.0 / (decimal - 1.0)));
    }

    private int clampOdds(long odds) {
        return (int) Math.max(MAX_FAVORITE_ODDS, Math.min(MAX_UNDERDOG_ODDS, odds));
    }

    private Double marketDecimal(List<ParlayLeg> legs, Integer parlayOdds) {
        if (parlayOdds != null) {
            return americanToDecimal(parlayOdds);
        }
        long priced = legs.stream().map(ParlayLeg::getAmericanOdds).filter(Objects::nonNull).count();
        if (priced == 0) return null;
        if (priced < legs.size()) {
            throw new InvalidOddsException("Cotes de marché fournies pour " + priced + " sélection(s) sur " + legs.size());
        }
        double decimal = 1.0;
        for (ParlayLeg leg : legs) {
            decimal *= americanToDecimal(leg.getAmericanOdds());
        }
        return decimal;
    }

    private double round(double val) { return Math.round(val * 100.0) / 100.0; }
}
