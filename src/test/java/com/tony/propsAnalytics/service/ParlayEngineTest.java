package com.tony.propsAnalytics.service;

import com.tony.propsAnalytics.exception.InsufficientLegsException;
import com.tony.propsAnalytics.exception.InvalidOddsException;
import com.tony.propsAnalytics.exception.InvalidProbabilityException;
import com.tony.propsAnalytics.model.ParlayLeg;
import com.tony.propsAnalytics.model.ParlayResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ParlayEngineTest {

    private final ParlayEngine parlayEngine = new ParlayEngine();

    @Test
    @DisplayName("Deux sélections à 50% : 25% combiné, cote juste +300")
    void twoCoinFlipsShouldPayPlus300() {
        ParlayResult result = parlayEngine.calculate(List.of(leg("A", 50.0), leg("B", 50.0)));

        assertThat(result.getLegs()).isEqualTo(2);
        assertThat(result.getCombinedProbability()).isEqualTo(25.0);
        assertThat(result.getAmericanOdds()).isEqualTo(300);
        assertThat(result.getDecimalPayoutPerUnit()).isEqualTo(400.0);
        assertThat(result.getExpectedValue()).isZero();
        assertThat(result.getEdgePercent()).isZero();
        assertThat(result.getMarketAmericanOdds()).isNull();
    }

    @Test
    @DisplayName("Proba combinée au-dessus de 50% : cote négative")
    void favoriteParlayShouldHaveNegativeOdds() {
        // 0.70 x 0.72 = 0.504
        ParlayResult result = parlayEngine.calculate(List.of(leg("A", 70.0), leg("B", 72.0)));

        assertThat(result.getCombinedProbability()).isEqualTo(50.4);
        assertThat(result.getAmericanOdds()).isEqualTo(-102);
    }

    @Test
    @DisplayName("70% x 80% x 90% : 50.4% combiné, cote -102")
    void threeLegsShouldCombineTo504() {
        ParlayResult result = parlayEngine.calculate(List.of(leg("A", 70.0), leg("B", 80.0), leg("C", 90.0)));

        assertThat(result.getLegs()).isEqualTo(3);
        assertThat(result.getCombinedProbability()).isEqualTo(50.4);
        assertThat(result.getAmericanOdds()).isEqualTo(-102);
    }

    @Test
    @DisplayName("Sélections très improbables : cote plafonnée à +100000, pas de débordement")
    void tinyProbabilitiesShouldCapUnderdogOdds() {
        ParlayResult result = parlayEngine.calculate(List.of(leg("A", 0.01), leg("B", 0.01)));

        assertThat(result.getAmericanOdds()).isEqualTo(ParlayEngine.MAX_UNDERDOG_ODDS);
        assertThat(result.getCombinedProbability()).isEqualTo(0.0);
        assertThat(result.getDecimalPayoutPerUnit()).isGreaterThan(1e9);
        assertThat(parlayEngine.fairAmericanOdds(1e-12)).isEqualTo(100_000);
        assertThat(parlayEngine.decimalToAmerican(1e9)).isEqualTo(100_000);
    }

    @Test
    @DisplayName("Produit qui s'annule en double : refusé en entrée invalide")
    void underflowingProductShouldBeRejected() {
        List<ParlayLeg> legs = IntStream.range(0, 60)
                .mapToObj(i -> leg("L" + i, 0.0001))
                .toList();

        assertThatThrownBy(() -> parlayEngine.calculate(legs))
                .isInstanceOf(InvalidProbabilityException.class)
                .hasMessageContaining("60");
    }

    @Test
    @DisplayName("Cotes justes aux bornes : 50% -> -100, 100% -> plancher")
    void fairOddsAtBoundaries() {
        assertThat(parlayEngine.fairAmericanOdds(0.5)).isEqualTo(-100);
        assertThat(parlayEngine.fairAmericanOdds(1.0)).isEqualTo(ParlayEngine.MAX_FAVORITE_ODDS);
        assertThat(parlayEngine.calculate(List.of(leg("A", 100.0), leg("B", 100.0))).getAmericanOdds())
                .isEqualTo(ParlayEngine.MAX_FAVORITE_ODDS);
    }

    @Test
    @DisplayName("Moins de 2 sélections : refusé")
    void shouldRejectSingleLeg() {
        assertThatThrownBy(() -> parlayEngine.calculate(List.of(leg("A", 60.0))))
                .isInstanceOf(InsufficientLegsException.class);
        assertThatThrownBy(() -> parlayEngine.calculate(null))
                .isInstanceOf(InsufficientLegsException.class);
    }

    @Test
    @DisplayName("Probabilité hors ]0, 100] : refusée, jamais corrigée")
    void shouldRejectInvalidProbabilities() {
        assertThatThrownBy(() -> parlayEngine.calculate(List.of(leg("A", 0.0), leg("B", 60.0))))
                .isInstanceOf(InvalidProbabilityException.class)
                .hasMessageContaining("A");
        assertThatThrownBy(() -> parlayEngine.calculate(List.of(leg("A", 60.0), leg("B", 101.0))))
                .isInstanceOf(InvalidProbabilityException.class);
        assertThatThrownBy(() -> parlayEngine.calculate(List.of(leg("A", 60.0), leg("B", -5.0))))
                .isInstanceOf(InvalidProbabilityException.class);
    }

    @Test
    @DisplayName("Cote de marché du parlay : EV et edge vs proba implicite")
    void shouldPriceAgainstParlayMarketOdds() {
        // p = 0.36, +264 -> décimal 3.64
        ParlayResult result = parlayEngine.calculate(List.of(leg("A", 60.0), leg("B", 60.0)), 264);

        assertThat(result.getDecimalPayoutPerUnit()).isEqualTo(364.0);
        assertThat(result.getImpliedProbability()).isEqualTo(27.47);
        assertThat(result.getEdgePercent()).isEqualTo(8.53);
        assertThat(result.getExpectedValue()).isEqualTo(31.04);
        assertThat(result.getMarketAmericanOdds()).isEqualTo(264);
    }

    @Test
    @DisplayName("Cotes par sélection : produit des cotes décimales")
    void shouldCombinePerLegMarketOdds() {
        ParlayLeg a = ParlayLeg.builder().label("A").probability(60.0).americanOdds(-110).build();
        ParlayLeg b = ParlayLeg.builder().label("B").probability(60.0).americanOdds(-110).build();

        ParlayResult result = parlayEngine.calculate(List.of(a, b));

        // 1.9091^2 = 3.6446
        assertThat(result.getDecimalPayoutPerUnit()).isCloseTo(364.46, within(0.01));
        assertThat(result.getMarketAmericanOdds()).isEqualTo(264);
        assertThat(result.getEdgePercent()).isGreaterThan(0.0);
    }

    @Test
    @DisplayName("Cotes invalides ou partielles : refusées")
    void shouldRejectInvalidOrPartialOdds() {
        ParlayLeg priced = ParlayLeg.builder().label("A").probability(60.0).americanOdds(-110).build();

        assertThatThrownBy(() -> parlayEngine.calculate(List.of(priced, leg("B", 60.0))))
                .isInstanceOf(InvalidOddsException.class);
        assertThatThrownBy(() -> parlayEngine.calculate(List.of(leg("A", 60.0), leg("B", 60.0)), 50))
                .isInstanceOf(InvalidOddsException.class);
    }

    @Test
    @DisplayName("Conversions de cotes américaines / décimales")
    void shouldConvertOdds() {
        assertThat(parlayEngine.americanToDecimal(150)).isEqualTo(2.5);
        assertThat(parlayEngine.americanToDecimal(-200)).isEqualTo(1.5);
        assertThat(parlayEngine.americanToDecimal(-110)).isCloseTo(1.9091, within(0.0001));
        assertThat(parlayEngine.decimalToAmerican(2.5)).isEqualTo(150);
        assertThat(parlayEngine.decimalToAmerican(1.5)).isEqualTo(-200);
    }

    private ParlayLeg leg(String label, double probability) {
        return ParlayLeg.builder().label(label).probability(probability).build();
    }
}
