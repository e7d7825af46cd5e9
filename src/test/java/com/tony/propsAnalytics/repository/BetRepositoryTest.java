package com.tony.propsAnalytics.repository;

import com.tony.propsAnalytics.model.Bet;
import com.tony.propsAnalytics.model.BetResult;
import com.tony.propsAnalytics.model.Pick;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class BetRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-01-15T18:00:00Z");

    @Autowired
    private BetRepository betRepository;

    @Test
    @DisplayName("Requêtes par date de match, statut et fenêtre de jours")
    void derivedQueriesShouldFilterBets() {
        betRepository.save(bet("old", LocalDate.of(2024, 1, 1), T0.minusSeconds(86400L * 14), BetResult.LOSS));
        betRepository.save(bet("yesterday", LocalDate.of(2024, 1, 14), T0.minusSeconds(86400), BetResult.WIN));
        betRepository.save(bet("today-late", LocalDate.of(2024, 1, 15), T0.plusSeconds(60), BetResult.PENDING));
        betRepository.save(bet("today-early", LocalDate.of(2024, 1, 15), T0, BetResult.PENDING));

        assertThat(betRepository.findByGameDateOrderByPlacedAtAsc(LocalDate.of(2024, 1, 15)))
                .extracting(Bet::getPlayerId)
                .containsExactly("today-early", "today-late");
        assertThat(betRepository.findByResultOrderByPlacedAtAsc(BetResult.PENDING)).hasSize(2);
        assertThat(betRepository.findByGameDateGreaterThanEqualOrderByPlacedAtDesc(LocalDate.of(2024, 1, 8)))
                .extracting(Bet::getPlayerId)
                .containsExactly("today-late", "today-early", "yesterday");
        assertThat(betRepository.findAllByOrderByPlacedAtDesc()).last()
                .satisfies(b -> assertThat(b.getPlayerId()).isEqualTo("old"));
    }

    private Bet bet(String player, LocalDate gameDate, Instant placedAt, BetResult result) {
        return Bet.builder()
                .playerId(player)
                .statType("PTS")
                .line(25.5)
                .pick(Pick.OVER)
                .oddsPlaced(-110)
                .stake(10.0)
                .placedAt(placedAt)
                .gameDate(gameDate)
                .result(result)
                .build();
    }
}
