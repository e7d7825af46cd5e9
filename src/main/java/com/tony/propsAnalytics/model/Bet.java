package com.tony.propsAnalytics.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Pari placé sur une prop, puis réglé avec la stat réelle du match.
 */
@Entity
@Table(name = "bet", indexes = {
        @Index(name = "idx_bet_game_date", columnList = "game_date")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Bet {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player_id", nullable = false)
    private String playerId;

    @Column(name = "stat_type", nullable = false)
    private String statType;

    @Column(name = "line_value")
    private double line;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Pick pick;

    // Cotes américaines : au moment du pari, puis à la fermeture du marché
    private int oddsPlaced;
    private Integer oddsClosing;

    private double stake;

    @Builder.Default
    private String platform = "Unknown";

    // Note de confiance au moment du pari (A+ ... F), facultative
    private String confidenceGrade;
    private Double confidenceScore;

    @Column(nullable = false)
    private Instant placedAt;

    @Column(name = "game_date", nullable = false)
    private LocalDate gameDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "bet_result", nullable = false)
    @Builder.Default
    private BetResult result = BetResult.PENDING;

    // --- Règlement ---
    private Double actualStat;
    private Double payout;
    private Double profit;
    private Instant settledAt;

    public boolean isSettled() {
        return result != BetResult.PENDING;
    }
}
