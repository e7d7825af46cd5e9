package com.tony.propsAnalytics.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Mouvement de ligne. Historique en ajout seul : pas de setters.
 */
@Entity
@Table(name = "line_change_event", indexes = {
        @Index(name = "idx_line_change_observed_at", columnList = "observed_at"),
        @Index(name = "idx_line_change_key", columnList = "player_id, stat_type")
})
@Getter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LineChangeEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player_id", nullable = false)
    private String playerId;

    @Column(name = "stat_type", nullable = false)
    private String statType;

    private double previousValue;
    private double newValue;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private LineDirection direction;

    private double delta;

    @Column(name = "observed_at", nullable = false)
    private Instant observedAt;

    // Vrai si la ligne a été corrigée à la main (edit), pour l'audit
    private boolean manual;
}
