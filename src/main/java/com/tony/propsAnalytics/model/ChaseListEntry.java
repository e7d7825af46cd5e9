package com.tony.propsAnalytics.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Prop mise sous surveillance à la main ("chase list"), indépendante du suivi automatique.
 */
@Entity
@Table(name = "chase_list_entry", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"player_id", "stat_type"})
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChaseListEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player_id", nullable = false)
    private String playerId;

    @Column(name = "stat_type", nullable = false)
    private String statType;

    private double lineValue;

    private String reason;

    @Column(nullable = false)
    private Instant addedAt;

    private Instant updatedAt;

    public LineKey key() {
        return LineKey.of(playerId, statType);
    }
}
