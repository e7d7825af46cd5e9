package com.tony.propsAnalytics.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Ligne alternative relevée chez une autre source. Plusieurs entrées par prop sont normales.
 */
@Entity
@Table(name = "alt_line_entry", indexes = {
        @Index(name = "idx_alt_line_key", columnList = "player_id, stat_type")
})
@Getter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AltLineEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player_id", nullable = false)
    private String playerId;

    @Column(name = "stat_type", nullable = false)
    private String statType;

    private double mainLine;
    private double altLine;
    private String source;

    // altLine - mainLine
    private double delta;

    private Instant addedAt;
}
