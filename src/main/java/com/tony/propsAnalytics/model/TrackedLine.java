package com.tony.propsAnalytics.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Ligne "courante" d'une prop. Une seule ligne par (joueur, stat).
 */
@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "tracked_line", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"player_id", "stat_type"})
})
public class TrackedLine {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player_id", nullable = false)
    private String playerId;

    @Column(name = "stat_type", nullable = false)
    private String statType;

    @Column(name = "line_value", nullable = false)
    private double value;

    @Column(nullable = false)
    private Instant recordedAt;

    public TrackedLine(Line line) {
        this.playerId = line.playerId();
        this.statType = line.statType();
        apply(line);
    }

    public void apply(Line line) {
        this.value = line.value();
        this.recordedAt = line.timestamp();
    }

    public Line toLine() {
        return new Line(playerId, statType, value, recordedAt);
    }
}
