package com.tony.propsAnalytics.service;

import com.tony.propsAnalytics.model.*;
import com.tony.propsAnalytics.repository.HistoryStore;
import com.tony.propsAnalytics.repository.WatchlistStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Suivi des lignes par (joueur, stat) : chaque nouvelle ligne remplace la ligne courante,
 * un mouvement ajoute un {@link LineChangeEvent}. Gère aussi la chase list et les lignes alternatives.
 * Les écritures sont sérialisées par prop pour éviter deux "première ligne" concurrentes.
 * Les verrous sont en nombre fixe (une prop tombe toujours sur le même), la mémoire ne croît pas avec les props.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LineHistoryTracker {

    private final HistoryStore historyStore;
    private final WatchlistStore watchlistStore;
    private final Clock clock;

    private static final int LOCK_STRIPES = 64;

    private final Object[] locks = newLocks();

    /**
     * Enregistre une ligne. Retourne l'événement créé si la ligne a bougé, vide sinon
     * (première ligne de la prop ou valeur inchangée).
     */
    public Optional<LineChangeEvent> recordLine(String playerId, String statType, double value, Instant timestamp) {
        return record(LineKey.of(playerId, statType), value, timestamp, false);
    }

    /**
     * Correction manuelle : même chemin que {@link #recordLine}, l'événement est marqué manuel.
     */
    public Optional<LineChangeEvent> editLine(String playerId, String statType, double newValue) {
        return record(LineKey.of(playerId, statType), newValue, clock.instant(), true);
    }

    public Optional<Line> currentLine(String playerId, String statType) {
        return historyStore.findCurrent(LineKey.of(playerId, statType));
    }

    public List<LineChangeEvent> getChanges(Instant since) {
        return historyStore.findChangesSince(since);
    }

    public List<LineChangeEvent> getChanges(String playerId, String statType, Instant since) {
        return historyStore.findChangesSince(LineKey.of(playerId, statType), since);
    }

    // --- CHASE LIST ---

    public ChaseListEntry addToChaseList(String playerId, String statType, double lineValue, String reason) {
        LineKey key = LineKey.of(playerId, statType);
        Instant now = clock.instant();
        ChaseListEntry entry = ChaseListEntry.builder()
                .playerId(key.playerId())
                .statType(key.statType())
                .lineValue(lineValue)
                .reason(reason != null ? reason : "")
                .addedAt(now)
                .updatedAt(now)
                .build();
        return withLock(key, () -> watchlistStore.upsert(entry));
    }

    public boolean removeFromChaseList(String playerId, String statType) {
        LineKey key = LineKey.of(playerId, statType);
        return withLock(key, () -> watchlistStore.remove(key));
    }

    public List<ChaseListEntry> listChase() {
        return watchlistStore.findAll();
    }

    // --- LIGNES ALTERNATIVES ---

    public AltLineEntry addAltLine(String playerId, String statType, double mainLine, double altLine, String source) {
        LineKey key = LineKey.of(playerId, statType);
        AltLineEntry entry = AltLineEntry.builder()
                .playerId(key.playerId())
                .statType(key.statType())
                .mainLine(mainLine)
                .altLine(altLine)
                .source(source != null ? source : "")
                .delta(round(altLine - mainLine))
                .addedAt(clock.instant())
                .build();
        return historyStore.appendAltLine(entry);
    }

    public List<AltLineEntry> listAltLines(String playerId, String statType) {
        return historyStore.findAltLines(LineKey.of(playerId, statType));
    }

    private Optional<LineChangeEvent> record(LineKey key, double value, Instant timestamp, boolean manual) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Valeur de ligne invalide : " + value);
        }
        Line line = new Line(key.playerId(), key.statType(), value, timestamp != null ? timestamp : clock.instant());

        return withLock(key, () -> {
            Optional<Line> previous = historyStore.findCurrent(key);
            if (previous.isPresent() && previous.get().value() == value) {
                return Optional.empty();
            }

            LineChangeEvent change = previous.map(prev -> LineChangeEvent.builder()
                    .playerId(key.playerId())
                    .statType(key.statType())
                    .previousValue(prev.value())
                    .newValue(value)
                    .direction(LineDirection.between(prev.value(), value))
                    .delta(round(value - prev.value()))
                    .observedAt(line.timestamp())
                    .manual(manual)
                    .build())
                    .orElse(null);

            Optional<LineChangeEvent> event = historyStore.recordChange(line, change);

            event.ifPresent(e -> log.info("📈 Ligne {} {} : {} -> {} ({}{}){}",
                    key.playerId(), key.statType(), e.getPreviousValue(), e.getNewValue(),
                    e.getDelta() > 0 ? "+" : "", e.getDelta(), manual ? " [manuel]" : ""));
            return event;
        });
    }

    private <T> T withLock(LineKey key, Supplier<T> action) {
        Object lock = locks[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
        synchronized (lock) {
            return action.get();
        }
    }

    private static Object[] newLocks() {
        Object[] stripes = new Object[LOCK_STRIPES];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new Object();
        }
        return stripes;
    }

    private double round(double val) { return Math.round(val * 100.0) / 100.0; }
}
