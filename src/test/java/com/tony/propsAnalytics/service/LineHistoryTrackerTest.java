package com.tony.propsAnalytics.service;

import com.tony.propsAnalytics.cache.MutableClock;
import com.tony.propsAnalytics.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LineHistoryTrackerTest {

    private static final Instant T0 = Instant.parse("2024-01-15T18:00:00Z");

    private InMemoryHistoryStore historyStore;
    private MutableClock clock;
    private LineHistoryTracker tracker;

    @BeforeEach
    void setUp() {
        historyStore = new InMemoryHistoryStore();
        clock = new MutableClock(T0);
        tracker = new LineHistoryTracker(historyStore, new InMemoryWatchlistStore(), clock);
    }

    @Test
    @DisplayName("Première ligne : enregistrée sans événement")
    void firstLineShouldNotCreateEvent() {
        Optional<LineChangeEvent> event = tracker.recordLine("lebron", "PTS", 25.5, T0);

        assertThat(event).isEmpty();
        assertThat(tracker.currentLine("lebron", "pts")).hasValueSatisfying(line -> assertThat(line.value()).isEqualTo(25.5));
    }

    @Test
    @DisplayName("Ligne inchangée : aucun événement")
    void sameValueShouldNotCreateEvent() {
        tracker.recordLine("lebron", "PTS", 25.5, T0);

        assertThat(tracker.recordLine("lebron", "PTS", 25.5, T0.plusSeconds(60))).isEmpty();
        assertThat(tracker.getChanges(Instant.EPOCH)).isEmpty();
    }

    @Test
    @DisplayName("19.5 -> 21.5 -> 20.5 : une hausse puis une baisse")
    void shouldRecordUpThenDownMoves() {
        tracker.recordLine("tatum", "REB", 19.5, T0);
        tracker.recordLine("tatum", "REB", 21.5, T0.plusSeconds(60));
        tracker.recordLine("tatum", "REB", 20.5, T0.plusSeconds(120));

        List<LineChangeEvent> changes = tracker.getChanges(Instant.EPOCH);

        assertThat(changes).hasSize(2);
        assertThat(changes.get(0).getDirection()).isEqualTo(LineDirection.UP);
        assertThat(changes.get(0).getDelta()).isEqualTo(2.0);
        assertThat(changes.get(1).getDirection()).isEqualTo(LineDirection.DOWN);
        assertThat(changes.get(1).getDelta()).isEqualTo(-1.0);
        assertThat(changes.get(1).getPreviousValue()).isEqualTo(21.5);
        assertThat(tracker.currentLine("tatum", "REB")).hasValueSatisfying(line -> assertThat(line.value()).isEqualTo(20.5));
    }

    @Test
    @DisplayName("Correction manuelle : événement marqué manuel, horodaté maintenant")
    void editLineShouldBeAudited() {
        tracker.recordLine("curry", "3PM", 4.5, T0);
        clock.advance(Duration.ofMinutes(5));

        Optional<LineChangeEvent> event = tracker.editLine("curry", "3PM", 5.5);

        assertThat(event).hasValueSatisfying(e -> {
            assertThat(e.isManual()).isTrue();
            assertThat(e.getObservedAt()).isEqualTo(T0.plus(Duration.ofMinutes(5)));
            assertThat(e.getDelta()).isEqualTo(1.0);
        });
    }

    @Test
    @DisplayName("getChanges filtre par date et par prop")
    void getChangesShouldFilterBySinceAndKey() {
        tracker.recordLine("a", "PTS", 20.5, T0);
        tracker.recordLine("a", "PTS", 21.5, T0.plusSeconds(10));
        tracker.recordLine("b", "PTS", 10.5, T0);
        tracker.recordLine("b", "PTS", 9.5, T0.plusSeconds(100));

        assertThat(tracker.getChanges(T0.plusSeconds(50))).hasSize(1);
        assertThat(tracker.getChanges("a", "PTS", Instant.EPOCH))
                .singleElement()
                .satisfies(e -> assertThat(e.getNewValue()).isEqualTo(21.5));
    }

    @Test
    @DisplayName("Chase list : pas de doublon sur la même prop")
    void chaseListShouldUpsertByKey() {
        tracker.addToChaseList("lebron", "PTS", 25.5, "blessure d'un coéquipier");
        tracker.addToChaseList("lebron", "pts", 27.5, "ligne relevée");

        List<ChaseListEntry> entries = tracker.listChase();

        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).getLineValue()).isEqualTo(27.5);
        assertThat(entries.get(0).getReason()).isEqualTo("ligne relevée");

        assertThat(tracker.removeFromChaseList("lebron", "PTS")).isTrue();
        assertThat(tracker.removeFromChaseList("lebron", "PTS")).isFalse();
        assertThat(tracker.listChase()).isEmpty();
    }

    @Test
    @DisplayName("Lignes alternatives : delta = alt - principale")
    void altLinesShouldKeepDelta() {
        tracker.addAltLine("jokic", "PTS+REB+AST", 45.5, 42.5, "bookA");
        tracker.addAltLine("jokic", "PTS+REB+AST", 45.5, 48.5, "bookB");

        List<AltLineEntry> alts = tracker.listAltLines("jokic", "pts+reb+ast");

        assertThat(alts).extracting(AltLineEntry::getDelta).containsExactly(-3.0, 3.0);
    }

    @Test
    @DisplayName("Ligne invalide refusée")
    void shouldRejectInvalidLine() {
        assertThatThrownBy(() -> tracker.recordLine("lebron", "PTS", Double.NaN, T0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tracker.recordLine(" ", "PTS", 25.5, T0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Échec d'écriture puis nouvel essai : un seul événement")
    void failedWriteThenRetryShouldNotDuplicateEvent() {
        tracker.recordLine("lebron", "PTS", 20.5, T0);
        historyStore.failNextWrite = true;

        assertThatThrownBy(() -> tracker.recordLine("lebron", "PTS", 22.5, T0.plusSeconds(60)))
                .isInstanceOf(IllegalStateException.class);
        assertThat(tracker.currentLine("lebron", "PTS")).hasValueSatisfying(line -> assertThat(line.value()).isEqualTo(20.5));

        Optional<LineChangeEvent> retried = tracker.recordLine("lebron", "PTS", 22.5, T0.plusSeconds(60));

        assertThat(retried).hasValueSatisfying(e -> assertThat(e.getDelta()).isEqualTo(2.0));
        assertThat(tracker.getChanges(Instant.EPOCH)).singleElement()
                .satisfies(e -> assertThat(e.getPreviousValue()).isEqualTo(20.5));
    }

    @Test
    @DisplayName("Beaucoup de props distinctes : chacune garde son propre historique")
    void manyKeysShouldKeepIndependentHistories() {
        for (int i = 0; i < 500; i++) {
            tracker.recordLine("player" + i, "PTS", 10.5, T0);
            tracker.recordLine("player" + i, "PTS", 11.5, T0.plusSeconds(60));
        }

        assertThat(tracker.getChanges(Instant.EPOCH)).hasSize(500)
                .allSatisfy(e -> assertThat(e.getPreviousValue()).isEqualTo(10.5));
        assertThat(tracker.currentLine("player499", "PTS")).hasValueSatisfying(line -> assertThat(line.value()).isEqualTo(11.5));
    }

    @Test
    @DisplayName("Écritures concurrentes sur une prop : historique cohérent")
    void concurrentWritesShouldKeepConsistentHistory() throws Exception {
        int threads = 8;
        int writesPerThread = 50;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            for (int t = 0; t < threads; t++) {
                double base = 20.0 + t;
                executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < writesPerThread; i++) {
                        tracker.recordLine("lebron", "PTS", base + (i % 2) * 0.5, T0);
                    }
                    return null;
                });
            }
            start.countDown();
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            executor.shutdownNow();
        }

        // Chaque événement part de la valeur d'arrivée du précédent
        List<LineChangeEvent> events = historyStore.events;
        for (int i = 1; i < events.size(); i++) {
            assertThat(events.get(i).getPreviousValue()).isEqualTo(events.get(i - 1).getNewValue());
        }
        assertThat(events).allSatisfy(e -> assertThat(e.getNewValue()).isNotEqualTo(e.getPreviousValue()));
        if (!events.isEmpty()) {
            double last = events.get(events.size() - 1).getNewValue();
            assertThat(tracker.currentLine("lebron", "PTS")).hasValueSatisfying(line -> assertThat(line.value()).isEqualTo(last));
        }
    }
}
