package com.tony.propsAnalytics.repository;

import com.tony.propsAnalytics.model.*;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JpaHistoryStore implements HistoryStore {

    private final TrackedLineRepository trackedLineRepository;
    private final LineChangeEventRepository eventRepository;
    private final AltLineRepository altLineRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Line> findCurrent(LineKey key) {
        return trackedLineRepository.findByPlayerIdAndStatType(key.playerId(), key.statType())
                .map(TrackedLine::toLine);
    }

    @Override
    @Transactional
    public Optional<LineChangeEvent> recordChange(Line line, LineChangeEvent event) {
        Optional<LineChangeEvent> saved = Optional.ofNullable(event).map(eventRepository::save);

        LineKey key = line.key();
        TrackedLine tracked = trackedLineRepository.findByPlayerIdAndStatType(key.playerId(), key.statType())
                .orElseGet(() -> new TrackedLine(line));
        tracked.apply(line);
        trackedLineRepository.saveAndFlush(tracked);
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public List<LineChangeEvent> findChangesSince(Instant since) {
        return eventRepository.findByObservedAtGreaterThanEqualOrderByObservedAtAscIdAsc(since);
    }

    @Override
    @Transactional(readOnly = true)
    public List<LineChangeEvent> findChangesSince(LineKey key, Instant since) {
        return eventRepository.findByPlayerIdAndStatTypeAndObservedAtGreaterThanEqualOrderByObservedAtAscIdAsc(
                key.playerId(), key.statType(), since);
    }

    @Override
    @Transactional
    public AltLineEntry appendAltLine(AltLineEntry entry) {
        return altLineRepository.save(entry);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AltLineEntry> findAltLines(LineKey key) {
        return altLineRepository.findByPlayerIdAndStatTypeOrderByIdAsc(key.playerId(), key.statType());
    }
}
