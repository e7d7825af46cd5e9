package com.tony.propsAnalytics.repository;

import com.tony.propsAnalytics.model.ChaseListEntry;
import com.tony.propsAnalytics.model.LineKey;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
@RequiredArgsConstructor
public class JpaWatchlistStore implements WatchlistStore {

    private final ChaseListRepository chaseListRepository;

    @Override
    @Transactional
    public ChaseListEntry upsert(ChaseListEntry entry) {
        // Même prop déjà suivie : on écrase ligne et raison, on garde la date d'ajout
        return chaseListRepository.findByPlayerIdAndStatType(entry.getPlayerId(), entry.getStatType())
                .map(existing -> {
                    existing.setLineValue(entry.getLineValue());
                    existing.setReason(entry.getReason());
                    existing.setUpdatedAt(entry.getUpdatedAt() != null ? entry.getUpdatedAt() : entry.getAddedAt());
                    return chaseListRepository.save(existing);
                })
                .orElseGet(() -> chaseListRepository.save(entry));
    }

    @Override
    @Transactional
    public boolean remove(LineKey key) {
        return chaseListRepository.deleteByPlayerIdAndStatType(key.playerId(), key.statType()) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChaseListEntry> findAll() {
        return chaseListRepository.findAllByOrderByAddedAtAsc();
    }
}
