package com.tony.propsAnalytics.repository;

import com.tony.propsAnalytics.model.ChaseListEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ChaseListRepository extends JpaRepository<ChaseListEntry, Long> {
    Optional<ChaseListEntry> findByPlayerIdAndStatType(String playerId, String statType);

    List<ChaseListEntry> findAllByOrderByAddedAtAsc();

    long deleteByPlayerIdAndStatType(String playerId, String statType);
}
