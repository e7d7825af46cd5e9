package com.tony.propsAnalytics.repository;

import com.tony.propsAnalytics.model.TrackedLine;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface TrackedLineRepository extends JpaRepository<TrackedLine, Long> {
    Optional<TrackedLine> findByPlayerIdAndStatType(String playerId, String statType);
}
