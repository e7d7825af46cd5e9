package com.tony.propsAnalytics.repository;

import com.tony.propsAnalytics.model.AltLineEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AltLineRepository extends JpaRepository<AltLineEntry, Long> {
    List<AltLineEntry> findByPlayerIdAndStatTypeOrderByIdAsc(String playerId, String statType);
}
