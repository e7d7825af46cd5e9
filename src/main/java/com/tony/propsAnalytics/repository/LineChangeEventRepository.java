package com.tony.propsAnalytics.repository;

import com.tony.propsAnalytics.model.LineChangeEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

public interface LineChangeEventRepository extends JpaRepository<LineChangeEvent, Long> {

    // Du plus ancien au plus récent
    List<LineChangeEvent> findByObservedAtGreaterThanEqualOrderByObservedAtAscIdAsc(Instant since);

    List<LineChangeEvent> findByPlayerIdAndStatTypeAndObservedAtGreaterThanEqualOrderByObservedAtAscIdAsc(
            String playerId, String statType, Instant since);
}
