package com.tony.propsAnalytics.repository;

import com.tony.propsAnalytics.model.Bet;
import com.tony.propsAnalytics.model.BetResult;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;

public interface BetRepository extends JpaRepository<Bet, Long> {
    List<Bet> findAllByOrderByPlacedAtDesc();

    List<Bet> findByResultOrderByPlacedAtAsc(BetResult result);

    List<Bet> findByGameDateOrderByPlacedAtAsc(LocalDate gameDate);

    List<Bet> findByGameDateGreaterThanEqualOrderByPlacedAtDesc(LocalDate from);
}
