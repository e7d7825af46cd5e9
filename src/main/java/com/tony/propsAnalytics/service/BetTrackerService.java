package com.tony.propsAnalytics.service;

import com.tony.propsAnalytics.exception.InvalidOddsException;
import com.tony.propsAnalytics.model.Bet;
import com.tony.propsAnalytics.model.BetResult;
import com.tony.propsAnalytics.model.Pick;
import com.tony.propsAnalytics.model.dto.BetPerformance;
import com.tony.propsAnalytics.model.dto.BetRequest;
import com.tony.propsAnalytics.repository.BetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Historique des paris : enregistrement, règlement avec la stat réelle et bilan (ROI, CLV).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BetTrackerService {

    private final BetRepository betRepository;
    private final Clock clock;

    @Transactional
    public Bet placeBet(BetRequest request) {
        checkOdds(request.getOddsPlaced());
        if (!(request.getStake() > 0) || Double.isInfinite(request.getStake())) {
            throw new IllegalArgumentException("La mise doit être positive : " + request.getStake());
        }
        if (Double.isNaN(request.getLine()) || Double.isInfinite(request.getLine())) {
            throw new IllegalArgumentException("Ligne invalide : " + request.getLine());
        }

        Bet bet = Bet.builder()
                .playerId(request.getPlayerId().trim())
                .statType(request.getStatType().trim().toUpperCase())
                .line(request.getLine())
                .pick(request.getPick())
                .oddsPlaced(request.getOddsPlaced())
                .stake(request.getStake())
                .platform(request.getPlatform() != null ? request.getPlatform() : "Unknown")
                .confidenceGrade(request.getConfidenceGrade())
                .confidenceScore(request.getConfidenceScore())
                .placedAt(clock.instant())
                .gameDate(LocalDate.now(clock))
                .build();

        Bet saved = betRepository.save(bet);
        log.info("🎟️ Pari #{} : {} {} {} {} à {} ({} misés)", saved.getId(), saved.getPlayerId(), saved.getStatType(),
                saved.getPick(), saved.getLine(), saved.getOddsPlaced(), saved.getStake());
        return saved;
    }

    @Transactional
    public Optional<Bet> updateClosingOdds(Long betId, int closingOdds) {
        checkOdds(closingOdds);
        return betRepository.findById(betId).map(bet -> {
            bet.setOddsClosing(closingOdds);
            return betRepository.save(bet);
        });
    }

    /**
     * Règle un pari : stat > ligne -> OVER gagnant, stat < ligne -> UNDER gagnant, égalité -> PUSH (mise rendue).
     * Un pari déjà réglé peut être re-réglé (correction de stat).
     */
    @Transactional
    public Optional<Bet> settle(Long betId, double actualStat, Integer closingOdds) {
        if (Double.isNaN(actualStat) || Double.isInfinite(actualStat)) {
            throw new IllegalArgumentException("Stat réelle invalide : " + actualStat);
        }
        if (closingOdds != null) {
            checkOdds(closingOdds);
        }
        return betRepository.findById(betId).map(bet -> {
            bet.setActualStat(actualStat);
            bet.setSettledAt(clock.instant());
            if (closingOdds != null) {
                bet.setOddsClosing(closingOdds);
            }

            BetResult result = outcome(bet.getPick(), bet.getLine(), actualStat);
            bet.setResult(result);

            double stake = bet.getStake();
            switch (result) {
                case WIN -> {
                    double payout = round(stake + winnings(stake, bet.getOddsPlaced()));
                    bet.setPayout(payout);
                    bet.setProfit(round(payout - stake));
                }
                case PUSH -> {
                    bet.setPayout(stake);
                    bet.setProfit(0.0);
                }
                default -> {
                    bet.setPayout(0.0);
                    bet.setProfit(-stake);
                }
            }
            log.info("🏁 Pari #{} réglé : {} (stat {} vs ligne {}) -> {}", bet.getId(), result, actualStat,
                    bet.getLine(), bet.getProfit());
            return betRepository.save(bet);
        });
    }

    @Transactional
    public boolean delete(Long betId) {
        if (!betRepository.existsById(betId)) {
            return false;
        }
        betRepository.deleteById(betId);
        return true;
    }

    public List<Bet> findAll() {
        return betRepository.findAllByOrderByPlacedAtDesc();
    }

    public List<Bet> pending() {
        return betRepository.findByResultOrderByPlacedAtAsc(BetResult.PENDING);
    }

    public List<Bet> byDate(LocalDate gameDate) {
        return betRepository.findByGameDateOrderByPlacedAtAsc(gameDate);
    }

    public List<Bet> today() {
        return byDate(LocalDate.now(clock));
    }

    public List<Bet> yesterday() {
        return byDate(LocalDate.now(clock).minusDays(1));
    }

    public List<Bet> recent(int days) {
        if (days < 0) {
            throw new IllegalArgumentException("Nombre de jours négatif : " + days);
        }
        return betRepository.findByGameDateGreaterThanEqualOrderByPlacedAtDesc(LocalDate.now(clock).minusDays(days));
    }

    public BetPerformance calculatePerformance(List<Bet> bets) {
        List<Bet> settled = bets.stream().filter(Bet::isSettled).toList();

        int wins = count(settled, BetResult.WIN);
        int losses = count(settled, BetResult.LOSS);
        int pushes = count(settled, BetResult.PUSH);

        double totalStake = settled.stream().mapToDouble(Bet::getStake).sum();
        double totalProfit = settled.stream().filter(b -> b.getProfit() != null).mapToDouble(Bet::getProfit).sum();
        double roi = totalStake > 0 ? totalProfit / totalStake * 100 : 0.0;
        double winRate = (wins + losses) > 0 ? (double) wins / (wins + losses) * 100 : 0.0;

        double avgPlaced = settled.stream().mapToInt(Bet::getOddsPlaced).average().orElse(0.0);
        List<Bet> withClosing = settled.stream().filter(b -> b.getOddsClosing() != null).toList();
        Integer avgClosing = withClosing.isEmpty() ? null
                : (int) Math.round(withClosing.stream().mapToInt(Bet::getOddsClosing).average().orElse(0.0));

        // CLV : proba implicite de fermeture - proba implicite prise, en points
        double clv = withClosing.stream()
                .mapToDouble(b -> (impliedProbability(b.getOddsClosing()) - impliedProbability(b.getOddsPlaced())) * 100)
                .average()
                .orElse(0.0);

        return BetPerformance.builder()
                .totalBets(bets.size())
                .settledBets(settled.size())
                .pendingBets(bets.size() - settled.size())
                .wins(wins)
                .losses(losses)
                .pushes(pushes)
                .totalStake(round(totalStake))
                .totalProfit(round(totalProfit))
                .roiPct(round(roi))
                .winRate(Math.round(winRate * 10.0) / 10.0)
                .avgOddsPlaced((int) Math.round(avgPlaced))
                .avgOddsClosing(avgClosing)
                .clv(round(clv))
                .build();
    }

    static BetResult outcome(Pick pick, double line, double actualStat) {
        if (actualStat > line) return pick == Pick.OVER ? BetResult.WIN : BetResult.LOSS;
        if (actualStat < line) return pick == Pick.UNDER ? BetResult.WIN : BetResult.LOSS;
        return BetResult.PUSH;
    }

    // Gain net (hors mise) pour une cote américaine
    static double winnings(double stake, int americanOdds) {
        return americanOdds > 0 ? stake * americanOdds / 100.0 : stake * 100.0 / Math.abs(americanOdds);
    }

    static double impliedProbability(int americanOdds) {
        return americanOdds < 0
                ? Math.abs(americanOdds) / (Math.abs(americanOdds) + 100.0)
                : 100.0 / (americanOdds + 100.0);
    }

    private void checkOdds(int americanOdds) {
        if (americanOdds > -100 && americanOdds < 100) {
            throw new InvalidOddsException("Cote américaine invalide : " + americanOdds + " (attendu <= -100 ou >= 100)");
        }
    }

    private int count(List<Bet> bets, BetResult result) {
        return (int) bets.stream().filter(b -> b.getResult() == result).count();
    }

    private double round(double val) { return Math.round(val * 100.0) / 100.0; }
}
