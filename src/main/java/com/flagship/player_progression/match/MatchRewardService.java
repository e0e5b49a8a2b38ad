package com.flagship.player_progression.match;

import com.flagship.player_progression.config.ProgressionProperties;
import com.flagship.player_progression.event.MatchRewardsAwardedEvent;
import com.flagship.player_progression.ledger.CurrencyLedgerService;
import com.flagship.player_progression.ledger.CurrencyTransaction;
import com.flagship.player_progression.ledger.TransactionKind;
import com.flagship.player_progression.observability.CorrelationContext;
import com.flagship.player_progression.observability.ProgressionMetrics;
import com.flagship.player_progression.outbox.OutboxService;
import com.flagship.player_progression.progression.LevelProgress;
import com.flagship.player_progression.progression.ProgressionService;
import com.flagship.player_progression.progression.ProgressionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Turns match results into experience, currency and lifetime stats.
 *
 * A whole match is rewarded in one transaction, guarded by a receipt row
 * unique on the match id: either every player of the match is paid exactly
 * once or nobody is.
 *
 * Experience formula: 100 + 10 per kill + 50 per wave survived + 1 per scrap.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatchRewardService {

    static final long BASE_EXPERIENCE = 100;
    static final long EXPERIENCE_PER_KILL = 10;
    static final long EXPERIENCE_PER_WAVE = 50;
    static final long EXPERIENCE_PER_SCRAP = 1;

    private final ProgressionStore progressionStore;
    private final ProgressionService progressionService;
    private final CurrencyLedgerService ledgerService;
    private final MatchRewardReceiptRepository receiptRepository;
    private final MatchRewardIdempotencyService idempotencyService;
    private final OutboxService outboxService;
    private final ProgressionMetrics metrics;
    private final ProgressionProperties properties;

    /**
     * Rewards a single player outside any match bookkeeping.
     *
     * @throws InvalidMatchStatsException if any counter is negative
     */
    @Transactional
    public MatchRewardResult awardMatchRewards(Long playerId, long kills, long deaths,
                                               long wavesSurvived, long scrapEarned, long dataEarned) {
        PlayerMatchStats stats = PlayerMatchStats.builder()
                .playerId(playerId)
                .kills(kills)
                .deaths(deaths)
                .wavesSurvived(wavesSurvived)
                .scrapEarned(scrapEarned)
                .dataEarned(dataEarned)
                .build();
        stats.validate();
        return rewardPlayer(null, stats);
    }

    /**
     * Rewards every player of a match at most once.
     *
     * A match that already has a receipt is reported as a duplicate and
     * nothing is applied.
     *
     * @throws InvalidMatchStatsException for an empty or oversized roster,
     *         a repeated player id or negative stats; nothing is applied
     */
    @Transactional
    public MatchAwardOutcome awardMatch(String matchId, String serverId, List<PlayerMatchStats> players) {
        validateMatch(matchId, players);

        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.MATCH_ID_MDC_KEY, matchId);
        if (idempotencyService.isAlreadyAwarded(matchId)) {
            return duplicate(matchId);
        }
        if (receiptRepository.claim(UUID.randomUUID(), matchId, serverId, players.size()) == 0) {
            // Lost the race against a concurrent submission of the same match.
            return duplicate(matchId);
        }

        // Ascending player id, so overlapping matches lock rows in the same order.
        List<PlayerMatchStats> ordered = new ArrayList<>(players);
        ordered.sort(Comparator.comparing(PlayerMatchStats::getPlayerId));

        List<MatchRewardResult> results = new ArrayList<>(ordered.size());
        for (PlayerMatchStats stats : ordered) {
            results.add(rewardPlayer(matchId, stats));
        }
        idempotencyService.rememberAfterCommit(matchId);

        metrics.recordLatency("award-match", System.currentTimeMillis() - startTime);
        log.info("Match rewarded: matchId={}, serverId={}, players={}", matchId, serverId, players.size());
        return MatchAwardOutcome.awarded(matchId, results);
    }

    /**
     * Experience granted for one match line. Overflow is rejected as invalid input.
     */
    public long experienceFor(PlayerMatchStats stats) {
        try {
            long xp = BASE_EXPERIENCE;
            xp = Math.addExact(xp, Math.multiplyExact(EXPERIENCE_PER_KILL, stats.getKills()));
            xp = Math.addExact(xp, Math.multiplyExact(EXPERIENCE_PER_WAVE, stats.getWavesSurvived()));
            return Math.addExact(xp, Math.multiplyExact(EXPERIENCE_PER_SCRAP, stats.getScrapEarned()));
        } catch (ArithmeticException e) {
            throw new InvalidMatchStatsException("Match stats overflow the experience range for player "
                    + stats.getPlayerId());
        }
    }

    private MatchRewardResult rewardPlayer(String matchId, PlayerMatchStats stats) {
        Long playerId = stats.getPlayerId();
        long experience = experienceFor(stats);

        CorrelationContext.enterPlayerScope(playerId, "match-reward");
        try {
            progressionStore.ensureExists(playerId);
            progressionStore.incrementMatchStats(playerId, stats.getKills(), stats.getDeaths(),
                    stats.getWavesSurvived(), stats.getScrapEarned(), stats.getDataEarned());

            LevelProgress progress = progressionService.applyExperience(playerId, experience);

            long balance;
            if (stats.getDataEarned() > 0) {
                balance = ledgerService.applyCurrencyDelta(playerId, stats.getDataEarned(),
                                TransactionKind.MATCH_REWARD, matchId)
                        .map(CurrencyTransaction::getBalanceAfter)
                        .orElseGet(() -> ledgerService.getBalance(playerId));
            } else {
                balance = ledgerService.getBalance(playerId);
            }

            outboxService.saveEvent(MatchRewardsAwardedEvent.of(playerId, matchId, experience,
                    stats.getDataEarned(), progress.getExperience(), progress.getNewLevel()));
            metrics.recordMatchReward("success");

            log.info("Match reward applied: playerId={}, matchId={}, xp=+{} ({}), level {} -> {}, data=+{}",
                    playerId, matchId, experience, progress.getExperience(),
                    progress.getPreviousLevel(), progress.getNewLevel(), stats.getDataEarned());

            return new MatchRewardResult(playerId, experience, stats.getDataEarned(),
                    progress.getExperience(), progress.getPreviousLevel(), progress.getNewLevel(),
                    balance, progress.getUnlockedCosmeticIds());

        } catch (RuntimeException e) {
            metrics.recordMatchReward(e.getClass().getSimpleName());
            throw e;
        }
    }

    /**
     * Checks a match submission without touching storage.
     *
     * @throws InvalidMatchStatsException describing the first problem found
     */
    public void validateMatch(String matchId, List<PlayerMatchStats> players) {
        if (matchId == null || matchId.isBlank()) {
            throw new InvalidMatchStatsException("match_id is required");
        }
        if (matchId.length() > 64) {
            throw new InvalidMatchStatsException("match_id must be at most 64 characters");
        }
        if (players == null || players.isEmpty()) {
            throw new InvalidMatchStatsException("A match needs at least one player");
        }
        int maxPlayers = properties.getMatch().getMaxPlayersPerMatch();
        if (players.size() > maxPlayers) {
            throw new InvalidMatchStatsException("A match has at most " + maxPlayers
                    + " players, got " + players.size());
        }

        Set<Long> seen = new HashSet<>();
        for (PlayerMatchStats stats : players) {
            stats.validate();
            if (!seen.add(stats.getPlayerId())) {
                throw new InvalidMatchStatsException("Player " + stats.getPlayerId()
                        + " appears more than once in match " + matchId);
            }
            experienceFor(stats);
        }
    }

    private MatchAwardOutcome duplicate(String matchId) {
        metrics.incrementDuplicateMatches();
        log.info("Match already rewarded, ignoring: matchId={}", matchId);
        return MatchAwardOutcome.duplicate(matchId);
    }
}
