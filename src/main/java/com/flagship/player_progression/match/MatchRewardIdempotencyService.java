package com.flagship.player_progression.match;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;

/**
 * Remembers which matches have been paid out.
 *
 * Redis is a fast path only. The receipt table is the source of truth, and
 * the receipt insert itself settles races between concurrent submissions.
 */
@Service
@Slf4j
public class MatchRewardIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "match-rewarded:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final MatchRewardReceiptRepository receiptRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public MatchRewardIdempotencyService(MatchRewardReceiptRepository receiptRepository,
                                         Optional<RedisTemplate<String, String>> redisTemplate) {
        this.receiptRepository = receiptRepository;
        this.redisTemplate = redisTemplate;
    }

    public boolean isAlreadyAwarded(String matchId) {
        if (redisTemplate.isPresent()) {
            try {
                if (redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + matchId) != null) {
                    log.debug("Match receipt found in Redis: matchId={}", matchId);
                    return true;
                }
            } catch (RuntimeException e) {
                log.warn("Redis lookup failed for matchId={}, falling back to database: {}",
                        matchId, e.getMessage());
            }
        }

        boolean awarded = receiptRepository.existsByMatchId(matchId);
        if (awarded) {
            cache(matchId);
        }
        return awarded;
    }

    /**
     * Caches the receipt once the surrounding transaction commits, so a
     * rolled-back award is never remembered as paid.
     */
    public void rememberAfterCommit(String matchId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            cache(matchId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                cache(matchId);
            }
        });
    }

    private void cache(String matchId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + matchId, "1", REDIS_TTL);
        } catch (RuntimeException e) {
            log.debug("Failed to cache match receipt in Redis: matchId={}, error={}", matchId, e.getMessage());
        }
    }
}
