package com.flagship.player_progression.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Counters and timers for progression and economy operations.
 *
 * Metrics exposed:
 * - progression.match_rewards{status}: players rewarded per outcome
 * - progression.match_rewards.duplicates: re-submitted matches that were ignored
 * - progression.level_ups: level increases recorded
 * - progression.prestige: prestige advances
 * - progression.purchases{status}
 * - progression.loot_drops{result}
 * - progression.currency.delta{kind,direction}: summed currency movement
 * - progression.followup.failures{effect}
 * - progression.latency{operation}
 */
@Component
public class ProgressionMetrics {

    private final MeterRegistry registry;

    private final Counter levelUps;
    private final Counter prestiges;
    private final Counter duplicateMatches;

    public ProgressionMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.levelUps = Counter.builder("progression.level_ups")
                .description("Number of level increases recorded")
                .register(registry);

        this.prestiges = Counter.builder("progression.prestige")
                .description("Number of prestige advances")
                .register(registry);

        this.duplicateMatches = Counter.builder("progression.match_rewards.duplicates")
                .description("Match submissions ignored because the match was already rewarded")
                .register(registry);
    }

    public void incrementLevelUps() {
        levelUps.increment();
    }

    public void incrementPrestige() {
        prestiges.increment();
    }

    public void incrementDuplicateMatches() {
        duplicateMatches.increment();
    }

    public void recordMatchReward(String status) {
        registry.counter("progression.match_rewards", "status", sanitizeTag(status)).increment();
    }

    public void recordPurchase(String status) {
        registry.counter("progression.purchases", "status", sanitizeTag(status)).increment();
    }

    public void recordLootDrop(String result) {
        registry.counter("progression.loot_drops", "result", sanitizeTag(result)).increment();
    }

    /**
     * Adds the absolute amount of a balance change, tagged by kind and direction.
     */
    public void recordCurrencyDelta(String kind, long amount) {
        registry.counter("progression.currency.delta",
                "kind", sanitizeTag(kind),
                "direction", amount >= 0 ? "credit" : "debit"
        ).increment(Math.abs((double) amount));
    }

    public void recordFollowUpFailure(String effect) {
        registry.counter("progression.followup.failures", "effect", sanitizeTag(effect)).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("progression.latency", "operation", sanitizeTag(operation))
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Keeps tag values short and free of characters that upset exporters.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
