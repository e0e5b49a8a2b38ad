package com.flagship.player_progression.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tunables for the progression engine, bound from the {@code progression.*} namespace.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "progression")
public class ProgressionProperties {

    public static final long DEFAULT_BASE_XP_PER_LEVEL = 1000L;

    private Leveling leveling = new Leveling();
    private Loadout loadout = new Loadout();
    private Match match = new Match();

    @Getter
    @Setter
    public static class Leveling {
        /**
         * Experience required per level. Non-positive values fall back to
         * {@link #DEFAULT_BASE_XP_PER_LEVEL}.
         */
        private long baseXpPerLevel = DEFAULT_BASE_XP_PER_LEVEL;
    }

    @Getter
    @Setter
    public static class Loadout {
        /** Name given to the loadout created on a player's first equip. */
        private String defaultName = "Default";
    }

    @Getter
    @Setter
    public static class Match {
        private int maxPlayersPerMatch = 64;
    }
}
