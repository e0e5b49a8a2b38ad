package com.flagship.player_progression.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Source of randomness for loot rolls. Tests replace it with a seeded {@link Random}.
 */
@Configuration
public class LootRandomConfig {

    @Bean
    public Random lootRandom() {
        return new SecureRandom();
    }
}
