package com.flagship.player_progression;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PlayerProgressionApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlayerProgressionApplication.class, args);
    }
}
