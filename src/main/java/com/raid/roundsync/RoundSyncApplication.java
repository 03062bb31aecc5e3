package com.raid.roundsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RoundSyncApplication {
    public static void main(String[] args) {
        SpringApplication.run(RoundSyncApplication.class, args);
    }
}
