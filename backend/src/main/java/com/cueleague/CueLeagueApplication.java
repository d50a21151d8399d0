package com.cueleague;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CueLeagueApplication {
    public static void main(String[] args) {
        SpringApplication.run(CueLeagueApplication.class, args);
    }
}
