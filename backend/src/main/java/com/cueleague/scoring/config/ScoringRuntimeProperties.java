package com.cueleague.scoring.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Match scoring runtime settings.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "scoring")
public class ScoringRuntimeProperties {

    private Tiebreaker tiebreaker = new Tiebreaker();
    private ChangeFeed changeFeed = new ChangeFeed();
    private Client client = new Client();
    private Worker worker = new Worker();

    @Getter
    @Setter
    public static class Tiebreaker {
        /**
         * Tiebreaker slots materialised when regulation play deadlocks.
         */
        private int gameCount = 3;

        /**
         * Finalized tiebreaker wins that end the phase.
         */
        private int winsRequired = 2;
    }

    @Getter
    @Setter
    public static class ChangeFeed {
        private String mode = "in_memory";
        private String redisChannel = "cueleague:scoring:changes";
    }

    @Getter
    @Setter
    public static class Client {
        /**
         * Confirm opposing score proposals without prompting.
         */
        private boolean autoConfirm = false;
    }

    @Getter
    @Setter
    public static class Worker {
        private boolean enabled = false;
        private long initialDelayMs = 5_000;
        private long pollIntervalMs = 30_000;
    }
}
