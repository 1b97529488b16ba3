package com.mirrorgroups.insights.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Group insights configuration properties (insights.*)
 *
 * Scoring weights and thresholds live in the engines as constants; this class only
 * carries the operational settings that differ between environments.
 *
 * @author MirrorGroups Insights Team
 * @version 1.0.0
 * @since 2026-10-01
 */
@Data
@Validated
@ConfigurationProperties(prefix = "insights")
public class GroupInsightsProperties {

    @Valid
    private Analysis analysis = new Analysis();

    @Valid
    private Queue queue = new Queue();

    @Valid
    private Synthesis synthesis = new Synthesis();

    @Valid
    private Events events = new Events();

    @Valid
    private Crypto crypto = new Crypto();

    @Data
    public static class Analysis {
        /**
         * Minimum confidence for strengths and minimum probability for risks
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double confidenceThreshold = 0.7;

        /**
         * How long a cached analysis is served without recomputation
         */
        private Duration cacheTtl = Duration.ofHours(1);

        private String cacheKeyPrefix = "mirror:group:analysis:";

        /**
         * Expiry stamped on persisted insight records
         */
        private Duration insightRetention = Duration.ofDays(30);

        /**
         * Threads available to the engine fan-out
         */
        @Min(1)
        private int engineThreads = 4;
    }

    @Data
    public static class Queue {
        private boolean enabled = true;

        private Duration pollInterval = Duration.ofSeconds(5);

        @Min(1)
        private int maxConcurrentJobs = 3;

        /**
         * Total attempts per job before it is marked failed
         */
        @Min(1)
        private int maxRetries = 3;

        private Duration retryDelay = Duration.ofSeconds(10);

        private Duration shutdownTimeout = Duration.ofSeconds(30);

        private int defaultPriority = 5;

        @NotBlank
        private String notificationTopic = "group-analysis-jobs";
    }

    @Data
    public static class Synthesis {
        /**
         * When false the template strategy is always used
         */
        private boolean remoteEnabled = false;

        private String endpoint = "http://localhost:8445/v1/completions";

        private String apiKey;

        private Duration timeout = Duration.ofSeconds(90);

        @Min(1)
        private int maxTokens = 2000;

        @DecimalMin("0.0")
        @DecimalMax("2.0")
        private double temperature = 0.7;

        /**
         * Total remote attempts, first call included
         */
        @Min(1)
        private int maxAttempts = 3;

        private Duration initialBackoff = Duration.ofSeconds(1);

        @Min(1)
        private int failureThreshold = 5;

        private Duration resetTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Events {
        @NotBlank
        private String analysisCompletedTopic = "group-analysis-completed";
    }

    @Data
    public static class Crypto {
        /**
         * Secret from which per-member data keys are derived
         */
        private String masterSecret;
    }
}
