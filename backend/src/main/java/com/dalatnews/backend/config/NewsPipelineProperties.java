package com.dalatnews.backend.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning for the ingestion, clustering, synthesis and linking stages of a pipeline run.
 */
@Data
@ConfigurationProperties(prefix = "news.pipeline")
public class NewsPipelineProperties {

    private Clustering clustering = new Clustering();
    private Synthesis synthesis = new Synthesis();
    private Linking linking = new Linking();
    private Ingestion ingestion = new Ingestion();
    private Schedule schedule = new Schedule();

    @Data
    public static class Clustering {
        private String model = "claude-haiku-4-5-20251001";
        private int maxTokens = 256;
        private int contentCharLimit = 1500;
        private int maxAttempts = 3;
        private long baseDelayMs = 1000;
        // Applied after every keyword extraction call, success or not
        private long interCallDelayMs = 200;
        private double similarityThreshold = 0.4;
        private double minRelevance = 0.3;
    }

    @Data
    public static class Synthesis {
        private String model = "claude-sonnet-4-20250514";
        private int maxTokens = 3000;
        private int contentCharLimit = 3000;
        private int maxAttempts = 3;
        private long baseDelayMs = 2000;
    }

    @Data
    public static class Linking {
        private int eventLookbackDays = 90;
        private int entityLimit = 200;
        private Duration dictionaryTtl = Duration.ofMinutes(10);
    }

    @Data
    public static class Ingestion {
        // Raw articles claimed per run
        private int batchSize = 50;
        // Runs a failed article is retried in before it stays in error
        private int maxAttempts = 3;
    }

    @Data
    public static class Schedule {
        private boolean enabled = false;
        // 22:00 UTC is 05:00 in Vietnam
        private String cron = "0 0 22 * * *";
    }
}
