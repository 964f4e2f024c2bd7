package com.dalatnews.backend.model.dto;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Counters of one pipeline run, returned by the admin endpoint and logged at the end of a run.
 */
@Data
public class NewsPipelineReport {
    private int scraped;
    // Scraped URLs already in the ingestion ledger from earlier runs
    private int alreadyIngested;
    // Ledger articles claimed for this run, including retries
    private int queued;
    private List<SourceSummary> sources = new ArrayList<>();
    private int clusters;
    private int skipped;
    private int duplicates;
    private int postsCreated;
    private int published;
    private int experimental;
    private int drafts;
    private int errors;
    private List<String> errorMessages = new ArrayList<>();
    private int aiCalls;
    private String startedAt;
    private String finishedAt;
    private Double durationSeconds;

    public void addError(String message) {
        errors++;
        errorMessages.add(message);
    }

    @Data
    public static class SourceSummary {
        private final String sourceId;
        private final int articles;
        private final boolean success;
        private final String error;
    }
}
