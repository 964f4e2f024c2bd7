package com.dalatnews.backend.pipeline;

import com.dalatnews.backend.model.dto.NewsPipelineReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily pipeline trigger, off unless {@code news.pipeline.schedule.enabled} is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "news.pipeline.schedule", name = "enabled", havingValue = "true")
public class NewsPipelineScheduler {

    private final NewsPipelineService pipelineService;

    @Scheduled(cron = "${news.pipeline.schedule.cron}", zone = "UTC")
    public void runScheduledPipeline() {
        log.info("⏰ Scheduled news pipeline run");
        try {
            NewsPipelineReport report = pipelineService.runPipeline();
            log.info("Scheduled run created {} posts with {} errors", report.getPostsCreated(), report.getErrors());
        } catch (PipelineAlreadyRunningException e) {
            log.warn("Scheduled run skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled news pipeline run failed: {}", e.getMessage(), e);
        }
    }
}
