package com.dalatnews.backend.pipeline;

import com.dalatnews.backend.config.NewsSourceConfig;
import com.dalatnews.backend.linking.LinkDictionaryCache;
import com.dalatnews.backend.model.dto.NewsPipelineReport;
import com.dalatnews.backend.scraping.NewsSourceRegistry;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/news")
@RequiredArgsConstructor
public class NewsPipelineController {

    private final NewsPipelineService pipelineService;
    private final NewsSourceRegistry sourceRegistry;
    private final LinkDictionaryCache linkDictionaryCache;

    /**
     * Run the whole pipeline synchronously and return its report
     */
    @PostMapping("/pipeline/run")
    public ResponseEntity<?> runPipeline() {
        log.info("🚀 Manual news pipeline run requested");
        try {
            NewsPipelineReport report = pipelineService.runPipeline();
            return ResponseEntity.ok(report);
        } catch (PipelineAlreadyRunningException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "error", "Pipeline busy",
                    "message", e.getMessage(),
                    "timestamp", System.currentTimeMillis()
            ));
        } catch (Exception e) {
            log.error("❌ News pipeline run failed: {}", e.getMessage());
            return ResponseEntity.internalServerError().body(Map.of(
                    "error", "News pipeline run failed",
                    "message", String.valueOf(e.getMessage()),
                    "timestamp", System.currentTimeMillis()
            ));
        }
    }

    @GetMapping("/sources")
    public ResponseEntity<List<NewsSourceConfig>> getSources() {
        return ResponseEntity.ok(sourceRegistry.getAll());
    }

    @PostMapping("/link-dictionary/invalidate")
    public ResponseEntity<Map<String, Object>> invalidateLinkDictionary() {
        linkDictionaryCache.invalidate();
        return ResponseEntity.ok(Map.of(
                "status", "INVALIDATED",
                "timestamp", System.currentTimeMillis()
        ));
    }
}
