package com.dalatnews.backend.scraping;

import com.dalatnews.backend.config.NewsSourceConfig;
import com.dalatnews.backend.config.NewsSourcesProperties;
import jakarta.annotation.PostConstruct;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Read-only lookup over the news sources declared under {@code news.sources}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NewsSourceRegistry {

    private final NewsSourcesProperties properties;
    private final Map<String, NewsSourceConfig> sourceConfigs = new LinkedHashMap<>();

    @PostConstruct
    public void loadConfigurations() {
        for (NewsSourceConfig config : properties.getSources()) {
            if (config.getId() == null || config.getId().isBlank()) {
                log.warn("Skipping news source without id: {}", config.getName());
                continue;
            }
            if (sourceConfigs.putIfAbsent(config.getId(), config) != null) {
                throw new IllegalStateException("Duplicate news source id: " + config.getId());
            }
            log.info("Loaded configuration for news source: {} ({})", config.getId(), config.getName());
        }
        log.info("Successfully loaded {} news source configurations", sourceConfigs.size());
    }

    /**
     * All descriptors in declaration order.
     */
    public List<NewsSourceConfig> getAll() {
        return Collections.unmodifiableList(List.copyOf(sourceConfigs.values()));
    }

    public Optional<NewsSourceConfig> find(String id) {
        return Optional.ofNullable(sourceConfigs.get(id));
    }

    /**
     * Descriptor lookup for scrapers that cannot work without their source entry.
     *
     * @throws IllegalStateException when no source with that id is registered
     */
    public NewsSourceConfig getRequired(String id) {
        return find(id).orElseThrow(() ->
                new IllegalStateException("No configuration found for news source: " + id));
    }
}
