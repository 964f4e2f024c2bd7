package com.dalatnews.backend.linking;

import com.dalatnews.backend.config.NewsPipelineProperties;
import com.dalatnews.backend.model.dto.InternalLink;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import java.util.Collections;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Holds the link dictionary for a bounded time so one pipeline run queries entities once.
 */
@Slf4j
@Component
public class LinkDictionaryCache {

    private static final String KEY = "dictionary";

    private final LoadingCache<String, Map<String, InternalLink>> cache;

    public LinkDictionaryCache(LinkDictionaryService dictionaryService, NewsPipelineProperties pipelineProperties) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(pipelineProperties.getLinking().getDictionaryTtl())
                .build(key -> Collections.unmodifiableMap(dictionaryService.buildLinkDictionary()));
    }

    public Map<String, InternalLink> get() {
        return cache.get(KEY);
    }

    public void invalidate() {
        log.debug("Link dictionary invalidated");
        cache.invalidateAll();
    }
}
