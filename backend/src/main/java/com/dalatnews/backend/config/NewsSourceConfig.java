package com.dalatnews.backend.config;

import java.util.List;
import lombok.Data;

/**
 * One entry of the news source registry, bound from {@code news.sources} in application.yml.
 * <p>
 * The extraction hints are optional: without an {@code articleLinkPattern} every same-host
 * {@code .html} link is a candidate, and without {@code contentSelectors} content falls back
 * to the {@code og:description} meta tag.
 */
@Data
public class NewsSourceConfig {
    private String id;
    private String name;
    private String baseUrl;
    private String discoveryUrl;

    // Regex an absolute URL must match to count as an article link
    private String articleLinkPattern;

    // Class names of content containers in priority order (high to low)
    private List<String> contentSelectors = List.of();

    private int maxArticles = 10;

    // Milliseconds to wait before each request to this host
    private long requestDelay = 1000;

    // Mixed-region sites need the Da Lat keyword check
    private boolean relevanceFilter = true;

    /**
     * Get the domain name from the base URL
     */
    public String getDomain() {
        if (baseUrl == null) return null;
        return baseUrl.replaceAll("https?://", "").replaceAll("/.*", "");
    }

    /**
     * Check if a URL belongs to this news source
     */
    public boolean matchesUrl(String url) {
        String domain = getDomain();
        return url != null && domain != null && url.toLowerCase().contains(domain.toLowerCase());
    }
}
