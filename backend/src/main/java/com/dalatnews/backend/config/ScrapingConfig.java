package com.dalatnews.backend.config;

import java.util.Arrays;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "scraping")
@Data
public class ScrapingConfig {

    private String userAgent = "Mozilla/5.0 (compatible; DalatApp/1.0; +https://dalat.app)";
    private String accept = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    private String acceptLanguage = "vi,en;q=0.5";

    // Hard upper bound for a single page fetch
    private int timeoutMs = 15_000;

    // Articles with less extracted text than this are dropped
    private int minContentLength = 200;

    // Run source scrapers on the scraping executor instead of one after another
    private boolean parallelSourcesEnabled = false;

    // Listing pages that are never articles
    private List<String> excludedUrlPatterns = Arrays.asList(
            "javascript:", "mailto:",
            "/tag/", "/tags/", "/category/", "/chu-de/", "/tim-kiem", "/search",
            "/author/", "/tac-gia/"
    );

    // Tracking pixels and chrome images
    private List<String> excludedImagePatterns = Arrays.asList(
            "pixel", "icon", "logo", "avatar", "1x1"
    );
}
