package com.dalatnews.backend.scraping;

import com.dalatnews.backend.model.dto.ScrapedArticle;
import java.util.List;

/**
 * A scraper for one news source.
 */
public interface NewsScraper {

    String getSourceId();

    /**
     * Discover and extract the source's current Da Lat articles.
     */
    List<ScrapedArticle> scrape();
}
