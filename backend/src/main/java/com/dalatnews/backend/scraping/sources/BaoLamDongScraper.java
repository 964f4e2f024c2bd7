package com.dalatnews.backend.scraping.sources;

import com.dalatnews.backend.config.ScrapingConfig;
import com.dalatnews.backend.scraping.BaseNewsScraper;
import com.dalatnews.backend.scraping.NewsSourceRegistry;
import com.dalatnews.backend.scraping.PageFetcher;
import org.springframework.stereotype.Component;

/**
 * Provincial paper. Covers the whole of Lam Dong, so the relevance filter does real work here.
 */
@Component
public class BaoLamDongScraper extends BaseNewsScraper {

    public static final String SOURCE_ID = "baolamdong";

    public BaoLamDongScraper(NewsSourceRegistry registry, PageFetcher pageFetcher, ScrapingConfig scrapingConfig) {
        super(registry.getRequired(SOURCE_ID), pageFetcher, scrapingConfig);
    }

    @Override
    protected String cleanTitle(String title) {
        return stripSuffix(title, "- Báo Lâm Đồng");
    }
}
