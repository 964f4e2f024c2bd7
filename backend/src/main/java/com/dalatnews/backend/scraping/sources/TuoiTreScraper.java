package com.dalatnews.backend.scraping.sources;

import com.dalatnews.backend.config.ScrapingConfig;
import com.dalatnews.backend.scraping.BaseNewsScraper;
import com.dalatnews.backend.scraping.NewsSourceRegistry;
import com.dalatnews.backend.scraping.PageFetcher;
import org.springframework.stereotype.Component;

@Component
public class TuoiTreScraper extends BaseNewsScraper {

    public static final String SOURCE_ID = "tuoitre";

    public TuoiTreScraper(NewsSourceRegistry registry, PageFetcher pageFetcher, ScrapingConfig scrapingConfig) {
        super(registry.getRequired(SOURCE_ID), pageFetcher, scrapingConfig);
    }

    // Video and photo-gallery pages share the article URL shape but carry no body text
    @Override
    protected boolean isCandidateUrl(String url) {
        return super.isCandidateUrl(url) && !url.contains("/video/") && !url.contains("/anh/");
    }

    @Override
    protected String cleanTitle(String title) {
        return stripSuffix(title, "- Tuổi Trẻ Online");
    }
}
