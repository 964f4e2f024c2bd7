package com.dalatnews.backend.scraping;

import com.dalatnews.backend.config.NewsSourceConfig;
import com.dalatnews.backend.config.ScrapingConfig;
import com.dalatnews.backend.model.dto.ScrapedArticle;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Discovery page → article links → sequential polite fetches → extraction → filtering.
 * Subclasses bind a source descriptor and may refine link selection and title cleanup.
 */
@Slf4j
public abstract class BaseNewsScraper implements NewsScraper {

    @Getter
    private final NewsSourceConfig config;
    private final PageFetcher pageFetcher;
    private final ScrapingConfig scrapingConfig;
    private final Pattern articleLinkPattern;

    protected BaseNewsScraper(NewsSourceConfig config, PageFetcher pageFetcher, ScrapingConfig scrapingConfig) {
        this.config = config;
        this.pageFetcher = pageFetcher;
        this.scrapingConfig = scrapingConfig;
        this.articleLinkPattern = config.getArticleLinkPattern() != null && !config.getArticleLinkPattern().isBlank()
                ? Pattern.compile(config.getArticleLinkPattern())
                : null;
    }

    @Override
    public String getSourceId() {
        return config.getId();
    }

    @Override
    public List<ScrapedArticle> scrape() {
        log.info("Scraping {} from {}", config.getName(), config.getDiscoveryUrl());

        String listingHtml = pageFetcher.fetchWithDelay(config.getDiscoveryUrl(), config.getRequestDelay());
        if (listingHtml == null) {
            log.warn("Discovery page unavailable for {}", config.getId());
            return List.of();
        }

        List<String> links = discoverArticleLinks(listingHtml);
        if (links.size() > config.getMaxArticles()) {
            links = links.subList(0, config.getMaxArticles());
        }
        log.info("Discovered {} article links for {}", links.size(), config.getId());

        List<ScrapedArticle> articles = new ArrayList<>();
        for (String url : links) {
            String html = pageFetcher.fetchWithDelay(url, config.getRequestDelay());
            if (html == null) {
                continue;
            }
            ScrapedArticle article = extractArticle(url, html);
            if (article != null) {
                articles.add(article);
            }
        }

        log.info("Completed scraping for {}: {} valid articles from {} links",
                config.getId(), articles.size(), links.size());
        return articles;
    }

    /**
     * Candidate article URLs of a listing page, absolute and fragment-free, in page order.
     */
    public List<String> discoverArticleLinks(String listingHtml) {
        Document doc = Jsoup.parse(listingHtml, config.getDiscoveryUrl());
        Set<String> urls = new LinkedHashSet<>();
        for (Element link : doc.select("a[href]")) {
            String url = link.absUrl("href");
            int fragment = url.indexOf('#');
            if (fragment >= 0) {
                url = url.substring(0, fragment);
            }
            if (!url.isEmpty() && isCandidateUrl(url)) {
                urls.add(url);
            }
        }
        return new ArrayList<>(urls);
    }

    /**
     * Build an article from its page, or {@code null} when the page is not a usable Da Lat
     * story.
     */
    public ScrapedArticle extractArticle(String url, String html) {
        String title = cleanTitle(ArticleHtmlExtractor.extractTitle(html));
        String content = ArticleHtmlExtractor.extractContent(html, config.getContentSelectors());

        if (title == null || title.isBlank() || content.isBlank()) {
            log.debug("Missing title or content at {}", url);
            return null;
        }
        if (content.length() < scrapingConfig.getMinContentLength()) {
            log.debug("Content too short ({} chars) at {}", content.length(), url);
            return null;
        }
        if (config.isRelevanceFilter() && !DalatRelevance.isDalatRelated(title, content)) {
            log.debug("Not Da Lat related: {}", title);
            return null;
        }

        return ScrapedArticle.builder()
                .sourceId(config.getId())
                .sourceUrl(url)
                .sourceName(config.getName())
                .title(title)
                .content(content)
                .imageUrls(List.copyOf(ArticleHtmlExtractor.extractImages(html, scrapingConfig.getExcludedImagePatterns())))
                .publishedAt(ArticleHtmlExtractor.extractPublishedDate(html))
                .build();
    }

    protected boolean isCandidateUrl(String url) {
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            return false;
        }
        if (!config.matchesUrl(url)) {
            return false;
        }
        String lowerUrl = url.toLowerCase(Locale.ROOT);
        for (String pattern : scrapingConfig.getExcludedUrlPatterns()) {
            if (lowerUrl.contains(pattern.toLowerCase(Locale.ROOT))) {
                return false;
            }
        }
        if (articleLinkPattern != null) {
            return articleLinkPattern.matcher(url).matches();
        }
        return lowerUrl.contains(".html");
    }

    /**
     * Hook for removing a site-name suffix from page titles.
     */
    protected String cleanTitle(String title) {
        return title == null ? null : title.trim();
    }

    protected static String stripSuffix(String title, String suffix) {
        if (title == null) return null;
        String trimmed = title.trim();
        if (trimmed.endsWith(suffix)) {
            trimmed = trimmed.substring(0, trimmed.length() - suffix.length()).trim();
        }
        return trimmed;
    }
}
