package com.dalatnews.backend.scraping;

import com.dalatnews.backend.config.NewsSourceConfig;
import com.dalatnews.backend.config.ScrapingConfig;
import com.dalatnews.backend.model.dto.ScrapedArticle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BaseNewsScraperTest {

    private static final String BASE = "https://news.example.vn";
    private static final String LISTING = BASE + "/da-lat";

    private static final String LISTING_HTML = """
            <html><body>
              <a href="/hoa-da-quy-1.html">Hoa dã quỳ</a>
              <a href="https://news.example.vn/hoa-da-quy-1.html#comments">Bình luận</a>
              <a href="/tag/da-lat-5.html">Tag</a>
              <a href="https://other.vn/tin-khac-9.html">Other site</a>
              <a href="/gia-vang-2.html">Giá vàng</a>
              <a href="/le-hoi-3.html">Lễ hội</a>
              <a href="/gioi-thieu">About</a>
            </body></html>
            """;

    @Mock
    private PageFetcher pageFetcher;

    private TestScraper scraper;

    @BeforeEach
    void setUp() {
        NewsSourceConfig config = new NewsSourceConfig();
        config.setId("test");
        config.setName("Test News");
        config.setBaseUrl(BASE);
        config.setDiscoveryUrl(LISTING);
        config.setArticleLinkPattern("https://news\\.example\\.vn/[a-z0-9-]+-\\d+\\.html");
        config.setContentSelectors(List.of("article-body"));
        config.setMaxArticles(2);
        config.setRequestDelay(0);

        scraper = new TestScraper(config, pageFetcher, new ScrapingConfig());
    }

    @Test
    @DisplayName("Link discovery keeps same-host article links in page order without fragments or tag pages")
    void discoverArticleLinks() {
        List<String> links = scraper.discoverArticleLinks(LISTING_HTML);

        assertThat(links).containsExactly(
                BASE + "/hoa-da-quy-1.html",
                BASE + "/gia-vang-2.html",
                BASE + "/le-hoi-3.html");
    }

    @Test
    @DisplayName("Scrape caps links, fetches sequentially and drops articles not about Da Lat")
    void scrapeFiltersIrrelevantArticles() {
        // given
        when(pageFetcher.fetchWithDelay(eq(LISTING), anyLong())).thenReturn(LISTING_HTML);
        when(pageFetcher.fetchWithDelay(eq(BASE + "/hoa-da-quy-1.html"), anyLong()))
                .thenReturn(articleHtml("Hoa dã quỳ nở rộ - Test News",
                        "Hoa dã quỳ nở vàng khắp các con đường ở Đà Lạt. "));
        when(pageFetcher.fetchWithDelay(eq(BASE + "/gia-vang-2.html"), anyLong()))
                .thenReturn(articleHtml("Giá vàng tăng", "Giá vàng trong nước tăng mạnh phiên sáng nay tại Hà Nội. "));

        // when
        List<ScrapedArticle> articles = scraper.scrape();

        // then
        assertThat(articles).hasSize(1);
        ScrapedArticle article = articles.get(0);
        assertThat(article.getSourceId()).isEqualTo("test");
        assertThat(article.getSourceName()).isEqualTo("Test News");
        assertThat(article.getSourceUrl()).isEqualTo(BASE + "/hoa-da-quy-1.html");
        assertThat(article.getTitle()).isEqualTo("Hoa dã quỳ nở rộ");
        assertThat(article.getImageUrls()).containsExactly("https://cdn.example.vn/p1.jpg");
        assertThatThrownBy(() -> article.getImageUrls().add("https://cdn.example.vn/other.jpg"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(article.getPublishedAt()).isEqualTo("2025-11-03T07:30:00+07:00");
        verify(pageFetcher, never()).fetchWithDelay(eq(BASE + "/le-hoi-3.html"), anyLong());
    }

    @Test
    @DisplayName("Content shorter than the minimum is dropped")
    void shortContentIsDropped() {
        String html = "<h1>Đà Lạt</h1><div class=\"article-body\">"
                + "Một đoạn tin ngắn về Đà Lạt, chỉ vừa đủ dài để vượt qua ngưỡng trích xuất một trăm ký tự."
                + "</div>";

        assertThat(scraper.extractArticle(BASE + "/x-1.html", html)).isNull();
    }

    @Test
    @DisplayName("Unavailable discovery page yields no articles")
    void discoveryFailure() {
        when(pageFetcher.fetchWithDelay(eq(LISTING), anyLong())).thenReturn(null);

        assertThat(scraper.scrape()).isEmpty();
        verify(pageFetcher, never()).fetchWithDelay(eq(BASE + "/hoa-da-quy-1.html"), anyLong());
    }

    @Test
    @DisplayName("A failed article fetch skips only that article")
    void failedArticleFetchIsSkipped() {
        when(pageFetcher.fetchWithDelay(anyString(), anyLong())).thenAnswer(invocation -> {
            String url = invocation.getArgument(0);
            if (url.equals(LISTING)) return LISTING_HTML;
            if (url.endsWith("-1.html")) return null;
            return articleHtml("Đà Lạt đón mưa lớn", "Mưa lớn kéo dài nhiều giờ khiến nhiều tuyến đường ở Đà Lạt ngập nước. ");
        });

        List<ScrapedArticle> articles = scraper.scrape();

        assertThat(articles).extracting(ScrapedArticle::getSourceUrl).containsExactly(BASE + "/gia-vang-2.html");
    }

    private static String articleHtml(String title, String sentence) {
        return "<html><head><title>" + title + "</title></head><body>"
                + "<h1 class=\"title-detail\">" + title + "</h1>"
                + "<span class=\"date\">3/11/2025 07:30</span>"
                + "<div class=\"article-body\"><p>" + sentence.repeat(6) + "</p></div>"
                + "<img src=\"https://cdn.example.vn/p1.jpg\">"
                + "</body></html>";
    }

    private static class TestScraper extends BaseNewsScraper {

        TestScraper(NewsSourceConfig config, PageFetcher pageFetcher, ScrapingConfig scrapingConfig) {
            super(config, pageFetcher, scrapingConfig);
        }

        @Override
        protected String cleanTitle(String title) {
            return stripSuffix(title, "- Test News");
        }
    }
}
