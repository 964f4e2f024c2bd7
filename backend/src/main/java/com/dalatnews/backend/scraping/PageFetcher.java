package com.dalatnews.backend.scraping;

import com.dalatnews.backend.config.ScrapingConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Service;

/**
 * Polite HTTP GET for news pages. Every failure is logged and reported as {@code null}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PageFetcher {

    private final ScrapingConfig scrapingConfig;

    /**
     * Wait {@code delayMs}, then fetch {@code url}.
     *
     * @return the response body, or {@code null} on non-2xx status, timeout, network error
     *         or interruption
     */
    public String fetchWithDelay(String url, long delayMs) {
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted before fetching {}", url);
                return null;
            }
        }

        try {
            Connection.Response response = Jsoup.connect(url)
                    .userAgent(scrapingConfig.getUserAgent())
                    .header("Accept", scrapingConfig.getAccept())
                    .header("Accept-Language", scrapingConfig.getAcceptLanguage())
                    .timeout(scrapingConfig.getTimeoutMs())
                    .ignoreHttpErrors(true)
                    .ignoreContentType(true)
                    .followRedirects(true)
                    .method(Connection.Method.GET)
                    .execute();

            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                log.warn("HTTP {} fetching {}", status, url);
                return null;
            }
            return response.body();
        } catch (SocketTimeoutException e) {
            log.warn("Timeout after {}ms fetching {}", scrapingConfig.getTimeoutMs(), url);
            return null;
        } catch (IOException | UncheckedIOException e) {
            log.error("Network error fetching {}: {}", url, e.getMessage());
            return null;
        } catch (IllegalArgumentException e) {
            log.error("Invalid URL {}: {}", url, e.getMessage());
            return null;
        }
    }
}
