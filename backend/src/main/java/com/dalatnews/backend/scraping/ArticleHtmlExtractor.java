package com.dalatnews.backend.scraping;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based extraction of article fields from raw page HTML.
 * <p>
 * Works on the markup as served: Vietnamese news sites keep titles, dates and og tags
 * in predictable places, so no DOM is built for article pages.
 */
public final class ArticleHtmlExtractor {

    static final int MIN_SELECTOR_CONTENT_LENGTH = 100;

    private static final Pattern SCRIPT = Pattern.compile("<script[\\s\\S]*?</script>", Pattern.CASE_INSENSITIVE);
    private static final Pattern STYLE = Pattern.compile("<style[\\s\\S]*?</style>", Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern H1_TITLE = Pattern.compile(
            "<h1[^>]*class=\"[^\"]*(?:title|headline)[^\"]*\"[^>]*>([\\s\\S]*?)</h1>", Pattern.CASE_INSENSITIVE);
    private static final Pattern H1_ANY = Pattern.compile("<h1[^>]*>([\\s\\S]*?)</h1>", Pattern.CASE_INSENSITIVE);
    private static final Pattern TITLE_TAG = Pattern.compile("<title[^>]*>([\\s\\S]*?)</title>", Pattern.CASE_INSENSITIVE);

    private static final Pattern IMG_TAG = Pattern.compile("<img[^>]+>", Pattern.CASE_INSENSITIVE);
    private static final Pattern IMG_SOURCE_ATTR = Pattern.compile(
            "(?<![\\w-])(?:src|data-src|data-original)=\"([^\"]+)\"", Pattern.CASE_INSENSITIVE);

    private static final Pattern VN_DATE = Pattern.compile(
            "(\\d{1,2})/(\\d{1,2})/(\\d{4})(?:\\s*[-,]?\\s*(\\d{1,2}):(\\d{2}))?");

    private ArticleHtmlExtractor() {
    }

    /**
     * Plain text of an HTML fragment: scripts and styles removed, tags replaced by spaces,
     * common entities decoded and whitespace collapsed.
     */
    public static String stripHtml(String html) {
        if (html == null) return "";
        String text = SCRIPT.matcher(html).replaceAll("");
        text = STYLE.matcher(text).replaceAll("");
        text = TAG.matcher(text).replaceAll(" ");
        text = text.replace("&amp;", "&")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&nbsp;", " ");
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Headline h1, then any h1, then og:title, then the document title.
     */
    public static String extractTitle(String html) {
        if (html == null) return null;

        Matcher m = H1_TITLE.matcher(html);
        if (m.find()) return stripHtml(m.group(1));

        m = H1_ANY.matcher(html);
        if (m.find()) return stripHtml(m.group(1));

        String ogTitle = extractMetaProperty(html, "og:title");
        if (ogTitle != null) return stripHtml(ogTitle);

        m = TITLE_TAG.matcher(html);
        if (m.find()) return stripHtml(m.group(1));

        return null;
    }

    /**
     * Text of the first content container, tried in selector order, that yields more than
     * {@value #MIN_SELECTOR_CONTENT_LENGTH} characters. Falls back to og:description, then "".
     */
    public static String extractContent(String html, List<String> selectors) {
        if (html == null) return "";
        if (selectors != null) {
            for (String selector : selectors) {
                if (selector == null || selector.isBlank()) continue;
                String className = selector.startsWith(".") ? selector.substring(1) : selector;
                String inner = extractElementByClass(html, className);
                if (inner != null) {
                    String content = stripHtml(inner);
                    if (content.length() > MIN_SELECTOR_CONTENT_LENGTH) return content;
                }
            }
        }

        String ogDescription = extractMetaProperty(html, "og:description");
        if (ogDescription != null) return stripHtml(ogDescription);

        return "";
    }

    /**
     * Inner HTML of the first div, article or section carrying {@code className}, bounded by
     * counting nested tags of the same name.
     *
     * @return the inner HTML, or {@code null} when no such element exists or it never closes
     */
    static String extractElementByClass(String html, String className) {
        Pattern openPattern = Pattern.compile(
                "<(div|article|section)[^>]*class=\"[^\"]*\\b" + Pattern.quote(className) + "\\b[^\"]*\"[^>]*>",
                Pattern.CASE_INSENSITIVE);
        Matcher open = openPattern.matcher(html);
        if (!open.find()) return null;

        String tagName = open.group(1).toLowerCase(Locale.ROOT);
        int start = open.end();

        Pattern nested = Pattern.compile("<" + tagName + "[\\s>]|</" + tagName + ">", Pattern.CASE_INSENSITIVE);
        Matcher tags = nested.matcher(html);
        int depth = 1;
        int from = start;
        while (tags.find(from)) {
            if (tags.group().startsWith("</")) {
                depth--;
                if (depth == 0) {
                    return html.substring(start, tags.start());
                }
            } else {
                depth++;
            }
            from = tags.end();
        }
        return null;
    }

    /**
     * og:image followed by every src, data-src and data-original found on img tags, in page
     * order. Data URIs, gifs and URLs containing an excluded pattern are dropped.
     */
    public static List<String> extractImages(String html, List<String> excludedPatterns) {
        if (html == null) return List.of();
        Set<String> images = new LinkedHashSet<>();

        String ogImage = extractMetaProperty(html, "og:image");
        if (ogImage != null) images.add(ogImage);

        Matcher img = IMG_TAG.matcher(html);
        while (img.find()) {
            Matcher attr = IMG_SOURCE_ATTR.matcher(img.group());
            while (attr.find()) {
                String src = attr.group(1);
                if (isUsableImage(src, excludedPatterns)) {
                    images.add(src);
                }
            }
        }
        return List.copyOf(images);
    }

    private static boolean isUsableImage(String src, List<String> excludedPatterns) {
        if (src == null || src.isBlank() || src.startsWith("data:") || src.endsWith(".gif")) {
            return false;
        }
        for (String pattern : excludedPatterns) {
            if (src.contains(pattern)) return false;
        }
        return true;
    }

    /**
     * {@code article:published_time} when present, otherwise the first DD/MM/YYYY date on the
     * page read as Vietnam local time.
     */
    public static String extractPublishedDate(String html) {
        if (html == null) return null;

        String meta = extractMetaProperty(html, "article:published_time");
        if (meta != null) return meta;

        Matcher date = VN_DATE.matcher(html);
        if (!date.find()) return null;

        String time = date.group(4) != null
                ? "T" + pad(date.group(4)) + ":" + date.group(5) + ":00"
                : "T00:00:00";
        return date.group(3) + "-" + pad(date.group(2)) + "-" + pad(date.group(1)) + time + "+07:00";
    }

    /**
     * Content of {@code <meta property="name" content="...">} in either attribute order.
     */
    static String extractMetaProperty(String html, String property) {
        String quoted = Pattern.quote(property);
        Matcher m = Pattern.compile("<meta\\s+property=\"" + quoted + "\"\\s+content=\"([^\"]+)\"",
                Pattern.CASE_INSENSITIVE).matcher(html);
        if (m.find()) return m.group(1);
        m = Pattern.compile("<meta\\s+content=\"([^\"]+)\"\\s+property=\"" + quoted + "\"",
                Pattern.CASE_INSENSITIVE).matcher(html);
        if (m.find()) return m.group(1);
        return null;
    }

    private static String pad(String value) {
        return value.length() == 1 ? "0" + value : value;
    }
}
