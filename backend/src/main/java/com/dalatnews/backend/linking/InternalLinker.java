package com.dalatnews.backend.linking;

import com.dalatnews.backend.model.dto.InternalLink;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Rewrites mentions of known events, venues and landmarks in markdown into internal links.
 * Each entity is linked at most once, and text already inside a markdown link is left alone.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InternalLinker {

    private static final int URL_SCAN_WINDOW = 200;
    private static final Pattern OPEN_LINK_URL_BEFORE = Pattern.compile("\\]\\([^)]*$");
    private static final Pattern CLOSE_LINK_URL_AFTER = Pattern.compile("^[^(]*\\)");

    private final LinkDictionaryCache dictionaryCache;

    /**
     * Apply suggested links, then the cached entity dictionary.
     */
    public String applyInternalLinks(String content, List<InternalLink> suggestedLinks) {
        Map<String, InternalLink> dictionary;
        try {
            dictionary = dictionaryCache.get();
        } catch (RuntimeException e) {
            log.error("Link dictionary unavailable, applying suggested links only: {}", e.getMessage());
            dictionary = Map.of();
        }
        return apply(content, suggestedLinks, dictionary);
    }

    public String applyInternalLinks(String content) {
        return applyInternalLinks(content, List.of());
    }

    /**
     * Suggested links first, then dictionary entries in iteration order, each tried by exact
     * name and then without diacritics. An entity whose first mention already sits inside a
     * link counts as linked, so a second pass changes nothing.
     */
    public static String apply(String content, List<InternalLink> suggestedLinks, Map<String, InternalLink> dictionary) {
        if (content == null || content.isEmpty()) {
            return content;
        }
        Set<String> linked = new HashSet<>();
        String result = content;

        if (suggestedLinks != null) {
            for (InternalLink link : suggestedLinks) {
                if (link == null || link.getText() == null || link.getText().isBlank()) continue;
                String key = link.getText().toLowerCase(Locale.ROOT);
                if (linked.contains(key) || !mentions(result, link.getText())) continue;

                result = safeMarkdownReplace(result, link.getText(), link);
                linked.add(key);
            }
        }

        for (Map.Entry<String, InternalLink> entry : dictionary.entrySet()) {
            String name = entry.getKey();
            InternalLink link = entry.getValue();
            if (linked.contains(name)) continue;

            if (mentions(result, link.getText())) {
                result = safeMarkdownReplace(result, link.getText(), link);
                linked.add(name);
                continue;
            }

            String withoutDiacritics = Diacritics.strip(link.getText());
            if (!withoutDiacritics.equals(link.getText()) && mentions(result, withoutDiacritics)) {
                result = safeMarkdownReplace(result, withoutDiacritics, link);
                linked.add(name);
            }
        }
        return result;
    }

    static boolean mentions(String content, String searchText) {
        return pattern(searchText).matcher(content).find();
    }

    /**
     * Replace the first case-insensitive occurrence of {@code searchText} with a link, unless
     * that occurrence sits inside an existing markdown link.
     */
    static String safeMarkdownReplace(String content, String searchText, InternalLink link) {
        Matcher match = pattern(searchText).matcher(content);
        if (!match.find()) {
            return content;
        }
        if (isInsideMarkdownLink(content, match.start(), match.end())) {
            return content;
        }
        return content.substring(0, match.start()) + link.toMarkdown() + content.substring(match.end());
    }

    private static Pattern pattern(String searchText) {
        return Pattern.compile(Pattern.quote(searchText), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    static boolean isInsideMarkdownLink(String content, int matchStart, int matchEnd) {
        // Unmatched '[' before the match on the same line means we are in a link label
        int bracketDepth = 0;
        for (int i = matchStart - 1; i >= 0; i--) {
            char c = content.charAt(i);
            if (c == ']') bracketDepth++;
            if (c == '[') {
                if (bracketDepth == 0) return true;
                bracketDepth--;
            }
            if (c == '\n') break;
        }

        String before = content.substring(Math.max(0, matchStart - URL_SCAN_WINDOW), matchStart);
        String after = content.substring(matchEnd, Math.min(content.length(), matchEnd + URL_SCAN_WINDOW));
        return OPEN_LINK_URL_BEFORE.matcher(before).find() && CLOSE_LINK_URL_AFTER.matcher(after).find();
    }
}
