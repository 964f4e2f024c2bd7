package com.dalatnews.backend.quality;

import com.dalatnews.backend.model.dto.NewsContentOutput;
import com.dalatnews.backend.model.dto.QualityFactors;
import com.dalatnews.backend.model.dto.QualityScore;
import com.dalatnews.backend.model.enums.PublishStatus;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Weighted publication-worthiness score of a synthesized article. Pure and deterministic.
 */
@Component
public class QualityScorer {

    public static final double PUBLISH_THRESHOLD = 0.75;
    public static final double EXPERIMENTAL_THRESHOLD = 0.50;

    static final double WEIGHT_SOURCE_COUNT = 0.15;
    static final double WEIGHT_DALAT_RELEVANCE = 0.20;
    static final double WEIGHT_NEWSWORTHINESS = 0.15;
    static final double WEIGHT_CONTENT_LENGTH = 0.10;
    static final double WEIGHT_HAS_DATES = 0.10;
    static final double WEIGHT_NAMED_SOURCES = 0.10;
    static final double WEIGHT_HAS_IMAGES = 0.10;
    static final double WEIGHT_ORIGINALITY = 0.10;

    private static final Pattern ATTRIBUTION =
            Pattern.compile("according to|said|told|reported", Pattern.CASE_INSENSITIVE);
    private static final Pattern HEADING = Pattern.compile("^#{1,6}\\s", Pattern.MULTILINE);
    private static final Pattern BOLD = Pattern.compile("\\*\\*[^*]+\\*\\*");
    private static final Pattern LOCAL_CONTEXT =
            Pattern.compile("\\b(?:locals|community|residents|visitors|tourists)\\b", Pattern.CASE_INSENSITIVE);

    /**
     * Score using the relevance the content processor recorded in the quality factors.
     */
    public QualityScore score(NewsContentOutput content, double newsworthiness) {
        QualityFactors factors = content.getQualityFactors();
        return score(content, newsworthiness, factors == null ? 0.0 : factors.getDalatRelevance());
    }

    /**
     * Score with an externally measured Da Lat relevance, typically the cluster's mean.
     */
    public QualityScore score(NewsContentOutput content, double newsworthiness, double dalatRelevance) {
        QualityFactors factors = content.getQualityFactors() != null
                ? content.getQualityFactors()
                : QualityFactors.builder().build();
        String story = content.getStoryContent() == null ? "" : content.getStoryContent();

        Map<String, Double> breakdown = new LinkedHashMap<>();
        breakdown.put("sourceCount", WEIGHT_SOURCE_COUNT * Math.min(factors.getSourceCount() / 3.0, 1.0));
        breakdown.put("dalatRelevance", WEIGHT_DALAT_RELEVANCE * clamp(dalatRelevance));
        breakdown.put("newsworthiness", WEIGHT_NEWSWORTHINESS * clamp(newsworthiness));
        breakdown.put("contentLength", WEIGHT_CONTENT_LENGTH * Math.min(factors.getContentLength() / 400.0, 1.0));
        breakdown.put("hasDates", factors.isHasDates() ? WEIGHT_HAS_DATES : 0.0);
        breakdown.put("hasNamedSources", factors.isHasNamedSources() ? WEIGHT_NAMED_SOURCES : 0.0);
        breakdown.put("hasImages", factors.isHasImages() ? WEIGHT_HAS_IMAGES : 0.0);
        breakdown.put("originality", WEIGHT_ORIGINALITY * originality(story, factors.getSourceCount()));

        double total = 0.0;
        for (double contribution : breakdown.values()) {
            total += contribution;
        }
        total = round4(Math.min(Math.max(total, 0.0), 1.0));

        return new QualityScore(total, Collections.unmodifiableMap(breakdown), decideStatus(total));
    }

    public static PublishStatus decideStatus(double total) {
        if (total >= PUBLISH_THRESHOLD) return PublishStatus.PUBLISHED;
        if (total >= EXPERIMENTAL_THRESHOLD) return PublishStatus.EXPERIMENTAL;
        return PublishStatus.DRAFT;
    }

    /**
     * Heuristic estimate in [0, 1]: multi-source synthesis, attribution, structure and local
     * framing all suggest the text was written rather than copied.
     */
    static double originality(String story, int sourceCount) {
        double points = 0.0;

        if (sourceCount >= 3) points += 0.3;
        else if (sourceCount >= 2) points += 0.15;

        int attributions = count(ATTRIBUTION, story);
        if (attributions >= 2) points += 0.25;
        else if (attributions >= 1) points += 0.15;

        if (HEADING.matcher(story).find()) points += 0.15;
        if (BOLD.matcher(story).find()) points += 0.10;
        if (LOCAL_CONTEXT.matcher(story).find()) points += 0.20;

        return Math.min(points, 1.0);
    }

    private static int count(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int n = 0;
        while (m.find()) n++;
        return n;
    }

    private static double clamp(double value) {
        return Math.min(Math.max(value, 0.0), 1.0);
    }

    private static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
