package com.pagewatch.core.diff;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Keyword heuristics that recognize menu, breadcrumb and other site chrome text.
 */
public final class NavigationFilter {
    private static final List<String> KEYWORDS = List.of(
            "menu", "home", "about", "about us", "our team", "what we do",
            "social responsibility", "news", "faq", "venture", "portfolio",
            "testimonials", "overview", "work with us", "contact", "login",
            "courses", "resources", "archives", "gateway", "investor login",
            "innovator resources"
    );
    private static final int SHORT_TEXT_LIMIT = 500;
    private static final int SHORT_TEXT_KEYWORDS = 3;
    private static final double KEYWORD_RATIO_LIMIT = 0.3;
    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("\\bmenu\\b.*\\bhome\\b.*\\babout\\b", Pattern.DOTALL),
            Pattern.compile("\\bhome\\s*/\\s*\\w+\\s*/\\s*\\w+")
    );

    private NavigationFilter() {
    }

    public static boolean isNavigation(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        long keywordCount = KEYWORDS.stream().filter(lowered::contains).count();
        if (text.length() < SHORT_TEXT_LIMIT && keywordCount >= SHORT_TEXT_KEYWORDS) {
            return true;
        }
        for (Pattern pattern : PATTERNS) {
            if (pattern.matcher(lowered).find()) {
                return true;
            }
        }
        int words = text.trim().split("\\s+").length;
        return (double) keywordCount / words > KEYWORD_RATIO_LIMIT;
    }
}
