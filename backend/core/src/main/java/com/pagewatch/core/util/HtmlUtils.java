package com.pagewatch.core.util;

import com.pagewatch.core.model.ImageDescriptor;
import com.pagewatch.core.model.LinkDescriptor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class HtmlUtils {
    private static final Pattern TITLE_PATTERN = Pattern.compile("<title[^>]*>(.*?)</title>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern BODY_PATTERN = Pattern.compile("<body[^>]*>(.*?)(?:</body>|$)", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern NOISE_PATTERN = Pattern.compile(
            "<!--.*?-->|<(script|style|noscript|nav|header)\\b[^>]*>.*?</\\1\\s*>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL
    );
    private static final Pattern IMG_PATTERN = Pattern.compile("<img\\b([^>]*)>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern ANCHOR_PATTERN = Pattern.compile(
            "<a\\b([^>]*)>(.*?)</a\\s*>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL
    );
    private static final Pattern HEADING_PATTERN = Pattern.compile(
            "<h([1-6])\\b[^>]*>(.*?)</h\\1\\s*>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL
    );
    private static final Pattern ATTRIBUTE_PATTERN = Pattern.compile(
            "([a-zA-Z_:][-a-zA-Z0-9_:.]*)\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)'|([^\\s>]+))"
    );
    private static final Pattern BLOCK_TAG_PATTERN = Pattern.compile(
            "</?(p|div|li|ul|ol|h[1-6]|br|section|article|aside|footer|main|tr|table|blockquote|figure|figcaption)\\b[^>]*>",
            Pattern.CASE_INSENSITIVE
    );
    private static final Pattern TAG_PATTERN = Pattern.compile("<[^>]+>");

    private HtmlUtils() {
    }

    public static Optional<String> extractTitle(String html) {
        Matcher matcher = TITLE_PATTERN.matcher(html);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String title = normalizeWhitespace(decodeEntities(matcher.group(1)));
        return title.isEmpty() ? Optional.empty() : Optional.of(title);
    }

    /**
     * Returns the body markup with scripts, styles, comments and navigation chrome removed.
     */
    public static Optional<String> extractBody(String html) {
        Matcher matcher = BODY_PATTERN.matcher(html);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(NOISE_PATTERN.matcher(matcher.group(1)).replaceAll(" "));
    }

    public static List<ImageDescriptor> extractImages(String html) {
        Matcher matcher = IMG_PATTERN.matcher(html);
        List<ImageDescriptor> images = new ArrayList<>();
        while (matcher.find()) {
            Map<String, String> attributes = parseAttributes(matcher.group(1));
            String src = attributes.getOrDefault("src", "");
            if (src.isBlank()) {
                src = attributes.getOrDefault("data-src", "");
            }
            if (src.isBlank()) {
                continue;
            }
            images.add(new ImageDescriptor(
                    src.trim(),
                    attributes.get("alt"),
                    attributes.get("title"),
                    attributes.get("data-id"),
                    attributes.get("id"),
                    attributes.get("aria-label"),
                    attributes.get("data-caption")
            ));
        }
        return images;
    }

    public static List<LinkDescriptor> extractLinks(String html) {
        Matcher matcher = ANCHOR_PATTERN.matcher(html);
        List<LinkDescriptor> links = new ArrayList<>();
        while (matcher.find()) {
            Map<String, String> attributes = parseAttributes(matcher.group(1));
            String href = attributes.getOrDefault("href", "").trim();
            String text = textOf(matcher.group(2));
            if (href.isEmpty() || text.isEmpty() || !isAllowedLink(href)) {
                continue;
            }
            links.add(new LinkDescriptor(href, text, attributes.get("title")));
        }
        return links;
    }

    /**
     * Heading markers in document order, formatted as {@code H2:Text}.
     */
    public static List<String> extractHeadings(String html) {
        Matcher matcher = HEADING_PATTERN.matcher(html);
        List<String> headings = new ArrayList<>();
        while (matcher.find()) {
            String text = textOf(matcher.group(2));
            if (!text.isEmpty()) {
                headings.add("H" + matcher.group(1) + ":" + text);
            }
        }
        return headings;
    }

    /**
     * Splits markup at block-level elements and returns the non-empty text of each block.
     */
    public static List<String> extractParagraphs(String html) {
        String separated = BLOCK_TAG_PATTERN.matcher(html.replaceAll("\\s+", " ")).replaceAll("\n");
        List<String> paragraphs = new ArrayList<>();
        for (String block : separated.split("\n")) {
            String text = textOf(block);
            if (!text.isEmpty()) {
                paragraphs.add(text);
            }
        }
        return paragraphs;
    }

    public static String textOf(String markup) {
        return normalizeWhitespace(decodeEntities(TAG_PATTERN.matcher(markup).replaceAll(" ")));
    }

    private static Map<String, String> parseAttributes(String raw) {
        Map<String, String> attributes = new HashMap<>();
        Matcher matcher = ATTRIBUTE_PATTERN.matcher(raw);
        while (matcher.find()) {
            String value = matcher.group(2) != null ? matcher.group(2)
                    : matcher.group(3) != null ? matcher.group(3)
                    : matcher.group(4);
            attributes.putIfAbsent(matcher.group(1).toLowerCase(Locale.ROOT), decodeEntities(value));
        }
        return attributes;
    }

    private static String decodeEntities(String text) {
        return text.replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&apos;", "'")
                .replace("&amp;", "&");
    }

    private static String normalizeWhitespace(String text) {
        return text.replaceAll("\\s+", " ").trim();
    }

    private static boolean isAllowedLink(String link) {
        String lowered = link.toLowerCase(Locale.ROOT);
        return !lowered.startsWith("mailto:") && !lowered.startsWith("javascript:");
    }
}
