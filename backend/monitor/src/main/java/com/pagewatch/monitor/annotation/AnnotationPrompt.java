package com.pagewatch.monitor.annotation;

import com.pagewatch.core.model.ChangeRecord;
import com.pagewatch.core.model.ImageDescriptor;
import com.pagewatch.core.model.LinkDescriptor;
import com.pagewatch.core.model.TextDelta;

import java.util.ArrayList;
import java.util.List;

final class AnnotationPrompt {
    private AnnotationPrompt() {
    }

    /**
     * Renders the facet payload of a record as plain lines. Empty when the record type has nothing
     * the classifier can reason about.
     */
    static String context(ChangeRecord record) {
        List<String> lines = new ArrayList<>();
        switch (record.type()) {
            case NEW_IMAGES -> images("=== NEW IMAGES DETECTED ===", record.details().images(), lines);
            case REMOVED_IMAGES -> images("=== REMOVED IMAGES DETECTED ===", record.details().images(), lines);
            case NEW_LINKS -> links("=== NEW LINKS DETECTED ===", record.details().links(), lines);
            case REMOVED_LINKS -> links("=== REMOVED LINKS DETECTED ===", record.details().links(), lines);
            case TEXT_CHANGE -> {
                lines.add("=== TEXT CHANGES DETECTED ===");
                for (TextDelta delta : record.details().textDeltas()) {
                    lines.add((delta.kind() == TextDelta.Kind.ADDED ? "New text added: " : "Text removed: ")
                            + delta.content());
                }
            }
            default -> {
            }
        }
        return lines.size() > 1 ? String.join("\n", lines) : "";
    }

    static String prompt(String context) {
        return """
                You are an analyst tracking the companies listed on investor and venture firm websites.
                Analyze the following website changes and decide whether a company was added, removed or modified.

                Changes detected:
                %s

                Ignore navigation menus, breadcrumbs and other site chrome.
                Extract company names from alt text, titles, link text or paragraph content.

                Respond with ONLY valid JSON, no markdown formatting or code blocks:
                {
                    "new_companies_detected": true/false,
                    "companies": [
                        {
                            "name": "Company Name",
                            "sector": "Industry/Sector",
                            "confidence": "high/medium/low",
                            "evidence": "What suggests this is a portfolio company",
                            "source": "image/text/link"
                        }
                    ],
                    "added_company": "Added company name or null",
                    "removed_company": "Removed company name or null",
                    "modified_company": "Modified company name or null",
                    "analysis_summary": "Brief summary of the analysis"
                }
                """.formatted(context);
    }

    private static void images(String header, List<ImageDescriptor> images, List<String> lines) {
        lines.add(header);
        for (ImageDescriptor image : images) {
            List<String> parts = new ArrayList<>();
            if (!image.alt().isEmpty()) {
                parts.add("Alt text: " + image.alt());
            }
            if (!image.title().isEmpty()) {
                parts.add("Title: " + image.title());
            }
            parts.add("Image URL: " + image.src());
            parts.add("Context: " + image.context());
            lines.add(String.join(" | ", parts));
        }
    }

    private static void links(String header, List<LinkDescriptor> links, List<String> lines) {
        lines.add(header);
        for (LinkDescriptor link : links) {
            List<String> parts = new ArrayList<>();
            parts.add("Link text: " + link.text());
            parts.add("URL: " + link.href());
            if (!link.title().isEmpty()) {
                parts.add("Title: " + link.title());
            }
            lines.add(String.join(" | ", parts));
        }
    }
}
