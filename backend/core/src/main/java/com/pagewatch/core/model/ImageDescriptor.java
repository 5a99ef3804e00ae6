package com.pagewatch.core.model;

import java.util.ArrayList;
import java.util.List;

public record ImageDescriptor(
        String src,
        String alt,
        String title,
        String dataId,
        String elementId,
        String ariaLabel,
        String caption
) {
    private static final int ALT_KEY_LENGTH = 50;

    public ImageDescriptor {
        src = src == null ? "" : src;
        alt = alt == null ? "" : alt;
        title = title == null ? "" : title;
        dataId = dataId == null ? "" : dataId;
        elementId = elementId == null ? "" : elementId;
        ariaLabel = ariaLabel == null ? "" : ariaLabel;
        caption = caption == null ? "" : caption;
    }

    public static ImageDescriptor of(String src, String alt) {
        return new ImageDescriptor(src, alt, "", "", "", "", "");
    }

    /**
     * Identity used to match the same image across snapshots.
     */
    public String key() {
        List<String> parts = new ArrayList<>();
        if (!src.isEmpty()) {
            parts.add("src:" + src);
        }
        if (!dataId.isEmpty()) {
            parts.add("data-id:" + dataId);
        }
        if (!elementId.isEmpty()) {
            parts.add("id:" + elementId);
        }
        if (!alt.isEmpty()) {
            parts.add("alt:" + alt.substring(0, Math.min(ALT_KEY_LENGTH, alt.length())));
        }
        return parts.isEmpty() ? src : String.join(" | ", parts);
    }

    public String context() {
        List<String> parts = new ArrayList<>();
        if (!alt.isEmpty()) {
            parts.add("Alt: '" + alt + "'");
        }
        if (!title.isEmpty()) {
            parts.add("Title: '" + title + "'");
        }
        if (!dataId.isEmpty()) {
            parts.add("Data-ID: '" + dataId + "'");
        }
        if (!ariaLabel.isEmpty()) {
            parts.add("Aria-Label: '" + ariaLabel + "'");
        }
        if (!caption.isEmpty()) {
            parts.add("Caption: '" + caption + "'");
        }
        return parts.isEmpty() ? "No additional context" : String.join(" | ", parts);
    }
}
