package com.pagewatch.core.model;

public record LinkDescriptor(String href, String text, String title) {
    public LinkDescriptor {
        href = href == null ? "" : href;
        text = text == null ? "" : text;
        title = title == null ? "" : title;
    }

    public String key() {
        return href + "|" + text;
    }
}
