package com.pagewatch.core.model;

public record TextDelta(Kind kind, String content, int position) {
    public enum Kind {
        ADDED,
        REMOVED
    }

    public static TextDelta added(String content, int position) {
        return new TextDelta(Kind.ADDED, content, position);
    }

    public static TextDelta removed(String content, int position) {
        return new TextDelta(Kind.REMOVED, content, position);
    }
}
