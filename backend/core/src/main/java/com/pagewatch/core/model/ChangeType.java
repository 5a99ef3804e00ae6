package com.pagewatch.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ChangeType {
    NEW_IMAGES("new_images"),
    REMOVED_IMAGES("removed_images"),
    MODIFIED_IMAGES("modified_images"),
    NEW_LINKS("new_links"),
    REMOVED_LINKS("removed_links"),
    TEXT_CHANGE("text_change"),
    STRUCTURE_CHANGE("structure_change");

    private final String tag;

    ChangeType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    @JsonCreator
    public static ChangeType fromTag(String tag) {
        for (ChangeType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown change type: " + tag);
    }
}
