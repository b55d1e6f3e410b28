package com.prakash.dayplanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Soft time-of-day band a habit prefers. Matching is done on the start hour of a window.
 */
public enum HabitAnchor {
    NONE(""),
    MORNING("morning"),         // start hour <= 11
    AFTER_LUNCH("after-lunch"), // start hour 12..15
    EVENING("evening");         // start hour >= 17

    private final String tag;

    HabitAnchor(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    /**
     * Resolves a tag such as {@code "after-lunch"}; blank or unknown tags mean no anchor.
     */
    @JsonCreator
    public static HabitAnchor fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return NONE;
        }
        for (HabitAnchor anchor : values()) {
            if (anchor.tag.equalsIgnoreCase(tag.trim()) || anchor.name().equalsIgnoreCase(tag.trim())) {
                return anchor;
            }
        }
        return NONE;
    }

    public boolean covers(int hour) {
        switch (this) {
            case MORNING:
                return hour <= 11;
            case AFTER_LUNCH:
                return hour >= 12 && hour <= 15;
            case EVENING:
                return hour >= 17;
            default:
                return false;
        }
    }
}
