package com.prakash.dayplanner.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BlockCategory {
    TASK("task", "#2f6feb"),     // deep work
    BUFFER("buffer", "#9aa3ab"), // display-only padding around task chunks
    HABIT("habit", "#22c55e");

    private final String wireName;
    private final String color;

    BlockCategory(String wireName, String color) {
        this.wireName = wireName;
        this.color = color;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getColor() {
        return color;
    }
}
