package com.anthem.billtriage.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-category count of procedure codes updated by one category-mode request.
 * Zero counts are kept; {@link #visibleCounts()} drops them for operator display.
 */
public final class CategorySummary {

    private final Map<String, Integer> counts;

    public CategorySummary(Map<String, Integer> counts) {
        this.counts = Collections.unmodifiableMap(new LinkedHashMap<>(counts));
    }

    @JsonValue
    public Map<String, Integer> counts() {
        return counts;
    }

    public Map<String, Integer> visibleCounts() {
        Map<String, Integer> visible = new LinkedHashMap<>();
        counts.forEach((category, count) -> {
            if (count > 0) {
                visible.put(category, count);
            }
        });
        return visible;
    }

    public int countFor(String category) {
        return counts.getOrDefault(category, 0);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CategorySummary other && counts.equals(other.counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return counts.toString();
    }
}
