package com.anthem.billtriage.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable category key to procedure codes mapping. Category keys are case-insensitive.
 */
public final class CategoryMap {

    private static final CategoryMap EMPTY = new CategoryMap(Map.of());

    private final Map<String, Set<String>> codesByCategory;

    public CategoryMap(Map<String, ? extends Collection<String>> source) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        source.forEach((category, codes) -> {
            Set<String> merged = copy.computeIfAbsent(normalize(category), k -> new LinkedHashSet<>());
            if (codes != null) {
                codes.stream()
                        .filter(c -> c != null && !c.isBlank())
                        .map(String::trim)
                        .forEach(merged::add);
            }
        });
        copy.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        this.codesByCategory = Collections.unmodifiableMap(copy);
    }

    public static CategoryMap empty() {
        return EMPTY;
    }

    public boolean contains(String category) {
        return category != null && codesByCategory.containsKey(normalize(category));
    }

    /**
     * Codes for a category; empty when the category is unknown.
     */
    public Set<String> codesFor(String category) {
        if (category == null) {
            return Set.of();
        }
        return codesByCategory.getOrDefault(normalize(category), Set.of());
    }

    public Set<String> categories() {
        return codesByCategory.keySet();
    }

    public Map<String, Set<String>> asMap() {
        return codesByCategory;
    }

    private static String normalize(String category) {
        return category.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "CategoryMap" + codesByCategory;
    }
}
