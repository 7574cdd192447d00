package com.nowqueue.config;

import com.nowqueue.exception.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Category weights per phase. Categories are matched case-insensitively;
 * an unknown phase or category yields 0.
 */
public final class WeightTable {

    private final Map<String, Map<String, Double>> rows;

    public WeightTable(Map<String, Map<String, Double>> rows) {
        Map<String, Map<String, Double>> copy = new LinkedHashMap<>();
        if (rows != null) {
            rows.forEach((phase, categories) -> {
                Map<String, Double> row = new LinkedHashMap<>();
                if (categories != null) {
                    categories.forEach((category, weight) -> {
                        if (weight == null || weight.isNaN() || weight.isInfinite()) {
                            throw new ConfigurationException("Weight for " + phase + "/" + category + " must be a finite number");
                        }
                        row.put(normalize(category), weight);
                    });
                }
                copy.put(phase, Collections.unmodifiableMap(row));
            });
        }
        this.rows = Collections.unmodifiableMap(copy);
    }

    public static WeightTable empty() {
        return new WeightTable(Map.of());
    }

    public double lookup(String phase, String category) {
        Map<String, Double> row = rows.get(phase);
        if (row == null || category == null) {
            return 0.0;
        }
        return row.getOrDefault(normalize(category), 0.0);
    }

    public boolean hasPhase(String phase) {
        return rows.containsKey(phase);
    }

    public Set<String> phases() {
        return rows.keySet();
    }

    public Map<String, Double> row(String phase) {
        return rows.getOrDefault(phase, Map.of());
    }

    private static String normalize(String category) {
        return category.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "WeightTable" + rows;
    }
}
