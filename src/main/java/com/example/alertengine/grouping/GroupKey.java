package com.example.alertengine.grouping;

import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Derives the key alerts are grouped under: the metric name, followed by the selected
 * dimensions sorted by name, e.g. {@code cpu_high|host=web-1,region=eu}.
 */
public final class GroupKey {

    private GroupKey() {
    }

    public static String of(String metricName, Map<String, String> dimensions, Collection<String> selected) {
        if (dimensions == null || dimensions.isEmpty()) return metricName;
        Map<String, String> sorted = new TreeMap<>();
        dimensions.forEach((name, value) -> {
            if (selected == null || selected.isEmpty() || selected.contains(name)) {
                sorted.put(name, value == null ? "" : value);
            }
        });
        if (sorted.isEmpty()) return metricName;
        return metricName + "|" + sorted.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(","));
    }
}
