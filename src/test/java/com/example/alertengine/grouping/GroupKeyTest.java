package com.example.alertengine.grouping;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GroupKeyTest {

    @Test
    void metricAloneWithoutDimensions() {
        assertEquals("cpu_high", GroupKey.of("cpu_high", Map.of(), List.of()));
        assertEquals("cpu_high", GroupKey.of("cpu_high", null, List.of()));
    }

    @Test
    void dimensionsAreSortedByName() {
        Map<String, String> dimensions = new LinkedHashMap<>();
        dimensions.put("region", "eu");
        dimensions.put("host", "web-1");

        assertEquals("cpu_high|host=web-1,region=eu", GroupKey.of("cpu_high", dimensions, List.of()));
    }

    @Test
    void onlySelectedDimensionsCount() {
        Map<String, String> dimensions = Map.of("region", "eu", "host", "web-1");

        assertEquals("cpu_high|region=eu", GroupKey.of("cpu_high", dimensions, List.of("region")));
        assertEquals("cpu_high", GroupKey.of("cpu_high", dimensions, List.of("pod")));
    }
}
