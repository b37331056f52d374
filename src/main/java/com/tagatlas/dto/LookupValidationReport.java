package com.tagatlas.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated result of validating lookup declarations against the graph.
 * Errors make the configuration unusable; warnings (e.g. a path with no tags) do not.
 */
@Data
public class LookupValidationReport {

    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final Map<String, Integer> resolvedCounts = new LinkedHashMap<>();

    public void error(String message) {
        errors.add(message);
    }

    public void warn(String message) {
        warnings.add(message);
    }

    public void resolved(String key, int tagCount) {
        resolvedCounts.put(key, tagCount);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        errors.forEach(e -> sb.append("ERROR ").append(e).append('\n'));
        warnings.forEach(w -> sb.append("WARN ").append(w).append('\n'));
        return sb.toString().trim();
    }
}
