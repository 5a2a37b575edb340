package com.example.reportmerge.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-run counters of how each PDF was matched. Not thread-safe; one instance per run.
 */
public final class MatchingStatistics {

    public static final String NO_MATCH = "no_match";

    private final Map<String, Integer> counts = new LinkedHashMap<>();

    public MatchingStatistics() {
        for (MatchPass pass : MatchPass.values()) {
            counts.put(pass.statisticKey(), 0);
        }
        counts.put(NO_MATCH, 0);
    }

    /**
     * Counts one matching outcome under the key of the pass that produced it.
     *
     * @param result matcher outcome for one PDF
     */
    public void record(MatchResult result) {
        String key = result.pass().map(MatchPass::statisticKey).orElse(NO_MATCH);
        counts.merge(key, 1, Integer::sum);
    }

    public int count(String key) {
        return counts.getOrDefault(key, 0);
    }

    @JsonValue
    public Map<String, Integer> asMap() {
        return Collections.unmodifiableMap(counts);
    }
}
