package com.diskwatcher.app.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Progress payload stored as {@code progress_json}. {@code stats} carries free-form counters
 * (walk errors, dropped writes, events seen).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobProgress(long filesProcessed, Long totalKnown, String lastPath, Map<String, Object> stats) {

    public JobProgress {
        stats = stats == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(stats));
    }

    public static JobProgress empty() {
        return new JobProgress(0, null, null, Map.of());
    }

    public static JobProgress of(long filesProcessed, String lastPath) {
        return new JobProgress(filesProcessed, null, lastPath, Map.of());
    }

    public JobProgress withStat(String key, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(stats);
        next.put(key, value);
        return new JobProgress(filesProcessed, totalKnown, lastPath, next);
    }
}
