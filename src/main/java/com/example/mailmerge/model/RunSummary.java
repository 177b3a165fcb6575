package com.example.mailmerge.model;

import lombok.Value;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Value
public class RunSummary {
    List<SendResult> results;
    boolean cancelled;

    public RunSummary(List<SendResult> results, boolean cancelled) {
        this.results = List.copyOf(results);
        this.cancelled = cancelled;
    }

    public Map<SendStatus, Long> getCounts() {
        Map<SendStatus, Long> counts = new EnumMap<>(SendStatus.class);
        for (SendStatus status : SendStatus.values()) {
            counts.put(status, 0L);
        }
        results.forEach(r -> counts.merge(r.getStatus(), 1L, Long::sum));
        return counts;
    }

    public long count(SendStatus status) {
        return getCounts().get(status);
    }

    public List<SendResult> getFailures() {
        return results.stream().filter(SendResult::isFailed).collect(Collectors.toList());
    }
}
