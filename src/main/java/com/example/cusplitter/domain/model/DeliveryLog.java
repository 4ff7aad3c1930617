package com.example.cusplitter.domain.model;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Authoritative record of a dispatch batch: one outcome per submitted pair.
 * Safe to append to from several worker threads.
 */
public final class DeliveryLog {

    private final Map<DeliveryKey, DeliveryOutcome> outcomes = new LinkedHashMap<>();

    public static DeliveryLog empty() {
        return new DeliveryLog();
    }

    /**
     * Adds an outcome; a second outcome for the same pair is rejected.
     *
     * @param outcome entry to record
     */
    public synchronized void record(DeliveryOutcome outcome) {
        DeliveryOutcome existing = outcomes.putIfAbsent(outcome.getKey(), outcome);
        if (existing != null) {
            throw new IllegalStateException("Delivery log already contains " + outcome.getKey());
        }
    }

    public synchronized Optional<DeliveryOutcome> find(DeliveryKey key) {
        return Optional.ofNullable(outcomes.get(key));
    }

    public synchronized List<DeliveryOutcome> getOutcomes() {
        return List.copyOf(new ArrayList<>(outcomes.values()));
    }

    public synchronized Map<DeliveryStatus, Long> getCounts() {
        Map<DeliveryStatus, Long> counts = new EnumMap<>(DeliveryStatus.class);
        for (DeliveryStatus status : DeliveryStatus.values()) {
            counts.put(status, 0L);
        }
        outcomes.values().forEach(outcome -> counts.merge(outcome.getStatus(), 1L, Long::sum));
        return counts;
    }

    public synchronized int size() {
        return outcomes.size();
    }
}
