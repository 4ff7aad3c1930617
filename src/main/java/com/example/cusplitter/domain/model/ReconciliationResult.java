package com.example.cusplitter.domain.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Full decision set of one reconciliation: one decision per certificate in document order,
 * followed by the orphan roster entries in roster order.
 */
public record ReconciliationResult(List<MatchDecision> decisions) {

    public ReconciliationResult {
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
    }

    public List<MatchDecision> withStatus(MatchStatus status) {
        return decisions.stream()
                .filter(decision -> decision.status() == status)
                .toList();
    }

    public Map<MatchStatus, Long> countsByStatus() {
        Map<MatchStatus, Long> counts = new EnumMap<>(MatchStatus.class);
        for (MatchStatus status : MatchStatus.values()) {
            counts.put(status, 0L);
        }
        decisions.forEach(decision -> counts.merge(decision.status(), 1L, Long::sum));
        return counts;
    }

    public Optional<MatchDecision> decisionFor(int sequence) {
        return decisions.stream()
                .filter(decision -> decision.record() != null && decision.record().sequence() == sequence)
                .findFirst();
    }
}
