package com.example.cusplitter.interfaces.api;

import com.example.cusplitter.domain.model.MatchDecision;
import com.example.cusplitter.domain.model.MatchStatus;
import com.example.cusplitter.domain.model.ReconciliationResult;

import java.util.List;
import java.util.Map;

/**
 * Match table returned to the operator.
 */
public record ReconciliationResponse(List<MatchDecision> decisions, Map<MatchStatus, Long> counts) {

    static ReconciliationResponse of(ReconciliationResult result) {
        return new ReconciliationResponse(result.decisions(), result.countsByStatus());
    }
}
