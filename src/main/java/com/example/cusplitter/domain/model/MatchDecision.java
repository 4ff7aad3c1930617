package com.example.cusplitter.domain.model;

import java.util.List;

/**
 * Reconciliation verdict for one certificate, or for one roster entry no certificate claimed.
 *
 * @param record           certificate under decision, {@code null} for {@link MatchStatus#ORPHAN_ROSTER}
 * @param status           match outcome
 * @param candidate        chosen roster entry; for orphans the orphan entry itself
 * @param alternatives     nearly tied entries of an {@link MatchStatus#AMBIGUOUS} decision
 * @param score            similarity of the chosen (or best) candidate, 1.0 for exact matches
 * @param operatorResolved {@code true} once an operator picked one of the alternatives
 */
public record MatchDecision(
        CertificateRecord record,
        MatchStatus status,
        RosterEntry candidate,
        List<RosterEntry> alternatives,
        double score,
        boolean operatorResolved
) {

    public MatchDecision {
        if (status == null) {
            throw new IllegalArgumentException("Match status is required");
        }
        if (record == null && status != MatchStatus.ORPHAN_ROSTER) {
            throw new IllegalArgumentException("Only orphan roster decisions may omit the certificate");
        }
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    public static MatchDecision exact(CertificateRecord record, RosterEntry candidate) {
        return new MatchDecision(record, MatchStatus.EXACT, candidate, List.of(), 1.0d, false);
    }

    public static MatchDecision fuzzy(CertificateRecord record, RosterEntry candidate, double score) {
        return new MatchDecision(record, MatchStatus.FUZZY, candidate, List.of(), score, false);
    }

    public static MatchDecision ambiguous(CertificateRecord record, List<RosterEntry> alternatives, double score) {
        return new MatchDecision(record, MatchStatus.AMBIGUOUS, null, alternatives, score, false);
    }

    public static MatchDecision unmatched(CertificateRecord record, double bestScore) {
        return new MatchDecision(record, MatchStatus.UNMATCHED, null, List.of(), bestScore, false);
    }

    public static MatchDecision orphan(RosterEntry entry) {
        return new MatchDecision(null, MatchStatus.ORPHAN_ROSTER, entry, List.of(), 0d, false);
    }

    /**
     * Records an operator's pick for an ambiguous decision.
     *
     * @param chosen one of {@link #alternatives()}
     * @return resolved copy of this decision
     * @throws IllegalStateException    when the decision is not ambiguous
     * @throws IllegalArgumentException when {@code chosen} is not one of the alternatives
     */
    public MatchDecision withOperatorChoice(RosterEntry chosen) {
        if (status != MatchStatus.AMBIGUOUS) {
            throw new IllegalStateException("Only ambiguous decisions can be resolved by an operator");
        }
        if (!alternatives.contains(chosen)) {
            throw new IllegalArgumentException("The chosen roster entry is not among the ambiguous candidates");
        }
        return new MatchDecision(record, status, chosen, alternatives, score, true);
    }

    /**
     * @return {@code true} when the certificate may be sent to {@link #candidate()}
     */
    public boolean isDispatchable() {
        if (candidate == null || record == null) {
            return false;
        }
        return status.isAutomaticallyDispatchable() || (status == MatchStatus.AMBIGUOUS && operatorResolved);
    }

    public ReviewCategory reviewCategory() {
        if (status == MatchStatus.ORPHAN_ROSTER) {
            return ReviewCategory.NO_CERTIFICATE;
        }
        if (isDispatchable() && candidate.hasEmail()) {
            return ReviewCategory.MATCHED;
        }
        return ReviewCategory.NEEDS_EMAIL;
    }
}
