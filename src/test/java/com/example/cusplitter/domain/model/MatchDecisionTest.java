package com.example.cusplitter.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MatchDecisionTest {

    private final CertificateRecord record = new CertificateRecord(1, 0, 0, "", "ROSSI", "MARIO", null, 2024);
    private final RosterEntry maria = RosterEntry.of("Rossi", "Maria", null, "maria@example.it");
    private final RosterEntry marie = RosterEntry.of("Rossi", "Marie", null, null);

    @Test
    void ambiguousDecisionIsDispatchableOnlyAfterOperatorChoice() {
        MatchDecision ambiguous = MatchDecision.ambiguous(record, List.of(maria, marie), 0.9d);

        assertThat(ambiguous.isDispatchable()).isFalse();
        assertThat(ambiguous.reviewCategory()).isEqualTo(ReviewCategory.NEEDS_EMAIL);

        MatchDecision resolved = ambiguous.withOperatorChoice(maria);

        assertThat(resolved.isDispatchable()).isTrue();
        assertThat(resolved.operatorResolved()).isTrue();
        assertThat(resolved.reviewCategory()).isEqualTo(ReviewCategory.MATCHED);
    }

    @Test
    void operatorChoiceMustBeOneOfTheAlternatives() {
        MatchDecision ambiguous = MatchDecision.ambiguous(record, List.of(maria, marie), 0.9d);
        RosterEntry stranger = RosterEntry.of("Verdi", "Giuseppe", null, null);

        assertThrows(IllegalArgumentException.class, () -> ambiguous.withOperatorChoice(stranger));
        assertThrows(IllegalStateException.class, () -> MatchDecision.fuzzy(record, maria, 0.9d).withOperatorChoice(maria));
    }

    @Test
    void unmatchedAndOrphanAreNeverDispatchable() {
        assertThat(MatchDecision.unmatched(record, 0.2d).isDispatchable()).isFalse();
        assertThat(MatchDecision.orphan(maria).isDispatchable()).isFalse();
        assertThat(MatchDecision.orphan(maria).reviewCategory()).isEqualTo(ReviewCategory.NO_CERTIFICATE);
    }

    @Test
    void matchedWithoutEmailNeedsAnEmail() {
        assertThat(MatchDecision.exact(record, marie).reviewCategory()).isEqualTo(ReviewCategory.NEEDS_EMAIL);
    }
}
