package com.example.cusplitter.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DeliveryLogTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private final CertificateRecord record = new CertificateRecord(1, 0, 1, "", "ROSSI", "MARIO", null, 2024);

    @Test
    void outcomeLeavesPendingOnlyOnce() {
        DeliveryOutcome outcome = DeliveryOutcome.pending(new DeliveryRequest(record, "x@example.it"), "CU.pdf", NOW);

        outcome.markSent("Certificazione Unica 2024", NOW.plusSeconds(1));

        assertThat(outcome.getStatus()).isEqualTo(DeliveryStatus.SENT);
        assertThrows(IllegalStateException.class, () -> outcome.markFailed("s", "late failure", NOW));
        assertThat(outcome.getStatus()).isEqualTo(DeliveryStatus.SENT);
    }

    @Test
    void failedOutcomeAlwaysCarriesAReason() {
        DeliveryOutcome outcome = DeliveryOutcome.pending(new DeliveryRequest(record, "x@example.it"), "CU.pdf", NOW);

        outcome.markFailed("subject", " ", NOW);

        assertThat(outcome.getFailureReason()).isNotBlank();
    }

    @Test
    void keysIgnoreEmailCase() {
        DeliveryLog log = DeliveryLog.empty();
        DeliveryOutcome outcome = DeliveryOutcome.pending(new DeliveryRequest(record, "Mario.Rossi@Email.it"), "CU.pdf", NOW);
        outcome.markSent("subject", NOW);
        log.record(outcome);

        assertThat(log.find(DeliveryKey.of(record, "mario.rossi@email.it"))).contains(outcome);
        assertThrows(IllegalStateException.class, () -> log.record(
                DeliveryOutcome.pending(new DeliveryRequest(record, "MARIO.ROSSI@EMAIL.IT"), "CU.pdf", NOW)));
        assertThat(log.getCounts()).containsEntry(DeliveryStatus.SENT, 1L).containsEntry(DeliveryStatus.FAILED, 0L);
    }
}
