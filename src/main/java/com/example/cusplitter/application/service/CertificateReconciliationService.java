package com.example.cusplitter.application.service;

import com.example.cusplitter.domain.model.CertificateRecord;
import com.example.cusplitter.domain.model.MatchDecision;
import com.example.cusplitter.domain.model.MatchStatus;
import com.example.cusplitter.domain.model.ReconciliationResult;
import com.example.cusplitter.domain.model.Roster;
import com.example.cusplitter.domain.model.RosterEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the matcher over every certificate of a document and reports the roster entries that no
 * certificate claimed. Each certificate is matched against the full roster, so the outcome does
 * not depend on the order of the certificates.
 */
@Service
public class CertificateReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(CertificateReconciliationService.class);

    private final CertificateMatcher matcher;

    public CertificateReconciliationService(CertificateMatcher matcher) {
        this.matcher = matcher;
    }

    /**
     * @param records certificates in document order
     * @param roster  known recipients
     * @return one decision per certificate followed by one orphan decision per unclaimed roster entry
     */
    public ReconciliationResult reconcile(List<CertificateRecord> records, Roster roster) {
        List<CertificateRecord> certificates = records == null ? List.of() : records;
        Roster knownRecipients = roster == null ? Roster.empty() : roster;

        List<MatchDecision> decisions = new ArrayList<>(certificates.size() + knownRecipients.size());
        Map<RosterEntry, List<Integer>> claims = new IdentityHashMap<>();
        for (CertificateRecord record : certificates) {
            MatchDecision decision = matcher.match(record, knownRecipients);
            decisions.add(decision);
            if (decision.status().isAutomaticallyDispatchable()) {
                claims.computeIfAbsent(decision.candidate(), key -> new ArrayList<>()).add(record.sequence());
            }
        }

        claims.forEach((entry, sequences) -> {
            if (sequences.size() > 1) {
                log.warn("Roster entry '{}' was chosen by certificates {}", entry.fullName(), sequences);
            }
        });

        for (RosterEntry entry : knownRecipients.entries()) {
            if (!claims.containsKey(entry)) {
                decisions.add(MatchDecision.orphan(entry));
            }
        }

        ReconciliationResult result = new ReconciliationResult(decisions);
        Map<MatchStatus, Long> counts = result.countsByStatus();
        log.info("Reconciled {} certificate(s) against {} roster entries: exact={}, fuzzy={}, ambiguous={}, unmatched={}, orphan={}",
                certificates.size(), knownRecipients.size(),
                counts.get(MatchStatus.EXACT), counts.get(MatchStatus.FUZZY), counts.get(MatchStatus.AMBIGUOUS),
                counts.get(MatchStatus.UNMATCHED), counts.get(MatchStatus.ORPHAN_ROSTER));
        return result;
    }
}
