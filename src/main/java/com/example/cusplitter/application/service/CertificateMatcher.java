package com.example.cusplitter.application.service;

import com.example.cusplitter.config.CuSplitterProperties;
import com.example.cusplitter.domain.model.CertificateRecord;
import com.example.cusplitter.domain.model.MatchDecision;
import com.example.cusplitter.domain.model.Roster;
import com.example.cusplitter.domain.model.RosterEntry;
import com.example.cusplitter.domain.support.FiscalCodes;
import com.example.cusplitter.domain.support.NameSimilarity;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Matches one certificate against the roster.
 * The fiscal code is the authoritative key; names are compared only when the code gives no hit,
 * and a near tie between two roster entries is reported as ambiguous instead of picking one.
 */
@Service
public class CertificateMatcher {

    private static final double EPSILON = 1e-9;

    private final double threshold;
    private final double margin;
    private final boolean surnameInitialPrefilter;

    public CertificateMatcher(CuSplitterProperties properties) {
        CuSplitterProperties.Matching matching = properties.matching();
        this.threshold = matching.threshold();
        this.margin = matching.margin();
        this.surnameInitialPrefilter = matching.surnameInitialPrefilter();
    }

    /**
     * @param record certificate to match
     * @param roster known recipients
     * @return decision with the chosen candidate, or the tied alternatives when ambiguous
     */
    public MatchDecision match(CertificateRecord record, Roster roster) {
        if (record.hasFiscalCode() && FiscalCodes.isWellFormed(record.fiscalCode())) {
            Optional<RosterEntry> exact = roster.findByFiscalCode(record.fiscalCode());
            if (exact.isPresent()) {
                return MatchDecision.exact(record, exact.get());
            }
        }
        if (!record.hasName()) {
            return MatchDecision.unmatched(record, 0d);
        }

        List<ScoredEntry> scored = score(record, roster);
        if (scored.isEmpty()) {
            return MatchDecision.unmatched(record, 0d);
        }

        ScoredEntry best = scored.get(0);
        if (best.score() < threshold) {
            return MatchDecision.unmatched(record, best.score());
        }

        // the runner-up counts whatever its score, so a close second below the threshold still blocks
        List<RosterEntry> tied = scored.stream()
                .filter(candidate -> best.score() - candidate.score() < margin - EPSILON)
                .map(ScoredEntry::entry)
                .toList();
        if (tied.size() > 1) {
            return MatchDecision.ambiguous(record, tied, best.score());
        }
        return MatchDecision.fuzzy(record, best.entry(), best.score());
    }

    /**
     * Scores every eligible roster entry, best first; equal scores keep roster order.
     */
    private List<ScoredEntry> score(CertificateRecord record, Roster roster) {
        String recordName = record.fullName();
        Character initial = surnameInitialPrefilter && record.surname() != null && !record.surname().isEmpty()
                ? record.surname().charAt(0)
                : null;

        List<ScoredEntry> scored = new ArrayList<>();
        for (RosterEntry entry : roster.entries()) {
            if (initial != null && (entry.surname() == null || entry.surname().isEmpty() || entry.surname().charAt(0) != initial)) {
                continue;
            }
            String entryName = entry.fullName();
            if (entryName.isBlank()) {
                continue;
            }
            scored.add(new ScoredEntry(entry, NameSimilarity.score(recordName, entryName)));
        }
        scored.sort(Comparator.comparingDouble(ScoredEntry::score).reversed());
        return scored;
    }

    private record ScoredEntry(RosterEntry entry, double score) {
    }
}
