package com.example.cusplitter.domain.model;

import com.example.cusplitter.domain.exception.DuplicateFiscalCodeException;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Immutable roster of known recipients with a fiscal-code index.
 * Construction fails when two entries share a fiscal code.
 */
public final class Roster {

    private final List<RosterEntry> entries;
    private final Map<String, RosterEntry> byFiscalCode;

    private Roster(List<RosterEntry> entries, Map<String, RosterEntry> byFiscalCode) {
        this.entries = entries;
        this.byFiscalCode = byFiscalCode;
    }

    /**
     * Builds a roster, keeping the entries in the given order.
     *
     * @param entries normalized roster entries
     * @return roster ready for matching
     * @throws DuplicateFiscalCodeException when a fiscal code is present on more than one entry
     */
    public static Roster of(List<RosterEntry> entries) {
        List<RosterEntry> copy = entries == null ? List.of() : List.copyOf(entries);
        Map<String, RosterEntry> index = new LinkedHashMap<>();
        Map<String, Integer> occurrences = new HashMap<>();
        for (RosterEntry entry : copy) {
            if (!entry.hasFiscalCode()) {
                continue;
            }
            occurrences.merge(entry.fiscalCode(), 1, Integer::sum);
            index.putIfAbsent(entry.fiscalCode(), entry);
        }
        TreeSet<String> duplicates = new TreeSet<>();
        occurrences.forEach((code, count) -> {
            if (count > 1) {
                duplicates.add(code);
            }
        });
        if (!duplicates.isEmpty()) {
            throw new DuplicateFiscalCodeException(duplicates);
        }
        return new Roster(copy, Collections.unmodifiableMap(index));
    }

    public static Roster empty() {
        return new Roster(List.of(), Map.of());
    }

    public List<RosterEntry> entries() {
        return entries;
    }

    public Optional<RosterEntry> findByFiscalCode(String fiscalCode) {
        if (fiscalCode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byFiscalCode.get(fiscalCode));
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
