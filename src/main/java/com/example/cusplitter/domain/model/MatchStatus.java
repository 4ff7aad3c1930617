package com.example.cusplitter.domain.model;

/**
 * Outcome of matching one certificate (or one unclaimed roster entry) against the roster.
 */
public enum MatchStatus {
    /** Fiscal code found in the roster. */
    EXACT,
    /** Name similarity above threshold with a clear winner. */
    FUZZY,
    /** Two or more roster entries are nearly tied; a person has to choose. */
    AMBIGUOUS,
    /** No roster entry qualifies. */
    UNMATCHED,
    /** Roster entry that no certificate claimed. */
    ORPHAN_ROSTER;

    /**
     * @return {@code true} for statuses that may reach the dispatcher without operator input
     */
    public boolean isAutomaticallyDispatchable() {
        return this == EXACT || this == FUZZY;
    }
}
