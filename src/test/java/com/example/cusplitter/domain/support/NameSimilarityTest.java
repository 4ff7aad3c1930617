package com.example.cusplitter.domain.support;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class NameSimilarityTest {

    @Test
    void identicalNamesScoreOne() {
        assertThat(NameSimilarity.score("ROSSI MARIO", "ROSSI MARIO")).isEqualTo(1.0d);
    }

    @Test
    void tokenOrderDoesNotMatter() {
        assertThat(NameSimilarity.score("MARIO ROSSI", "ROSSI MARIO")).isEqualTo(1.0d);
    }

    @Test
    void oneEditOnElevenCharacters() {
        assertThat(NameSimilarity.score("ROSSI MARIO", "ROSSI MARIA")).isCloseTo(10d / 11d, within(1e-9));
    }

    @Test
    void blankSideScoresZero() {
        assertThat(NameSimilarity.score("", "ROSSI MARIO")).isZero();
        assertThat(NameSimilarity.score("ROSSI MARIO", null)).isZero();
    }

    @Test
    void levenshteinDistanceCountsEdits() {
        assertThat(NameSimilarity.levenshteinDistance("KITTEN", "SITTING")).isEqualTo(3);
        assertThat(NameSimilarity.levenshteinDistance("", "ABC")).isEqualTo(3);
    }
}
