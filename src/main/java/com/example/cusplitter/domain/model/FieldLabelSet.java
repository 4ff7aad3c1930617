package com.example.cusplitter.domain.model;

import java.util.List;

/**
 * Label vocabulary of one certificate layout (vendor or locale).
 *
 * @param name            short identifier used in logs
 * @param surnameLabels   labels preceding the surname, most specific first
 * @param givenNameLabels labels preceding the given name
 * @param stopLabels      labels that end a value when they follow it on the same line
 */
public record FieldLabelSet(
        String name,
        List<String> surnameLabels,
        List<String> givenNameLabels,
        List<String> stopLabels
) {

    public FieldLabelSet {
        surnameLabels = surnameLabels == null ? List.of() : List.copyOf(surnameLabels);
        givenNameLabels = givenNameLabels == null ? List.of() : List.copyOf(givenNameLabels);
        stopLabels = stopLabels == null ? List.of() : List.copyOf(stopLabels);
    }

    /**
     * Layout used by the Agenzia delle Entrate model printed by most payroll systems.
     */
    public static FieldLabelSet italianDefault() {
        return new FieldLabelSet(
                "agenzia-entrate",
                List.of("Cognome o Denominazione", "Cognome o denominazione", "Cognome"),
                List.of("Nome"),
                List.of("Codice fiscale", "Sesso", "Data di nascita", "Comune", "Provincia", "Prov.")
        );
    }
}
