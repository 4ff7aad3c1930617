package com.example.cusplitter.domain.exception;

import java.util.Set;

/**
 * Raised when a roster load contains the same fiscal code on more than one row.
 * The roster is rejected as a whole: picking one of the rows would route a certificate to a
 * recipient chosen by file order.
 */
public class DuplicateFiscalCodeException extends DomainException {

    private final Set<String> fiscalCodes;

	/**
	 * @param fiscalCodes every code that appears more than once
	 */
    public DuplicateFiscalCodeException(Set<String> fiscalCodes) {
        super("The roster contains duplicated fiscal codes: " + String.join(", ", fiscalCodes));
        this.fiscalCodes = Set.copyOf(fiscalCodes);
    }

    public Set<String> getFiscalCodes() {
        return fiscalCodes;
    }
}
