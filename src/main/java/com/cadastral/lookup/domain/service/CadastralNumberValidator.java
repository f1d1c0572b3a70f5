package com.cadastral.lookup.domain.service;

import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Domain service checking cadastral number syntax.
 *
 * Grammar: {@code DD:DD:DDDDDD[D]:D+}, i.e. two digits, two digits, six or seven
 * digits and at least one digit, separated by colons. The whole string must match.
 * Length limits (15-25 characters) are enforced by the request layer, not here.
 */
@Service
public class CadastralNumberValidator {

    public static final String FORMAT_MESSAGE = "cadastral number does not match the required format";

    private static final Pattern CADASTRAL_NUMBER = Pattern.compile("\\d{2}:\\d{2}:\\d{6,7}:\\d+");

    /**
     * @param candidate value to check
     * @return the candidate, unchanged
     * @throws CadastralNumberFormatException if the candidate is null or does not match
     */
    public String validate(String candidate) {
        if (!isValid(candidate)) {
            throw new CadastralNumberFormatException(FORMAT_MESSAGE);
        }
        return candidate;
    }

    public boolean isValid(String candidate) {
        return candidate != null && CADASTRAL_NUMBER.matcher(candidate).matches();
    }

    /**
     * Thrown when a cadastral number does not follow the grammar.
     */
    public static class CadastralNumberFormatException extends RuntimeException {
        public CadastralNumberFormatException(String message) {
            super(message);
        }
    }
}
