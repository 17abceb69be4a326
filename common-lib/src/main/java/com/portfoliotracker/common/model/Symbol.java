package com.portfoliotracker.common.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.portfoliotracker.common.exception.InvalidSymbolException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalized instrument identifier: trimmed, uppercase, ASCII letters and digits only,
 * at most {@value #MAX_LENGTH} characters.
 * Used as the cache and lookup key for every per-symbol operation.
 */
public record Symbol(@JsonValue String value) {

    /** Width of the symbol columns in the cache tables. */
    public static final int MAX_LENGTH = 32;

    private static final Pattern VALID = Pattern.compile("[A-Z0-9]{1," + MAX_LENGTH + "}");

    public Symbol {
        if (value == null || !VALID.matcher(value).matches()) {
            throw new InvalidSymbolException(value);
        }
    }

    /**
     * Trims and upper-cases raw input. Idempotent; performs no validation.
     */
    public static String normalize(String raw) {
        return raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Normalizes and validates raw user input.
     *
     * @throws InvalidSymbolException when the normalized text is empty or contains
     *                                anything other than letters and digits, or is too long
     */
    public static Symbol parse(String raw) {
        return new Symbol(normalize(raw));
    }

    @Override
    public String toString() {
        return value;
    }
}
