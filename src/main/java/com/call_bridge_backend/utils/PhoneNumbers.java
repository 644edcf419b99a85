package com.call_bridge_backend.utils;

import java.util.Collection;
import java.util.Optional;

public final class PhoneNumbers {

    private static final int MIN_DIGITS = 6;
    private static final int MAX_DIGITS = 15;

    private PhoneNumbers() {
    }

    /**
     * Strip formatting from a dialable number. Keeps a single leading '+'.
     *
     * @return the normalized number, or empty when the input is not a plausible phone number
     */
    public static Optional<String> normalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }

        StringBuilder digits = new StringBuilder();
        boolean plus = false;
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (Character.isDigit(c)) {
                digits.append(c);
            } else if (c == '+' && digits.length() == 0 && !plus) {
                plus = true;
            } else if (c != ' ' && c != '-' && c != '(' && c != ')' && c != '.') {
                return Optional.empty();
            }
        }

        if (digits.length() < MIN_DIGITS || digits.length() > MAX_DIGITS) {
            return Optional.empty();
        }
        return Optional.of(plus ? "+" + digits : digits.toString());
    }

    /**
     * First candidate that normalizes to a valid number.
     */
    public static Optional<String> firstValid(Collection<String> candidates) {
        if (candidates == null) {
            return Optional.empty();
        }
        for (String candidate : candidates) {
            Optional<String> normalized = normalize(candidate);
            if (normalized.isPresent()) {
                return normalized;
            }
        }
        return Optional.empty();
    }
}
