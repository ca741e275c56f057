package com.think.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import com.think.script.parser.Program.Subtask;

/**
 * Program-wide map from normalized subtask name to its declaration. Built once
 * by the {@link Validator}; read-only afterwards, so it can be shared by any
 * number of sequential executions.
 */
public final class SubtaskRegistry {

    private final Map<String, Subtask> byName;

    SubtaskRegistry(Map<String, Subtask> byName) {
        this.byName = Collections.unmodifiableMap(new LinkedHashMap<>(byName));
    }

    /**
     * Lower-cases the name and collapses every run of non-alphanumeric
     * characters into one underscore, so {@code "Calculate Average"} and
     * {@code calculate_average} share the key {@code calculate_average}.
     */
    public static String normalize(String name) {
        String lower = name.trim().toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(lower.length());
        boolean pendingSeparator = false;
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                if (pendingSeparator && sb.length() > 0) sb.append('_');
                pendingSeparator = false;
                sb.append(c);
            } else {
                pendingSeparator = true;
            }
        }
        return sb.toString();
    }

    /** Subtask a call named {@code callName} resolves to, or null. */
    public Subtask lookup(String callName) {
        return byName.get(normalize(callName));
    }

    public int size() {
        return byName.size();
    }
}
