package com.example.vehicleplatereader.util;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Filename helpers for client supplied upload names.
 */
public final class FileNames {

    private static final String FALLBACK_NAME = "upload";
    static final int MAX_LENGTH = 100;
    private static final Pattern CONTROL_CHARACTERS = Pattern.compile("\\p{Cntrl}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern UNSAFE_CHARACTERS = Pattern.compile("[^A-Za-z0-9._-]");
    private static final Pattern LEADING_DOTS = Pattern.compile("^[._]+");

    private FileNames() {
    }

    /**
     * Reduces a client filename to a single safe path segment. Directory components,
     * control characters and anything outside {@code [A-Za-z0-9._-]} are removed so the
     * result can never escape the directory it is resolved against. Names longer than
     * {@value #MAX_LENGTH} characters are shortened with their extension kept.
     */
    public static String sanitize(String filename) {
        if (filename == null) {
            return FALLBACK_NAME;
        }
        String cleaned = CONTROL_CHARACTERS.matcher(baseName(filename)).replaceAll("");
        cleaned = WHITESPACE.matcher(cleaned.trim()).replaceAll("_");
        cleaned = UNSAFE_CHARACTERS.matcher(cleaned).replaceAll("");
        cleaned = LEADING_DOTS.matcher(cleaned).replaceAll("");
        return cleaned.isEmpty() ? FALLBACK_NAME : truncate(cleaned);
    }

    /**
     * @return the lower-cased extension without the dot, or empty when the name has none
     */
    public static Optional<String> extension(String filename) {
        if (filename == null) {
            return Optional.empty();
        }
        String name = baseName(filename);
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static String truncate(String name) {
        if (name.length() <= MAX_LENGTH) {
            return name;
        }
        int dot = name.lastIndexOf('.');
        String suffix = dot > 0 && name.length() - dot <= MAX_LENGTH / 2 ? name.substring(dot) : "";
        return name.substring(0, MAX_LENGTH - suffix.length()) + suffix;
    }

    private static String baseName(String filename) {
        String normalized = filename.replace('\\', '/');
        int separator = normalized.lastIndexOf('/');
        return separator >= 0 ? normalized.substring(separator + 1) : normalized;
    }
}
