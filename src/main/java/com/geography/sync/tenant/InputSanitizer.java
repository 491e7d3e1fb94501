package com.geography.sync.tenant;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Validates free text entering the system: names and language codes.
 */
public final class InputSanitizer {

    public static final int MAX_NAME_LENGTH = 500;
    private static final Pattern CONTROL_CHARS = Pattern.compile("\\p{Cntrl}");
    private static final Pattern LANGUAGE_CODE = Pattern.compile("[A-Za-z]{2,8}([-_][A-Za-z0-9]{1,8})*");

    private InputSanitizer() {
    }

    /**
     * Returns the NFC-normalized, trimmed name.
     *
     * @throws InvalidHierarchyException if the name is blank, too long or contains control characters
     */
    public static String sanitizeName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidHierarchyException("Name must not be blank");
        }
        String cleaned = Normalizer.normalize(name.trim(), Normalizer.Form.NFC);
        if (cleaned.length() > MAX_NAME_LENGTH) {
            throw new InvalidHierarchyException("Name exceeds " + MAX_NAME_LENGTH + " characters");
        }
        if (CONTROL_CHARS.matcher(cleaned).find()) {
            throw new InvalidHierarchyException("Name contains control characters");
        }
        return cleaned;
    }

    public static String sanitizeLanguage(String language) {
        if (language == null || !LANGUAGE_CODE.matcher(language).matches()) {
            throw new InvalidHierarchyException("Invalid language code: " + language);
        }
        return language;
    }
}
