package com.address.resolution.domain.service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Helpers for recognising Plus Code locators (e.g. {@code 8GXX+PH}) in formatted address text.
 *
 * A Plus Code is four alphanumerics, a '+', then at least two alphanumerics. Providers sometimes
 * put one in front of the real address ("8GXX+PH, Springfield, IL"), and it is never something
 * a user wants to see as a street line.
 */
public final class PlusCodes {

    private static final Pattern PLUS_CODE = Pattern.compile("^[A-Z0-9]{4}\\+[A-Z0-9]{2,}");

    private PlusCodes() {
        // Utility class
    }

    /**
     * @param text candidate text, may be null
     * @return true when the text starts with a Plus-Code-shaped token
     */
    public static boolean isPlusCode(String text) {
        return text != null && PLUS_CODE.matcher(text.trim()).find();
    }

    /**
     * Splits formatted address text on commas, trimming each segment and dropping blank ones.
     */
    public static List<String> segments(String formattedAddress) {
        List<String> segments = new ArrayList<>();
        if (formattedAddress == null) {
            return segments;
        }
        for (String part : formattedAddress.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                segments.add(trimmed);
            }
        }
        return segments;
    }

    /**
     * First comma segment of the text, or empty string.
     */
    public static String leadingSegment(String formattedAddress) {
        List<String> segments = segments(formattedAddress);
        return segments.isEmpty() ? "" : segments.get(0);
    }

    /**
     * First comma segment after dropping a leading Plus Code segment, or empty string
     * when nothing else remains.
     */
    public static String firstReadableSegment(String formattedAddress) {
        List<String> segments = segments(formattedAddress);
        if (!segments.isEmpty() && isPlusCode(segments.get(0))) {
            segments.remove(0);
        }
        return segments.isEmpty() ? "" : segments.get(0);
    }
}
