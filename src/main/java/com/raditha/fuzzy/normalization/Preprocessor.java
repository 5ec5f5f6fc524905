package com.raditha.fuzzy.normalization;

import org.jspecify.annotations.Nullable;

/**
 * Turns raw values into comparison-ready strings.
 * <p>
 * Full processing keeps letters and numbers, lower-cases them, and collapses
 * everything else into single spaces between tokens:
 * {@code "  Hello,  World!! "} becomes {@code "hello world"}.
 */
public final class Preprocessor {

    private static final int ASCII_LIMIT = 128;

    private Preprocessor() {
    }

    /**
     * Stable textual form of a value.
     * <p>
     * Character sequences and {@code char[]} become their text; arrays of any other
     * type have no stable form and are rejected; anything else uses
     * {@link String#valueOf(Object)}.
     *
     * @throws IllegalArgumentException if the value is a non-char array
     */
    public static String coerce(Object value) {
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof CharSequence cs) {
            return cs.toString();
        }
        if (value instanceof char[] chars) {
            return new String(chars);
        }
        if (value.getClass().isArray()) {
            throw new IllegalArgumentException(
                    "Cannot compare a " + value.getClass().getSimpleName() + ": arrays have no stable text form");
        }
        return String.valueOf(value);
    }

    /**
     * Full processing, dropping non-ASCII characters first.
     */
    public static String fullProcess(Object value) {
        return fullProcess(value, true);
    }

    /**
     * Coerce, optionally drop code points outside ASCII, then keep lower-cased
     * letter/digit runs joined by single spaces.
     *
     * @param value      raw value, never null
     * @param forceAscii drop every code point at or above 128 before normalising
     * @return processed string, possibly empty
     */
    public static String fullProcess(Object value, boolean forceAscii) {
        String text = coerce(value);
        StringBuilder out = new StringBuilder(text.length());
        boolean pendingSeparator = false;

        for (int offset = 0; offset < text.length();) {
            int cp = text.codePointAt(offset);
            offset += Character.charCount(cp);

            if (forceAscii && cp >= ASCII_LIMIT) {
                continue;
            }
            if (!isAlphanumeric(cp)) {
                pendingSeparator = out.length() > 0;
                continue;
            }
            if (pendingSeparator) {
                out.append(' ');
                pendingSeparator = false;
            }
            out.appendCodePoint(Character.toLowerCase(cp));
        }
        return out.toString();
    }

    /**
     * Letters and every kind of number, including letter numbers such as
     * {@code Ⅻ} and other numbers such as {@code ½} or {@code ⁵}.
     */
    static boolean isAlphanumeric(int cp) {
        if (Character.isLetterOrDigit(cp)) {
            return true;
        }
        int type = Character.getType(cp);
        return type == Character.LETTER_NUMBER || type == Character.OTHER_NUMBER;
    }

    /**
     * Process only when asked to; otherwise coerce and pass through.
     */
    public static String process(Object value, boolean forceAscii, boolean fullProcess) {
        return fullProcess ? fullProcess(value, forceAscii) : coerce(value);
    }

    /**
     * A string is valid for scoring if it is non-empty.
     */
    public static boolean isValid(@Nullable String processed) {
        return processed != null && !processed.isEmpty();
    }
}
