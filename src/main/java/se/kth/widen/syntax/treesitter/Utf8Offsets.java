package se.kth.widen.syntax.treesitter;

import java.util.Arrays;

/**
 * Converts byte offsets reported by tree-sitter to UTF-8 byte offsets.
 *
 * <p>Strings reach the native parser in the JNI's modified UTF-8, which encodes {@code U+0000} in
 * two bytes and each half of a surrogate pair in three. Text without such characters has identical
 * offsets in both encodings.
 */
final class Utf8Offsets {
    private static final Utf8Offsets IDENTITY = new Utf8Offsets(null, null);

    // offsets of each char in modified UTF-8 and in UTF-8, with a trailing entry for the end
    private final int[] modified;
    private final int[] utf8;

    private Utf8Offsets(int[] modified, int[] utf8) {
        this.modified = modified;
        this.utf8 = utf8;
    }

    static Utf8Offsets of(String text) {
        if (!needsConversion(text)) {
            return IDENTITY;
        }

        int[] modified = new int[text.length() + 1];
        int[] utf8 = new int[text.length() + 1];
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            modified[i + 1] = modified[i] + modifiedLength(c);
            utf8[i + 1] = utf8[i] + utf8Length(text, i);
        }
        return new Utf8Offsets(modified, utf8);
    }

    int toUtf8(int modifiedOffset) {
        if (modified == null) {
            return modifiedOffset;
        }
        int index = Arrays.binarySearch(modified, modifiedOffset);
        if (index < 0) {
            // inside a multi-byte sequence, round down to the char it belongs to
            index = Math.max(0, -index - 2);
        }
        return utf8[index];
    }

    private static boolean needsConversion(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == 0 || Character.isSurrogate(c)) {
                return true;
            }
        }
        return false;
    }

    private static int modifiedLength(char c) {
        if (c == 0) {
            return 2;
        } else if (c < 0x80) {
            return 1;
        } else if (c < 0x800) {
            return 2;
        }
        return 3;
    }

    /** Bytes a char takes in {@link String#getBytes} UTF-8 output. A pair splits 4 bytes evenly. */
    private static int utf8Length(String text, int i) {
        char c = text.charAt(i);
        if (c < 0x80) {
            return 1;
        } else if (c < 0x800) {
            return 2;
        } else if (Character.isHighSurrogate(c)) {
            boolean paired = i + 1 < text.length() && Character.isLowSurrogate(text.charAt(i + 1));
            return paired ? 2 : 1;
        } else if (Character.isLowSurrogate(c)) {
            boolean paired = i > 0 && Character.isHighSurrogate(text.charAt(i - 1));
            return paired ? 2 : 1;
        }
        return 3;
    }
}
