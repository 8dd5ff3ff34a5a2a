package com.example.securitycore.models;

import java.util.StringJoiner;

/**
 * Joins free-form parts into a single storage key. Separator and escape characters inside a
 * part are percent-encoded, so different part lists never produce the same key.
 */
public final class CompositeKeys {

    public static final char SEPARATOR = '#';

    private CompositeKeys() {
    }

    public static String join(String... parts) {
        StringJoiner joiner = new StringJoiner(String.valueOf(SEPARATOR));
        for (String part : parts) {
            joiner.add(escape(part));
        }
        return joiner.toString();
    }

    static String escape(String part) {
        StringBuilder out = new StringBuilder(part.length());
        for (int i = 0; i < part.length(); i++) {
            char c = part.charAt(i);
            switch (c) {
                case '%' -> out.append("%25");
                case SEPARATOR -> out.append("%23");
                case '|' -> out.append("%7C");
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
