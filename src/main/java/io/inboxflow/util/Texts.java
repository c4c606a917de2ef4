package io.inboxflow.util;

import java.util.Locale;

public final class Texts {
    private Texts() {
    }

    /**
     * {@code summary_length -> Summary Length}.
     */
    public static String titleCase(String value) {
        StringBuilder out = new StringBuilder();
        for (String word : value.replace('_', ' ').trim().split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (out.length() > 0) {
                out.append(' ');
            }
            out.append(word.substring(0, 1).toUpperCase(Locale.ROOT))
                    .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return out.toString();
    }

    public static String truncate(String value, int maxChars) {
        if (value == null) {
            return "";
        }
        return value.length() <= maxChars ? value : value.substring(0, maxChars);
    }
}
