package io.inboxflow.stats;

import io.inboxflow.util.Texts;

public record ActivityEntry(String time, String taskId, String displayName, String statusGlyph, String summary) {
    public static final int MAX_SUMMARY_CHARS = 50;
    public static final String COMPLETED = "✅";
    public static final String FAILED = "❌";
    public static final String PENDING = "⏳";

    public ActivityEntry {
        displayName = displayName == null || displayName.isBlank() ? "Unknown" : cellSafe(displayName.strip());
        summary = summary == null || summary.isBlank()
                ? "No summary available"
                : Texts.truncate(cellSafe(summary.strip()), MAX_SUMMARY_CHARS);
        statusGlyph = statusGlyph == null || statusGlyph.isBlank() ? PENDING : statusGlyph.strip();
    }

    private static String cellSafe(String value) {
        return value.replace('\n', ' ').replace('\r', ' ').replace('|', '/').replace("]]", "] ]");
    }
}
