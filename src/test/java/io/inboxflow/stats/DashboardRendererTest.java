package io.inboxflow.stats;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class DashboardRendererTest {
    private final DashboardRenderer renderer = new DashboardRenderer();

    @Test
    void emptyReportShowsPlaceholderRow() {
        String text = renderer.render(Report.empty(), Instant.parse("2025-01-15T10:00:00Z"));

        assertTrue(text.contains("- ✅ Completed: 0 tasks"));
        assertTrue(text.contains("| -- | No activity yet | -- | Drop files in Inbox/ to get started |"));
        assertTrue(text.contains("- **Success rate**: 100.0%"));
        assertTrue(text.contains("- **Most common type**: N/A"));
        assertTrue(renderer.parseActivity(text).isEmpty());
    }

    @Test
    void cellBreakingCharactersAreReplaced() {
        ActivityEntry entry = new ActivityEntry("09:30", "task-1", "a|b.txt", ActivityEntry.FAILED, "Failed: x | y\nz");
        Report report = new Report(0, 0, 1, 0, 0d, 0d, "N/A", List.of(entry));

        List<ActivityEntry> parsed = renderer.parseActivity(renderer.render(report, Instant.EPOCH));

        assertEquals(1, parsed.size());
        assertEquals("a/b.txt", parsed.get(0).displayName());
        assertEquals(ActivityEntry.FAILED, parsed.get(0).statusGlyph());
        assertEquals("Failed: x / y z", parsed.get(0).summary());
    }
}
