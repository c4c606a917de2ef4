package io.inboxflow.summarize;

import io.inboxflow.rules.FlagRuleParser;
import io.inboxflow.rules.RuleSet;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;

final class ScriptSummarizerTest {
    private final ScriptSummarizer summarizer = new ScriptSummarizer(List.of("summarize-bin"), 5_000L);

    @Test
    void jsonResponseCarriesCategoryFlagsAndTokens() {
        SummaryResult result = summarizer.parseResponse(
                "{\"summary\":\"Pay the invoice\",\"category\":\"invoice\",\"flags\":[\"📎 Attachment\",\"\",3],"
                        + "\"tokens\":42,\"model\":\"local-llm\"}");

        Assertions.assertTrue(result.success());
        Assertions.assertEquals("Pay the invoice", result.text());
        Assertions.assertEquals("invoice", result.category());
        Assertions.assertEquals(List.of("📎 Attachment"), result.flags());
        Assertions.assertEquals(42L, result.tokens());
        Assertions.assertEquals("local-llm", result.model());
    }

    @Test
    void plainTextResponseIsTheSummary() {
        SummaryResult result = summarizer.parseResponse("Three words here");

        Assertions.assertTrue(result.success());
        Assertions.assertEquals("Three words here", result.text());
        Assertions.assertEquals("script:summarize-bin", result.model());
        Assertions.assertEquals(3L, result.tokens());
        Assertions.assertNull(result.category());
    }

    @Test
    void jsonWithoutSummaryFails() {
        SummaryResult result = summarizer.parseResponse("{\"category\":\"invoice\"}");

        Assertions.assertFalse(result.success());
        Assertions.assertTrue(result.error().contains("no summary"));
    }

    @Test
    void missingExecutableIsAFailedResult() {
        ScriptSummarizer missing = new ScriptSummarizer(List.of("inboxflow-definitely-not-installed"), 1_000L);

        SummaryResult result = missing.summarize("hello", RuleSet.defaults(new FlagRuleParser()), List.of());

        Assertions.assertFalse(result.success());
        Assertions.assertTrue(result.error().startsWith("summarizer spawn failed"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void nonZeroExitIsAFailedResult() {
        ScriptSummarizer failing = new ScriptSummarizer(List.of("sh", "-c", "cat >/dev/null; echo boom; exit 3"), 5_000L);

        SummaryResult result = failing.summarize("hello", RuleSet.defaults(new FlagRuleParser()), List.of());

        Assertions.assertFalse(result.success());
        Assertions.assertEquals("summarizer exit=3 output=boom", result.error());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void commandReceivesRequestOnStdin() {
        ScriptSummarizer echo = new ScriptSummarizer(List.of("sh", "-c", "cat"), 5_000L);

        SummaryResult result = echo.summarize("invoice body", RuleSet.defaults(new FlagRuleParser()), List.of("🔥 Urgent"));

        Assertions.assertFalse(result.success());
        Assertions.assertTrue(result.error().contains("no summary"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void outputLargerThanPipeBufferIsReadInFull() {
        ScriptSummarizer verbose = new ScriptSummarizer(
                List.of("sh", "-c", "cat >/dev/null; head -c 200000 /dev/zero | tr '\\0' a"), 10_000L);

        SummaryResult result = verbose.summarize("hello", RuleSet.defaults(new FlagRuleParser()), List.of());

        Assertions.assertTrue(result.success(), () -> "unexpected failure: " + result.error());
        Assertions.assertEquals(200_000, result.text().length());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void commandEchoingLargeRequestWhileReadingReturnsBeforeTimeout() {
        ScriptSummarizer echo = new ScriptSummarizer(List.of("cat"), 10_000L);
        String content = "x".repeat(1024 * 1024);

        SummaryResult result = Assertions.assertTimeoutPreemptively(Duration.ofSeconds(20),
                () -> echo.summarize(content, RuleSet.defaults(new FlagRuleParser()), List.of()));

        Assertions.assertFalse(result.success());
        Assertions.assertTrue(result.error().contains("no summary"), result.error());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void hungCommandTimesOut() {
        ScriptSummarizer hung = new ScriptSummarizer(List.of("sh", "-c", "sleep 30"), 1_000L);

        SummaryResult result = Assertions.assertTimeoutPreemptively(Duration.ofSeconds(10),
                () -> hung.summarize("x".repeat(512 * 1024), RuleSet.defaults(new FlagRuleParser()), List.of()));

        Assertions.assertFalse(result.success());
        Assertions.assertTrue(result.error().startsWith("summarizer timeout after"), result.error());
    }

    @Test
    void emptyCommandIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ScriptSummarizer(List.of(), 1_000L));
    }
}
