package io.inboxflow.summarize;

import java.util.List;

public record SummaryResult(
        boolean success,
        String text,
        String model,
        long tokens,
        String category,
        List<String> flags,
        String error
) {
    public SummaryResult {
        flags = flags == null ? List.of() : List.copyOf(flags);
    }

    public static SummaryResult ok(String text, String model, long tokens, String category, List<String> flags) {
        return new SummaryResult(true, text, model, tokens, category, flags, null);
    }

    public static SummaryResult ok(String text, String model, long tokens) {
        return ok(text, model, tokens, null, List.of());
    }

    public static SummaryResult fail(String error) {
        return new SummaryResult(false, null, null, 0L, null, List.of(), error);
    }
}
