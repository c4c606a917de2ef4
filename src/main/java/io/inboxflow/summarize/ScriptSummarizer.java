package io.inboxflow.summarize;

import com.fasterxml.jackson.databind.JsonNode;
import io.inboxflow.rules.RuleSet;
import io.inboxflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Delegates analysis to an external command. The command reads a JSON request on stdin
 * ({@code content}, {@code rules}, {@code flags}) and answers on stdout with either plain text or a
 * JSON object {@code {"summary", "category", "flags", "tokens", "model"}}.
 *
 * <p>The request is fed from a separate thread and the answer goes to a temporary file, so the
 * timeout bounds the whole exchange whatever the sizes involved.
 */
public final class ScriptSummarizer implements Summarizer {
    private static final int MAX_ERROR_CHARS = 512;

    private final List<String> command;
    private final long timeoutMs;
    private final Logger log;

    public ScriptSummarizer(List<String> command, long timeoutMs) {
        this(command, timeoutMs, LoggerFactory.getLogger(ScriptSummarizer.class));
    }

    public ScriptSummarizer(List<String> command, long timeoutMs, Logger log) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("summarizer command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
        this.log = log;
    }

    @Override
    public String id() {
        return "script:" + command.get(0);
    }

    @Override
    public SummaryResult summarize(String content, RuleSet rules, List<String> flags) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("content", content == null ? "" : content);
        request.put("rules", rules == null ? "" : rules.processingContext());
        request.put("flags", flags == null ? List.of() : flags);
        byte[] input = Jsons.toJson(request).getBytes(StandardCharsets.UTF_8);

        Path outputFile;
        try {
            outputFile = Files.createTempFile("inboxflow-summary-", ".out");
        } catch (IOException e) {
            return SummaryResult.fail("summarizer output file could not be created: " + e.getMessage());
        }
        try {
            return run(input, outputFile);
        } finally {
            try {
                Files.deleteIfExists(outputFile);
            } catch (IOException e) {
                log.warn("Could not remove summarizer output {}: {}", outputFile, e.getMessage());
            }
        }
    }

    private SummaryResult run(byte[] input, Path outputFile) {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        pb.redirectOutput(outputFile.toFile());
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return SummaryResult.fail("summarizer spawn failed: " + e.getMessage());
        }

        Thread feeder = new Thread(() -> feed(process, input), "inboxflow-summarizer-stdin");
        feeder.setDaemon(true);
        feeder.start();
        try {
            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return SummaryResult.fail("summarizer timeout after " + Duration.ofMillis(timeoutMs));
            }
            feeder.join(1_000L);

            String output = new String(Files.readAllBytes(outputFile), StandardCharsets.UTF_8).strip();
            if (process.exitValue() != 0) {
                return SummaryResult.fail("summarizer exit=" + process.exitValue() + " output=" + truncate(output));
            }
            if (output.isEmpty()) {
                return SummaryResult.fail("summarizer produced no output");
            }
            return parseResponse(output);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return SummaryResult.fail("summarizer interrupted");
        } catch (Exception e) {
            process.destroyForcibly();
            return SummaryResult.fail("summarizer execution failed: " + e.getMessage());
        }
    }

    private void feed(Process process, byte[] input) {
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(input);
        } catch (IOException e) {
            // The exit status decides the outcome; a command may stop reading early.
            log.debug("Summarizer closed its input before the request was written: {}", e.getMessage());
        }
    }

    SummaryResult parseResponse(String output) {
        if (!output.startsWith("{")) {
            return SummaryResult.ok(output, id(), TemplateSummarizer.estimateTokens(output));
        }
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(output);
        } catch (IOException e) {
            return SummaryResult.ok(output, id(), TemplateSummarizer.estimateTokens(output));
        }
        String summary = node.path("summary").asText("");
        if (summary.isBlank()) {
            return SummaryResult.fail("summarizer response has no summary");
        }
        List<String> flags = new ArrayList<>();
        for (JsonNode flag : node.path("flags")) {
            if (flag.isTextual() && !flag.asText().isBlank()) {
                flags.add(flag.asText());
            }
        }
        String category = node.path("category").asText("");
        return SummaryResult.ok(
                summary,
                node.path("model").asText(id()),
                node.path("tokens").asLong(TemplateSummarizer.estimateTokens(summary)),
                category.isBlank() ? null : category,
                flags
        );
    }

    private static String truncate(String raw) {
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
