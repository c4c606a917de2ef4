package io.inboxflow.config;

import io.inboxflow.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Pipeline tunables. Every field has a default; {@code inboxflow-settings.json} in the vault root
 * overrides any subset of them.
 */
public record PipelineSettings(
        long maxFileSizeBytes,
        long debounceMs,
        int maxCreateAttempts,
        long retryDelayMs,
        Set<String> allowedExtensions,
        List<String> summarizerCommand,
        long summarizerTimeoutMs,
        long watchPollMs
) {
    public static final long DEFAULT_MAX_FILE_SIZE_BYTES = 10L * 1024L * 1024L;
    public static final long DEFAULT_DEBOUNCE_MS = 1_000L;
    public static final int DEFAULT_MAX_CREATE_ATTEMPTS = 3;
    public static final long DEFAULT_RETRY_DELAY_MS = 2_000L;
    public static final long DEFAULT_SUMMARIZER_TIMEOUT_MS = 60_000L;
    public static final long DEFAULT_WATCH_POLL_MS = 500L;
    public static final Set<String> DEFAULT_ALLOWED_EXTENSIONS =
            Set.of(".txt", ".md", ".pdf", ".png", ".jpg", ".jpeg");

    public PipelineSettings {
        allowedExtensions = Set.copyOf(allowedExtensions);
        summarizerCommand = summarizerCommand == null ? List.of() : List.copyOf(summarizerCommand);
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(
                DEFAULT_MAX_FILE_SIZE_BYTES,
                DEFAULT_DEBOUNCE_MS,
                DEFAULT_MAX_CREATE_ATTEMPTS,
                DEFAULT_RETRY_DELAY_MS,
                DEFAULT_ALLOWED_EXTENSIONS,
                List.of(),
                DEFAULT_SUMMARIZER_TIMEOUT_MS,
                DEFAULT_WATCH_POLL_MS
        );
    }

    public static PipelineSettings load(Path settingsFile) {
        PipelineSettings defaults = defaults();
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults;
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load pipeline settings: " + settingsFile, e);
        }
    }

    public PipelineSettings withRetryDelayMs(long delayMs) {
        return new PipelineSettings(maxFileSizeBytes, debounceMs, maxCreateAttempts, Math.max(0L, delayMs),
                allowedExtensions, summarizerCommand, summarizerTimeoutMs, watchPollMs);
    }

    public PipelineSettings withMaxFileSizeBytes(long maxBytes) {
        return new PipelineSettings(Math.max(1L, maxBytes), debounceMs, maxCreateAttempts, retryDelayMs,
                allowedExtensions, summarizerCommand, summarizerTimeoutMs, watchPollMs);
    }

    public boolean isAllowedExtension(String extension) {
        return extension != null && allowedExtensions.contains(extension.toLowerCase(Locale.ROOT));
    }

    static PipelineSettings fromFile(SettingsFile file, PipelineSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new PipelineSettings(
                sanitizeLong(file.maxFileSizeBytes(), defaults.maxFileSizeBytes(), 1L),
                sanitizeLong(file.debounceMs(), defaults.debounceMs(), 0L),
                sanitizeInt(file.maxCreateAttempts(), defaults.maxCreateAttempts(), 1),
                sanitizeLong(file.retryDelayMs(), defaults.retryDelayMs(), 0L),
                sanitizeExtensions(file.allowedExtensions(), defaults.allowedExtensions()),
                file.summarizerCommand() == null ? defaults.summarizerCommand() : file.summarizerCommand(),
                sanitizeLong(file.summarizerTimeoutMs(), defaults.summarizerTimeoutMs(), 1_000L),
                sanitizeLong(file.watchPollMs(), defaults.watchPollMs(), 50L)
        );
    }

    private static Set<String> sanitizeExtensions(List<String> raw, Set<String> fallback) {
        if (raw == null || raw.isEmpty()) {
            return fallback;
        }
        Set<String> out = new LinkedHashSet<>();
        for (String value : raw) {
            if (value == null || value.isBlank()) {
                continue;
            }
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            out.add(normalized.startsWith(".") ? normalized : "." + normalized);
        }
        return out.isEmpty() ? fallback : out;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    record SettingsFile(
            Long maxFileSizeBytes,
            Long debounceMs,
            Integer maxCreateAttempts,
            Long retryDelayMs,
            List<String> allowedExtensions,
            List<String> summarizerCommand,
            Long summarizerTimeoutMs,
            Long watchPollMs
    ) {
    }
}
