package io.inboxflow.storage;

import io.inboxflow.codec.Frontmatter;
import io.inboxflow.codec.FrontmatterCodec;
import io.inboxflow.codec.FrontmatterException;
import io.inboxflow.model.OriginalFile;
import io.inboxflow.model.ProcessingMetadata;
import io.inboxflow.model.Task;
import io.inboxflow.model.TaskStatus;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps tasks to and from their markdown record: a frontmatter header plus an
 * "Original Content" and an "AI Analysis" section.
 */
public final class TaskRecordFormat {
    static final String ORIGINAL_HEADING = "## Original Content";
    static final String ANALYSIS_HEADING = "## AI Analysis";

    private final FrontmatterCodec codec;

    public TaskRecordFormat(FrontmatterCodec codec) {
        this.codec = codec;
    }

    public String render(Task task) {
        return codec.encode(fields(task), body(task));
    }

    public Task parse(String content) {
        Frontmatter frontmatter;
        try {
            frontmatter = codec.decode(content);
        } catch (FrontmatterException e) {
            throw new TaskRecordException(e.getMessage(), e);
        }
        Map<String, Object> fields = frontmatter.fields();
        if (!frontmatter.hasHeader()) {
            throw new TaskRecordException("Task record has no frontmatter header");
        }
        String id = requiredString(fields, "id");
        TaskStatus status;
        try {
            status = TaskStatus.fromWire(requiredString(fields, "status"));
        } catch (IllegalArgumentException e) {
            throw new TaskRecordException(e.getMessage(), e);
        }
        String[] sections = splitBody(frontmatter.body());
        return Task.restore(
                id,
                optionalString(fields, "type"),
                status,
                optionalInstant(fields, "created"),
                originalFile(fields),
                sections[0],
                sections[1],
                processing(fields),
                optionalString(fields, "error"),
                flags(fields)
        );
    }

    /**
     * Reads only the header, for scans that need counts and metadata but not the task itself.
     */
    public Map<String, Object> header(String content) {
        try {
            return codec.decode(content).fields();
        } catch (FrontmatterException e) {
            throw new TaskRecordException(e.getMessage(), e);
        }
    }

    private Map<String, Object> fields(Task task) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", task.id());
        if (task.type() != null) {
            fields.put("type", task.type());
        }
        fields.put("status", task.status().wireName());
        if (task.createdAt() != null) {
            fields.put("created", task.createdAt().toString());
        }
        OriginalFile file = task.originalFile();
        if (file != null) {
            Map<String, Object> original = new LinkedHashMap<>();
            original.put("name", file.name());
            original.put("extension", file.extension());
            original.put("size_bytes", file.sizeBytes());
            if (file.discoveredAt() != null) {
                original.put("discovered", file.discoveredAt().toString());
            }
            fields.put("original_file", original);
        }
        ProcessingMetadata processing = task.processing();
        if (processing != null) {
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("model", processing.model());
            meta.put("duration_seconds", processing.durationSeconds());
            meta.put("tokens", processing.tokenCount());
            fields.put("processing", meta);
        }
        if (task.error() != null) {
            fields.put("error", task.error());
        }
        if (!task.flags().isEmpty()) {
            fields.put("flags", task.flags());
        }
        return fields;
    }

    private String body(Task task) {
        String analysis = task.analysisBody() == null ? Task.ANALYSIS_PLACEHOLDER : task.analysisBody().strip();
        return "# Task: " + task.displayName() + "\n\n"
                + ORIGINAL_HEADING + "\n\n"
                + task.originalBody().strip() + "\n\n"
                + ANALYSIS_HEADING + "\n\n"
                + analysis + "\n";
    }

    private static String[] splitBody(String body) {
        int originalAt = headingIndex(body, ORIGINAL_HEADING, false);
        int analysisAt = headingIndex(body, ANALYSIS_HEADING, true);
        if (originalAt < 0 || analysisAt < 0 || analysisAt < originalAt) {
            throw new TaskRecordException("Task record body is missing its content sections");
        }
        String original = body.substring(originalAt + ORIGINAL_HEADING.length(), analysisAt).strip();
        String analysis = body.substring(analysisAt + ANALYSIS_HEADING.length()).strip();
        if (analysis.isEmpty() || analysis.equals(Task.ANALYSIS_PLACEHOLDER)) {
            analysis = null;
        }
        return new String[]{original, analysis};
    }

    private static int headingIndex(String body, String heading, boolean last) {
        int found = -1;
        int lineStart = 0;
        while (lineStart < body.length()) {
            int lineEnd = body.indexOf('\n', lineStart);
            int end = lineEnd < 0 ? body.length() : lineEnd;
            if (body.substring(lineStart, end).strip().equals(heading)) {
                found = lineStart;
                if (!last) {
                    return found;
                }
            }
            if (lineEnd < 0) {
                break;
            }
            lineStart = lineEnd + 1;
        }
        return found;
    }

    private static String requiredString(Map<String, Object> fields, String key) {
        Object value = fields.get(key);
        if (!(value instanceof String) || ((String) value).isBlank()) {
            throw new TaskRecordException("Task record field '" + key + "' is missing or not text");
        }
        return ((String) value).trim();
    }

    private static String optionalString(Map<String, Object> fields, String key) {
        Object value = fields.get(key);
        return value == null ? null : String.valueOf(value);
    }

    private static Instant optionalInstant(Map<String, Object> fields, String key) {
        Object value = fields.get(key);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(String.valueOf(value));
        } catch (DateTimeParseException e) {
            throw new TaskRecordException("Task record field '" + key + "' is not an ISO-8601 instant", e);
        }
    }

    private static OriginalFile originalFile(Map<String, Object> fields) {
        Map<String, Object> original = optionalMap(fields, "original_file");
        if (original == null) {
            return null;
        }
        return new OriginalFile(
                optionalString(original, "name"),
                optionalString(original, "extension"),
                optionalNumber(original, "size_bytes").longValue(),
                optionalInstant(original, "discovered")
        );
    }

    private static ProcessingMetadata processing(Map<String, Object> fields) {
        Map<String, Object> meta = optionalMap(fields, "processing");
        if (meta == null) {
            return null;
        }
        return new ProcessingMetadata(
                optionalString(meta, "model"),
                optionalNumber(meta, "duration_seconds").doubleValue(),
                optionalNumber(meta, "tokens").longValue()
        );
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> optionalMap(Map<String, Object> fields, String key) {
        Object value = fields.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new TaskRecordException("Task record field '" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static Number optionalNumber(Map<String, Object> fields, String key) {
        Object value = fields.get(key);
        if (value == null) {
            return 0;
        }
        if (value instanceof Number) {
            return (Number) value;
        }
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new TaskRecordException("Task record field '" + key + "' must be numeric", e);
        }
    }

    private static List<String> flags(Map<String, Object> fields) {
        Object value = fields.get("flags");
        List<String> out = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                if (item != null) {
                    out.add(String.valueOf(item));
                }
            }
        } else if (value != null) {
            out.add(String.valueOf(value));
        }
        return out;
    }
}
