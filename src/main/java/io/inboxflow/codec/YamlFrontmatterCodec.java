package io.inboxflow.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import java.util.LinkedHashMap;
import java.util.Map;

public final class YamlFrontmatterCodec implements FrontmatterCodec {
    private static final String DELIMITER = "---";

    private final YAMLMapper mapper;

    public YamlFrontmatterCodec() {
        this.mapper = new YAMLMapper(YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
                .build());
    }

    @Override
    public String encode(Map<String, Object> fields, String body) {
        String yaml;
        try {
            yaml = mapper.writeValueAsString(fields == null ? Map.of() : fields);
        } catch (JsonProcessingException e) {
            throw new FrontmatterException("Failed to serialize frontmatter", e);
        }
        StringBuilder sb = new StringBuilder();
        sb.append(DELIMITER).append('\n').append(yaml);
        if (!yaml.endsWith("\n")) {
            sb.append('\n');
        }
        sb.append(DELIMITER).append("\n\n");
        sb.append(body == null ? "" : body);
        return sb.toString();
    }

    @Override
    public Frontmatter decode(String content) {
        if (content == null) {
            return new Frontmatter(Map.of(), "");
        }
        String normalized = content.replace("\r\n", "\n");
        if (!normalized.startsWith(DELIMITER + "\n")) {
            return new Frontmatter(Map.of(), normalized);
        }
        int headerStart = DELIMITER.length() + 1;
        int closing = findClosingDelimiter(normalized, headerStart);
        if (closing < 0) {
            throw new FrontmatterException("Frontmatter block is not terminated");
        }
        String header = normalized.substring(headerStart, closing);
        int bodyStart = normalized.indexOf('\n', closing);
        String body = bodyStart < 0 ? "" : stripLeadingBlankLine(normalized.substring(bodyStart + 1));
        return new Frontmatter(parseHeader(header), body);
    }

    private Map<String, Object> parseHeader(String header) {
        if (header.isBlank()) {
            return Map.of();
        }
        JsonNode node;
        try {
            node = mapper.readTree(header);
        } catch (JsonProcessingException e) {
            throw new FrontmatterException("Malformed frontmatter: " + e.getOriginalMessage(), e);
        } catch (RuntimeException e) {
            throw new FrontmatterException("Malformed frontmatter: " + e.getMessage(), e);
        }
        if (node == null || node.isMissingNode() || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new FrontmatterException("Frontmatter must be a mapping, found " + node.getNodeType());
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> fields = mapper.convertValue(node, LinkedHashMap.class);
        return fields;
    }

    private static int findClosingDelimiter(String content, int from) {
        int lineStart = from;
        while (lineStart <= content.length()) {
            int lineEnd = content.indexOf('\n', lineStart);
            String line = lineEnd < 0 ? content.substring(lineStart) : content.substring(lineStart, lineEnd);
            if (line.strip().equals(DELIMITER)) {
                return lineStart;
            }
            if (lineEnd < 0) {
                return -1;
            }
            lineStart = lineEnd + 1;
        }
        return -1;
    }

    private static String stripLeadingBlankLine(String body) {
        return body.startsWith("\n") ? body.substring(1) : body;
    }
}
