package io.inboxflow.codec;

import java.util.Map;

/**
 * Reads and writes markdown documents that start with a structured header block.
 */
public interface FrontmatterCodec {
    String encode(Map<String, Object> fields, String body);

    /**
     * @throws FrontmatterException when a header block is present but cannot be parsed
     */
    Frontmatter decode(String content);
}
