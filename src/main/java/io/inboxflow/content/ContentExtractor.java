package io.inboxflow.content;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Turns a dropped file into the text stored as a task's original content.
 */
public interface ContentExtractor {
    /**
     * @throws IOException when the file cannot be read at all; unparseable content is described
     *                     in the returned text instead
     */
    String extract(Path file) throws IOException;

    /**
     * Task type assigned before any analysis, derived from the file kind.
     */
    String initialType(Path file);
}
