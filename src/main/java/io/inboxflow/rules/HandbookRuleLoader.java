package io.inboxflow.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads rules from {@code Company_Handbook.md}. The file is re-read on every call so edits take
 * effect on the next batch.
 */
public final class HandbookRuleLoader implements RuleLoader {
    static final String SUMMARIZATION = "### Summarization";
    static final String TONE_STYLE = "### Tone & Style";
    static final String SPECIAL_INSTRUCTIONS = "### Special Instructions";
    static final String CUSTOM_FLAGS = "## Custom Flags";
    static final String PREFERENCES = "## Preferences";
    private static final Pattern PREFERENCE = Pattern.compile("^- \\*\\*(.+?)\\*\\*:\\s*(.+)$");

    private final Path handbookFile;
    private final FlagRuleParser parser;
    private final Logger log;

    public HandbookRuleLoader(Path handbookFile) {
        this(handbookFile, new FlagRuleParser(), LoggerFactory.getLogger(HandbookRuleLoader.class));
    }

    public HandbookRuleLoader(Path handbookFile, FlagRuleParser parser, Logger log) {
        this.handbookFile = handbookFile;
        this.parser = parser;
        this.log = log;
    }

    @Override
    public RuleSet loadRules() {
        if (!Files.isRegularFile(handbookFile)) {
            log.debug("No handbook at {}, using default rules", handbookFile);
            return RuleSet.defaults(parser);
        }
        String content;
        try {
            content = Files.readString(handbookFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not read handbook {}, using default rules: {}", handbookFile, e.getMessage());
            return RuleSet.defaults(parser);
        }
        return parse(content);
    }

    RuleSet parse(String content) {
        List<String> lines = content.replace("\r\n", "\n").lines().toList();
        List<String> customFlags = bullets(lines, CUSTOM_FLAGS);
        return new RuleSet(
                bullets(lines, SUMMARIZATION),
                bullets(lines, TONE_STYLE),
                bullets(lines, SPECIAL_INSTRUCTIONS),
                customFlags,
                preferences(lines),
                parser.parseAll(customFlags)
        );
    }

    private static List<String> bullets(List<String> lines, String header) {
        List<String> items = new ArrayList<>();
        for (String line : section(lines, header)) {
            String trimmed = line.strip();
            if (trimmed.startsWith("- ")) {
                items.add(trimmed.substring(2).strip());
            }
        }
        return items;
    }

    private static Map<String, String> preferences(List<String> lines) {
        Map<String, String> preferences = new LinkedHashMap<>();
        for (String line : section(lines, PREFERENCES)) {
            Matcher matcher = PREFERENCE.matcher(line.strip());
            if (matcher.matches()) {
                String key = matcher.group(1).trim().toLowerCase(Locale.ROOT).replace(' ', '_');
                preferences.put(key, matcher.group(2).trim());
            }
        }
        return preferences;
    }

    /**
     * Lines after the first heading equal to {@code header}, up to the next heading of level two or
     * three.
     */
    private static List<String> section(List<String> lines, String header) {
        List<String> out = new ArrayList<>();
        boolean inside = false;
        for (String line : lines) {
            String trimmed = line.strip();
            if (inside) {
                if (trimmed.startsWith("##")) {
                    break;
                }
                out.add(line);
            } else if (trimmed.equals(header)) {
                inside = true;
            }
        }
        return out;
    }
}
