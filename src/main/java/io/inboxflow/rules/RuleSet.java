package io.inboxflow.rules;

import io.inboxflow.util.Texts;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Processing rules read from the handbook.
 */
public record RuleSet(
        List<String> summarization,
        List<String> toneStyle,
        List<String> specialInstructions,
        List<String> customFlags,
        Map<String, String> preferences,
        List<FlagRule> flagRules
) {
    public RuleSet {
        summarization = List.copyOf(summarization);
        toneStyle = List.copyOf(toneStyle);
        specialInstructions = List.copyOf(specialInstructions);
        customFlags = List.copyOf(customFlags);
        preferences = Collections.unmodifiableMap(new LinkedHashMap<>(preferences));
        flagRules = List.copyOf(flagRules);
    }

    public static RuleSet defaults(FlagRuleParser parser) {
        List<String> flags = List.of("Amount > $1000 → 💰 High-value");
        Map<String, String> preferences = new LinkedHashMap<>();
        preferences.put("summary_length", "150-200 words");
        preferences.put("action_item_format", "Checkboxes");
        preferences.put("date_format", "ISO 8601");
        preferences.put("time_zone", "UTC");
        return new RuleSet(
                List.of("Use 3 bullet points for summaries",
                        "Keep summaries under 200 words",
                        "Extract action items as checkboxes"),
                List.of("Professional and courteous", "Concise and clear", "Action-oriented"),
                List.of(),
                flags,
                preferences,
                parser.parseAll(flags)
        );
    }

    /**
     * Rules rendered as the prompt preamble handed to a summarizer.
     */
    public String processingContext() {
        StringBuilder sb = new StringBuilder("# Processing Rules\n\n");
        appendSection(sb, "Summarization", summarization);
        appendSection(sb, "Tone & Style", toneStyle);
        appendSection(sb, "Special Instructions", specialInstructions);
        appendSection(sb, "Custom Flags", customFlags);
        if (!preferences.isEmpty()) {
            sb.append("## Preferences:\n");
            for (Map.Entry<String, String> entry : preferences.entrySet()) {
                sb.append("- ").append(Texts.titleCase(entry.getKey())).append(": ").append(entry.getValue()).append('\n');
            }
        }
        return sb.toString();
    }

    private static void appendSection(StringBuilder sb, String title, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        sb.append("## ").append(title).append(":\n");
        for (String item : items) {
            sb.append("- ").append(item).append('\n');
        }
        sb.append('\n');
    }
}
