package io.inboxflow.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses custom flag lines of the form {@code <condition> → <flag>} ({@code ->} is accepted too).
 *
 * <p>Grammar version 1 knows three conditions:
 * <ul>
 *   <li>{@code Amount <op> $N}: any dollar amount in the content compared with N</li>
 *   <li>{@code Contains 'keyword'}: case-insensitive substring</li>
 *   <li>{@code Due date <op> N days}: a date in the content falls within N days from today</li>
 * </ul>
 * Anything else parses to {@link FlagRule.Kind#UNKNOWN} and never matches.
 */
public final class FlagRuleParser {
    public static final int GRAMMAR_VERSION = 1;

    static final Pattern DOLLAR_AMOUNT = Pattern.compile("\\$(\\d+(?:,\\d{3})*(?:\\.\\d+)?)");
    private static final Pattern OPERATOR = Pattern.compile("(>=|<=|==|=|>|<)");
    private static final Pattern QUOTED = Pattern.compile("['\"‘’“”]([^'\"‘’“”]+)['\"‘’“”]");
    private static final Pattern DAYS = Pattern.compile("(\\d+)\\s*days?", Pattern.CASE_INSENSITIVE);
    private static final String[] ARROWS = {"→", "->"};

    public List<FlagRule> parseAll(List<String> lines) {
        List<FlagRule> rules = new ArrayList<>();
        if (lines == null) {
            return rules;
        }
        for (String line : lines) {
            parse(line).ifPresent(rules::add);
        }
        return rules;
    }

    /**
     * @return empty when the line has no arrow or an empty side
     */
    public Optional<FlagRule> parse(String line) {
        if (line == null) {
            return Optional.empty();
        }
        for (String arrow : ARROWS) {
            int at = line.indexOf(arrow);
            if (at < 0) {
                continue;
            }
            String condition = line.substring(0, at).trim();
            String flag = line.substring(at + arrow.length()).trim();
            if (condition.isEmpty() || flag.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(parseCondition(condition, flag));
        }
        return Optional.empty();
    }

    private static FlagRule parseCondition(String condition, String flag) {
        String lower = condition.toLowerCase(Locale.ROOT);
        if (lower.startsWith("amount") || condition.contains("$")) {
            Matcher amount = DOLLAR_AMOUNT.matcher(condition);
            FlagRule.Comparison comparison = comparison(condition);
            if (!amount.find() || comparison == null) {
                return FlagRule.unknown(condition, flag);
            }
            return FlagRule.amount(condition, flag, comparison, parseAmount(amount.group(1)));
        }
        if (lower.startsWith("contains")) {
            Matcher quoted = QUOTED.matcher(condition);
            if (!quoted.find() || quoted.group(1).isBlank()) {
                return FlagRule.unknown(condition, flag);
            }
            return FlagRule.contains(condition, flag, quoted.group(1));
        }
        if (lower.startsWith("due date")) {
            Matcher days = DAYS.matcher(condition);
            if (!days.find()) {
                return FlagRule.unknown(condition, flag);
            }
            FlagRule.Comparison comparison = comparison(condition);
            return FlagRule.dueDate(condition, flag,
                    comparison == null ? FlagRule.Comparison.LESS_OR_EQUAL : comparison,
                    Integer.parseInt(days.group(1)));
        }
        return FlagRule.unknown(condition, flag);
    }

    private static FlagRule.Comparison comparison(String condition) {
        Matcher matcher = OPERATOR.matcher(condition);
        return matcher.find() ? FlagRule.Comparison.fromSymbol(matcher.group(1)) : null;
    }

    static double parseAmount(String raw) {
        return Double.parseDouble(raw.replace(",", ""));
    }
}
