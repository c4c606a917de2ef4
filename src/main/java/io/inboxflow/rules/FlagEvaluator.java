package io.inboxflow.rules;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies parsed flag rules to a piece of content. Has no side effects.
 */
public final class FlagEvaluator {
    private static final Pattern ISO_DATE = Pattern.compile("\\b(\\d{4})-(\\d{2})-(\\d{2})\\b");
    private static final Pattern US_DATE = Pattern.compile("\\b(\\d{1,2})/(\\d{1,2})/(\\d{4})\\b");
    private static final Pattern LONG_DATE = Pattern.compile(
            "\\b(January|February|March|April|May|June|July|August|September|October|November|December)"
                    + "\\s+(\\d{1,2}),?\\s+(\\d{4})\\b",
            Pattern.CASE_INSENSITIVE);

    public List<String> evaluate(List<FlagRule> rules, String content, LocalDate today) {
        Set<String> flags = new LinkedHashSet<>();
        if (rules == null || content == null) {
            return new ArrayList<>();
        }
        for (FlagRule rule : rules) {
            if (matches(rule, content, today)) {
                flags.add(rule.flag());
            }
        }
        return new ArrayList<>(flags);
    }

    public boolean matches(FlagRule rule, String content, LocalDate today) {
        switch (rule.kind()) {
            case AMOUNT:
                return matchesAmount(rule, content);
            case CONTAINS:
                return content.toLowerCase(Locale.ROOT).contains(rule.keyword().toLowerCase(Locale.ROOT));
            case DUE_DATE:
                return matchesDueDate(rule, content, today);
            default:
                return false;
        }
    }

    private static boolean matchesAmount(FlagRule rule, String content) {
        Matcher matcher = FlagRuleParser.DOLLAR_AMOUNT.matcher(content);
        while (matcher.find()) {
            if (rule.comparison().test(FlagRuleParser.parseAmount(matcher.group(1)), rule.threshold())) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesDueDate(FlagRule rule, String content, LocalDate today) {
        for (LocalDate date : datesIn(content)) {
            long daysUntil = ChronoUnit.DAYS.between(today, date);
            if (daysUntil >= 0 && rule.comparison().test(daysUntil, rule.days())) {
                return true;
            }
        }
        return false;
    }

    static List<LocalDate> datesIn(String content) {
        List<LocalDate> dates = new ArrayList<>();
        Matcher iso = ISO_DATE.matcher(content);
        while (iso.find()) {
            addDate(dates, iso.group(1), iso.group(2), iso.group(3));
        }
        Matcher us = US_DATE.matcher(content);
        while (us.find()) {
            addDate(dates, us.group(3), us.group(1), us.group(2));
        }
        Matcher longForm = LONG_DATE.matcher(content);
        while (longForm.find()) {
            Month month = Month.valueOf(longForm.group(1).toUpperCase(Locale.ROOT));
            addDate(dates, longForm.group(3), String.valueOf(month.getValue()), longForm.group(2));
        }
        return dates;
    }

    private static void addDate(List<LocalDate> dates, String year, String month, String day) {
        try {
            dates.add(LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day)));
        } catch (DateTimeException e) {
            // Not a real calendar date, e.g. 02/30/2025.
        }
    }
}
