package io.inboxflow.rules;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class FlagRuleParserTest {
    private final FlagRuleParser parser = new FlagRuleParser();

    @Test
    void parsesAmountRuleWithThousandsSeparator() {
        FlagRule rule = parser.parse("Amount >= $1,250.50 → 💰 High-value").orElseThrow();

        assertEquals(FlagRule.Kind.AMOUNT, rule.kind());
        assertEquals(FlagRule.Comparison.GREATER_OR_EQUAL, rule.comparison());
        assertEquals(1250.50d, rule.threshold(), 1e-9);
        assertEquals("💰 High-value", rule.flag());
        assertEquals("Amount >= $1,250.50", rule.condition());
    }

    @Test
    void acceptsAsciiArrow() {
        FlagRule rule = parser.parse("Contains \"invoice\" -> 🧾 Invoice").orElseThrow();

        assertEquals(FlagRule.Kind.CONTAINS, rule.kind());
        assertEquals("invoice", rule.keyword());
        assertEquals("🧾 Invoice", rule.flag());
    }

    @Test
    void dueDateDefaultsToWithinWhenNoOperatorIsGiven() {
        FlagRule explicit = parser.parse("Due date < 7 days → ⏰ Due soon").orElseThrow();
        FlagRule implicit = parser.parse("Due date within 3 days → ⏰ Due soon").orElseThrow();

        assertEquals(FlagRule.Comparison.LESS, explicit.comparison());
        assertEquals(7, explicit.days());
        assertEquals(FlagRule.Comparison.LESS_OR_EQUAL, implicit.comparison());
        assertEquals(3, implicit.days());
    }

    @Test
    void unrecognizedConditionsAreKeptAsUnknown() {
        assertEquals(FlagRule.Kind.UNKNOWN, parser.parse("Sender is boss → 👔 Boss").orElseThrow().kind());
        assertEquals(FlagRule.Kind.UNKNOWN, parser.parse("Contains urgent → 🔥").orElseThrow().kind());
        assertEquals(FlagRule.Kind.UNKNOWN, parser.parse("Amount is large → 💰").orElseThrow().kind());
    }

    @Test
    void linesWithoutArrowOrWithEmptySidesAreSkipped() {
        assertEquals(Optional.empty(), parser.parse("Amount > $1000"));
        assertEquals(Optional.empty(), parser.parse("→ 💰 High-value"));
        assertEquals(Optional.empty(), parser.parse("Amount > $1000 →   "));
        assertEquals(Optional.empty(), parser.parse(null));

        List<FlagRule> rules = parser.parseAll(List.of("no arrow here", "Contains 'x' → X"));
        assertEquals(1, rules.size());
        assertTrue(parser.parseAll(null).isEmpty());
    }
}
