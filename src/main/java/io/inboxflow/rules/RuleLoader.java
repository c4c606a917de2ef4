package io.inboxflow.rules;

public interface RuleLoader {
    RuleSet loadRules();
}
