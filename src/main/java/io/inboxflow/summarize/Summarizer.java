package io.inboxflow.summarize;

import io.inboxflow.rules.RuleSet;

import java.util.List;

public interface Summarizer {
    String id();

    SummaryResult summarize(String content, RuleSet rules, List<String> flags) throws Exception;
}
