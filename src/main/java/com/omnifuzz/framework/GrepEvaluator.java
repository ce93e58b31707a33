package com.omnifuzz.framework;

import com.omnifuzz.model.ConfigurationException;
import com.omnifuzz.model.GrepMode;
import com.omnifuzz.model.GrepRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Applies match/extract rules to a response. Rules are evaluated against the
 * full raw response (status line, headers, blank line and body).
 * Regexes are compiled once, when the evaluator is built; evaluation never throws.
 */
public class GrepEvaluator {

    private static final GrepEvaluator NONE = new GrepEvaluator();

    private final List<CompiledRule> rules;

    private GrepEvaluator() {
        this.rules = List.of();
    }

    public GrepEvaluator(List<GrepRule> grepRules) throws ConfigurationException {
        List<CompiledRule> compiled = new ArrayList<>(grepRules.size());
        Set<String> ids = new HashSet<>();
        for (GrepRule rule : grepRules) {
            if (!ids.add(rule.getId())) {
                throw new ConfigurationException("Duplicate grep rule id: " + rule.getId());
            }
            if (!rule.isEnabled()) continue;
            compiled.add(new CompiledRule(rule, compile(rule)));
        }
        this.rules = List.copyOf(compiled);
    }

    public static GrepEvaluator none() {
        return NONE;
    }

    private static Pattern compile(GrepRule rule) throws ConfigurationException {
        if (!rule.isRegex()) return null;
        try {
            return Pattern.compile(rule.getPattern());
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid regex in grep rule " + rule.getId()
                    + ": " + e.getDescription(), e);
        }
    }

    public Outcome evaluate(String rawResponse) {
        if (rawResponse == null || rules.isEmpty()) {
            return Outcome.EMPTY;
        }
        Map<String, Boolean> matches = new LinkedHashMap<>();
        Map<String, String> extractions = new LinkedHashMap<>();
        for (CompiledRule r : rules) {
            GrepRule rule = r.rule();
            if (rule.getMode() == GrepMode.MATCH) {
                matches.put(rule.getId(), match(r, rawResponse));
            } else {
                String value = extract(r, rawResponse);
                if (value != null) {
                    extractions.put(rule.getId(), value);
                }
            }
        }
        return new Outcome(matches, extractions);
    }

    // Backtracking patterns such as (a|b)*c can exhaust the stack on large
    // responses; the rule then reports no match or extraction for that response.
    private static boolean match(CompiledRule r, String rawResponse) {
        if (r.pattern() == null) {
            return rawResponse.contains(r.rule().getPattern());
        }
        try {
            return r.pattern().matcher(rawResponse).find();
        } catch (StackOverflowError e) {
            return false;
        }
    }

    private static String extract(CompiledRule r, String rawResponse) {
        if (r.pattern() == null) {
            String literal = r.rule().getPattern();
            return rawResponse.contains(literal) ? literal : null;
        }
        try {
            Matcher m = r.pattern().matcher(rawResponse);
            if (!m.find()) return null;
            if (m.groupCount() >= 1) {
                // an optional group 1 that did not participate counts as no extraction
                return m.group(1);
            }
            return m.group();
        } catch (StackOverflowError e) {
            return null;
        }
    }

    private record CompiledRule(GrepRule rule, Pattern pattern) {}

    /** Matches and extractions for one response. */
    public static class Outcome {

        static final Outcome EMPTY = new Outcome(Map.of(), Map.of());

        private final Map<String, Boolean> matches;
        private final Map<String, String> extractions;

        Outcome(Map<String, Boolean> matches, Map<String, String> extractions) {
            this.matches = Collections.unmodifiableMap(matches);
            this.extractions = Collections.unmodifiableMap(extractions);
        }

        public Map<String, Boolean> getMatches() { return matches; }
        public Map<String, String> getExtractions() { return extractions; }
    }
}
