package com.omnifuzz.model;

import java.util.Objects;

/**
 * A match or extract rule evaluated against every response.
 */
public class GrepRule {

    private final String id;
    private final GrepMode mode;
    private final String pattern;
    private final boolean regex;
    private final boolean enabled;

    public GrepRule(String id, GrepMode mode, String pattern, boolean regex, boolean enabled) {
        this.id = Objects.requireNonNull(id, "id is required");
        this.mode = Objects.requireNonNull(mode, "mode is required");
        this.pattern = Objects.requireNonNull(pattern, "pattern is required");
        this.regex = regex;
        this.enabled = enabled;
    }

    public static GrepRule match(String id, String pattern, boolean regex) {
        return new GrepRule(id, GrepMode.MATCH, pattern, regex, true);
    }

    public static GrepRule extract(String id, String pattern, boolean regex) {
        return new GrepRule(id, GrepMode.EXTRACT, pattern, regex, true);
    }

    public String getId() { return id; }
    public GrepMode getMode() { return mode; }
    public String getPattern() { return pattern; }
    public boolean isRegex() { return regex; }
    public boolean isEnabled() { return enabled; }

    @Override
    public String toString() {
        return mode + "(" + id + ": " + (regex ? "/" + pattern + "/" : "\"" + pattern + "\"") + ")";
    }
}
