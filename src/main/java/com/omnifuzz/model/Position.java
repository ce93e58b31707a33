package com.omnifuzz.model;

import java.util.Objects;

/**
 * A substitution span in the base request template. Offsets are half-open
 * char indices into the template text.
 */
public class Position {

    private final String id;
    private final int start;
    private final int end;
    private final String label;

    public Position(String id, int start, int end, String label) {
        this.id = Objects.requireNonNull(id, "id is required");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ") for position " + id);
        }
        this.start = start;
        this.end = end;
        this.label = label != null ? label : id;
    }

    public static Position of(String id, int start, int end) {
        return new Position(id, start, end, id);
    }

    public String getId() { return id; }
    public int getStart() { return start; }
    public int getEnd() { return end; }
    public String getLabel() { return label; }

    public int length() { return end - start; }

    /** The template text this position covers. */
    public String originalText(String template) {
        return template.substring(start, end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Position p = (Position) o;
        return start == p.start && end == p.end && id.equals(p.id) && label.equals(p.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, start, end, label);
    }

    @Override
    public String toString() {
        return label + "[" + start + "," + end + ")";
    }
}
