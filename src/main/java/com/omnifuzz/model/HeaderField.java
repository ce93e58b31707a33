package com.omnifuzz.model;

import java.util.Objects;

public class HeaderField {

    private final String name;
    private final String value;

    public HeaderField(String name, String value) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.value = value != null ? value : "";
    }

    public String getName() { return name; }
    public String getValue() { return value; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HeaderField that = (HeaderField) o;
        return name.equals(that.name) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value);
    }

    @Override
    public String toString() {
        return name + ": " + value;
    }
}
