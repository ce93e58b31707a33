package com.omnifuzz.model;

public enum GrepMode {
    MATCH,
    EXTRACT
}
