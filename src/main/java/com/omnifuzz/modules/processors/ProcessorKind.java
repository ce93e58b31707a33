package com.omnifuzz.modules.processors;

public enum ProcessorKind {

    URL_ENCODE("url-encode"),
    URL_ENCODE_KEY_CHARS("url-encode-key-chars"),
    URL_DECODE("url-decode"),
    HTML_ENCODE("html-encode"),
    HTML_DECODE("html-decode"),
    BASE64_ENCODE("base64-encode"),
    BASE64_DECODE("base64-decode"),
    HASH("hash"),
    ADD_PREFIX("add-prefix"),
    ADD_SUFFIX("add-suffix"),
    MATCH_REPLACE("match-replace"),
    REVERSE("reverse"),
    LOWERCASE("lowercase"),
    UPPERCASE("uppercase");

    private final String id;

    ProcessorKind(String id) {
        this.id = id;
    }

    public String getId() { return id; }

    public static ProcessorKind fromId(String id) {
        for (ProcessorKind k : values()) {
            if (k.id.equalsIgnoreCase(id)) return k;
        }
        throw new IllegalArgumentException("Unknown processor: " + id);
    }

    @Override
    public String toString() { return id; }
}
