package com.omnifuzz.modules.payloads;

public enum PayloadSourceKind {

    SIMPLE_LIST("simple-list", "Simple list"),
    NUMBERS("numbers", "Numbers"),
    BRUTE_FORCE("brute-force", "Brute forcer"),
    NULL("null", "Null payloads"),
    CHARACTER_SUBSTITUTION("character-substitution", "Character substitution"),
    CASE_MODIFICATION("case-modification", "Case modification"),
    RECURSIVE_GREP("recursive-grep", "Recursive grep"),
    CUSTOM("custom", "Custom");

    private final String id;
    private final String displayName;

    PayloadSourceKind(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    public String getId() { return id; }
    public String getDisplayName() { return displayName; }

    @Override
    public String toString() { return displayName; }
}
