package com.omnifuzz.model;

/**
 * How positions and payload sources combine into request plans.
 */
public enum AttackStrategy {

    SINGLE_SET_ROTATE("single-set-rotate", "Sniper", true),
    SINGLE_SET_BROADCAST("single-set-broadcast", "Battering Ram", true),
    LOCKSTEP("lockstep", "Pitchfork", false),
    CARTESIAN("cartesian", "Cluster Bomb", false);

    private final String id;
    private final String displayName;
    private final boolean singleSource;

    AttackStrategy(String id, String displayName, boolean singleSource) {
        this.id = id;
        this.displayName = displayName;
        this.singleSource = singleSource;
    }

    public String getId() { return id; }
    public String getDisplayName() { return displayName; }

    /** True when the strategy takes exactly one payload source for all positions. */
    public boolean isSingleSource() { return singleSource; }

    public static AttackStrategy fromId(String id) {
        for (AttackStrategy s : values()) {
            if (s.id.equalsIgnoreCase(id)) return s;
        }
        throw new IllegalArgumentException("Unknown attack strategy: " + id);
    }

    @Override
    public String toString() { return displayName; }
}
