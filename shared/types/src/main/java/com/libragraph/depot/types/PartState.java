package com.libragraph.depot.types;

/**
 * Validity of one uploaded binary part as reported by the registry.
 */
public enum PartState {
    PENDING("pending"),
    VALID("valid"),
    UNRECOGNIZED("unrecognized");

    private final String wireName;

    PartState(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static PartState fromWireName(String name) {
        if (name == null) return UNRECOGNIZED;
        for (PartState s : values()) {
            if (s.wireName.equalsIgnoreCase(name)) return s;
        }
        return UNRECOGNIZED;
    }
}
