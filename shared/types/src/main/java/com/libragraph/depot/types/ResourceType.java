package com.libragraph.depot.types;

public enum ResourceType {
    ARTIFACT("artifact"),
    ARTIFACT_VERSION("artifact_version"),
    BINARY("binary"),
    BUNDLE("bundle"),
    SIGNING_KEY("signing_key");

    private final String label;

    ResourceType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ResourceType fromLabel(String label) {
        for (ResourceType t : values()) {
            if (t.label.equals(label)) return t;
        }
        throw new IllegalArgumentException("Unknown resource type: " + label);
    }
}
