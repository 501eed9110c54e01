package com.libragraph.revisions.types;

/**
 * Which component of a semantic version a new revision increments.
 */
public enum VersionBump {
    MAJOR("major"),
    MINOR("minor"),
    PATCH("patch");

    private final String label;

    VersionBump(String label) {
        this.label = label;
    }

    /** Parses a label; null or blank selects {@link #MINOR}. */
    public static VersionBump fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return MINOR;
        }
        for (VersionBump b : values()) {
            if (b.label.equalsIgnoreCase(label.trim())) return b;
        }
        throw new IllegalArgumentException("Unknown version type: " + label);
    }
}
