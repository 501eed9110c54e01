package com.libragraph.revisions.util;

import com.libragraph.revisions.types.VersionBump;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * {@code MAJOR.MINOR.PATCH} revision version. Immutable.
 */
public record SemanticVersion(int major, int minor, int patch) {

    public static final SemanticVersion INITIAL = new SemanticVersion(1, 0, 0);

    private static final Pattern FORMAT = Pattern.compile("^\\d+\\.\\d+\\.\\d+$");

    public SemanticVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException(
                    "Version components must be non-negative: " + major + "." + minor + "." + patch);
        }
    }

    /**
     * Parses {@code "x.y.z"}.
     *
     * @throws IllegalArgumentException if the string is not three dot-separated integers
     */
    public static SemanticVersion parse(String version) {
        Objects.requireNonNull(version, "version cannot be null");
        if (!FORMAT.matcher(version).matches()) {
            throw new IllegalArgumentException("Invalid version string: " + version);
        }
        String[] parts = version.split("\\.");
        try {
            return new SemanticVersion(
                    Integer.parseInt(parts[0]),
                    Integer.parseInt(parts[1]),
                    Integer.parseInt(parts[2]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Version component out of range: " + version, e);
        }
    }

    public static boolean isValid(String version) {
        if (version == null) return false;
        try {
            parse(version);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /** Returns the next version; lower components reset to zero. */
    public SemanticVersion bump(VersionBump bump) {
        return switch (bump) {
            case MAJOR -> new SemanticVersion(major + 1, 0, 0);
            case MINOR -> new SemanticVersion(major, minor + 1, 0);
            case PATCH -> new SemanticVersion(major, minor, patch + 1);
        };
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
