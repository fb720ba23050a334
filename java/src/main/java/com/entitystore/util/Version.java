package com.entitystore.util;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Dotted schema version ({@code major.minor.patch}).
 */
@Getter
@EqualsAndHashCode
public final class Version implements Comparable<Version> {

    private final int major;
    private final int minor;
    private final int patch;

    private Version(int major, int minor, int patch) {
        this.major = major;
        this.minor = minor;
        this.patch = patch;
    }

    public static Version of(int major, int minor, int patch) {
        return new Version(major, minor, patch);
    }

    public static Version fromString(String value) {
        String[] parts = value == null ? new String[0] : value.trim().split("\\.");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Invalid version string: " + value);
        }
        try {
            return new Version(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), Integer.parseInt(parts[2]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid version string: " + value, e);
        }
    }

    public boolean isNewerThan(Version other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(Version other) {
        if (major != other.major) {
            return Integer.compare(major, other.major);
        }
        if (minor != other.minor) {
            return Integer.compare(minor, other.minor);
        }
        return Integer.compare(patch, other.patch);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
