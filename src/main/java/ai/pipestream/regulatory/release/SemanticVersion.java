package ai.pipestream.regulatory.release;

import ai.pipestream.regulatory.entity.ReleaseType;

import java.util.Comparator;

/**
 * {@code major.minor.patch}; releases start from {@link #BASELINE}.
 */
public record SemanticVersion(int major, int minor, int patch) implements Comparable<SemanticVersion> {

    public static final SemanticVersion BASELINE = new SemanticVersion(0, 0, 0);

    private static final Comparator<SemanticVersion> ORDER = Comparator
            .comparingInt(SemanticVersion::major)
            .thenComparingInt(SemanticVersion::minor)
            .thenComparingInt(SemanticVersion::patch);

    public SemanticVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Version components must be non-negative");
        }
    }

    public static SemanticVersion parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Version is null");
        }
        String[] parts = text.trim().split("\\.");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Not a semantic version: " + text);
        }
        try {
            return new SemanticVersion(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]),
                    Integer.parseInt(parts[2]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a semantic version: " + text, e);
        }
    }

    public SemanticVersion bump(ReleaseType type) {
        return switch (type) {
            case MAJOR -> new SemanticVersion(major + 1, 0, 0);
            case MINOR -> new SemanticVersion(major, minor + 1, 0);
            case PATCH -> new SemanticVersion(major, minor, patch + 1);
        };
    }

    @Override
    public int compareTo(SemanticVersion other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
