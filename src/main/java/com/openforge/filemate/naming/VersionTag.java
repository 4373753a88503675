package com.openforge.filemate.naming;

import java.util.Comparator;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A {@code vMAJOR.MINOR[.PATCH]} tag as it appears in archived file names.
 *
 * @param patch null when the tag has no patch component; compared as 0
 */
public record VersionTag(int major, int minor, Integer patch) implements Comparable<VersionTag> {

    static final Pattern PATTERN = Pattern.compile("v(\\d+)\\.(\\d+)(?:\\.(\\d+))?", Pattern.CASE_INSENSITIVE);

    private static final Comparator<VersionTag> ORDER = Comparator
            .comparingInt(VersionTag::major)
            .thenComparingInt(VersionTag::minor)
            .thenComparingInt(VersionTag::patchOrZero);

    public VersionTag {
        if (major < 0 || minor < 0 || (patch != null && patch < 0)) {
            throw new IllegalArgumentException("version components must be non-negative");
        }
    }

    public static VersionTag of(int major, int minor) {
        return new VersionTag(major, minor, null);
    }

    public static VersionTag of(int major, int minor, int patch) {
        return new VersionTag(major, minor, patch);
    }

    /** Parses a tag such as "v1.2" or "V1.2.3"; the whole text must be the tag. */
    public static VersionTag parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("version must not be null");
        }
        Matcher m = PATTERN.matcher(text.strip());
        if (!m.matches()) {
            throw new IllegalArgumentException("not a version tag: " + text);
        }
        return fromMatch(m);
    }

    /** The last tag embedded in a file stem, e.g. "plan_v1.2_v1.3" → v1.3. */
    public static Optional<VersionTag> findIn(String stem) {
        if (stem == null) {
            return Optional.empty();
        }
        Matcher m = PATTERN.matcher(stem);
        VersionTag last = null;
        while (m.find()) {
            try {
                last = fromMatch(m);
            } catch (IllegalArgumentException ignored) {
                // digits beyond int range are not a version
            }
        }
        return Optional.ofNullable(last);
    }

    public int patchOrZero() {
        return patch == null ? 0 : patch;
    }

    /**
     * @throws ArithmeticException the component to advance is already {@link Integer#MAX_VALUE}
     */
    public VersionTag next(VersionFormat format) {
        return format == VersionFormat.SEMANTIC
                ? new VersionTag(major, minor, Math.addExact(patchOrZero(), 1))
                : new VersionTag(major, Math.addExact(minor, 1), null);
    }

    public boolean canAdvance(VersionFormat format) {
        return format == VersionFormat.SEMANTIC
                ? patchOrZero() < Integer.MAX_VALUE
                : minor < Integer.MAX_VALUE;
    }

    /** Same tag written in the given format: a semantic tag always carries a patch. */
    public VersionTag in(VersionFormat format) {
        return format == VersionFormat.SEMANTIC && patch == null
                ? new VersionTag(major, minor, 0)
                : this;
    }

    @Override
    public int compareTo(VersionTag other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return patch == null
                ? "v" + major + "." + minor
                : "v" + major + "." + minor + "." + patch;
    }

    private static VersionTag fromMatch(Matcher m) {
        try {
            return new VersionTag(
                    Integer.parseInt(m.group(1)),
                    Integer.parseInt(m.group(2)),
                    m.group(3) == null ? null : Integer.parseInt(m.group(3)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("version component out of range: " + m.group(), e);
        }
    }
}
