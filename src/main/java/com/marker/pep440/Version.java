package com.marker.pep440;

import com.marker.exception.VersionParseException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A PEP 440 version such as {@code 1!2.0.1rc1.post2.dev3+local.7}.
 * <p>
 * Immutable. Equality and ordering follow the PEP 440 total order, so {@code 3.6}
 * and {@code 3.6.0} are equal.
 */
public final class Version implements Comparable<Version> {

    private static final Pattern VERSION_PATTERN = Pattern.compile(
            "^\\s*v?"
                    + "(?:(?<epoch>[0-9]+)!)?"
                    + "(?<release>[0-9]+(?:\\.[0-9]+)*)"
                    + "(?:[-_.]?(?<preL>alpha|a|beta|b|preview|pre|c|rc)[-_.]?(?<preN>[0-9]+)?)?"
                    + "(?:-(?<postImplicit>[0-9]+)|[-_.]?(?<postL>post|rev|r)[-_.]?(?<postN>[0-9]+)?)?"
                    + "(?:[-_.]?(?<devL>dev)[-_.]?(?<devN>[0-9]+)?)?"
                    + "(?:\\+(?<local>[a-z0-9]+(?:[-_.][a-z0-9]+)*))?"
                    + "\\s*$",
            Pattern.CASE_INSENSITIVE);

    /**
     * Pre-release phases in PEP 440 order.
     */
    public enum PreKind {
        ALPHA("a"),
        BETA("b"),
        RC("rc");

        private final String label;

        PreKind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }

        static PreKind fromLabel(String label) {
            return switch (label.toLowerCase(Locale.ROOT)) {
                case "a", "alpha" -> ALPHA;
                case "b", "beta" -> BETA;
                default -> RC;
            };
        }
    }

    private final long epoch;
    private final long[] release;
    private final PreKind preKind;
    private final long preNumber;
    private final Long post;
    private final Long dev;
    private final List<String> local;

    private Version(long epoch, long[] release, PreKind preKind, long preNumber,
                    Long post, Long dev, List<String> local) {
        if (release.length == 0) {
            throw new IllegalArgumentException("Release must have at least one segment");
        }
        this.epoch = epoch;
        this.release = release;
        this.preKind = preKind;
        this.preNumber = preNumber;
        this.post = post;
        this.dev = dev;
        this.local = local;
    }

    /**
     * Create a plain release version such as {@code 3.11}.
     */
    public static Version of(long... release) {
        return new Version(0, release.clone(), null, 0, null, null, List.of());
    }

    /**
     * Parse a PEP 440 version.
     *
     * @param text Version text, e.g. "3.8" or "1.0rc1"
     * @return Parsed version
     * @throws VersionParseException if the text is not a valid version
     */
    public static Version parse(String text) {
        if (text == null) {
            throw new VersionParseException("Version cannot be null");
        }
        Matcher m = VERSION_PATTERN.matcher(text);
        if (!m.matches()) {
            throw new VersionParseException("Version `" + text + "` doesn't match PEP 440 rules");
        }

        try {
            long epoch = m.group("epoch") == null ? 0 : Long.parseLong(m.group("epoch"));
            long[] release = Arrays.stream(m.group("release").split("\\."))
                    .mapToLong(Long::parseLong)
                    .toArray();

            PreKind preKind = null;
            long preNumber = 0;
            if (m.group("preL") != null) {
                preKind = PreKind.fromLabel(m.group("preL"));
                preNumber = m.group("preN") == null ? 0 : Long.parseLong(m.group("preN"));
            }

            Long post = null;
            if (m.group("postImplicit") != null) {
                post = Long.parseLong(m.group("postImplicit"));
            } else if (m.group("postL") != null) {
                post = m.group("postN") == null ? 0L : Long.parseLong(m.group("postN"));
            }

            Long dev = null;
            if (m.group("devL") != null) {
                dev = m.group("devN") == null ? 0L : Long.parseLong(m.group("devN"));
            }

            List<String> local = List.of();
            if (m.group("local") != null) {
                local = Arrays.stream(m.group("local").toLowerCase(Locale.ROOT).split("[-_.]"))
                        .map(Version::normalizeLocalSegment)
                        .collect(Collectors.toUnmodifiableList());
            }

            return new Version(epoch, release, preKind, preNumber, post, dev, local);
        } catch (NumberFormatException e) {
            throw new VersionParseException("Version `" + text + "` has a segment that is too large");
        }
    }

    private static String normalizeLocalSegment(String segment) {
        if (isNumeric(segment)) {
            return String.valueOf(Long.parseLong(segment));
        }
        return segment;
    }

    private static boolean isNumeric(String segment) {
        return !segment.isEmpty() && segment.chars().allMatch(Character::isDigit);
    }

    public long epoch() {
        return epoch;
    }

    /**
     * Release segments, e.g. [3, 8, 1] for 3.8.1.
     */
    public List<Long> release() {
        List<Long> segments = new ArrayList<>(release.length);
        for (long segment : release) {
            segments.add(segment);
        }
        return Collections.unmodifiableList(segments);
    }

    public List<String> local() {
        return local;
    }

    public boolean isPre() {
        return preKind != null;
    }

    public boolean isPost() {
        return post != null;
    }

    public boolean isDev() {
        return dev != null;
    }

    public boolean isLocal() {
        return !local.isEmpty();
    }

    /**
     * Whether this is an alpha/beta/rc or dev version.
     */
    public boolean anyPrerelease() {
        return isPre() || isDev();
    }

    /**
     * This version with the local segment removed.
     */
    public Version withoutLocal() {
        if (local.isEmpty()) {
            return this;
        }
        return new Version(epoch, release, preKind, preNumber, post, dev, List.of());
    }

    /**
     * This version with the given release segments and the same epoch, without any
     * pre, post, dev or local part.
     */
    public Version withRelease(List<Long> segments) {
        long[] copy = segments.stream().mapToLong(Long::longValue).toArray();
        return new Version(epoch, copy, null, 0, null, null, List.of());
    }

    /**
     * Compare only the release segments, padding the shorter one with zeros.
     */
    public static int compareRelease(Version left, Version right) {
        int length = Math.max(left.release.length, right.release.length);
        for (int i = 0; i < length; i++) {
            long l = i < left.release.length ? left.release[i] : 0;
            long r = i < right.release.length ? right.release[i] : 0;
            if (l != r) {
                return Long.compare(l, r);
            }
        }
        return 0;
    }

    @Override
    public int compareTo(Version other) {
        int cmp = Long.compare(epoch, other.epoch);
        if (cmp != 0) {
            return cmp;
        }
        cmp = compareRelease(this, other);
        if (cmp != 0) {
            return cmp;
        }
        cmp = Long.compare(preRank(), other.preRank());
        if (cmp != 0) {
            return cmp;
        }
        if (preKind != null) {
            cmp = Long.compare(preNumber, other.preNumber);
            if (cmp != 0) {
                return cmp;
            }
        }
        // Missing post sorts before any post release
        cmp = Long.compare(post == null ? -1 : post, other.post == null ? -1 : other.post);
        if (cmp != 0) {
            return cmp;
        }
        // Missing dev sorts after any dev release
        cmp = Long.compare(dev == null ? Long.MAX_VALUE : dev, other.dev == null ? Long.MAX_VALUE : other.dev);
        if (cmp != 0) {
            return cmp;
        }
        return compareLocal(local, other.local);
    }

    // dev-only releases < alpha < beta < rc < final
    private int preRank() {
        if (preKind == null) {
            return post == null && dev != null ? -1 : PreKind.values().length;
        }
        return preKind.ordinal();
    }

    private static int compareLocal(List<String> left, List<String> right) {
        int length = Math.min(left.size(), right.size());
        for (int i = 0; i < length; i++) {
            String l = left.get(i);
            String r = right.get(i);
            boolean lNumeric = isNumeric(l);
            boolean rNumeric = isNumeric(r);
            int cmp;
            if (lNumeric && rNumeric) {
                cmp = Long.compare(Long.parseLong(l), Long.parseLong(r));
            } else if (lNumeric) {
                cmp = 1;
            } else if (rNumeric) {
                cmp = -1;
            } else {
                cmp = l.compareTo(r);
            }
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Version other)) {
            return false;
        }
        return compareTo(other) == 0;
    }

    @Override
    public int hashCode() {
        int significant = release.length;
        while (significant > 1 && release[significant - 1] == 0) {
            significant--;
        }
        return Objects.hash(epoch, Arrays.hashCode(Arrays.copyOf(release, significant)),
                preKind, preKind == null ? 0 : preNumber, post, dev, local);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (epoch != 0) {
            sb.append(epoch).append('!');
        }
        sb.append(Arrays.stream(release).mapToObj(Long::toString).collect(Collectors.joining(".")));
        if (preKind != null) {
            sb.append(preKind.label()).append(preNumber);
        }
        if (post != null) {
            sb.append(".post").append(post);
        }
        if (dev != null) {
            sb.append(".dev").append(dev);
        }
        if (!local.isEmpty()) {
            sb.append('+').append(String.join(".", local));
        }
        return sb.toString();
    }
}
