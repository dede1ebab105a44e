package com.cinderkv.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Byte-level glob matcher used by KEYS.
 *
 * Only {@code *} is special: it matches any run of bytes, including none.
 * Everything else matches literally. Matching is anchored at both ends, so
 * the literal before the first {@code *} must be a prefix of the key and the
 * literal after the last {@code *} must be a suffix.
 */
public final class GlobPattern {

    private static final byte WILDCARD = '*';

    private final byte[] prefix;
    private final byte[] suffix;
    private final List<byte[]> inner;
    private final boolean hasWildcard;
    private final byte[] exact;

    private GlobPattern(byte[] pattern) {
        List<byte[]> segments = split(pattern);
        this.hasWildcard = segments.size() > 1;
        if (!hasWildcard) {
            this.exact = segments.get(0);
            this.prefix = null;
            this.suffix = null;
            this.inner = List.of();
        } else {
            this.exact = null;
            this.prefix = segments.get(0);
            this.suffix = segments.get(segments.size() - 1);
            List<byte[]> middle = new ArrayList<>();
            for (byte[] segment : segments.subList(1, segments.size() - 1)) {
                if (segment.length > 0) {
                    middle.add(segment);
                }
            }
            this.inner = middle;
        }
    }

    /**
     * Compile a pattern.
     *
     * @param pattern the raw pattern bytes
     * @return the compiled pattern
     */
    public static GlobPattern compile(byte[] pattern) {
        if (pattern == null) {
            throw new IllegalArgumentException("Pattern cannot be null");
        }
        return new GlobPattern(pattern);
    }

    /**
     * Check whether a key matches this pattern.
     *
     * @param key the key bytes
     * @return true if the key matches
     */
    public boolean matches(byte[] key) {
        if (!hasWildcard) {
            return Arrays.equals(exact, key);
        }
        if (key.length < prefix.length + suffix.length) {
            return false;
        }
        if (!regionEquals(key, 0, prefix)) {
            return false;
        }
        int limit = key.length - suffix.length;
        if (!regionEquals(key, limit, suffix)) {
            return false;
        }
        // inner segments must fit between the prefix and the suffix, in order
        int from = prefix.length;
        for (byte[] segment : inner) {
            int found = indexOf(key, segment, from, limit);
            if (found < 0) {
                return false;
            }
            from = found + segment.length;
        }
        return true;
    }

    private static List<byte[]> split(byte[] pattern) {
        List<byte[]> segments = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < pattern.length; i++) {
            if (pattern[i] == WILDCARD) {
                segments.add(Arrays.copyOfRange(pattern, start, i));
                start = i + 1;
            }
        }
        segments.add(Arrays.copyOfRange(pattern, start, pattern.length));
        return segments;
    }

    private static boolean regionEquals(byte[] key, int offset, byte[] segment) {
        for (int i = 0; i < segment.length; i++) {
            if (key[offset + i] != segment[i]) {
                return false;
            }
        }
        return true;
    }

    private static int indexOf(byte[] key, byte[] segment, int from, int limit) {
        for (int i = from; i + segment.length <= limit; i++) {
            if (regionEquals(key, i, segment)) {
                return i;
            }
        }
        return -1;
    }
}
