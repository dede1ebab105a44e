package com.cinderkv.core;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Immutable wrapper that gives a byte sequence value semantics so it can be
 * used as a map key. Keys are binary safe; no charset is assumed.
 */
public final class BinaryKey {

    private final byte[] bytes;
    private final int hashCode;

    /**
     * Create a key from a copy of the given bytes.
     *
     * @param bytes the key bytes
     */
    public BinaryKey(byte[] bytes) {
        this(bytes, true);
    }

    private BinaryKey(byte[] bytes, boolean copy) {
        if (bytes == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
        this.bytes = copy ? Arrays.copyOf(bytes, bytes.length) : bytes;
        this.hashCode = Arrays.hashCode(this.bytes);
    }

    /**
     * Create a key from a UTF-8 string.
     */
    public static BinaryKey of(String key) {
        return new BinaryKey(key.getBytes(StandardCharsets.UTF_8), false);
    }

    /**
     * Get a copy of the key bytes.
     *
     * @return copy of the key
     */
    public byte[] getBytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Get the raw key bytes without copying.
     * Do not modify the returned array.
     *
     * @return the internal key array
     */
    public byte[] getBytesUnsafe() {
        return bytes;
    }

    public int length() {
        return bytes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BinaryKey that = (BinaryKey) o;
        return hashCode == that.hashCode && Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
