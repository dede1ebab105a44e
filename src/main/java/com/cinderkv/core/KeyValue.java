package com.cinderkv.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable key/value pair, used for batch writes.
 */
public final class KeyValue {

    private final BinaryKey key;
    private final byte[] value;

    /**
     * Create a new pair. Both arrays are copied.
     *
     * @param key   the key bytes
     * @param value the value bytes
     */
    public KeyValue(byte[] key, byte[] value) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        this.key = new BinaryKey(key);
        this.value = Arrays.copyOf(value, value.length);
    }

    public BinaryKey getKey() {
        return key;
    }

    /**
     * Get a copy of the value bytes.
     *
     * @return copy of the value
     */
    public byte[] getValue() {
        return Arrays.copyOf(value, value.length);
    }

    /**
     * Get the raw value bytes without copying.
     * Use with caution - do not modify the returned array.
     *
     * @return the internal value array
     */
    public byte[] getValueUnsafe() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KeyValue that = (KeyValue) o;
        return key.equals(that.key) && Arrays.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(key);
        result = 31 * result + Arrays.hashCode(value);
        return result;
    }

    @Override
    public String toString() {
        return "KeyValue{" +
               "key='" + key + '\'' +
               ", valueLength=" + value.length +
               '}';
    }
}
