package com.cinderkv.core;

import java.util.List;
import java.util.Optional;

/**
 * Core storage interface for the key-value store.
 * All implementations must be thread-safe and every operation must be atomic
 * with respect to every other operation.
 */
public interface KVStore {

    /**
     * Store a value, clearing any TTL the key had.
     *
     * @param key   the key to store
     * @param value the value to store
     */
    void set(byte[] key, byte[] value);

    /**
     * Store a value that expires after the given TTL.
     *
     * @param key       the key to store
     * @param value     the value to store
     * @param ttlMillis time-to-live in milliseconds, must be positive
     */
    void setWithTtl(byte[] key, byte[] value, long ttlMillis);

    /**
     * Retrieve the value for a given key.
     *
     * @param key the key to look up
     * @return the value if found and not expired, empty otherwise
     */
    Optional<byte[]> get(byte[] key);

    /**
     * Delete a key together with its TTL and numeric state.
     *
     * @param key the key to delete
     * @return true if a value was stored under the key
     */
    boolean delete(byte[] key);

    /**
     * Check if a key exists and is not expired.
     *
     * @param key the key to check
     * @return true if the key exists and is not expired
     */
    boolean exists(byte[] key);

    /**
     * Append to the value at a key, creating it if absent. TTL is kept.
     *
     * @return the length of the value after the append
     */
    int append(byte[] key, byte[] suffix);

    /**
     * @return the length of the value, or 0 if absent
     */
    int strlen(byte[] key);

    /**
     * Get the inclusive byte range {@code [start, end]} of a value.
     * Negative indices count from the end of the value.
     *
     * @return the range, empty if the key is absent or the range is empty
     */
    byte[] getRange(byte[] key, long start, long end);

    /**
     * Overwrite part of a value starting at offset, zero-padding as needed.
     *
     * @param offset non-negative write position
     * @return the length of the value after the write
     */
    int setRange(byte[] key, int offset, byte[] value);

    /**
     * Atomically add delta to the integer stored at key (0 if absent).
     *
     * @return the new value
     * @throws NumericValueException if the stored value is not an integer
     *                               or the result overflows
     */
    long incrementBy(byte[] key, long delta);

    default long increment(byte[] key) {
        return incrementBy(key, 1);
    }

    default long decrement(byte[] key) {
        return incrementBy(key, -1);
    }

    default long decrementBy(byte[] key, long delta) {
        if (delta == Long.MIN_VALUE) {
            throw new NumericValueException(NumericValueException.OVERFLOW);
        }
        return incrementBy(key, -delta);
    }

    /**
     * Atomically replace the value at key and clear its TTL.
     *
     * @return the previous value and whether the key existed
     */
    GetSetResult getAndSet(byte[] key, byte[] value);

    /**
     * Retrieve several values at once.
     *
     * @return one slot per key in input order, null where the key is absent
     */
    List<byte[]> multiGet(List<byte[]> keys);

    /**
     * Store several values as one batch, clearing their TTLs.
     *
     * @param pairs key/value pairs, applied in order
     */
    void multiSet(List<KeyValue> pairs);

    /**
     * @return all live keys matching the glob pattern
     */
    List<byte[]> keys(byte[] pattern);

    /**
     * @return the number of non-expired keys
     */
    int size();

    /**
     * Remove every key.
     */
    void flushAll();
}
