package com.cinderkv.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongSupplier;

/**
 * Thread-safe in-memory key-value store.
 *
 * Values, expiration instants and the numeric cache live in three maps that
 * are guarded together by a single readers-writer lock. Reads share the lock;
 * every mutation, including read-modify-write sequences such as increments,
 * holds it exclusively for its whole duration.
 *
 * Expiration is lazy. A read that finds an expired key reports it as absent,
 * then re-acquires the lock exclusively, re-checks, and purges the key from
 * all three maps. Write paths purge expired keys before touching them.
 */
public class InMemoryStore implements KVStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryStore.class);
    private static final byte[] EMPTY = new byte[0];

    private final Map<BinaryKey, byte[]> values;
    private final Map<BinaryKey, Long> expireAt;
    private final Map<BinaryKey, Long> lastNumeric;
    private final Lock readLock;
    private final Lock writeLock;
    private final LongSupplier clock;

    /**
     * Create a new empty store using the system clock.
     */
    public InMemoryStore() {
        this(System::currentTimeMillis);
    }

    /**
     * Create a new empty store with a custom millisecond clock.
     *
     * @param clock supplier of the current time in milliseconds since epoch
     */
    public InMemoryStore(LongSupplier clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        this.values = new HashMap<>();
        this.expireAt = new HashMap<>();
        this.lastNumeric = new HashMap<>();
        this.readLock = lock.readLock();
        this.writeLock = lock.writeLock();
        this.clock = clock;
    }

    @Override
    public void set(byte[] key, byte[] value) {
        BinaryKey k = new BinaryKey(key);
        byte[] copy = copyValue(value);
        writeLock.lock();
        try {
            values.put(k, copy);
            expireAt.remove(k);
            lastNumeric.remove(k);
        } finally {
            writeLock.unlock();
        }
        logger.trace("SET key={}, valueSize={}", k, copy.length);
    }

    @Override
    public void setWithTtl(byte[] key, byte[] value, long ttlMillis) {
        if (ttlMillis <= 0) {
            throw new IllegalArgumentException("ttlMillis must be positive, got: " + ttlMillis);
        }
        BinaryKey k = new BinaryKey(key);
        byte[] copy = copyValue(value);
        writeLock.lock();
        try {
            values.put(k, copy);
            expireAt.put(k, deadline(clock.getAsLong(), ttlMillis));
            lastNumeric.remove(k);
        } finally {
            writeLock.unlock();
        }
        logger.trace("SET key={}, valueSize={}, ttl={}", k, copy.length, ttlMillis);
    }

    @Override
    public Optional<byte[]> get(byte[] key) {
        BinaryKey k = new BinaryKey(key);
        readLock.lock();
        try {
            if (!isExpired(k, clock.getAsLong())) {
                byte[] value = values.get(k);
                logger.trace("GET key={} -> {}", k, value != null ? "FOUND" : "NOT_FOUND");
                return value != null ? Optional.of(Arrays.copyOf(value, value.length)) : Optional.empty();
            }
        } finally {
            readLock.unlock();
        }
        purgeIfExpired(k);
        logger.trace("GET key={} -> EXPIRED", k);
        return Optional.empty();
    }

    @Override
    public boolean delete(byte[] key) {
        BinaryKey k = new BinaryKey(key);
        boolean existed;
        writeLock.lock();
        try {
            existed = values.remove(k) != null;
            expireAt.remove(k);
            lastNumeric.remove(k);
        } finally {
            writeLock.unlock();
        }
        logger.trace("DELETE key={} -> {}", k, existed ? "DELETED" : "NOT_FOUND");
        return existed;
    }

    @Override
    public boolean exists(byte[] key) {
        BinaryKey k = new BinaryKey(key);
        readLock.lock();
        try {
            if (!isExpired(k, clock.getAsLong())) {
                return values.containsKey(k);
            }
        } finally {
            readLock.unlock();
        }
        purgeIfExpired(k);
        return false;
    }

    @Override
    public int append(byte[] key, byte[] suffix) {
        BinaryKey k = new BinaryKey(key);
        byte[] tail = copyValue(suffix);
        writeLock.lock();
        try {
            byte[] current = liveValue(k);
            byte[] updated;
            if (current == null) {
                updated = tail;
            } else {
                updated = Arrays.copyOf(current, current.length + tail.length);
                System.arraycopy(tail, 0, updated, current.length, tail.length);
            }
            values.put(k, updated);
            lastNumeric.remove(k);
            logger.trace("APPEND key={}, newLength={}", k, updated.length);
            return updated.length;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int strlen(byte[] key) {
        BinaryKey k = new BinaryKey(key);
        readLock.lock();
        try {
            if (!isExpired(k, clock.getAsLong())) {
                byte[] value = values.get(k);
                return value != null ? value.length : 0;
            }
        } finally {
            readLock.unlock();
        }
        purgeIfExpired(k);
        return 0;
    }

    @Override
    public byte[] getRange(byte[] key, long start, long end) {
        BinaryKey k = new BinaryKey(key);
        readLock.lock();
        try {
            if (!isExpired(k, clock.getAsLong())) {
                byte[] value = values.get(k);
                return value != null ? slice(value, start, end) : EMPTY;
            }
        } finally {
            readLock.unlock();
        }
        purgeIfExpired(k);
        return EMPTY;
    }

    @Override
    public int setRange(byte[] key, int offset, byte[] value) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be non-negative, got: " + offset);
        }
        BinaryKey k = new BinaryKey(key);
        byte[] patch = copyValue(value);
        writeLock.lock();
        try {
            byte[] current = liveValue(k);
            if (current == null) {
                current = offset > 0 ? new byte[offset] : EMPTY;
            }
            int required = offset + patch.length;
            byte[] updated = Arrays.copyOf(current, Math.max(current.length, required));
            System.arraycopy(patch, 0, updated, offset, patch.length);
            values.put(k, updated);
            lastNumeric.remove(k);
            logger.trace("SETRANGE key={}, offset={}, newLength={}", k, offset, updated.length);
            return updated.length;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public long incrementBy(byte[] key, long delta) {
        BinaryKey k = new BinaryKey(key);
        writeLock.lock();
        try {
            byte[] current = liveValue(k);
            long base = 0;
            if (current != null) {
                Long cached = lastNumeric.get(k);
                base = cached != null ? cached : parseInteger(current);
            }
            long result;
            try {
                result = Math.addExact(base, delta);
            } catch (ArithmeticException e) {
                throw new NumericValueException(NumericValueException.OVERFLOW, e);
            }
            values.put(k, Long.toString(result).getBytes(StandardCharsets.US_ASCII));
            lastNumeric.put(k, result);
            logger.trace("INCRBY key={}, delta={} -> {}", k, delta, result);
            return result;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public GetSetResult getAndSet(byte[] key, byte[] value) {
        BinaryKey k = new BinaryKey(key);
        byte[] copy = copyValue(value);
        writeLock.lock();
        try {
            byte[] previous = liveValue(k);
            values.put(k, copy);
            expireAt.remove(k);
            lastNumeric.remove(k);
            logger.trace("GETSET key={} -> {}", k, previous != null ? "REPLACED" : "CREATED");
            return previous != null ? GetSetResult.replaced(previous) : GetSetResult.absent();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<byte[]> multiGet(List<byte[]> keys) {
        List<BinaryKey> lookup = toKeys(keys);
        List<byte[]> results = new ArrayList<>(lookup.size());
        List<BinaryKey> expired = new ArrayList<>();
        readLock.lock();
        try {
            long now = clock.getAsLong();
            for (BinaryKey k : lookup) {
                if (isExpired(k, now)) {
                    expired.add(k);
                    results.add(null);
                    continue;
                }
                byte[] value = values.get(k);
                results.add(value != null ? Arrays.copyOf(value, value.length) : null);
            }
        } finally {
            readLock.unlock();
        }
        purgeIfExpired(expired);
        return results;
    }

    @Override
    public void multiSet(List<KeyValue> pairs) {
        writeLock.lock();
        try {
            for (KeyValue pair : pairs) {
                values.put(pair.getKey(), pair.getValueUnsafe());
                expireAt.remove(pair.getKey());
                lastNumeric.remove(pair.getKey());
            }
        } finally {
            writeLock.unlock();
        }
        logger.trace("MSET pairs={}", pairs.size());
    }

    @Override
    public List<byte[]> keys(byte[] pattern) {
        GlobPattern glob = GlobPattern.compile(pattern);
        List<byte[]> matches = new ArrayList<>();
        List<BinaryKey> expired = new ArrayList<>();
        readLock.lock();
        try {
            long now = clock.getAsLong();
            for (BinaryKey k : values.keySet()) {
                if (isExpired(k, now)) {
                    expired.add(k);
                } else if (glob.matches(k.getBytesUnsafe())) {
                    matches.add(k.getBytes());
                }
            }
        } finally {
            readLock.unlock();
        }
        purgeIfExpired(expired);
        return matches;
    }

    @Override
    public int size() {
        readLock.lock();
        try {
            long now = clock.getAsLong();
            int live = 0;
            for (BinaryKey k : values.keySet()) {
                if (!isExpired(k, now)) {
                    live++;
                }
            }
            return live;
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public void flushAll() {
        writeLock.lock();
        try {
            values.clear();
            expireAt.clear();
            lastNumeric.clear();
        } finally {
            writeLock.unlock();
        }
        logger.debug("Store flushed");
    }

    /**
     * Get raw entry count including expired keys not yet purged (for debugging).
     */
    public int rawSize() {
        readLock.lock();
        try {
            return values.size();
        } finally {
            readLock.unlock();
        }
    }

    // Saturates at Long.MAX_VALUE on overflow.
    private static long deadline(long now, long ttlMillis) {
        try {
            return Math.addExact(now, ttlMillis);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    // Caller must hold the lock.
    private boolean isExpired(BinaryKey k, long now) {
        Long deadline = expireAt.get(k);
        return deadline != null && now > deadline;
    }

    // Caller must hold the write lock. Returns the live value, purging it if expired.
    private byte[] liveValue(BinaryKey k) {
        if (isExpired(k, clock.getAsLong())) {
            purge(k);
            return null;
        }
        return values.get(k);
    }

    // Caller must hold the write lock.
    private void purge(BinaryKey k) {
        values.remove(k);
        expireAt.remove(k);
        lastNumeric.remove(k);
        logger.trace("Purged expired key={}", k);
    }

    private void purgeIfExpired(BinaryKey k) {
        writeLock.lock();
        try {
            if (isExpired(k, clock.getAsLong())) {
                purge(k);
            }
        } finally {
            writeLock.unlock();
        }
    }

    private void purgeIfExpired(List<BinaryKey> keys) {
        if (keys.isEmpty()) {
            return;
        }
        writeLock.lock();
        try {
            long now = clock.getAsLong();
            for (BinaryKey k : keys) {
                if (isExpired(k, now)) {
                    purge(k);
                }
            }
        } finally {
            writeLock.unlock();
        }
    }

    private static byte[] slice(byte[] value, long start, long end) {
        long length = value.length;
        if (start < 0) {
            start = length + start;
        }
        if (end < 0) {
            end = length + end;
        }
        if (start < 0) {
            start = 0;
        }
        if (end >= length) {
            end = length - 1;
        }
        if (start > end) {
            return EMPTY;
        }
        return Arrays.copyOfRange(value, (int) start, (int) end + 1);
    }

    private static long parseInteger(byte[] value) {
        try {
            return Long.parseLong(new String(value, StandardCharsets.US_ASCII));
        } catch (NumberFormatException e) {
            throw new NumericValueException(NumericValueException.NOT_AN_INTEGER, e);
        }
    }

    private static byte[] copyValue(byte[] value) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        return Arrays.copyOf(value, value.length);
    }

    private static List<BinaryKey> toKeys(List<byte[]> keys) {
        List<BinaryKey> result = new ArrayList<>(keys.size());
        for (byte[] key : keys) {
            result.add(new BinaryKey(key));
        }
        return result;
    }
}
