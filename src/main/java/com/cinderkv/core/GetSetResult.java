package com.cinderkv.core;

import java.util.Arrays;

/**
 * Outcome of an atomic get-and-set: the value that was replaced, if any.
 */
public final class GetSetResult {

    private static final GetSetResult ABSENT = new GetSetResult(null);

    private final byte[] previous;

    private GetSetResult(byte[] previous) {
        this.previous = previous;
    }

    static GetSetResult replaced(byte[] previous) {
        return new GetSetResult(Arrays.copyOf(previous, previous.length));
    }

    static GetSetResult absent() {
        return ABSENT;
    }

    /**
     * @return true if the key held a live value before the swap
     */
    public boolean existed() {
        return previous != null;
    }

    /**
     * @return copy of the previous value, or null if the key did not exist
     */
    public byte[] getPrevious() {
        return previous != null ? Arrays.copyOf(previous, previous.length) : null;
    }

    @Override
    public String toString() {
        return "GetSetResult{" +
               "existed=" + existed() +
               ", previousLength=" + (previous != null ? previous.length : -1) +
               '}';
    }
}
