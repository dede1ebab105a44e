package com.cinderkv.core;

/**
 * Exception thrown when a numeric operation meets a value that is not a
 * base-10 signed 64-bit integer, or when the result would overflow.
 */
public class NumericValueException extends RuntimeException {

    public static final String NOT_AN_INTEGER = "value is not an integer or out of range";
    public static final String OVERFLOW = "increment or decrement would overflow";

    public NumericValueException(String message) {
        super(message);
    }

    public NumericValueException(String message, Throwable cause) {
        super(message, cause);
    }
}
