package com.opsbrief.insights.analytics;

/**
 * Raised inside the analyzers when a series holds NaN or an infinite value, or when a statistic
 * computed from finite values overflows. Public operations catch it and fall back to their empty
 * result.
 */
public class NonFiniteValueException extends RuntimeException {

    private final int index;

    public NonFiniteValueException(int index, double value) {
        super("non-finite value " + value + " at index " + index);
        this.index = index;
    }

    /**
     * For a standalone value that is not part of a series; {@link #getIndex()} returns -1.
     */
    public NonFiniteValueException(double value) {
        super("non-finite value " + value);
        this.index = -1;
    }

    /**
     * For a derived statistic such as a mean or variance; {@link #getIndex()} returns -1.
     */
    public NonFiniteValueException(String quantity, double value) {
        super("non-finite " + quantity + " " + value);
        this.index = -1;
    }

    public int getIndex() {
        return index;
    }
}
