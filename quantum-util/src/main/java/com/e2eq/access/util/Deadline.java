package com.e2eq.access.util;

import java.time.Duration;
import java.util.Objects;

/**
 * An absolute point in time, on the monotonic clock, by which some piece of work must
 * complete. Deadlines are passed explicitly down a call chain (evaluation, script
 * execution, storage calls) instead of being captured by callbacks.
 */
public final class Deadline implements Comparable<Deadline> {

    private static final Deadline NONE = new Deadline(Long.MAX_VALUE);

    private final long deadlineNanos;

    private Deadline(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * A deadline that never expires.
     */
    public static Deadline none() {
        return NONE;
    }

    public static Deadline after(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        long now = System.nanoTime();
        long nanos = timeout.isNegative() ? 0L : saturatedNanos(timeout);
        long at = now + nanos;
        // overflow on very long timeouts
        if (at < now) {
            return NONE;
        }
        return new Deadline(at);
    }

    public boolean isUnbounded() {
        return deadlineNanos == Long.MAX_VALUE;
    }

    public boolean isExpired() {
        return !isUnbounded() && System.nanoTime() - deadlineNanos >= 0;
    }

    /**
     * Time left before expiry, never negative. An unbounded deadline reports
     * {@code Duration.ofNanos(Long.MAX_VALUE)}.
     */
    public Duration remaining() {
        if (isUnbounded()) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        long left = deadlineNanos - System.nanoTime();
        return left <= 0 ? Duration.ZERO : Duration.ofNanos(left);
    }

    public long remainingMillis() {
        return remaining().toMillis();
    }

    /**
     * The earlier of this deadline and one that expires after {@code timeout}.
     */
    public Deadline limitedTo(Duration timeout) {
        return earliest(this, after(timeout));
    }

    public static Deadline earliest(Deadline a, Deadline b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    @Override
    public int compareTo(Deadline other) {
        if (this.deadlineNanos == other.deadlineNanos) {
            return 0;
        }
        if (this.isUnbounded()) {
            return 1;
        }
        if (other.isUnbounded()) {
            return -1;
        }
        return Long.signum(this.deadlineNanos - other.deadlineNanos);
    }

    @Override
    public String toString() {
        return isUnbounded() ? "Deadline[none]" : "Deadline[" + remainingMillis() + "ms]";
    }

    private static long saturatedNanos(Duration d) {
        try {
            return d.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
