package io.github.hotbrkm.mailgoat.dispatcher.send.engine;

import io.github.hotbrkm.mailgoat.dispatcher.send.entry.BatchConfigurationException;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Paces send attempts to at most {@code R} per second.
 * <p>
 * Token bucket with capacity one: the first attempt passes immediately and every later attempt starts no earlier
 * than {@code 1/R} seconds after the previous one. Idle time is not banked, so bursts never exceed one attempt.
 * The wait blocks the calling thread. Not thread-safe.
 */
public final class SendRateLimiter {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;
    private static final SendRateLimiter UNLIMITED = new SendRateLimiter(null, 0L, System::nanoTime, TimeUnit.NANOSECONDS::sleep);

    private final Double ratePerSecond;
    private final long intervalNanos;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;

    private boolean started;
    private long nextPermitNanos;
    private long totalWaitNanos;
    private int permits;

    private SendRateLimiter(Double ratePerSecond, long intervalNanos, LongSupplier nanoClock, Sleeper sleeper) {
        this.ratePerSecond = ratePerSecond;
        this.intervalNanos = intervalNanos;
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /**
     * Limiter that never waits.
     */
    public static SendRateLimiter unlimited() {
        return UNLIMITED;
    }

    /**
     * @param ratePerSecond maximum attempts per second, at least 1; decimals allowed
     * @throws BatchConfigurationException if the rate is below 1 or not finite
     */
    public static SendRateLimiter perSecond(double ratePerSecond) {
        return perSecond(ratePerSecond, System::nanoTime, TimeUnit.NANOSECONDS::sleep);
    }

    static SendRateLimiter perSecond(double ratePerSecond, LongSupplier nanoClock, Sleeper sleeper) {
        if (Double.isNaN(ratePerSecond) || Double.isInfinite(ratePerSecond) || ratePerSecond < 1d) {
            throw new BatchConfigurationException("rate limit must be a number >= 1, got " + ratePerSecond);
        }
        long interval = Math.max(1L, Math.round(NANOS_PER_SECOND / ratePerSecond));
        return new SendRateLimiter(ratePerSecond, interval, nanoClock, sleeper);
    }

    /**
     * Creates a limiter for an optional rate; null means unlimited.
     */
    public static SendRateLimiter of(Double ratePerSecond) {
        return ratePerSecond == null ? unlimited() : perSecond(ratePerSecond);
    }

    /**
     * Blocks until the next attempt may start.
     *
     * @return nanoseconds waited by this call
     * @throws InterruptedException if interrupted while waiting
     */
    public long acquire() throws InterruptedException {
        if (isUnlimited()) {
            return 0L;
        }
        long now = nanoClock.getAsLong();
        if (!started) {
            started = true;
            nextPermitNanos = now + intervalNanos;
            permits++;
            return 0L;
        }
        long waitNanos = Math.max(0L, nextPermitNanos - now);
        if (waitNanos > 0) {
            sleeper.sleep(waitNanos);
            totalWaitNanos += waitNanos;
        }
        nextPermitNanos = Math.max(now, nextPermitNanos) + intervalNanos;
        permits++;
        return waitNanos;
    }

    public boolean isUnlimited() {
        return ratePerSecond == null;
    }

    /**
     * Configured rate, or null when unlimited.
     */
    public Double getRatePerSecond() {
        return ratePerSecond;
    }

    public long getIntervalNanos() {
        return intervalNanos;
    }

    /**
     * Cumulative wait inserted between attempts so far.
     */
    public long getTotalWaitNanos() {
        return totalWaitNanos;
    }

    public int getPermits() {
        return permits;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long nanos) throws InterruptedException;
    }
}
