package com.usatiuk.ringmesh.strategy;

import java.util.Random;

/**
 * Delay before retrying a device, doubling with each failed attempt up to a cap.
 * No delay is applied to a device that never failed.
 *
 * @param baseMs   the delay of the first tier
 * @param cap      the retry count after which the delay stops growing
 * @param offset   subtracted from the capped retry count before exponentiation
 * @param jitterMs upper bound of the random delay added to every non-zero delay
 */
public record ExponentialBackoff(long baseMs, int cap, int offset, long jitterMs) {
    /**
     * {@code 2^(min(retry, cap) - 1) * base}, plus jitter.
     */
    public static ExponentialBackoff ring(long baseMs, int cap, long jitterMs) {
        return new ExponentialBackoff(baseMs, cap, 1, jitterMs);
    }

    /**
     * {@code 2^min(retry, cap) * base}, without jitter.
     */
    public static ExponentialBackoff random(long baseMs, int cap) {
        return new ExponentialBackoff(baseMs, cap, 0, 0);
    }

    /**
     * @param retryCount the failed attempts so far
     * @return the delay without jitter
     */
    public long baseDelayMs(int retryCount) {
        if (retryCount <= 0) return 0;
        var exponent = Math.max(0, Math.min(retryCount, cap) - offset);
        return baseMs << exponent;
    }

    public long delayMs(int retryCount, Random random) {
        var delay = baseDelayMs(retryCount);
        if (delay == 0 || jitterMs <= 0) return delay;
        return delay + random.nextLong(jitterMs);
    }
}
