package org.springaicommunity.github.exporter;

/**
 * Point-in-time counters of a {@link RateLimiter}.
 *
 * @param running operations currently executing
 * @param queued operations waiting for a worker
 * @param done operations finished, successfully or not
 * @param reservoir calls left in the current quota window
 */
public record RateLimiterStats(int running, int queued, long done, int reservoir) {
}
