package org.springaicommunity.github.exporter;

import java.time.Instant;

/**
 * Snapshot of the GitHub API quota.
 *
 * <p>
 * Captured either from the dedicated {@code /rate_limit} endpoint or from the
 * {@code X-RateLimit-*} headers of any response.
 *
 * @param limit the maximum number of requests allowed per window
 * @param remaining the number of requests remaining in the current window
 * @param reset the time when the window resets (epoch seconds)
 * @param used the number of requests used in the current window
 */
public record RateLimitInfo(int limit, int remaining, long reset, int used) {

	/**
	 * Returns the reset time as an Instant.
	 * @return the reset time
	 */
	public Instant getResetTime() {
		return Instant.ofEpochSecond(reset);
	}

	/**
	 * Returns true if the rate limit has been exceeded.
	 * @return true if no requests remaining
	 */
	public boolean isExceeded() {
		return remaining <= 0;
	}

	/**
	 * Remaining quota as a percentage of the limit.
	 * @return percentage in {@code [0, 100]}, or 0 when the limit is unknown
	 */
	public double percentRemaining() {
		if (limit <= 0) {
			return 0;
		}
		return (remaining * 100.0) / limit;
	}

}
