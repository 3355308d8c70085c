package org.springaicommunity.github.exporter;

import java.time.Duration;

/**
 * Retry and backoff parameters derived from the declared size of a dataset.
 *
 * <p>
 * Larger datasets get more retries, longer delays and, above 5000 items, a wider backoff
 * multiplier:
 * <ul>
 * <li>under 1000 items: 3 retries</li>
 * <li>under 5000 items: 5 retries</li>
 * <li>under 10000 items: 7 retries</li>
 * <li>otherwise: 10 retries</li>
 * </ul>
 * The initial delay is {@code min(1s, 500ms + size/10 ms)} and the maximum delay is
 * {@code min(60s, 30s + size/5 ms)}.
 *
 * @param maxRetries retries after the first attempt
 * @param initialDelay delay before the first retry
 * @param maxDelay upper bound of any single delay
 * @param backoffMultiplier growth factor between consecutive delays
 */
public record RetryStrategy(int maxRetries, Duration initialDelay, Duration maxDelay, double backoffMultiplier) {

	private static final double DEFAULT_MULTIPLIER = 2.0;

	private static final double MAX_MULTIPLIER = 3.0;

	private static final int LARGE_DATASET_THRESHOLD = 5000;

	public RetryStrategy {
		if (maxRetries < 0) {
			throw new IllegalArgumentException("maxRetries must be non-negative");
		}
		if (backoffMultiplier < 1.0) {
			throw new IllegalArgumentException("backoffMultiplier must be at least 1");
		}
	}

	/**
	 * Derive the strategy for a dataset of the given size.
	 * @param datasetSize expected number of items
	 * @return the strategy for that size
	 */
	public static RetryStrategy forDatasetSize(int datasetSize) {
		int size = Math.max(0, datasetSize);
		long initialMs = Math.round(Math.min(1000, 500 + size / 10.0));
		long maxMs = Math.round(Math.min(60_000, 30_000 + size / 5.0));
		double multiplier = DEFAULT_MULTIPLIER;
		if (size > LARGE_DATASET_THRESHOLD) {
			multiplier = Math.min(MAX_MULTIPLIER, multiplier + 0.5);
		}
		return new RetryStrategy(maxRetriesFor(size), Duration.ofMillis(initialMs), Duration.ofMillis(maxMs),
				multiplier);
	}

	private static int maxRetriesFor(int size) {
		if (size < 1000) {
			return 3;
		}
		if (size < 5000) {
			return 5;
		}
		if (size < 10_000) {
			return 7;
		}
		return 10;
	}

	/**
	 * Delay before retry number {@code attempt} (zero-based):
	 * {@code min(initialDelay * multiplier^attempt, maxDelay)}.
	 * @param attempt zero-based attempt index
	 * @return the delay
	 */
	public Duration delayForAttempt(int attempt) {
		double raw = initialDelay.toMillis() * Math.pow(backoffMultiplier, attempt);
		return Duration.ofMillis(Math.round(Math.min(raw, maxDelay.toMillis())));
	}

	/**
	 * Worst-case total time spent waiting when every retry is used.
	 * @return sum of all retry delays
	 */
	public Duration estimatedMaxDuration() {
		Duration total = Duration.ZERO;
		for (int i = 0; i < maxRetries; i++) {
			total = total.plus(delayForAttempt(i));
		}
		return total;
	}

}
