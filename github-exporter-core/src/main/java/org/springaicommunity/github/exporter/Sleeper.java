package org.springaicommunity.github.exporter;

import java.time.Duration;

/**
 * Blocking wait abstraction so backoff and quota waits can be verified without real
 * sleeping.
 */
@FunctionalInterface
public interface Sleeper {

	/**
	 * Sleeper backed by {@link Thread#sleep(long)}.
	 */
	Sleeper SYSTEM = duration -> {
		if (duration.toMillis() > 0) {
			Thread.sleep(duration.toMillis());
		}
	};

	/**
	 * Block the calling thread for the given duration.
	 * @param duration how long to wait; non-positive durations return immediately
	 * @throws InterruptedException if the thread is interrupted while waiting
	 */
	void sleep(Duration duration) throws InterruptedException;

}
