package org.springaicommunity.github.exporter;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of an {@link AdaptiveRetry} operation.
 *
 * @param success true when the operation completed without any unrecovered error
 * @param data items obtained, in chunk order; partial when {@code success} is false
 * @param itemsProcessed number of items obtained
 * @param totalAttempts number of fetch calls made, retries included
 * @param errors every unrecovered error, in the order they occurred
 * @param duration wall-clock time of the whole operation
 * @param <T> item type
 */
public record AdaptiveRetryResult<T>(boolean success, List<T> data, int itemsProcessed, int totalAttempts,
		List<Exception> errors, Duration duration) {

	public AdaptiveRetryResult {
		data = List.copyOf(data);
		errors = List.copyOf(errors);
	}

}
