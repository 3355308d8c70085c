package org.springaicommunity.github.exporter;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one resource-type export.
 *
 * @param success true when every item was fetched and written
 * @param itemsExported items written successfully
 * @param itemsFailed items that could not be written
 * @param apiCalls upstream calls made
 * @param cacheHits fetches answered by a cache
 * @param duration wall-clock time of the export
 * @param errors every error message, in occurrence order
 * @param dataAsOf when the oldest cached page served to this export was fetched, or null
 * if every page came from upstream
 */
public record ExportResult(boolean success, int itemsExported, int itemsFailed, int apiCalls, int cacheHits,
		Duration duration, List<String> errors, @Nullable Instant dataAsOf) {

	public ExportResult {
		errors = List.copyOf(errors);
	}

	public ExportResult(boolean success, int itemsExported, int itemsFailed, int apiCalls, int cacheHits,
			Duration duration, List<String> errors) {
		this(success, itemsExported, itemsFailed, apiCalls, cacheHits, duration, errors, null);
	}

	/**
	 * Result for an export that could not start.
	 * @param error why it failed
	 * @return a failed result with no counters
	 */
	public static ExportResult failed(String error) {
		return new ExportResult(false, 0, 0, 0, 0, Duration.ZERO, List.of(error));
	}

}
