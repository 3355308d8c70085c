package org.springaicommunity.github.exporter;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * Document stored for each key of the {@link FileResponseCache}.
 *
 * @param data the cached value as JSON
 * @param etag validator token returned by the server with the value (may be null)
 * @param timestamp when the value was written
 * @param ttlMillis time-to-live in milliseconds
 */
public record FileCacheEntry(JsonNode data, @Nullable String etag, Instant timestamp, long ttlMillis) {

	/**
	 * An entry is expired once more than its ttl has passed since it was written.
	 * @param now current time
	 * @return true if the entry must no longer be returned
	 */
	public boolean isExpired(Instant now) {
		return Duration.between(timestamp, now).toMillis() > ttlMillis;
	}

}
