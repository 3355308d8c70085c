package org.springaicommunity.github.exporter;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Summary of the entries in a {@link FileResponseCache} directory.
 *
 * @param totalEntries number of cache files
 * @param totalSizeBytes combined size of the cache files
 * @param oldestEntry write time of the oldest readable entry (null when empty)
 */
public record FileCacheStats(int totalEntries, long totalSizeBytes, @Nullable Instant oldestEntry) {
}
