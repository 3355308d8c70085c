package org.springaicommunity.github.exporter;

/**
 * Counters of a {@link MemoryCache}.
 *
 * @param totalHits lookups answered from the cache
 * @param totalMisses lookups that found nothing or an expired entry
 * @param evictedEntries entries removed by the eviction policy
 * @param hitRate hits as a percentage of all lookups
 * @param totalEntries live entries
 * @param totalSizeBytes tracked aggregate estimated size
 * @param averageEntrySizeBytes tracked size divided by the entry count
 */
public record CacheStats(long totalHits, long totalMisses, long evictedEntries, double hitRate, int totalEntries,
		long totalSizeBytes, long averageEntrySizeBytes) {
}
