package org.springaicommunity.github.exporter;

import org.jspecify.annotations.Nullable;

/**
 * Services shared by all exporters of one run.
 *
 * @param apiService typed GitHub operations
 * @param properties configuration
 * @param itemWriter writes exported items
 * @param memoryCache in-process cache of fetched pages (null to disable)
 * @param fileCache durable cache of fetched pages (null to disable)
 * @param sleeper used for retry backoff
 */
public record ExporterContext(GitHubApiService apiService, ExportProperties properties, ItemWriter itemWriter,
		@Nullable MemoryCache<Object> memoryCache, @Nullable FileResponseCache fileCache, Sleeper sleeper) {
}
