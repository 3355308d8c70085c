package org.springaicommunity.github.exporter;

import com.fasterxml.jackson.core.type.TypeReference;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Base class for resource-type exporters.
 *
 * <p>
 * {@link #export()} fetches the full item set through {@link #fetchData()}, then writes
 * each item individually. A failing item is counted and reported without stopping the
 * remaining ones. The export succeeds only if every item was fetched and written.
 *
 * <p>
 * Subclasses fetch paged resources with {@link #fetchPaged(PageFetcher)}, which sizes
 * an {@link AdaptiveRetry} by the resource type's item ceiling, answers pages from the
 * caches when possible and counts upstream calls and cache hits.
 *
 * @param <T> the exported item type
 */
public abstract class BaseExporter<T extends ExportItem> implements ResourceExporter {

	private static final Logger logger = LoggerFactory.getLogger(BaseExporter.class);

	protected final ExporterContext context;

	protected final ExportRequest request;

	private final List<String> errors = new ArrayList<>();

	private int apiCalls;

	private int cacheHits;

	private boolean fetchIncomplete;

	@Nullable
	private Instant oldestCachedAt;

	protected BaseExporter(ExporterContext context, ExportRequest request) {
		this.context = context;
		this.request = request;
	}

	@Override
	public final ResourceType getResourceType() {
		return request.resourceType();
	}

	@Override
	public ExportResult export() {
		long start = System.nanoTime();
		logDiffModeInfo();

		List<T> items;
		try {
			items = fetchData();
		}
		catch (RuntimeException e) {
			logger.error("Failed to fetch {} for {}: {}", getResourceType().getDisplayName(), request.repository(),
					e.getMessage());
			errors.add("Failed to fetch " + getResourceType().getDisplayName() + ": " + e.getMessage());
			return new ExportResult(false, 0, 0, apiCalls, cacheHits, elapsed(start), errors, oldestCachedAt);
		}

		int exported = 0;
		int failed = 0;
		for (T item : items) {
			try {
				exportItem(item);
				exported++;
			}
			catch (IOException | RuntimeException e) {
				failed++;
				errors.add("Failed to export " + item.fileStem() + ": " + e.getMessage());
				logger.warn("Failed to export {} of {}: {}", item.fileStem(), request.repository(), e.getMessage());
			}
		}

		boolean success = failed == 0 && !fetchIncomplete;
		logger.info("Exported {} {} for {} ({} failed, {} API calls, {} cache hits)", exported,
				getResourceType().getDisplayName(), request.repository(), failed, apiCalls, cacheHits);
		return new ExportResult(success, exported, failed, apiCalls, cacheHits, elapsed(start), errors,
				oldestCachedAt);
	}

	/**
	 * Fetch every item to export, honouring diff mode.
	 * @return the items
	 */
	protected abstract List<T> fetchData();

	/**
	 * Jackson type of one cached page, used to read pages back from the durable cache.
	 * @return the page type
	 */
	protected abstract TypeReference<List<T>> pageType();

	/**
	 * Write one item.
	 * @param item the item
	 * @throws IOException if writing fails
	 */
	protected void exportItem(T item) throws IOException {
		context.itemWriter().write(request.outputPath(), item, request.format());
	}

	/**
	 * Fetch pages until a short page or the item ceiling is reached. Each page has its
	 * own retry budget; pages that keep failing are reported as errors and mark the
	 * export as incomplete.
	 * @param fetcher fetches one page
	 * @return the items of all pages, in page order
	 */
	protected List<T> fetchPaged(PageFetcher<T> fetcher) {
		int ceiling = context.properties().getItemCeiling(getResourceType());
		int pageSize = context.properties().getPageSize();
		AdaptiveRetry retry = AdaptiveRetry.builder(ceiling).sleeper(context.sleeper()).build();
		AdaptiveRetryResult<T> result = retry.executeWithChunking((offset, limit) -> {
			int page = offset / pageSize + 1;
			List<T> items = cachedFetch(cacheKey(page, pageSize), () -> fetcher.fetchPage(page, pageSize));
			return (items.size() > limit) ? items.subList(0, limit) : items;
		}, pageSize, GitHubApiException::isRetryable, (items, limit) -> items.size() < limit);

		if (!result.success()) {
			fetchIncomplete = true;
			result.errors().forEach(error -> errors.add(error.getMessage()));
		}
		return result.data();
	}

	/**
	 * Answer a fetch from the in-process cache, then the durable cache, and only then
	 * from upstream. Upstream results are stored in both caches. A forced full export
	 * never reads the caches. The fetch time of every cached page served is tracked and
	 * reported as {@link ExportResult#dataAsOf()}, so the checkpoint never claims data
	 * newer than what was exported.
	 * @param key cache key
	 * @param upstream the upstream call
	 * @return the fetched items
	 * @throws Exception if the upstream call fails
	 */
	@SuppressWarnings("unchecked")
	protected List<T> cachedFetch(String key, Callable<List<T>> upstream) throws Exception {
		MemoryCache<Object> memoryCache = context.memoryCache();
		FileResponseCache fileCache = context.fileCache();
		if (!request.diffMode().forceFullExport()) {
			if (memoryCache != null) {
				Optional<CacheEntry<Object>> cached = memoryCache.getEntry(key);
				if (cached.isPresent()) {
					recordCacheHit(cached.get().getTimestamp());
					return (List<T>) cached.get().getValue();
				}
			}
			if (fileCache != null) {
				Optional<FileCacheEntry> entry = fileCache.getEntry(key);
				Optional<List<T>> stored = entry.flatMap(e -> fileCache.readData(e, pageType()));
				if (stored.isPresent()) {
					Instant fetchedAt = entry.get().timestamp();
					recordCacheHit(fetchedAt);
					if (memoryCache != null) {
						memoryCache.set(key, stored.get(), context.properties().getMemoryCacheTtl(), fetchedAt);
					}
					return stored.get();
				}
			}
		}

		incrementApiCalls();
		List<T> fresh = upstream.call();
		if (memoryCache != null) {
			memoryCache.set(key, fresh);
		}
		if (fileCache != null) {
			fileCache.set(key, fresh, null, context.properties().getCacheTtl());
		}
		return fresh;
	}

	private void recordCacheHit(Instant fetchedAt) {
		incrementCacheHits();
		if (oldestCachedAt == null || fetchedAt.isBefore(oldestCachedAt)) {
			oldestCachedAt = fetchedAt;
		}
	}

	protected void incrementApiCalls() {
		apiCalls++;
	}

	protected void incrementCacheHits() {
		cacheHits++;
	}

	public boolean isDiffMode() {
		return request.isDiffMode();
	}

	/**
	 * Lower bound of changed items in diff mode.
	 * @return the previous checkpoint time, or null for a full export
	 */
	@Nullable
	public Instant getDiffModeSince() {
		return request.sinceTimestamp();
	}

	protected void logDiffModeInfo() {
		if (isDiffMode()) {
			logger.info("Diff mode: exporting {} of {} changed since {}", getResourceType().getDisplayName(),
					request.repository(), getDiffModeSince());
		}
		else if (request.diffMode().forceFullExport()) {
			logger.info("Forced full export of {} for {}", getResourceType().getDisplayName(), request.repository());
		}
		else {
			logger.debug("Full export of {} for {}", getResourceType().getDisplayName(), request.repository());
		}
	}

	private String cacheKey(int page, int pageSize) {
		Instant since = getDiffModeSince();
		return "github:" + request.repository() + ":" + getResourceType().getId() + ":since="
				+ (since != null ? since : "all") + ":page=" + page + ":per_page=" + pageSize;
	}

	private static Duration elapsed(long startNanos) {
		return Duration.ofNanos(System.nanoTime() - startNanos);
	}

	/**
	 * Fetches one page of a resource.
	 *
	 * @param <T> item type
	 */
	@FunctionalInterface
	protected interface PageFetcher<T> {

		List<T> fetchPage(int page, int perPage) throws Exception;

	}

}
