package org.springaicommunity.github.exporter;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiPredicate;
import java.util.function.Predicate;

/**
 * Retry engine whose aggressiveness scales with the declared size of a dataset.
 *
 * <p>
 * Two modes are offered:
 * <ul>
 * <li>{@link #executeWithPartialRecovery} retries a whole fetch and, once retries are
 * exhausted, returns whatever progress the fetch recorded instead of discarding it</li>
 * <li>{@link #executeWithChunking} splits the dataset into chunks that are fetched and
 * retried independently; a chunk that keeps failing is recorded and skipped while the
 * remaining chunks proceed</li>
 * </ul>
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * AdaptiveRetry retry = AdaptiveRetry.builder(2000).build();
 * AdaptiveRetryResult<PullRequest> result = retry.executeWithChunking(
 *     (offset, limit) -> service.listPullRequests(owner, name, offset / limit + 1, limit),
 *     100, GitHubApiException::isRetryable);
 * }
 * </pre>
 */
public final class AdaptiveRetry {

	private static final Logger logger = LoggerFactory.getLogger(AdaptiveRetry.class);

	private final int datasetSize;

	private final RetryStrategy strategy;

	private final Sleeper sleeper;

	@Nullable
	private final RetryListener retryListener;

	/**
	 * Private constructor - use {@link #builder(int)} to create instances.
	 */
	private AdaptiveRetry(Builder builder) {
		this.datasetSize = builder.datasetSize;
		RetryStrategy derived = RetryStrategy.forDatasetSize(builder.datasetSize);
		this.strategy = new RetryStrategy((builder.maxRetries != null) ? builder.maxRetries : derived.maxRetries(),
				(builder.initialDelay != null) ? builder.initialDelay : derived.initialDelay(),
				(builder.maxDelay != null) ? builder.maxDelay : derived.maxDelay(),
				(builder.backoffMultiplier != null) ? builder.backoffMultiplier : derived.backoffMultiplier());
		this.sleeper = builder.sleeper;
		this.retryListener = builder.retryListener;
	}

	/**
	 * Create a builder for a dataset of the given declared size.
	 * @param datasetSize expected number of items
	 * @return new Builder instance
	 */
	public static Builder builder(int datasetSize) {
		return new Builder(datasetSize);
	}

	public RetryStrategy getStrategy() {
		return strategy;
	}

	/**
	 * Run a fetch, retrying failures accepted by {@code shouldRetry}. When retries are
	 * exhausted the items recorded through the {@link ProgressTracker} are returned in a
	 * non-success result; the failure is rethrown only if nothing was recorded.
	 *
	 * <p>
	 * The tracker is shared by all attempts, so a fetch may resume from
	 * {@link ProgressTracker#itemsProcessed()} instead of starting over.
	 * @param fetch the fetch to run
	 * @param shouldRetry decides whether a failure is worth another attempt
	 * @param <T> item type
	 * @return the result
	 * @throws GitHubApiException or another runtime exception if no progress was made
	 */
	public <T> AdaptiveRetryResult<T> executeWithPartialRecovery(PartialFetch<T> fetch,
			Predicate<Exception> shouldRetry) {
		long start = System.nanoTime();
		ProgressTracker<T> tracker = new ProgressTracker<>();
		Exception lastError = null;
		int attempts = 0;

		for (int attempt = 0; attempt <= strategy.maxRetries(); attempt++) {
			attempts++;
			try {
				List<T> data = fetch.fetch(tracker);
				return new AdaptiveRetryResult<>(true, data, data.size(), attempts, List.of(), elapsed(start));
			}
			catch (Exception e) {
				lastError = e;
				if (attempt >= strategy.maxRetries() || !shouldRetry.test(e)) {
					break;
				}
				backoff(attempt, e);
			}
		}

		if (tracker.itemsProcessed() > 0) {
			logger.warn("Returning partial result after {} attempts: {} items recovered ({})", attempts,
					tracker.itemsProcessed(), lastError.getMessage());
			return new AdaptiveRetryResult<>(false, tracker.items(), tracker.itemsProcessed(), attempts,
					List.of(lastError), elapsed(start));
		}
		logger.error("Operation failed after {} attempts with no progress: {}", attempts, lastError.getMessage());
		if (lastError instanceof RuntimeException runtimeException) {
			throw runtimeException;
		}
		throw new ExportException("Operation failed after " + attempts + " attempts", lastError);
	}

	/**
	 * Fetch the declared dataset in {@code ceil(size / chunkSize)} chunks, each with its
	 * own retry budget. A chunk that exhausts its retries contributes one error and is
	 * skipped. Every chunk is fetched regardless of how many items earlier chunks
	 * returned.
	 * @param fetchChunk fetches {@code limit} items starting at {@code offset}
	 * @param chunkSize items per chunk
	 * @param shouldRetry decides whether a failure is worth another attempt
	 * @param <T> item type
	 * @return aggregated data in chunk order, successful only if no chunk failed
	 */
	public <T> AdaptiveRetryResult<T> executeWithChunking(ChunkFetcher<T> fetchChunk, int chunkSize,
			Predicate<Exception> shouldRetry) {
		return executeWithChunking(fetchChunk, chunkSize, shouldRetry, (chunkData, limit) -> false);
	}

	/**
	 * Like {@link #executeWithChunking(ChunkFetcher, int, Predicate)}, but stops early
	 * once {@code endOfData} reports that a successfully fetched chunk was the last one,
	 * for sources whose real size is only known while paging.
	 * @param fetchChunk fetches {@code limit} items starting at {@code offset}
	 * @param chunkSize items per chunk
	 * @param shouldRetry decides whether a failure is worth another attempt
	 * @param endOfData receives a chunk's items and the requested limit
	 * @param <T> item type
	 * @return aggregated data in chunk order, successful only if no chunk failed
	 */
	public <T> AdaptiveRetryResult<T> executeWithChunking(ChunkFetcher<T> fetchChunk, int chunkSize,
			Predicate<Exception> shouldRetry, BiPredicate<List<T>, Integer> endOfData) {
		if (chunkSize < 1) {
			throw new IllegalArgumentException("chunkSize must be positive");
		}
		long start = System.nanoTime();
		int totalChunks = (datasetSize + chunkSize - 1) / chunkSize;
		List<T> data = new ArrayList<>();
		List<Exception> errors = new ArrayList<>();
		int attempts = 0;

		logger.debug("Fetching up to {} items in {} chunks of {}", datasetSize, totalChunks, chunkSize);
		for (int chunk = 0; chunk < totalChunks; chunk++) {
			int offset = chunk * chunkSize;
			int limit = Math.min(chunkSize, datasetSize - offset);
			List<T> chunkData = null;

			for (int attempt = 0; attempt <= strategy.maxRetries(); attempt++) {
				attempts++;
				try {
					chunkData = fetchChunk.fetch(offset, limit);
					break;
				}
				catch (Exception e) {
					if (attempt >= strategy.maxRetries() || !shouldRetry.test(e)) {
						logger.error("Chunk {}/{} (offset {}) failed after {} attempts: {}", chunk + 1, totalChunks,
								offset, attempt + 1, e.getMessage());
						errors.add(new ExportException("Chunk " + (chunk + 1) + " at offset " + offset + " failed after "
								+ (attempt + 1) + " attempts: " + e.getMessage(), e));
						break;
					}
					backoff(attempt, e);
				}
			}

			if (chunkData != null) {
				data.addAll(chunkData);
				if (endOfData.test(chunkData, limit)) {
					logger.debug("Chunk {} returned {} of {} items, end of data", chunk + 1, chunkData.size(), limit);
					break;
				}
			}
		}

		return new AdaptiveRetryResult<>(errors.isEmpty(), data, data.size(), attempts, errors, elapsed(start));
	}

	/**
	 * Computed parameters and worst-case wait for observability.
	 * @return the strategy information
	 */
	public StrategyInfo getStrategyInfo() {
		return new StrategyInfo(datasetSize, strategy.maxRetries(), strategy.initialDelay(), strategy.maxDelay(),
				strategy.backoffMultiplier(), strategy.estimatedMaxDuration());
	}

	private void backoff(int attempt, Exception error) {
		Duration delay = strategy.delayForAttempt(attempt);
		logger.warn("Attempt {}/{} failed: {}. Retrying in {}ms", attempt + 1, strategy.maxRetries() + 1,
				error.getMessage(), delay.toMillis());
		if (retryListener != null) {
			retryListener.onRetry(attempt + 1, error, delay);
		}
		try {
			sleeper.sleep(delay);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ExportException("Retry interrupted", e);
		}
	}

	private static Duration elapsed(long startNanos) {
		return Duration.ofNanos(System.nanoTime() - startNanos);
	}

	/**
	 * A fetch that reports progress as it goes.
	 *
	 * @param <T> item type
	 */
	@FunctionalInterface
	public interface PartialFetch<T> {

		List<T> fetch(ProgressTracker<T> progress) throws Exception;

	}

	/**
	 * Fetches one chunk of a dataset.
	 *
	 * @param <T> item type
	 */
	@FunctionalInterface
	public interface ChunkFetcher<T> {

		List<T> fetch(int offset, int limit) throws Exception;

	}

	/**
	 * Callback invoked before each backoff wait.
	 */
	@FunctionalInterface
	public interface RetryListener {

		void onRetry(int attempt, Exception error, Duration delay);

	}

	/**
	 * Collects the items a fetch has obtained so far.
	 *
	 * @param <T> item type
	 */
	public static final class ProgressTracker<T> {

		private final List<T> items = new ArrayList<>();

		/**
		 * Record newly obtained items.
		 * @param batch the items
		 */
		public synchronized void addProgress(List<T> batch) {
			items.addAll(batch);
		}

		public synchronized int itemsProcessed() {
			return items.size();
		}

		public synchronized List<T> items() {
			return Collections.unmodifiableList(new ArrayList<>(items));
		}

	}

	/**
	 * Strategy parameters exposed for observability and testing.
	 *
	 * @param datasetSize declared dataset size
	 * @param maxRetries retries per operation or chunk
	 * @param initialDelay first backoff delay
	 * @param maxDelay cap of a single delay
	 * @param backoffMultiplier growth factor between delays
	 * @param estimatedMaxDuration sum of all delays when every retry is used
	 */
	public record StrategyInfo(int datasetSize, int maxRetries, Duration initialDelay, Duration maxDelay,
			double backoffMultiplier, Duration estimatedMaxDuration) {
	}

	/**
	 * Builder for {@link AdaptiveRetry}. Unset parameters come from
	 * {@link RetryStrategy#forDatasetSize(int)}.
	 */
	public static class Builder {

		private final int datasetSize;

		@Nullable
		private Integer maxRetries;

		@Nullable
		private Duration initialDelay;

		@Nullable
		private Duration maxDelay;

		@Nullable
		private Double backoffMultiplier;

		private Sleeper sleeper = Sleeper.SYSTEM;

		@Nullable
		private RetryListener retryListener;

		private Builder(int datasetSize) {
			this.datasetSize = datasetSize;
		}

		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		public Builder initialDelay(Duration initialDelay) {
			this.initialDelay = initialDelay;
			return this;
		}

		public Builder maxDelay(Duration maxDelay) {
			this.maxDelay = maxDelay;
			return this;
		}

		public Builder backoffMultiplier(double backoffMultiplier) {
			this.backoffMultiplier = backoffMultiplier;
			return this;
		}

		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		public Builder onRetry(RetryListener retryListener) {
			this.retryListener = retryListener;
			return this;
		}

		/**
		 * Build the AdaptiveRetry.
		 * @return configured AdaptiveRetry
		 * @throws IllegalStateException if the dataset size is negative
		 */
		public AdaptiveRetry build() {
			if (datasetSize < 0) {
				throw new IllegalStateException("datasetSize must be non-negative");
			}
			return new AdaptiveRetry(this);
		}

	}

}
