package org.springaicommunity.github.exporter;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Throttles calls against the GitHub hourly quota.
 *
 * <p>
 * Scheduled operations run on a bounded worker pool ({@code maxConcurrent} threads). Each
 * run takes one unit from a reservoir that starts at the hourly quota and is refilled
 * once per window, and starts no sooner than {@code minTime} after the previous start.
 * Waiting work is ordered by priority (lower value first, FIFO within a priority) and is
 * never dropped: an empty reservoir makes callers wait for the refill.
 *
 * <p>
 * A failed operation is retried when the failure is transient, with exponential backoff
 * (1s, 2s, 4s by default) or, for quota errors, until the reported reset when that is
 * less than an hour away. Permanent failures surface immediately.
 *
 * <p>
 * The quota-status query ({@link #fetchStatus()}) bypasses the scheduler and its retries
 * so that checking the quota never throttles itself.
 *
 * <pre>
 * {@code
 * RateLimiter limiter = RateLimiter.builder()
 *     .statusSource(apiService::getRateLimit)
 *     .build();
 * String body = limiter.execute(() -> client.get("/repos/owner/repo"));
 * }
 * </pre>
 */
public final class RateLimiter implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

	/**
	 * Priority used when none is given.
	 */
	public static final int DEFAULT_PRIORITY = 5;

	/**
	 * Maximum time to wait for a rate limit reset (1 hour). If the computed wait exceeds
	 * this, fall back to exponential backoff.
	 */
	private static final long MAX_RESET_WAIT_SECONDS = 3600;

	private final int hourlyQuota;

	private final long minTimeMs;

	private final Duration refreshInterval;

	private final int maxRetries;

	private final long initialBackoffMs;

	private final int lowQuotaWarningPercent;

	private final int criticalRemainingThreshold;

	@Nullable
	private final Supplier<RateLimitInfo> statusSource;

	private final Clock clock;

	private final Sleeper sleeper;

	private final ThreadPoolExecutor executor;

	private final AtomicLong sequence = new AtomicLong();

	private final AtomicInteger running = new AtomicInteger();

	private final AtomicLong done = new AtomicLong();

	private final Object spacingLock = new Object();

	private long nextStartMillis;

	private final ReentrantLock reservoirLock = new ReentrantLock();

	private int reservoir;

	private Instant reservoirRefreshedAt;

	@Nullable
	private volatile RateLimitInfo currentLimit;

	private volatile boolean closed;

	/**
	 * Private constructor - use {@link #builder()} to create instances.
	 */
	private RateLimiter(Builder builder) {
		this.hourlyQuota = builder.hourlyQuota;
		this.minTimeMs = builder.minTime.toMillis();
		this.refreshInterval = builder.refreshInterval;
		this.maxRetries = builder.maxRetries;
		this.initialBackoffMs = builder.initialBackoff.toMillis();
		this.lowQuotaWarningPercent = builder.lowQuotaWarningPercent;
		this.criticalRemainingThreshold = builder.criticalRemainingThreshold;
		this.statusSource = builder.statusSource;
		this.clock = builder.clock;
		this.sleeper = builder.sleeper;
		this.reservoir = builder.hourlyQuota;
		this.reservoirRefreshedAt = clock.instant();
		AtomicInteger threadCount = new AtomicInteger();
		this.executor = new ThreadPoolExecutor(builder.maxConcurrent, builder.maxConcurrent, 0L, TimeUnit.MILLISECONDS,
				new PriorityBlockingQueue<>(), runnable -> {
					Thread thread = new Thread(runnable, "rate-limiter-" + threadCount.incrementAndGet());
					thread.setDaemon(true);
					return thread;
				});
	}

	/**
	 * Create a new builder for RateLimiter.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Schedule an operation with the default priority.
	 * @param operation the call to run
	 * @param <T> result type
	 * @return future completed with the operation's result or its final failure
	 */
	public <T> CompletableFuture<T> schedule(Callable<T> operation) {
		return schedule(operation, DEFAULT_PRIORITY);
	}

	/**
	 * Schedule an operation.
	 * @param operation the call to run
	 * @param priority lower values run first
	 * @param <T> result type
	 * @return future completed with the operation's result or its final failure
	 * @throws IllegalStateException if the limiter has been closed
	 */
	public <T> CompletableFuture<T> schedule(Callable<T> operation, int priority) {
		if (closed) {
			throw new IllegalStateException("RateLimiter is closed");
		}
		CompletableFuture<T> future = new CompletableFuture<>();
		long seq = sequence.incrementAndGet();
		logger.debug("Scheduling job #{} with priority {}", seq, priority);
		executor.execute(new PrioritizedJob(priority, seq, () -> run(operation, future)));
		return future;
	}

	/**
	 * Schedule an operation with the default priority and wait for its result.
	 * @param operation the call to run
	 * @param <T> result type
	 * @return the operation's result
	 * @throws GitHubApiException if the operation failed with an API error
	 */
	public <T> T execute(Callable<T> operation) {
		return execute(operation, DEFAULT_PRIORITY);
	}

	/**
	 * Schedule an operation and wait for its result.
	 * @param operation the call to run
	 * @param priority lower values run first
	 * @param <T> result type
	 * @return the operation's result
	 * @throws GitHubApiException if the operation failed with an API error
	 */
	public <T> T execute(Callable<T> operation, int priority) {
		try {
			return schedule(operation, priority).get();
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ExportException("Interrupted while waiting for a scheduled call", e);
		}
		catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException runtimeException) {
				throw runtimeException;
			}
			throw new ExportException("Scheduled call failed: " + cause.getMessage(), cause);
		}
	}

	/**
	 * Query the quota-status endpoint directly, outside the scheduler and without retry.
	 * @return the current quota status
	 * @throws IllegalStateException if no status source was configured
	 */
	public RateLimitInfo fetchStatus() {
		if (statusSource == null) {
			throw new IllegalStateException("No rate limit status source configured");
		}
		RateLimitInfo status = statusSource.get();
		this.currentLimit = status;
		logger.debug("Rate limit status: {}/{} remaining, {} used, resets at {}", status.remaining(), status.limit(),
				status.used(), status.getResetTime());
		return status;
	}

	/**
	 * Check the quota and pause the caller when it is nearly exhausted. Logs a warning
	 * when less than the configured percentage remains; waits until the reset when fewer
	 * than the critical number of requests remain.
	 * @return the status that was checked
	 */
	public RateLimitInfo checkAndThrottle() {
		RateLimitInfo status = fetchStatus();
		if (status.limit() > 0 && status.percentRemaining() < lowQuotaWarningPercent) {
			logger.warn("Rate limit low: {}/{} requests remaining ({}%)", status.remaining(), status.limit(),
					Math.round(status.percentRemaining()));
		}
		if (status.remaining() < criticalRemainingThreshold) {
			Duration wait = Duration.between(clock.instant(), status.getResetTime());
			if (!wait.isNegative() && !wait.isZero()) {
				logger.warn("Rate limit nearly exhausted ({} remaining). Pausing {}s until reset at {}",
						status.remaining(), wait.toSeconds(), status.getResetTime());
				sleep(wait);
			}
		}
		return status;
	}

	/**
	 * Resynchronize the reservoir with the authoritative remaining count.
	 * @return the status used for the update
	 */
	public RateLimitInfo updateReservoir() {
		RateLimitInfo status = fetchStatus();
		reservoirLock.lock();
		try {
			this.reservoir = Math.max(0, status.remaining());
			this.reservoirRefreshedAt = clock.instant();
		}
		finally {
			reservoirLock.unlock();
		}
		logger.info("Rate limiter reservoir set to {} from quota status", status.remaining());
		return status;
	}

	/**
	 * Status captured by the most recent {@link #fetchStatus()}.
	 * @return last fetched status, or null if none was fetched yet
	 */
	@Nullable
	public RateLimitInfo getCurrentLimit() {
		return currentLimit;
	}

	public RateLimiterStats getStats() {
		reservoirLock.lock();
		try {
			return new RateLimiterStats(running.get(), executor.getQueue().size(), done.get(), reservoir);
		}
		finally {
			reservoirLock.unlock();
		}
	}

	/**
	 * Stop accepting work. Already queued operations still run; waits up to one minute
	 * for them.
	 */
	@Override
	public void close() {
		if (closed) {
			return;
		}
		closed = true;
		executor.shutdown();
		try {
			if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
				logger.warn("Rate limiter closed with {} queued jobs still pending", executor.getQueue().size());
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.warn("Interrupted while draining rate limiter queue");
		}
		logger.debug("Rate limiter stopped after {} jobs", done.get());
	}

	private <T> void run(Callable<T> operation, CompletableFuture<T> future) {
		running.incrementAndGet();
		try {
			future.complete(executeWithRetry(operation));
		}
		catch (Exception e) {
			future.completeExceptionally(e);
		}
		finally {
			running.decrementAndGet();
			done.incrementAndGet();
		}
	}

	private <T> T executeWithRetry(Callable<T> operation) throws Exception {
		Exception lastException = null;
		long delay = initialBackoffMs;

		for (int attempt = 0; attempt <= maxRetries; attempt++) {
			takeFromReservoir();
			awaitSpacing();
			try {
				return operation.call();
			}
			catch (Exception e) {
				lastException = e;
				if (!GitHubApiException.isRetryable(e)) {
					throw e;
				}
				if (attempt < maxRetries) {
					long waitMs = computeWaitTime(e, delay);
					logger.warn("Scheduled call failed (attempt {}/{}): {}. Waiting {}ms...", attempt + 1,
							maxRetries + 1, e.getMessage(), waitMs);
					sleep(Duration.ofMillis(waitMs));
					delay *= 2;
				}
			}
		}

		logger.error("Scheduled call failed after {} attempts", maxRetries + 1);
		throw lastException;
	}

	/**
	 * Compute how long to wait before retrying. For rate limit errors with a known reset
	 * time, waits until exactly that time (+1s buffer). Otherwise falls back to the
	 * default exponential backoff delay.
	 */
	private long computeWaitTime(Exception e, long defaultDelay) {
		if (e instanceof GitHubApiException apiException && apiException.isRateLimitError()
				&& apiException.getResetEpochSeconds() > 0) {
			long waitSeconds = apiException.getResetEpochSeconds() - clock.instant().getEpochSecond() + 1;
			if (waitSeconds > 0 && waitSeconds <= MAX_RESET_WAIT_SECONDS) {
				logger.info("Rate limit exceeded. Waiting {} seconds until reset at epoch {}", waitSeconds,
						apiException.getResetEpochSeconds());
				return waitSeconds * 1000;
			}
			else if (waitSeconds > MAX_RESET_WAIT_SECONDS) {
				logger.warn("Rate limit reset is {} seconds away (> 1hr), using exponential backoff instead",
						waitSeconds);
			}
		}
		return defaultDelay;
	}

	private void takeFromReservoir() {
		@Nullable Instant waitedOn = null;
		while (true) {
			Duration wait;
			reservoirLock.lock();
			try {
				Instant now = clock.instant();
				Instant refreshAt = reservoirRefreshedAt.plus(refreshInterval);
				// A finished wait counts as the window passing unless someone refilled meanwhile
				if (!now.isBefore(refreshAt) || reservoirRefreshedAt.equals(waitedOn)) {
					refill(now);
				}
				if (reservoir > 0) {
					reservoir--;
					return;
				}
				wait = Duration.between(now, reservoirRefreshedAt.plus(refreshInterval));
				waitedOn = reservoirRefreshedAt;
			}
			finally {
				reservoirLock.unlock();
			}
			// Sleep outside the lock; getStats and updateReservoir stay responsive
			logger.warn("Rate limiter reservoir empty, waiting {}s for the next window", wait.toSeconds());
			sleep(wait);
		}
	}

	private void refill(Instant now) {
		logger.debug("Refilling rate limiter reservoir to {}", hourlyQuota);
		this.reservoir = hourlyQuota;
		this.reservoirRefreshedAt = now;
	}

	private void awaitSpacing() {
		long waitMs;
		synchronized (spacingLock) {
			long now = clock.millis();
			long start = Math.max(now, nextStartMillis);
			nextStartMillis = start + minTimeMs;
			waitMs = start - now;
		}
		if (waitMs > 0) {
			sleep(Duration.ofMillis(waitMs));
		}
	}

	private void sleep(Duration duration) {
		try {
			sleeper.sleep(duration);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ExportException("Rate limiter wait interrupted", e);
		}
	}

	/**
	 * Queue element ordered by priority, then by submission order.
	 */
	private static final class PrioritizedJob implements Runnable, Comparable<PrioritizedJob> {

		private final int priority;

		private final long sequence;

		private final Runnable task;

		PrioritizedJob(int priority, long sequence, Runnable task) {
			this.priority = priority;
			this.sequence = sequence;
			this.task = task;
		}

		@Override
		public void run() {
			task.run();
		}

		@Override
		public int compareTo(PrioritizedJob other) {
			int byPriority = Integer.compare(priority, other.priority);
			return (byPriority != 0) ? byPriority : Long.compare(sequence, other.sequence);
		}

	}

	/**
	 * Builder for {@link RateLimiter}.
	 *
	 * <p>
	 * Provides defaults matching the GitHub REST quota:
	 * <ul>
	 * <li>maxConcurrent: 5</li>
	 * <li>minTime: 1 second between call starts</li>
	 * <li>hourlyQuota: 5000, refreshed every hour</li>
	 * <li>maxRetries: 3, initial backoff 1 second</li>
	 * <li>warning under 10% remaining, pause under 100 remaining</li>
	 * </ul>
	 */
	public static class Builder {

		private int maxConcurrent = 5;

		private Duration minTime = Duration.ofSeconds(1);

		private int hourlyQuota = 5000;

		private Duration refreshInterval = Duration.ofHours(1);

		private int maxRetries = 3;

		private Duration initialBackoff = Duration.ofSeconds(1);

		private int lowQuotaWarningPercent = 10;

		private int criticalRemainingThreshold = 100;

		@Nullable
		private Supplier<RateLimitInfo> statusSource;

		private Clock clock = Clock.systemUTC();

		private Sleeper sleeper = Sleeper.SYSTEM;

		private Builder() {
		}

		/**
		 * Copy all limiter settings from the given properties.
		 * @param properties configuration source
		 * @return this builder
		 */
		public Builder properties(ExportProperties properties) {
			this.maxConcurrent = properties.getMaxConcurrent();
			this.minTime = properties.getMinTimeBetweenRequests();
			this.hourlyQuota = properties.getHourlyQuota();
			this.refreshInterval = properties.getReservoirRefreshInterval();
			this.maxRetries = properties.getLimiterMaxRetries();
			this.initialBackoff = properties.getLimiterInitialBackoff();
			this.lowQuotaWarningPercent = properties.getLowQuotaWarningPercent();
			this.criticalRemainingThreshold = properties.getCriticalRemainingThreshold();
			return this;
		}

		public Builder maxConcurrent(int maxConcurrent) {
			this.maxConcurrent = maxConcurrent;
			return this;
		}

		public Builder minTime(Duration minTime) {
			this.minTime = minTime;
			return this;
		}

		public Builder hourlyQuota(int hourlyQuota) {
			this.hourlyQuota = hourlyQuota;
			return this;
		}

		public Builder reservoirRefreshInterval(Duration refreshInterval) {
			this.refreshInterval = refreshInterval;
			return this;
		}

		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		public Builder initialBackoff(Duration initialBackoff) {
			this.initialBackoff = initialBackoff;
			return this;
		}

		public Builder lowQuotaWarningPercent(int percent) {
			this.lowQuotaWarningPercent = percent;
			return this;
		}

		public Builder criticalRemainingThreshold(int threshold) {
			this.criticalRemainingThreshold = threshold;
			return this;
		}

		/**
		 * Set the quota-status query. It must not go through this limiter.
		 * @param statusSource supplier calling the rate limit endpoint directly
		 * @return this builder
		 */
		public Builder statusSource(Supplier<RateLimitInfo> statusSource) {
			this.statusSource = statusSource;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		/**
		 * Build the RateLimiter.
		 * @return configured RateLimiter
		 * @throws IllegalStateException if parameters are invalid
		 */
		public RateLimiter build() {
			if (maxConcurrent < 1) {
				throw new IllegalStateException("maxConcurrent must be at least 1");
			}
			if (hourlyQuota < 1) {
				throw new IllegalStateException("hourlyQuota must be positive");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (minTime.isNegative() || initialBackoff.isNegative() || refreshInterval.isNegative()
					|| refreshInterval.isZero()) {
				throw new IllegalStateException("Durations must be non-negative and the refresh interval positive");
			}
			return new RateLimiter(this);
		}

	}

}
