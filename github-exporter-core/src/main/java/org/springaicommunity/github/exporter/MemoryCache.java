package org.springaicommunity.github.exporter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * In-process cache bounded by a byte budget, living for one export run.
 *
 * <p>
 * Each entry's size is estimated from its JSON form. When an insert would exceed the
 * budget, entries chosen by the configured {@link EvictionPolicy} are removed one at a
 * time until the new entry fits. Expired entries are dropped lazily on access and by a
 * periodic sweep that runs between {@link #start()} and {@link #close()}.
 *
 * <p>
 * All operations are serialized on the cache instance, which keeps the tracked aggregate
 * size equal to the sum of the live entries' sizes; {@link #validate()} checks that.
 *
 * @param <V> value type
 */
public class MemoryCache<V> implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(MemoryCache.class);

	private static final long FALLBACK_ENTRY_SIZE = 1024;

	private final Map<String, CacheEntry<V>> entries = new HashMap<>();

	private final long maxBytes;

	private final Duration defaultTtl;

	private final EvictionPolicy policy;

	private final Duration sweepInterval;

	private final Clock clock;

	private final ObjectMapper objectMapper;

	private long totalSize;

	private long hits;

	private long misses;

	private long evictions;

	private long sequence;

	@Nullable
	private ScheduledExecutorService sweeper;

	public MemoryCache(long maxBytes, Duration defaultTtl, EvictionPolicy policy) {
		this(maxBytes, defaultTtl, policy, Duration.ofMinutes(5), Clock.systemUTC(), ObjectMapperFactory.create());
	}

	public MemoryCache(long maxBytes, Duration defaultTtl, EvictionPolicy policy, Duration sweepInterval, Clock clock,
			ObjectMapper objectMapper) {
		if (maxBytes <= 0) {
			throw new IllegalArgumentException("maxBytes must be positive");
		}
		this.maxBytes = maxBytes;
		this.defaultTtl = defaultTtl;
		this.policy = policy;
		this.sweepInterval = sweepInterval;
		this.clock = clock;
		this.objectMapper = objectMapper;
	}

	/**
	 * Create a cache from a named preset.
	 * @param preset the preset
	 * @param <V> value type
	 * @return the cache (sweep not yet started)
	 */
	public static <V> MemoryCache<V> fromPreset(Preset preset) {
		return new MemoryCache<>(preset.maxBytes(), preset.ttl(), EvictionPolicy.named(preset.policy()));
	}

	/**
	 * Store a value with the default ttl.
	 * @param key cache key
	 * @param value value to store
	 * @return false if the value is larger than the whole budget and was not cached
	 */
	public boolean set(String key, V value) {
		return set(key, value, defaultTtl);
	}

	/**
	 * Store a value, evicting entries as needed to stay within the byte budget.
	 * @param key cache key
	 * @param value value to store
	 * @param ttl time-to-live of this entry
	 * @return false if the value is larger than the whole budget and was not cached
	 */
	public synchronized boolean set(String key, V value, Duration ttl) {
		return set(key, value, ttl, clock.instant());
	}

	/**
	 * Store a value that was obtained at an earlier time, such as a promoted durable cache
	 * entry. Expiry counts from {@code timestamp}.
	 * @param key cache key
	 * @param value value to store
	 * @param ttl time-to-live of this entry
	 * @param timestamp when the value was obtained
	 * @return false if the value is larger than the whole budget and was not cached
	 */
	public synchronized boolean set(String key, V value, Duration ttl, Instant timestamp) {
		long size = estimateSize(value);
		CacheEntry<V> previous = entries.remove(key);
		if (previous != null) {
			totalSize -= previous.getEstimatedSize();
		}
		if (size > maxBytes) {
			logger.warn("Not caching '{}': estimated size {} bytes exceeds the cache budget of {} bytes", key, size,
					maxBytes);
			return false;
		}
		while (totalSize + size > maxBytes && !entries.isEmpty()) {
			CacheEntry<V> victim = policy.selectVictim(entries.values()).orElseThrow();
			entries.remove(victim.getKey());
			totalSize -= victim.getEstimatedSize();
			evictions++;
			logger.debug("Evicted '{}' ({} bytes, policy {})", victim.getKey(), victim.getEstimatedSize(),
					policy.name());
		}
		entries.put(key, new CacheEntry<>(key, value, timestamp, ttl, size, ++sequence));
		totalSize += size;
		return true;
	}

	/**
	 * Look up a value. An expired entry is removed and counted as a miss.
	 * @param key cache key
	 * @return the value, or empty on a miss
	 */
	public Optional<V> get(String key) {
		return getEntry(key).map(CacheEntry::getValue);
	}

	/**
	 * Look up an entry, with the same hit, miss and expiry accounting as {@link #get}.
	 * @param key cache key
	 * @return the live entry, or empty on a miss
	 */
	public synchronized Optional<CacheEntry<V>> getEntry(String key) {
		CacheEntry<V> entry = entries.get(key);
		Instant now = clock.instant();
		if (entry == null) {
			misses++;
			logger.debug("Cache miss: {}", key);
			return Optional.empty();
		}
		if (entry.isExpired(now)) {
			remove(key);
			misses++;
			logger.debug("Cache entry expired: {}", key);
			return Optional.empty();
		}
		entry.recordHit(now, ++sequence);
		hits++;
		logger.debug("Cache hit: {}", key);
		return Optional.of(entry);
	}

	/**
	 * Whether a live entry exists. Does not count as a hit or miss.
	 * @param key cache key
	 * @return true if a non-expired entry is present
	 */
	public synchronized boolean has(String key) {
		CacheEntry<V> entry = entries.get(key);
		if (entry == null) {
			return false;
		}
		if (entry.isExpired(clock.instant())) {
			remove(key);
			return false;
		}
		return true;
	}

	public synchronized boolean delete(String key) {
		return remove(key);
	}

	/**
	 * Remove all entries and reset the counters.
	 */
	public synchronized void clear() {
		entries.clear();
		totalSize = 0;
		hits = 0;
		misses = 0;
		evictions = 0;
		logger.debug("Cache cleared");
	}

	/**
	 * Remove every expired entry.
	 * @return number of entries removed
	 */
	public synchronized int removeExpired() {
		Instant now = clock.instant();
		int removed = 0;
		Iterator<CacheEntry<V>> iterator = entries.values().iterator();
		while (iterator.hasNext()) {
			CacheEntry<V> entry = iterator.next();
			if (entry.isExpired(now)) {
				iterator.remove();
				totalSize -= entry.getEstimatedSize();
				removed++;
			}
		}
		if (removed > 0) {
			logger.debug("Expiry sweep removed {} entries", removed);
		}
		return removed;
	}

	public synchronized CacheStats getStats() {
		long lookups = hits + misses;
		double hitRate = (lookups == 0) ? 0 : (hits * 100.0) / lookups;
		long average = entries.isEmpty() ? 0 : totalSize / entries.size();
		return new CacheStats(hits, misses, evictions, hitRate, entries.size(), totalSize, average);
	}

	public void logStats() {
		CacheStats stats = getStats();
		logger.info("Memory cache: {} entries, {} bytes (avg {}), hit rate {}% ({} hits / {} misses), {} evicted",
				stats.totalEntries(), stats.totalSizeBytes(), stats.averageEntrySizeBytes(),
				String.format("%.1f", stats.hitRate()), stats.totalHits(), stats.totalMisses(),
				stats.evictedEntries());
	}

	public synchronized long getSizeBytes() {
		return totalSize;
	}

	public long getMaxBytes() {
		return maxBytes;
	}

	public EvictionPolicy getPolicy() {
		return policy;
	}

	/**
	 * Cross-check the tracked aggregate size against the live entries and look for
	 * expired entries that are still present.
	 * @return the validation outcome
	 */
	public synchronized CacheValidation validate() {
		List<String> issues = new ArrayList<>();
		long actual = entries.values().stream().mapToLong(CacheEntry::getEstimatedSize).sum();
		if (actual != totalSize) {
			issues.add("Tracked size " + totalSize + " does not match sum of entry sizes " + actual);
		}
		if (totalSize > maxBytes) {
			issues.add("Tracked size " + totalSize + " exceeds budget " + maxBytes);
		}
		Instant now = clock.instant();
		long expired = entries.values().stream().filter(entry -> entry.isExpired(now)).count();
		if (expired > 0) {
			issues.add(expired + " expired entries still present");
		}
		return new CacheValidation(issues.isEmpty(), issues);
	}

	/**
	 * Start the periodic expiry sweep. Calling it again has no effect.
	 */
	public synchronized void start() {
		if (sweeper != null) {
			return;
		}
		ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
			Thread thread = new Thread(runnable, "memory-cache-sweep");
			thread.setDaemon(true);
			return thread;
		});
		long intervalMs = sweepInterval.toMillis();
		executor.scheduleAtFixedRate(this::sweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
		this.sweeper = executor;
		logger.debug("Expiry sweep started every {}ms", intervalMs);
	}

	public synchronized boolean isRunning() {
		return sweeper != null;
	}

	/**
	 * Stop the expiry sweep. Entries stay readable.
	 */
	@Override
	public synchronized void close() {
		if (sweeper != null) {
			sweeper.shutdownNow();
			sweeper = null;
			logger.debug("Expiry sweep stopped");
		}
	}

	private void sweep() {
		try {
			removeExpired();
		}
		catch (RuntimeException e) {
			// an exception would cancel the scheduled task
			logger.warn("Expiry sweep failed: {}", e.getMessage());
		}
	}

	private boolean remove(String key) {
		CacheEntry<V> removed = entries.remove(key);
		if (removed == null) {
			return false;
		}
		totalSize -= removed.getEstimatedSize();
		return true;
	}

	private long estimateSize(V value) {
		try {
			return objectMapper.writeValueAsBytes(value).length;
		}
		catch (JsonProcessingException e) {
			logger.debug("Could not serialize value for size estimation, assuming {} bytes: {}", FALLBACK_ENTRY_SIZE,
					e.getMessage());
			return FALLBACK_ENTRY_SIZE;
		}
	}

	/**
	 * Named cache configurations.
	 */
	public enum Preset {

		/**
		 * Small and short-lived, keeps frequently used entries.
		 */
		AGGRESSIVE(50L * 1024 * 1024, Duration.ofMinutes(30), "LFU"),

		/**
		 * Default trade-off.
		 */
		BALANCED(200L * 1024 * 1024, Duration.ofHours(1), "LRU"),

		/**
		 * Large and long-lived.
		 */
		CONSERVATIVE(500L * 1024 * 1024, Duration.ofHours(24), "FIFO");

		private final long maxBytes;

		private final Duration ttl;

		private final String policy;

		Preset(long maxBytes, Duration ttl, String policy) {
			this.maxBytes = maxBytes;
			this.ttl = ttl;
			this.policy = policy;
		}

		public long maxBytes() {
			return maxBytes;
		}

		public Duration ttl() {
			return ttl;
		}

		public String policy() {
			return policy;
		}

	}

}
