package org.springaicommunity.github.exporter;

import java.time.Duration;
import java.time.Instant;

/**
 * A value held by {@link MemoryCache} together with the bookkeeping eviction policies
 * need.
 *
 * <p>
 * Besides timestamps, every entry carries an insertion sequence and an access sequence
 * taken from a counter owned by the cache. Eviction order is decided on those sequences
 * so that entries touched within the same clock tick are still ordered.
 *
 * <p>
 * Instances are mutated only while the owning cache's lock is held.
 *
 * @param <V> value type
 */
public final class CacheEntry<V> {

	private final String key;

	private final V value;

	private final Instant timestamp;

	private final Duration ttl;

	private final long estimatedSize;

	private final long insertionSequence;

	private long hitCount;

	private Instant lastAccessed;

	private long accessSequence;

	CacheEntry(String key, V value, Instant timestamp, Duration ttl, long estimatedSize, long sequence) {
		this.key = key;
		this.value = value;
		this.timestamp = timestamp;
		this.ttl = ttl;
		this.estimatedSize = estimatedSize;
		this.insertionSequence = sequence;
		this.lastAccessed = timestamp;
		this.accessSequence = sequence;
	}

	public String getKey() {
		return key;
	}

	public V getValue() {
		return value;
	}

	public Instant getTimestamp() {
		return timestamp;
	}

	public Duration getTtl() {
		return ttl;
	}

	public long getEstimatedSize() {
		return estimatedSize;
	}

	public long getHitCount() {
		return hitCount;
	}

	public Instant getLastAccessed() {
		return lastAccessed;
	}

	public long getInsertionSequence() {
		return insertionSequence;
	}

	public long getAccessSequence() {
		return accessSequence;
	}

	public Instant getExpiresAt() {
		return timestamp.plus(ttl);
	}

	/**
	 * An entry is expired once more than its ttl has passed since it was written.
	 * @param now current time
	 * @return true if the entry must no longer be returned
	 */
	public boolean isExpired(Instant now) {
		return Duration.between(timestamp, now).compareTo(ttl) > 0;
	}

	void recordHit(Instant now, long sequence) {
		this.hitCount++;
		this.lastAccessed = now;
		this.accessSequence = sequence;
	}

}
