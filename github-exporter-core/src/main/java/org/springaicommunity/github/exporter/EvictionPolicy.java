package org.springaicommunity.github.exporter;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Chooses which {@link MemoryCache} entries to remove when the byte budget would be
 * exceeded.
 *
 * <p>
 * A policy is an ordering of entries: the first entry in {@link #evictionOrder()} is the
 * first one evicted. New policies only need to supply that ordering.
 */
public interface EvictionPolicy {

	/**
	 * Configuration label of this policy, e.g. "LRU".
	 * @return the label
	 */
	String name();

	/**
	 * Ordering in which entries become eviction candidates.
	 * @return comparator placing the next victim first
	 */
	Comparator<CacheEntry<?>> evictionOrder();

	/**
	 * Pick the next entry to evict.
	 * @param entries live entries
	 * @param <E> entry type
	 * @return the victim, or empty if there are no entries
	 */
	default <E extends CacheEntry<?>> Optional<E> selectVictim(Collection<E> entries) {
		return entries.stream().min(evictionOrder());
	}

	/**
	 * All entries in eviction order.
	 * @param entries live entries
	 * @param <E> entry type
	 * @return entries sorted from first to last victim
	 */
	default <E extends CacheEntry<?>> List<E> orderCandidates(Collection<E> entries) {
		return entries.stream().sorted(evictionOrder()).toList();
	}

	/**
	 * Resolve a policy from its configuration label.
	 * @param label one of LRU, LFU, FIFO or TTL (case-insensitive)
	 * @return the policy
	 * @throws IllegalArgumentException if the label is unknown
	 */
	static EvictionPolicy named(String label) {
		String normalized = (label == null) ? "" : label.trim().toUpperCase(Locale.ROOT);
		return switch (normalized) {
			case "LRU" -> new LruEvictionPolicy();
			case "LFU" -> new LfuEvictionPolicy();
			case "FIFO" -> new FifoEvictionPolicy();
			case "TTL" -> new TtlEvictionPolicy();
			default -> throw new IllegalArgumentException(
					"Unknown eviction policy '" + label + "'. Supported: LRU, LFU, FIFO, TTL");
		};
	}

}
