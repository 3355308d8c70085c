package org.springaicommunity.github.exporter;

import java.util.Comparator;

/**
 * Evicts the entry with the fewest hits first; ties go to the least recently accessed.
 */
public class LfuEvictionPolicy implements EvictionPolicy {

	@Override
	public String name() {
		return "LFU";
	}

	@Override
	public Comparator<CacheEntry<?>> evictionOrder() {
		return Comparator.<CacheEntry<?>>comparingLong(CacheEntry::getHitCount)
			.thenComparingLong(CacheEntry::getAccessSequence);
	}

}
