package org.springaicommunity.github.exporter;

import java.util.Comparator;

/**
 * Evicts the least recently accessed entry first.
 */
public class LruEvictionPolicy implements EvictionPolicy {

	@Override
	public String name() {
		return "LRU";
	}

	@Override
	public Comparator<CacheEntry<?>> evictionOrder() {
		return Comparator.comparingLong(CacheEntry::getAccessSequence);
	}

}
