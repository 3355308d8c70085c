package org.springaicommunity.github.exporter;

import java.util.Comparator;

/**
 * Evicts the earliest inserted entry first, regardless of how it was used.
 */
public class FifoEvictionPolicy implements EvictionPolicy {

	@Override
	public String name() {
		return "FIFO";
	}

	@Override
	public Comparator<CacheEntry<?>> evictionOrder() {
		return Comparator.comparingLong(CacheEntry::getInsertionSequence);
	}

}
