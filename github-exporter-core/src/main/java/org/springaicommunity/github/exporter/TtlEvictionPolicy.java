package org.springaicommunity.github.exporter;

import java.time.Instant;
import java.util.Comparator;

/**
 * Evicts the entry closest to expiry first; ties go to the earliest inserted.
 */
public class TtlEvictionPolicy implements EvictionPolicy {

	@Override
	public String name() {
		return "TTL";
	}

	@Override
	public Comparator<CacheEntry<?>> evictionOrder() {
		return Comparator.<CacheEntry<?>, Instant>comparing(CacheEntry::getExpiresAt)
			.thenComparingLong(CacheEntry::getInsertionSequence);
	}

}
