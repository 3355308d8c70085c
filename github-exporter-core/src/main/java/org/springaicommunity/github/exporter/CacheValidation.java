package org.springaicommunity.github.exporter;

import java.util.List;

/**
 * Result of {@link MemoryCache#validate()}.
 *
 * @param valid true when no issue was found
 * @param issues human-readable description of each inconsistency
 */
public record CacheValidation(boolean valid, List<String> issues) {

	public CacheValidation {
		issues = List.copyOf(issues);
	}

}
