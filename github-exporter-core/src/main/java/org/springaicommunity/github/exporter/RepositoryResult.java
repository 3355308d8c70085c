package org.springaicommunity.github.exporter;

import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Outcome of exporting one resource type of one repository within a batch.
 *
 * @param repository repository in "owner/name" form
 * @param success whether the export succeeded
 * @param resourceType the exported resource type
 * @param itemsExported items written
 * @param itemsFailed items that could not be written
 * @param apiCalls upstream calls made
 * @param duration time spent on this export
 * @param error all error messages joined, or null on success
 */
public record RepositoryResult(String repository, boolean success, ResourceType resourceType, int itemsExported,
		int itemsFailed, int apiCalls, Duration duration, @Nullable String error) {

	/**
	 * A resource type that was not attempted because an earlier step failed.
	 * @param repository repository in "owner/name" form
	 * @param type the resource type
	 * @param error why it failed
	 * @return a failed result with no counters
	 */
	public static RepositoryResult notAttempted(String repository, ResourceType type, String error) {
		return new RepositoryResult(repository, false, type, 0, 0, 0, Duration.ZERO, error);
	}

}
