package org.springaicommunity.github.exporter;

import java.time.Duration;
import java.util.List;

/**
 * Aggregated outcome of a batch.
 *
 * <p>
 * A repository counts as successful when at least one of its resource types was exported
 * successfully; {@code partiallySucceededRepositories} counts the successful ones where
 * some resource type still failed.
 *
 * @param totalRepositories repositories in the batch
 * @param successfulRepositories repositories with at least one successful resource type
 * @param failedRepositories repositories where every resource type failed
 * @param partiallySucceededRepositories successful repositories with a failed resource
 * type
 * @param totalItemsExported items written across the batch
 * @param totalApiCalls upstream calls made by exporters
 * @param totalDuration wall-clock time of the batch
 * @param results one row per repository and resource type
 * @param failedRepositoryNames names of the failed repositories
 */
public record BatchResult(int totalRepositories, int successfulRepositories, int failedRepositories,
		int partiallySucceededRepositories, int totalItemsExported, int totalApiCalls, Duration totalDuration,
		List<RepositoryResult> results, List<String> failedRepositoryNames) {

	public BatchResult {
		results = List.copyOf(results);
		failedRepositoryNames = List.copyOf(failedRepositoryNames);
	}

	/**
	 * Result rows of one repository.
	 * @param repository repository in "owner/name" form
	 * @return its rows, in resource type order
	 */
	public List<RepositoryResult> resultsFor(String repository) {
		return results.stream().filter(r -> r.repository().equals(repository)).toList();
	}

	public int totalItemsFailed() {
		return results.stream().mapToInt(RepositoryResult::itemsFailed).sum();
	}

}
