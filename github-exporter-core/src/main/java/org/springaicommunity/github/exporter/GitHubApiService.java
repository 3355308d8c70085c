package org.springaicommunity.github.exporter;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Interface for the GitHub REST operations the exporters need.
 *
 * <p>
 * Returns strongly-typed records instead of raw JSON. List operations are paged:
 * {@code page} is 1-based and a page shorter than {@code perPage} is the last one.
 */
public interface GitHubApiService {

	/**
	 * Get current rate limit status of the core REST quota.
	 * @return Rate limit information
	 * @throws GitHubApiException if the API call fails
	 */
	RateLimitInfo getRateLimit();

	/**
	 * Get repository by name.
	 * @param repoName Repository name in "owner/repo" format
	 * @return Repository information
	 * @throws GitHubApiException if the API call fails (404 for unknown repositories)
	 * @throws IllegalArgumentException if the name is not in "owner/repo" format
	 */
	RepositoryInfo getRepository(String repoName);

	/**
	 * List pull requests in all states, most recently updated first.
	 * @param owner Repository owner
	 * @param repo Repository name
	 * @param page 1-based page number
	 * @param perPage page size
	 * @return one page of pull requests
	 */
	List<PullRequest> listPullRequests(String owner, String repo, int page, int perPage);

	/**
	 * List issues in all states. Pull requests listed by the issues endpoint are included
	 * with {@link Issue#pullRequest()} set, so a short page still means the last page.
	 * @param owner Repository owner
	 * @param repo Repository name
	 * @param since only issues updated at or after this time (null for all)
	 * @param page 1-based page number
	 * @param perPage page size
	 * @return one page of issues
	 */
	List<Issue> listIssues(String owner, String repo, @Nullable Instant since, int page, int perPage);

	/**
	 * List commits of the default branch.
	 * @param owner Repository owner
	 * @param repo Repository name
	 * @param since only commits after this time (null for all)
	 * @param page 1-based page number
	 * @param perPage page size
	 * @return one page of commits
	 */
	List<Commit> listCommits(String owner, String repo, @Nullable Instant since, int page, int perPage);

	/**
	 * List branches.
	 * @param owner Repository owner
	 * @param repo Repository name
	 * @param page 1-based page number
	 * @param perPage page size
	 * @return one page of branches
	 */
	List<Branch> listBranches(String owner, String repo, int page, int perPage);

	/**
	 * List releases, newest first.
	 * @param owner Repository owner
	 * @param repo Repository name
	 * @param page 1-based page number
	 * @param perPage page size
	 * @return one page of releases
	 */
	List<Release> listReleases(String owner, String repo, int page, int perPage);

}
