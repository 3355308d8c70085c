package org.springaicommunity.github.exporter;

import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Interface for GitHub REST API HTTP operations.
 *
 * <p>
 * Provides abstraction over the GitHub REST API, enabling testability and decorator
 * implementations such as {@link RateLimitedGitHubClient}.
 */
public interface GitHubClient {

	/**
	 * Execute a GET request to the GitHub REST API using the client's default timeout.
	 * @param path API path (e.g., "/repos/owner/repo") or full URL
	 * @return Response body as String
	 * @throws GitHubApiException if the request fails
	 */
	String get(String path);

	/**
	 * Execute a GET request with an explicit timeout. A timeout surfaces as a transient
	 * {@link GitHubApiException}.
	 * @param path API path or full URL
	 * @param timeout maximum time to wait for the response
	 * @return Response body as String
	 * @throws GitHubApiException if the request fails or times out
	 */
	String get(String path, Duration timeout);

	/**
	 * Execute a GET request with query parameters.
	 * @param path API path (without query string)
	 * @param queryString Query string (without leading ?)
	 * @return Response body as String
	 * @throws GitHubApiException if the request fails
	 */
	default String getWithQuery(String path, @Nullable String queryString) {
		if (queryString == null || queryString.isEmpty()) {
			return get(path);
		}
		return get(path + "?" + queryString);
	}

	/**
	 * Get the rate limit information from the most recent API response. Returns null if
	 * no rate limit headers have been observed yet.
	 * @return last observed RateLimitInfo, or null
	 */
	@Nullable
	default RateLimitInfo getLastRateLimitInfo() {
		return null;
	}

}
