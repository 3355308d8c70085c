package org.springaicommunity.github.exporter;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Decorator that routes every call of a {@link GitHubClient} through a
 * {@link RateLimiter}, so all upstream traffic of a run shares one quota reservoir,
 * concurrency bound and retry policy.
 *
 * <pre>
 * {@code
 * GitHubClient client = new RateLimitedGitHubClient(new GitHubHttpClient(token), limiter);
 * }
 * </pre>
 */
public final class RateLimitedGitHubClient implements GitHubClient {

	private final GitHubClient delegate;

	private final RateLimiter rateLimiter;

	private final int priority;

	public RateLimitedGitHubClient(GitHubClient delegate, RateLimiter rateLimiter) {
		this(delegate, rateLimiter, RateLimiter.DEFAULT_PRIORITY);
	}

	public RateLimitedGitHubClient(GitHubClient delegate, RateLimiter rateLimiter, int priority) {
		this.delegate = delegate;
		this.rateLimiter = rateLimiter;
		this.priority = priority;
	}

	@Override
	public String get(String path) {
		return await(() -> delegate.get(path));
	}

	@Override
	public String get(String path, Duration timeout) {
		return await(() -> delegate.get(path, timeout));
	}

	@Override
	@Nullable
	public RateLimitInfo getLastRateLimitInfo() {
		return delegate.getLastRateLimitInfo();
	}

	private String await(Callable<String> call) {
		return rateLimiter.execute(call, priority);
	}

}
