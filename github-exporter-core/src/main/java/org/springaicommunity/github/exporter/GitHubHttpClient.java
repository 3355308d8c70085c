package org.springaicommunity.github.exporter;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * HTTP client for GitHub REST calls using the JDK {@link HttpClient}.
 *
 * <p>
 * Every request carries an explicit timeout. Rate limit headers are extracted from all
 * responses and made available via {@link #getLastRateLimitInfo()}.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	/**
	 * Public GitHub REST endpoint.
	 */
	public static final String DEFAULT_API_BASE = "https://api.github.com";

	private final HttpClient httpClient;

	private final String token;

	private final String apiBase;

	private final Duration defaultTimeout;

	@Nullable
	private volatile RateLimitInfo lastRateLimitInfo;

	public GitHubHttpClient(String token) {
		this(token, DEFAULT_API_BASE, Duration.ofSeconds(30));
	}

	public GitHubHttpClient(String token, String apiBase, Duration defaultTimeout) {
		this(token, apiBase, defaultTimeout,
				HttpClient.newBuilder()
					.connectTimeout(defaultTimeout)
					.followRedirects(HttpClient.Redirect.NORMAL)
					.build());
	}

	GitHubHttpClient(String token, String apiBase, Duration defaultTimeout, HttpClient httpClient) {
		this.token = token;
		this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
		this.defaultTimeout = defaultTimeout;
		this.httpClient = httpClient;
	}

	@Override
	@Nullable
	public RateLimitInfo getLastRateLimitInfo() {
		return lastRateLimitInfo;
	}

	@Override
	public String get(String path) {
		return get(path, defaultTimeout);
	}

	@Override
	public String get(String path, Duration timeout) {
		String url = path.startsWith("http") ? path : apiBase + path;
		logger.debug("GET {}", url);
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.timeout(timeout)
			.header("Authorization", "Bearer " + token)
			.header("Accept", "application/vnd.github+json")
			.header("User-Agent", "github-exporter")
			.GET()
			.build();

		try {
			String response = executeRequest(request);
			logger.debug("GET {} completed in {}ms ({} bytes)", url, System.currentTimeMillis() - start,
					response.length());
			return response;
		}
		catch (GitHubApiException e) {
			logger.debug("GET {} failed after {}ms: {}", url, System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	private String executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

			// Rate limit headers arrive on every response, successful or not
			int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
			long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
			int limit = parseIntHeader(response, "X-RateLimit-Limit", -1);
			int used = parseIntHeader(response, "X-RateLimit-Used", -1);

			if (remaining >= 0) {
				this.lastRateLimitInfo = new RateLimitInfo(limit, remaining, reset, used);
				logger.debug("Rate limit: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
			}

			int statusCode = response.statusCode();
			if (statusCode >= 200 && statusCode < 300) {
				return response.body();
			}
			else if (statusCode == 401) {
				throw new GitHubApiException("Unauthorized: Bad credentials. Check your GITHUB_TOKEN.", statusCode,
						response.body(), remaining, reset);
			}
			else if (statusCode == 403) {
				if (remaining == 0) {
					throw new GitHubApiException("Rate limit exceeded. Resets at epoch: " + reset, statusCode,
							response.body(), remaining, reset);
				}
				throw new GitHubApiException("Forbidden: " + response.body(), statusCode, response.body(), remaining,
						reset);
			}
			else if (statusCode == 404) {
				throw new GitHubApiException("Not found: " + request.uri(), statusCode, response.body(), remaining,
						reset);
			}
			else if (statusCode == 429) {
				throw new GitHubApiException("Too Many Requests (429). Resets at epoch: " + reset, statusCode,
						response.body(), remaining, reset);
			}
			else {
				throw new GitHubApiException("GitHub API error: " + statusCode, statusCode, response.body(), remaining,
						reset);
			}
		}
		catch (HttpTimeoutException e) {
			logger.warn("HTTP request timed out: {}", request.uri());
			throw new GitHubApiException("HTTP request timed out after " + request.timeout().orElse(defaultTimeout),
					e);
		}
		catch (IOException e) {
			logger.error("HTTP request failed: {}", e.getMessage());
			throw new GitHubApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("HTTP request interrupted", e);
		}
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

}
