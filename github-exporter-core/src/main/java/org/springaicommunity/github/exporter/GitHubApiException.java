package org.springaicommunity.github.exporter;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.net.http.HttpTimeoutException;

/**
 * Exception thrown when GitHub API calls fail.
 *
 * <p>
 * Carries rate limit information when available, enabling quota-aware retry logic in
 * {@link RateLimiter} and {@link AdaptiveRetry}. An exception is <em>transient</em> when a
 * fresh attempt may succeed: server errors, quota exhaustion, I/O failures and timeouts.
 * Validation, authentication and not-found failures are permanent.
 */
public class GitHubApiException extends RuntimeException {

	private final int statusCode;

	@Nullable
	private final String responseBody;

	private final int rateLimitRemaining;

	private final long resetEpochSeconds;

	public GitHubApiException(String message, int statusCode, @Nullable String responseBody) {
		this(message, statusCode, responseBody, -1, -1);
	}

	public GitHubApiException(String message, int statusCode, @Nullable String responseBody, int rateLimitRemaining,
			long resetEpochSeconds) {
		super(message);
		this.statusCode = statusCode;
		this.responseBody = responseBody;
		this.rateLimitRemaining = rateLimitRemaining;
		this.resetEpochSeconds = resetEpochSeconds;
	}

	public GitHubApiException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
		this.responseBody = null;
		this.rateLimitRemaining = -1;
		this.resetEpochSeconds = -1;
	}

	public int getStatusCode() {
		return statusCode;
	}

	@Nullable
	public String getResponseBody() {
		return responseBody;
	}

	public int getRateLimitRemaining() {
		return rateLimitRemaining;
	}

	public long getResetEpochSeconds() {
		return resetEpochSeconds;
	}

	/**
	 * Returns true if this exception represents a rate limit error (either 403 with
	 * remaining=0 or 429).
	 */
	public boolean isRateLimitError() {
		return (statusCode == 429) || (statusCode == 403 && rateLimitRemaining == 0);
	}

	/**
	 * Returns true if the request timed out before a response arrived.
	 */
	public boolean isTimeout() {
		return getCause() instanceof HttpTimeoutException;
	}

	/**
	 * Returns true if retrying the same request may succeed.
	 */
	public boolean isTransient() {
		if (statusCode == -1) {
			// no response: connection failure or timeout (HttpTimeoutException is an IOException)
			return getCause() instanceof IOException;
		}
		return isRateLimitError() || statusCode >= 500;
	}

	/**
	 * Default retry predicate: transient API failures and I/O failures other than
	 * malformed JSON are retryable, everything else is not.
	 * @param error the failure to classify
	 * @return true if the failure is worth another attempt
	 */
	public static boolean isRetryable(Throwable error) {
		Throwable current = error;
		while (current != null) {
			if (current instanceof GitHubApiException apiException) {
				return apiException.isTransient();
			}
			if (current instanceof JsonProcessingException) {
				return false;
			}
			if (current instanceof IOException) {
				return true;
			}
			current = current.getCause();
		}
		return false;
	}

}
