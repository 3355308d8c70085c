package org.springaicommunity.github.exporter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link AdaptiveRetry}.
 */
@DisplayName("AdaptiveRetry Tests")
class AdaptiveRetryTest {

	private final RecordingSleeper sleeper = new RecordingSleeper();

	private static List<Integer> range(int offset, int limit) {
		return IntStream.range(offset, offset + limit).boxed().collect(Collectors.toList());
	}

	@Nested
	@DisplayName("Chunked Execution")
	class ChunkedExecutionTest {

		@Test
		@DisplayName("Should issue one fetch per chunk when nothing fails")
		void shouldIssueOneFetchPerChunk() {
			AdaptiveRetry retry = AdaptiveRetry.builder(1050).sleeper(sleeper).build();
			List<Integer> offsets = new ArrayList<>();

			AdaptiveRetryResult<Integer> result = retry.executeWithChunking((offset, limit) -> {
				offsets.add(offset);
				return range(offset, limit);
			}, 100, e -> true);

			assertThat(result.success()).isTrue();
			assertThat(result.totalAttempts()).isEqualTo(11);
			assertThat(offsets).containsExactly(0, 100, 200, 300, 400, 500, 600, 700, 800, 900, 1000);
			assertThat(result.itemsProcessed()).isEqualTo(1050);
			assertThat(result.data()).startsWith(0, 1, 2).endsWith(1049);
			assertThat(sleeper.sleeps()).isEmpty();
		}

		@Test
		@DisplayName("Should recover a chunk that fails every fifth call")
		void shouldRecoverIntermittentChunkFailure() {
			AdaptiveRetry retry = AdaptiveRetry.builder(2500).sleeper(sleeper).build();
			AtomicInteger calls = new AtomicInteger();

			AdaptiveRetryResult<Integer> result = retry.executeWithChunking((offset, limit) -> {
				if (calls.incrementAndGet() % 5 == 0) {
					throw new GitHubApiException("Server error", 502, "bad gateway");
				}
				return range(offset, limit);
			}, 500, GitHubApiException::isRetryable);

			assertThat(result.success()).isTrue();
			assertThat(result.itemsProcessed()).isEqualTo(2500);
			assertThat(result.totalAttempts()).isEqualTo(6);
			assertThat(result.errors()).isEmpty();
			assertThat(sleeper.sleeps()).hasSize(1);
		}

		@Test
		@DisplayName("Should record exactly one error for a chunk that always fails and keep the others")
		void shouldSkipPermanentlyFailingChunk() {
			AdaptiveRetry retry = AdaptiveRetry.builder(500).maxRetries(2).sleeper(sleeper).build();

			AdaptiveRetryResult<Integer> result = retry.executeWithChunking((offset, limit) -> {
				if (offset == 200) {
					throw new IOException("connection reset");
				}
				return range(offset, limit);
			}, 100, e -> true);

			assertThat(result.success()).isFalse();
			assertThat(result.errors()).hasSize(1);
			assertThat(result.errors().get(0)).isInstanceOf(ExportException.class)
				.hasMessageContaining("offset 200")
				.hasCauseInstanceOf(IOException.class);
			assertThat(result.itemsProcessed()).isEqualTo(400);
			assertThat(result.data()).doesNotContain(200, 250, 299).contains(199, 300);
			// 4 good chunks plus 3 attempts on the bad one
			assertThat(result.totalAttempts()).isEqualTo(7);
		}

		@Test
		@DisplayName("Should not retry a chunk when the predicate rejects the error")
		void shouldNotRetryRejectedError() {
			AdaptiveRetry retry = AdaptiveRetry.builder(200).sleeper(sleeper).build();

			AdaptiveRetryResult<Integer> result = retry.executeWithChunking((offset, limit) -> {
				if (offset == 0) {
					throw new GitHubApiException("Not found", 404, "{}");
				}
				return range(offset, limit);
			}, 100, GitHubApiException::isRetryable);

			assertThat(result.errors()).hasSize(1);
			assertThat(result.totalAttempts()).isEqualTo(2);
			assertThat(sleeper.sleeps()).isEmpty();
		}

		@Test
		@DisplayName("Should fetch every chunk even when one returns fewer items")
		void shouldFetchAllChunksByDefault() {
			AdaptiveRetry retry = AdaptiveRetry.builder(500).sleeper(sleeper).build();
			List<Integer> offsets = new ArrayList<>();

			AdaptiveRetryResult<Integer> result = retry.executeWithChunking((offset, limit) -> {
				offsets.add(offset);
				return (offset == 100) ? range(offset, 1) : range(offset, limit);
			}, 100, e -> true);

			assertThat(result.success()).isTrue();
			assertThat(offsets).containsExactly(0, 100, 200, 300, 400);
			assertThat(result.totalAttempts()).isEqualTo(5);
			assertThat(result.itemsProcessed()).isEqualTo(401);
		}

		@Test
		@DisplayName("Should stop after the chunk that signals the end of data")
		void shouldStopAtEndOfData() {
			AdaptiveRetry retry = AdaptiveRetry.builder(1000).sleeper(sleeper).build();

			AdaptiveRetryResult<Integer> result = retry.executeWithChunking(
					(offset, limit) -> (offset < 200) ? range(offset, limit) : range(offset, 30), 100, e -> true,
					(chunk, limit) -> chunk.size() < limit);

			assertThat(result.success()).isTrue();
			assertThat(result.itemsProcessed()).isEqualTo(230);
			assertThat(result.totalAttempts()).isEqualTo(3);
		}

		@Test
		@DisplayName("Should reject non-positive chunk size")
		void shouldRejectInvalidChunkSize() {
			AdaptiveRetry retry = AdaptiveRetry.builder(10).sleeper(sleeper).build();

			assertThatThrownBy(() -> retry.executeWithChunking((offset, limit) -> List.of(), 0, e -> true))
				.isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Nested
	@DisplayName("Partial Recovery")
	class PartialRecoveryTest {

		@Test
		@DisplayName("Should return full data on success")
		void shouldReturnDataOnSuccess() {
			AdaptiveRetry retry = AdaptiveRetry.builder(10).sleeper(sleeper).build();

			AdaptiveRetryResult<String> result = retry.executeWithPartialRecovery(progress -> List.of("a", "b"),
					e -> true);

			assertThat(result.success()).isTrue();
			assertThat(result.data()).containsExactly("a", "b");
			assertThat(result.totalAttempts()).isEqualTo(1);
		}

		@Test
		@DisplayName("Should resume from recorded progress across attempts")
		void shouldResumeFromProgress() {
			AdaptiveRetry retry = AdaptiveRetry.builder(10).sleeper(sleeper).build();
			AtomicInteger calls = new AtomicInteger();

			AdaptiveRetryResult<Integer> result = retry.executeWithPartialRecovery(progress -> {
				int start = progress.itemsProcessed();
				progress.addProgress(range(start, 2));
				if (calls.incrementAndGet() < 3) {
					throw new IOException("flaky");
				}
				return progress.items();
			}, e -> true);

			assertThat(result.success()).isTrue();
			assertThat(result.data()).containsExactly(0, 1, 2, 3, 4, 5);
			assertThat(result.totalAttempts()).isEqualTo(3);
			assertThat(sleeper.sleeps()).hasSize(2);
		}

		@Test
		@DisplayName("Should return partial result when retries are exhausted after progress")
		void shouldReturnPartialResult() {
			AdaptiveRetry retry = AdaptiveRetry.builder(10).maxRetries(2).sleeper(sleeper).build();

			AdaptiveRetryResult<String> result = retry.executeWithPartialRecovery(progress -> {
				if (progress.itemsProcessed() == 0) {
					progress.addProgress(List.of("x", "y"));
				}
				throw new IOException("still failing");
			}, e -> true);

			assertThat(result.success()).isFalse();
			assertThat(result.data()).containsExactly("x", "y");
			assertThat(result.itemsProcessed()).isEqualTo(2);
			assertThat(result.totalAttempts()).isEqualTo(3);
			assertThat(result.errors()).singleElement().isInstanceOf(IOException.class);
		}

		@Test
		@DisplayName("Should rethrow when no progress was made")
		void shouldRethrowWithoutProgress() {
			AdaptiveRetry retry = AdaptiveRetry.builder(10).maxRetries(1).sleeper(sleeper).build();
			GitHubApiException failure = new GitHubApiException("Server error", 500, "");

			assertThatThrownBy(() -> retry.executeWithPartialRecovery(progress -> {
				throw failure;
			}, e -> true)).isSameAs(failure);
			assertThat(sleeper.sleeps()).hasSize(1);
		}

		@Test
		@DisplayName("Should wrap checked failures when no progress was made")
		void shouldWrapCheckedFailure() {
			AdaptiveRetry retry = AdaptiveRetry.builder(10).maxRetries(0).sleeper(sleeper).build();

			assertThatThrownBy(() -> retry.executeWithPartialRecovery(progress -> {
				throw new IOException("offline");
			}, e -> true)).isInstanceOf(ExportException.class).hasCauseInstanceOf(IOException.class);
		}

	}

	@Nested
	@DisplayName("Backoff")
	class BackoffTest {

		@Test
		@DisplayName("Should wait with exponential delays and notify listener")
		void shouldWaitWithExponentialDelays() {
			List<Integer> notified = new ArrayList<>();
			AdaptiveRetry retry = AdaptiveRetry.builder(10)
				.maxRetries(3)
				.initialDelay(Duration.ofMillis(100))
				.maxDelay(Duration.ofMillis(300))
				.backoffMultiplier(2.0)
				.sleeper(sleeper)
				.onRetry((attempt, error, delay) -> notified.add(attempt))
				.build();

			assertThatThrownBy(() -> retry.executeWithPartialRecovery(progress -> {
				throw new IllegalStateException("boom");
			}, e -> true)).isInstanceOf(IllegalStateException.class);

			assertThat(sleeper.sleeps()).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200),
					Duration.ofMillis(300));
			assertThat(notified).containsExactly(1, 2, 3);
		}

		@Test
		@DisplayName("Should expose strategy information")
		void shouldExposeStrategyInfo() {
			AdaptiveRetry.StrategyInfo info = AdaptiveRetry.builder(2000).build().getStrategyInfo();

			assertThat(info.datasetSize()).isEqualTo(2000);
			assertThat(info.maxRetries()).isEqualTo(5);
			assertThat(info.initialDelay()).isEqualTo(Duration.ofMillis(700));
			assertThat(info.estimatedMaxDuration()).isPositive();
		}

		@Test
		@DisplayName("Should reject negative dataset size")
		void shouldRejectNegativeSize() {
			assertThatThrownBy(() -> AdaptiveRetry.builder(-1).build()).isInstanceOf(IllegalStateException.class);
		}

	}

}
