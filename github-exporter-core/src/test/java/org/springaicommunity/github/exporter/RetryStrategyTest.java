package org.springaicommunity.github.exporter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link RetryStrategy}.
 */
@DisplayName("RetryStrategy Tests")
class RetryStrategyTest {

	@Nested
	@DisplayName("Size Breakpoints")
	class SizeBreakpointsTest {

		@ParameterizedTest(name = "size {0} -> {1} retries")
		@CsvSource({ "0, 3", "999, 3", "1000, 5", "4999, 5", "5000, 7", "9999, 7", "10000, 10", "250000, 10" })
		@DisplayName("Should derive max retries from dataset size")
		void shouldDeriveMaxRetries(int size, int expectedRetries) {
			assertThat(RetryStrategy.forDatasetSize(size).maxRetries()).isEqualTo(expectedRetries);
		}

		@Test
		@DisplayName("Max retries should never decrease across breakpoints")
		void maxRetriesShouldBeMonotonic() {
			int[][] pairs = { { 999, 1000 }, { 4999, 5000 }, { 9999, 10000 } };
			for (int[] pair : pairs) {
				assertThat(RetryStrategy.forDatasetSize(pair[1]).maxRetries())
					.isGreaterThanOrEqualTo(RetryStrategy.forDatasetSize(pair[0]).maxRetries());
			}
		}

	}

	@Nested
	@DisplayName("Delay Scaling")
	class DelayScalingTest {

		@Test
		@DisplayName("Should scale initial and max delay with size")
		void shouldScaleDelays() {
			RetryStrategy small = RetryStrategy.forDatasetSize(100);
			assertThat(small.initialDelay()).isEqualTo(Duration.ofMillis(510));
			assertThat(small.maxDelay()).isEqualTo(Duration.ofMillis(30_020));
			assertThat(small.backoffMultiplier()).isEqualTo(2.0);
		}

		@Test
		@DisplayName("Should cap delays for very large datasets")
		void shouldCapDelays() {
			RetryStrategy huge = RetryStrategy.forDatasetSize(1_000_000);
			assertThat(huge.initialDelay()).isEqualTo(Duration.ofSeconds(1));
			assertThat(huge.maxDelay()).isEqualTo(Duration.ofSeconds(60));
		}

		@Test
		@DisplayName("Should widen multiplier above 5000 items")
		void shouldWidenMultiplier() {
			assertThat(RetryStrategy.forDatasetSize(5000).backoffMultiplier()).isEqualTo(2.0);
			assertThat(RetryStrategy.forDatasetSize(5001).backoffMultiplier()).isEqualTo(2.5);
		}

		@Test
		@DisplayName("Should grow delay exponentially up to the cap")
		void shouldGrowDelayUpToCap() {
			RetryStrategy strategy = new RetryStrategy(10, Duration.ofSeconds(1), Duration.ofSeconds(5), 2.0);

			assertThat(strategy.delayForAttempt(0)).isEqualTo(Duration.ofSeconds(1));
			assertThat(strategy.delayForAttempt(1)).isEqualTo(Duration.ofSeconds(2));
			assertThat(strategy.delayForAttempt(2)).isEqualTo(Duration.ofSeconds(4));
			assertThat(strategy.delayForAttempt(3)).isEqualTo(Duration.ofSeconds(5));
			assertThat(strategy.delayForAttempt(9)).isEqualTo(Duration.ofSeconds(5));
		}

		@Test
		@DisplayName("Estimated max duration should sum every retry delay")
		void shouldEstimateMaxDuration() {
			RetryStrategy strategy = new RetryStrategy(3, Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0);

			assertThat(strategy.estimatedMaxDuration()).isEqualTo(Duration.ofSeconds(7));
		}

	}

	@Test
	@DisplayName("Should reject invalid parameters")
	void shouldRejectInvalidParameters() {
		assertThatThrownBy(() -> new RetryStrategy(-1, Duration.ZERO, Duration.ZERO, 2.0))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new RetryStrategy(1, Duration.ZERO, Duration.ZERO, 0.5))
			.isInstanceOf(IllegalArgumentException.class);
	}

}
