package org.springaicommunity.github.exporter;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link MemoryCache}.
 */
@DisplayName("MemoryCache Tests")
class MemoryCacheTest {

	// Every value is 8 characters, serialized as a 10 byte JSON string
	private static final long ENTRY_SIZE = 10;

	private MutableClock clock;

	private MemoryCache<String> cache;

	@BeforeEach
	void setUp() {
		clock = new MutableClock(Instant.parse("2024-06-01T00:00:00Z"));
		cache = newCache(3 * ENTRY_SIZE, new LruEvictionPolicy());
	}

	@AfterEach
	void tearDown() {
		cache.close();
	}

	private MemoryCache<String> newCache(long maxBytes, EvictionPolicy policy) {
		return new MemoryCache<>(maxBytes, Duration.ofMinutes(10), policy, Duration.ofMinutes(5), clock,
				ObjectMapperFactory.create());
	}

	@Nested
	@DisplayName("Basic Operations")
	class BasicOperationsTest {

		@Test
		@DisplayName("Should return stored value and count hits and misses")
		void shouldCountHitsAndMisses() {
			cache.set("a", "aaaaaaaa");

			assertThat(cache.get("a")).contains("aaaaaaaa");
			assertThat(cache.get("a")).contains("aaaaaaaa");
			assertThat(cache.get("missing")).isEmpty();

			CacheStats stats = cache.getStats();
			assertThat(stats.totalHits()).isEqualTo(2);
			assertThat(stats.totalMisses()).isEqualTo(1);
			assertThat(stats.hitRate()).isCloseTo(66.67, within(0.01));
			assertThat(stats.totalEntries()).isEqualTo(1);
			assertThat(stats.totalSizeBytes()).isEqualTo(ENTRY_SIZE);
			assertThat(stats.averageEntrySizeBytes()).isEqualTo(ENTRY_SIZE);
		}

		@Test
		@DisplayName("Should replace existing key without double counting size")
		void shouldReplaceExistingKey() {
			cache.set("a", "aaaaaaaa");
			cache.set("a", "bbbbbbbb");

			assertThat(cache.get("a")).contains("bbbbbbbb");
			assertThat(cache.getSizeBytes()).isEqualTo(ENTRY_SIZE);
			assertThat(cache.validate().valid()).isTrue();
		}

		@Test
		@DisplayName("Should delete and clear")
		void shouldDeleteAndClear() {
			cache.set("a", "aaaaaaaa");
			cache.set("b", "bbbbbbbb");

			assertThat(cache.delete("a")).isTrue();
			assertThat(cache.delete("a")).isFalse();
			assertThat(cache.has("a")).isFalse();
			assertThat(cache.has("b")).isTrue();

			cache.clear();
			assertThat(cache.getSizeBytes()).isZero();
			assertThat(cache.getStats().totalEntries()).isZero();
		}

		@Test
		@DisplayName("Should estimate structured values from their JSON form")
		void shouldEstimateStructuredValues() {
			MemoryCache<Object> objects = new MemoryCache<>(1024, Duration.ofMinutes(1), new FifoEvictionPolicy(),
					Duration.ofMinutes(5), clock, ObjectMapperFactory.create());

			objects.set("list", List.of(Map.of("id", 1)));

			// [{"id":1}]
			assertThat(objects.getSizeBytes()).isEqualTo(10);
		}

		@Test
		@DisplayName("Should reject non-positive budget")
		void shouldRejectNonPositiveBudget() {
			assertThatThrownBy(() -> newCache(0, new LruEvictionPolicy())).isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Nested
	@DisplayName("Expiry")
	class ExpiryTest {

		@Test
		@DisplayName("Should expire entries after their ttl")
		void shouldExpireAfterTtl() {
			cache.set("a", "aaaaaaaa", Duration.ofSeconds(30));

			clock.advance(Duration.ofSeconds(30));
			assertThat(cache.get("a")).isPresent();

			clock.advance(Duration.ofMillis(1));
			assertThat(cache.get("a")).isEmpty();
			assertThat(cache.getSizeBytes()).isZero();
			assertThat(cache.getStats().totalMisses()).isEqualTo(1);
		}

		@Test
		@DisplayName("Should remove expired entries in a sweep")
		void shouldRemoveExpiredEntries() {
			cache.set("short", "aaaaaaaa", Duration.ofSeconds(1));
			cache.set("long", "bbbbbbbb", Duration.ofHours(1));
			clock.advance(Duration.ofSeconds(2));

			assertThat(cache.validate().valid()).isFalse();
			assertThat(cache.removeExpired()).isEqualTo(1);
			assertThat(cache.has("long")).isTrue();
			assertThat(cache.validate().valid()).isTrue();
		}

		@Test
		@DisplayName("Should treat expired entry as absent in has()")
		void hasShouldIgnoreExpiredEntry() {
			cache.set("a", "aaaaaaaa", Duration.ofSeconds(1));
			clock.advance(Duration.ofSeconds(5));

			assertThat(cache.has("a")).isFalse();
			assertThat(cache.getSizeBytes()).isZero();
		}

	}

	@Nested
	@DisplayName("Eviction")
	class EvictionTest {

		@Test
		@DisplayName("Should keep recently read entry under LRU")
		void shouldKeepRecentlyReadEntry() {
			cache.set("a", "aaaaaaaa");
			cache.set("b", "bbbbbbbb");
			cache.set("c", "cccccccc");

			cache.get("a");
			cache.set("d", "dddddddd");

			assertThat(cache.has("a")).isTrue();
			assertThat(cache.has("b")).isFalse();
			assertThat(cache.has("c")).isTrue();
			assertThat(cache.has("d")).isTrue();
			assertThat(cache.getStats().evictedEntries()).isEqualTo(1);
		}

		@Test
		@DisplayName("Should evict earliest insertion under FIFO even if it was read")
		void shouldEvictEarliestUnderFifo() {
			MemoryCache<String> fifo = newCache(3 * ENTRY_SIZE, new FifoEvictionPolicy());
			fifo.set("a", "aaaaaaaa");
			fifo.set("b", "bbbbbbbb");
			fifo.set("c", "cccccccc");
			fifo.get("a");

			fifo.set("d", "dddddddd");

			assertThat(fifo.has("a")).isFalse();
			assertThat(fifo.has("b")).isTrue();
		}

		@Test
		@DisplayName("Should evict least used entry under LFU")
		void shouldEvictLeastUsedUnderLfu() {
			MemoryCache<String> lfu = newCache(3 * ENTRY_SIZE, new LfuEvictionPolicy());
			lfu.set("a", "aaaaaaaa");
			lfu.set("b", "bbbbbbbb");
			lfu.set("c", "cccccccc");
			lfu.get("a");
			lfu.get("a");
			lfu.get("b");
			lfu.get("c");

			lfu.set("d", "dddddddd");

			assertThat(lfu.has("a")).isTrue();
			assertThat(lfu.has("b")).isFalse();
			assertThat(lfu.has("c")).isTrue();
		}

		@Test
		@DisplayName("Should evict entry closest to expiry under TTL")
		void shouldEvictClosestToExpiryUnderTtl() {
			MemoryCache<String> ttl = newCache(3 * ENTRY_SIZE, new TtlEvictionPolicy());
			ttl.set("a", "aaaaaaaa", Duration.ofHours(2));
			ttl.set("b", "bbbbbbbb", Duration.ofMinutes(1));
			ttl.set("c", "cccccccc", Duration.ofHours(1));

			ttl.set("d", "dddddddd");

			assertThat(ttl.has("b")).isFalse();
			assertThat(ttl.has("a")).isTrue();
			assertThat(ttl.has("c")).isTrue();
		}

		@Test
		@DisplayName("Should evict several entries to fit a large value")
		void shouldEvictSeveralEntries() {
			cache.set("a", "aaaaaaaa");
			cache.set("b", "bbbbbbbb");
			cache.set("c", "cccccccc");

			// 18 characters, 20 bytes
			assertThat(cache.set("big", "xxxxxxxxxxxxxxxxxx")).isTrue();

			assertThat(cache.has("a")).isFalse();
			assertThat(cache.has("b")).isFalse();
			assertThat(cache.has("c")).isTrue();
			assertThat(cache.getSizeBytes()).isLessThanOrEqualTo(cache.getMaxBytes());
			assertThat(cache.validate().valid()).isTrue();
		}

		@Test
		@DisplayName("Should refuse a value larger than the whole budget")
		void shouldRefuseOversizeValue() {
			cache.set("a", "aaaaaaaa");

			assertThat(cache.set("huge", "x".repeat(100))).isFalse();

			assertThat(cache.has("huge")).isFalse();
			assertThat(cache.has("a")).isTrue();
			assertThat(cache.getStats().evictedEntries()).isZero();
		}

		@Test
		@DisplayName("Should never exceed budget across many inserts")
		void shouldStayWithinBudget() {
			for (int i = 0; i < 100; i++) {
				cache.set("key-" + i, String.format("%08d", i));
				if (i % 3 == 0) {
					cache.get("key-" + (i / 2));
				}
				assertThat(cache.getSizeBytes()).isLessThanOrEqualTo(cache.getMaxBytes());
			}
			assertThat(cache.validate().issues()).isEmpty();
		}

	}

	@Nested
	@DisplayName("Lifecycle")
	class LifecycleTest {

		@Test
		@DisplayName("Should start and stop the expiry sweep")
		void shouldStartAndStop() {
			assertThat(cache.isRunning()).isFalse();

			cache.start();
			cache.start();
			assertThat(cache.isRunning()).isTrue();

			cache.close();
			assertThat(cache.isRunning()).isFalse();
		}

		@Test
		@DisplayName("Should stay readable after close")
		void shouldStayReadableAfterClose() {
			cache.start();
			cache.set("a", "aaaaaaaa");
			cache.close();

			assertThat(cache.get("a")).contains("aaaaaaaa");
		}

		@Test
		@DisplayName("Should build caches from presets")
		void shouldBuildFromPresets() {
			MemoryCache<String> aggressive = MemoryCache.fromPreset(MemoryCache.Preset.AGGRESSIVE);
			MemoryCache<String> conservative = MemoryCache.fromPreset(MemoryCache.Preset.CONSERVATIVE);

			assertThat(aggressive.getMaxBytes()).isEqualTo(50L * 1024 * 1024);
			assertThat(aggressive.getPolicy().name()).isEqualTo("LFU");
			assertThat(conservative.getPolicy().name()).isEqualTo("FIFO");
			assertThat(MemoryCache.Preset.BALANCED.ttl()).isEqualTo(Duration.ofHours(1));
		}

	}

}
