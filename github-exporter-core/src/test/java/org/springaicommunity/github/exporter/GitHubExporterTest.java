package org.springaicommunity.github.exporter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests of {@link GitHubExporter} against an in-memory GitHub.
 */
@DisplayName("GitHubExporter Tests")
class GitHubExporterTest {

	private static final Instant T0 = Instant.parse("2024-06-01T10:00:00Z");

	@TempDir
	Path tempDir;

	private MutableClock clock;

	private FakeGitHubClient github;

	private ExportProperties properties;

	@BeforeEach
	void setUp() {
		clock = new MutableClock(T0);
		github = new FakeGitHubClient();
		github.route("/rate_limit", query -> FakeGitHubClient.rateLimitJson(4999, clock.instant().getEpochSecond() + 3600))
			.route("/repos/acme/widgets", FakeGitHubClient.repositoryJson("acme", "widgets"))
			.paged("/repos/acme/widgets/issues", 3, i -> FakeGitHubClient.issueJson(i + 1, i == 2))
			.paged("/repos/acme/widgets/releases", 2, i -> FakeGitHubClient.releaseJson(i, "v" + i + ".0"));

		properties = new ExportProperties();
		properties.setStateFile(tempDir.resolve("state/exports.json"));
		properties.setCacheDirectory(tempDir.resolve("cache"));
		properties.setOutputDirectory(tempDir.resolve("out"));
		properties.setMinTimeBetweenRequests(Duration.ZERO);
	}

	private GitHubExporter build() {
		// Use minimal delay
		return GitHubExporterBuilder.create()
			.httpClient(github)
			.properties(properties)
			.clock(clock)
			.sleeper(duration -> {
			})
			.build();
	}

	private BatchConfig batch(boolean diffMode) {
		return BatchConfig.builder()
			.repository("acme/widgets")
			.resourceTypes(List.of(ResourceType.ISSUES, ResourceType.RELEASES))
			.format(ExportFormat.BOTH)
			.outputPath(tempDir.resolve("out"))
			.diffMode(diffMode)
			.build();
	}

	@Nested
	@DisplayName("Incremental Pipeline")
	class IncrementalPipelineTest {

		@Test
		@DisplayName("Should export everything first, then only changes since the checkpoint")
		void shouldExportIncrementally() {
			properties.setCacheEnabled(false);
			try (GitHubExporter exporter = build()) {
				BatchResult first = exporter.runBatch(batch(true));

				assertThat(first.successfulRepositories()).isEqualTo(1);
				assertThat(first.resultsFor("acme/widgets")).extracting(RepositoryResult::itemsExported)
					.containsExactly(2, 2);
				assertThat(github.requests()).filteredOn(request -> request.contains("/issues"))
					.noneMatch(request -> request.contains("since="));
				assertThat(exporter.getStateManager().getLastExport("acme/widgets", ResourceType.ISSUES))
					.hasValueSatisfying(checkpoint -> assertThat(checkpoint.lastExportAt()).isEqualTo(T0));

				clock.advance(Duration.ofHours(1));
				exporter.runBatch(batch(true));

				assertThat(github.requests()).filteredOn(request -> request.contains("/issues"))
					.anyMatch(request -> request.contains("since=2024-06-01T10:00:00Z"));
				assertThat(exporter.getStateManager().getLastExport("acme/widgets", ResourceType.ISSUES))
					.hasValueSatisfying(
							checkpoint -> assertThat(checkpoint.lastExportAt()).isEqualTo(T0.plus(Duration.ofHours(1))));
			}
		}

		@Test
		@DisplayName("Should write items in both formats under the repository directory")
		void shouldWriteItemFiles() {
			try (GitHubExporter exporter = build()) {
				exporter.runBatch(batch(false));
			}

			Path issues = tempDir.resolve("out/acme/widgets/Issues");
			assertThat(issues.resolve("ISSUE-1.json")).exists();
			assertThat(issues.resolve("ISSUE-2.md")).exists();
			assertThat(issues.resolve("ISSUE-3.json")).doesNotExist();
			assertThat(tempDir.resolve("out/acme/widgets/Releases/v0.0.json")).exists();
			assertThat(tempDir.resolve("out/batch-summary.md")).exists();
		}

		@Test
		@DisplayName("Should answer a repeated full export from the caches")
		void shouldReuseCachedPages() {
			try (GitHubExporter exporter = build()) {
				exporter.runBatch(batch(false));
				long issueCalls = github.count("/repos/acme/widgets/issues");

				BatchResult second = exporter.runBatch(batch(false));

				assertThat(github.count("/repos/acme/widgets/issues")).isEqualTo(issueCalls);
				assertThat(second.totalApiCalls()).isZero();
				assertThat(exporter.getMemoryCache().getStats().totalHits()).isPositive();
			}
		}

		@Test
		@DisplayName("Should fetch fresh pages for a forced full export after upstream changed")
		void shouldRefetchWhenForced() {
			try (GitHubExporter exporter = build()) {
				exporter.runBatch(batch(false));
				github.paged("/repos/acme/widgets/issues", 5, i -> FakeGitHubClient.issueJson(i + 1, false));
				clock.advance(Duration.ofHours(2));

				BatchConfig forced = BatchConfig.builder()
					.repository("acme/widgets")
					.resourceTypes(List.of(ResourceType.ISSUES))
					.outputPath(tempDir.resolve("out"))
					.diffMode(true)
					.forceFullExport(true)
					.build();
				BatchResult result = exporter.runBatch(forced);

				assertThat(result.resultsFor("acme/widgets")).singleElement().satisfies(row -> {
					assertThat(row.itemsExported()).isEqualTo(5);
					assertThat(row.apiCalls()).isPositive();
				});
				assertThat(exporter.getStateManager().getLastExport("acme/widgets", ResourceType.ISSUES))
					.hasValueSatisfying(
							checkpoint -> assertThat(checkpoint.lastExportAt()).isEqualTo(T0.plus(Duration.ofHours(2))));
			}
		}

		@Test
		@DisplayName("Should place the checkpoint at the time cached pages were fetched")
		void shouldCheckpointAtCachedDataTime() {
			try (GitHubExporter exporter = build()) {
				exporter.runBatch(batch(false));
				github.paged("/repos/acme/widgets/issues", 5, i -> FakeGitHubClient.issueJson(i + 1, false));
				clock.advance(Duration.ofMinutes(30));

				BatchResult cached = exporter.runBatch(batch(false));
				assertThat(cached.totalApiCalls()).isZero();
				assertThat(exporter.getStateManager().getLastExport("acme/widgets", ResourceType.ISSUES))
					.hasValueSatisfying(checkpoint -> assertThat(checkpoint.lastExportAt()).isEqualTo(T0));

				clock.advance(Duration.ofMinutes(30));
				exporter.runBatch(batch(true));

				assertThat(github.requests()).filteredOn(request -> request.contains("/issues"))
					.anyMatch(request -> request.contains("since=2024-06-01T10:00:00Z"));
			}
		}

		@Test
		@DisplayName("Should export a single resource type")
		void shouldExportSingleType() throws Exception {
			try (GitHubExporter exporter = build()) {
				ExportResult result = exporter.export("acme/widgets", ResourceType.RELEASES, ExportFormat.JSON, false);

				assertThat(result.success()).isTrue();
				assertThat(result.itemsExported()).isEqualTo(2);
			}
			try (Stream<Path> files = Files.list(tempDir.resolve("out/acme/widgets/Releases"))) {
				assertThat(files.map(file -> file.getFileName().toString())).containsExactlyInAnyOrder("v0.0.json",
						"v1.0.json");
			}
		}

		@Test
		@DisplayName("Should write branches whose names differ only in punctuation to separate files")
		void shouldKeepSimilarBranchNamesApart() throws Exception {
			github.route("/repos/acme/widgets/branches",
					"[" + FakeGitHubClient.branchJson("feature/x") + "," + FakeGitHubClient.branchJson("feature-x") + "]");
			try (GitHubExporter exporter = build()) {
				ExportResult result = exporter.export("acme/widgets", ResourceType.BRANCHES, ExportFormat.JSON, false);

				assertThat(result.itemsExported()).isEqualTo(2);
			}
			try (Stream<Path> files = Files.list(tempDir.resolve("out/acme/widgets/Branches"))) {
				assertThat(files.map(file -> file.getFileName().toString()))
					.containsExactlyInAnyOrder("feature-x.json", "feature-x-217d2bf5.json");
			}
		}

	}

	@Nested
	@DisplayName("Lifecycle")
	class LifecycleTest {

		@Test
		@DisplayName("Should start the cache sweep and stop everything on close")
		void shouldManageLifecycle() {
			GitHubExporter exporter = build();
			assertThat(exporter.getMemoryCache().isRunning()).isTrue();

			exporter.close();

			assertThat(exporter.getMemoryCache().isRunning()).isFalse();
			assertThatThrownBy(() -> exporter.getRateLimiter().schedule(() -> "late"))
				.isInstanceOf(IllegalStateException.class);
		}

		@Test
		@DisplayName("Should synchronize the reservoir with the quota before a batch")
		void shouldSynchronizeReservoir() {
			try (GitHubExporter exporter = build()) {
				exporter.runBatch(batch(false));

				assertThat(exporter.getRateLimiter().getCurrentLimit()).isNotNull();
				assertThat(exporter.getRateLimiter().getStats().reservoir()).isLessThan(4999);
			}
		}

	}

	@Nested
	@DisplayName("Builder Validation")
	class BuilderValidationTest {

		@Test
		@DisplayName("Should require a token without a custom client")
		void shouldRequireToken() {
			assertThatThrownBy(() -> GitHubExporterBuilder.create().build()).isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("token");
		}

		@Test
		@DisplayName("Should reject an unknown eviction policy")
		void shouldRejectUnknownEvictionPolicy() {
			properties.setMemoryCacheEvictionPolicy("RANDOM");

			assertThatThrownBy(() -> build()).isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("Should skip the durable cache when disabled")
		void shouldSkipDurableCache() {
			properties.setCacheEnabled(false);

			try (GitHubExporter exporter = build()) {
				assertThat(exporter.getFileCache()).isNull();
			}
		}

	}

}
