package org.springaicommunity.github.exporter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link BatchSummaryWriter}.
 */
@DisplayName("BatchSummaryWriter Tests")
class BatchSummaryWriterTest {

	private static final Instant GENERATED_AT = Instant.parse("2024-06-01T12:00:00Z");

	@TempDir
	Path tempDir;

	private ObjectMapper objectMapper;

	private BatchSummaryWriter writer;

	private BatchConfig config;

	private BatchResult result;

	@BeforeEach
	void setUp() {
		objectMapper = ObjectMapperFactory.create();
		writer = new BatchSummaryWriter(objectMapper, Clock.fixed(GENERATED_AT, ZoneOffset.UTC));
		config = BatchConfig.builder()
			.repositories(List.of("acme/a", "acme/b"))
			.resourceTypes(List.of(ResourceType.PULL_REQUESTS, ResourceType.ISSUES))
			.format(ExportFormat.BOTH)
			.outputPath(tempDir.resolve("out"))
			.parallelism(2)
			.diffMode(true)
			.build();
		result = new BatchResult(2, 1, 1, 1, 17, 9, Duration.ofMillis(2500),
				List.of(new RepositoryResult("acme/a", true, ResourceType.PULL_REQUESTS, 12, 0, 4,
						Duration.ofMillis(1200), null),
						new RepositoryResult("acme/a", false, ResourceType.ISSUES, 5, 1, 5, Duration.ofMillis(800),
								"Chunk at offset 100 failed: GitHub API error: 502"),
						RepositoryResult.notAttempted("acme/b", ResourceType.PULL_REQUESTS, "Not found"),
						RepositoryResult.notAttempted("acme/b", ResourceType.ISSUES, "Not found")),
				List.of("acme/b"));
	}

	@Nested
	@DisplayName("Markdown Rendering")
	class MarkdownTest {

		@Test
		@DisplayName("Should render configuration and totals")
		void shouldRenderConfigurationAndTotals() {
			String markdown = writer.toMarkdown(config, result, GENERATED_AT);

			assertThat(markdown).startsWith("# Batch Export Summary\n\n**Generated:** 2024-06-01T12:00:00Z")
				.contains("- **Repositories:** 2")
				.contains("- **Export Types:** prs, issues")
				.contains("- **Format:** both")
				.contains("- **Parallelism:** 2")
				.contains("- **Diff Mode:** Enabled")
				.contains("- **Successful:** 1 ✓")
				.contains("- **Partially Successful:** 1")
				.contains("- **Failed:** 1 ✗")
				.contains("- **Total Items Exported:** 17")
				.contains("- **Total Items Failed:** 1")
				.contains("- **Total API Calls:** 9")
				.contains("- **Total Duration:** 2.50s");
		}

		@Test
		@DisplayName("Should group rows by repository with status markers and errors")
		void shouldGroupRowsByRepository() {
			String markdown = writer.toMarkdown(config, result, GENERATED_AT);

			assertThat(markdown).contains("### ✗ acme/a")
				.contains("| prs | ✓ | 12 | 0 | 4 | 1.20s |")
				.contains("| issues | ✗ | 5 | 1 | 5 | 0.80s |")
				.contains("**issues error:** Chunk at offset 100 failed")
				.contains("### ✗ acme/b")
				.contains("**prs error:** Not found");
			assertThat(markdown.indexOf("acme/a")).isLessThan(markdown.indexOf("acme/b"));
		}

		@Test
		@DisplayName("Should mark fully successful repositories")
		void shouldMarkSuccessfulRepositories() {
			BatchResult allGood = new BatchResult(1, 1, 0, 0, 3, 1, Duration.ofSeconds(1),
					List.of(new RepositoryResult("acme/a", true, ResourceType.RELEASES, 3, 0, 1, Duration.ofSeconds(1),
							null)),
					List.of());

			assertThat(writer.toMarkdown(config, allGood, GENERATED_AT)).contains("### ✓ acme/a")
				.doesNotContain("error:**");
		}

	}

	@Nested
	@DisplayName("Files")
	class FilesTest {

		@Test
		@DisplayName("Should write markdown and json summaries into the output directory")
		void shouldWriteBothFiles() throws Exception {
			Path markdown = writer.write(config, result);

			Path out = tempDir.resolve("out");
			assertThat(markdown).isEqualTo(out.resolve(BatchSummaryWriter.MARKDOWN_FILE));
			assertThat(Files.readString(markdown)).contains("# Batch Export Summary");

			JsonNode json = objectMapper.readTree(out.resolve(BatchSummaryWriter.JSON_FILE).toFile());
			assertThat(json.path("result").path("total_items_exported").asInt()).isEqualTo(17);
			assertThat(json.path("result").path("failed_repository_names").get(0).asText()).isEqualTo("acme/b");
			assertThat(json.path("config").path("repositories")).hasSize(2);
		}

		@Test
		@DisplayName("Should return null instead of failing when the directory cannot be created")
		void shouldNotFailOnWriteError() throws Exception {
			Path blocker = tempDir.resolve("blocker");
			Files.writeString(blocker, "not a directory");
			BatchConfig blocked = BatchConfig.builder().repository("acme/a").outputPath(blocker.resolve("out")).build();

			assertThat(writer.write(blocked, result)).isNull();
		}

	}

}
