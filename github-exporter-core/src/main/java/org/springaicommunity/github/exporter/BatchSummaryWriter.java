package org.springaicommunity.github.exporter;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes the per-run summary of a batch: {@code batch-summary.md} for people and
 * {@code batch-summary.json} for tools, both in the batch output directory.
 *
 * <p>
 * Failures are logged; a summary that cannot be written never fails the batch.
 */
public class BatchSummaryWriter {

	private static final Logger logger = LoggerFactory.getLogger(BatchSummaryWriter.class);

	static final String MARKDOWN_FILE = "batch-summary.md";

	static final String JSON_FILE = "batch-summary.json";

	private final ObjectMapper objectMapper;

	private final Clock clock;

	public BatchSummaryWriter(ObjectMapper objectMapper) {
		this(objectMapper, Clock.systemUTC());
	}

	public BatchSummaryWriter(ObjectMapper objectMapper, Clock clock) {
		this.objectMapper = objectMapper;
		this.clock = clock;
	}

	/**
	 * Write both summary files.
	 * @param config the batch configuration
	 * @param result the batch outcome
	 * @return path of the markdown summary, or null if it could not be written
	 */
	@Nullable
	public Path write(BatchConfig config, BatchResult result) {
		Instant generatedAt = clock.instant();
		Path directory = config.outputPath();
		try {
			Files.createDirectories(directory);
			Path markdown = directory.resolve(MARKDOWN_FILE);
			Files.writeString(markdown, toMarkdown(config, result, generatedAt), StandardCharsets.UTF_8);
			objectMapper.writerWithDefaultPrettyPrinter()
				.writeValue(directory.resolve(JSON_FILE).toFile(), new BatchSummary(generatedAt, config, result));
			logger.info("Batch summary saved to {}", markdown);
			return markdown;
		}
		catch (IOException e) {
			logger.warn("Failed to write batch summary to {}: {}", directory, e.getMessage());
			return null;
		}
	}

	String toMarkdown(BatchConfig config, BatchResult result, Instant generatedAt) {
		StringBuilder md = new StringBuilder();
		md.append("# Batch Export Summary\n\n");
		md.append("**Generated:** ").append(generatedAt).append("\n\n");

		md.append("## Configuration\n\n");
		md.append("- **Repositories:** ").append(config.repositories().size()).append('\n');
		md.append("- **Export Types:** ")
			.append(config.resourceTypes().stream().map(ResourceType::getId).collect(Collectors.joining(", ")))
			.append('\n');
		md.append("- **Format:** ").append(config.format().name().toLowerCase(Locale.ROOT)).append('\n');
		md.append("- **Parallelism:** ").append(config.parallelism()).append('\n');
		md.append("- **Diff Mode:** ").append(config.diffMode() ? "Enabled" : "Disabled").append('\n');
		md.append("- **Force Full Export:** ").append(config.forceFullExport() ? "Yes" : "No").append('\n');
		md.append("- **Output Path:** `").append(config.outputPath()).append("`\n\n");

		md.append("## Overall Results\n\n");
		md.append("- **Total Repositories:** ").append(result.totalRepositories()).append('\n');
		md.append("- **Successful:** ").append(result.successfulRepositories()).append(" ✓\n");
		md.append("- **Partially Successful:** ").append(result.partiallySucceededRepositories()).append('\n');
		md.append("- **Failed:** ").append(result.failedRepositories()).append(" ✗\n");
		md.append("- **Total Items Exported:** ").append(result.totalItemsExported()).append('\n');
		md.append("- **Total Items Failed:** ").append(result.totalItemsFailed()).append('\n');
		md.append("- **Total API Calls:** ").append(result.totalApiCalls()).append('\n');
		md.append("- **Total Duration:** ").append(seconds(result.totalDuration())).append("\n\n");

		md.append("## Repository Details\n\n");
		Map<String, List<RepositoryResult>> byRepository = new LinkedHashMap<>();
		for (RepositoryResult row : result.results()) {
			byRepository.computeIfAbsent(row.repository(), key -> new ArrayList<>()).add(row);
		}
		for (Map.Entry<String, List<RepositoryResult>> entry : byRepository.entrySet()) {
			boolean allSuccess = entry.getValue().stream().allMatch(RepositoryResult::success);
			md.append("### ").append(allSuccess ? "✓ " : "✗ ").append(entry.getKey()).append("\n\n");
			md.append("| Export Type | Status | Items | Failed | API Calls | Duration |\n");
			md.append("|-------------|--------|-------|--------|-----------|----------|\n");
			StringBuilder errors = new StringBuilder();
			for (RepositoryResult row : entry.getValue()) {
				md.append("| ")
					.append(row.resourceType().getId())
					.append(" | ")
					.append(row.success() ? "✓" : "✗")
					.append(" | ")
					.append(row.itemsExported())
					.append(" | ")
					.append(row.itemsFailed())
					.append(" | ")
					.append(row.apiCalls())
					.append(" | ")
					.append(seconds(row.duration()))
					.append(" |\n");
				if (row.error() != null) {
					errors.append("\n**").append(row.resourceType().getId()).append(" error:** ").append(row.error())
						.append('\n');
				}
			}
			md.append(errors).append('\n');
		}
		return md.toString();
	}

	private static String seconds(Duration duration) {
		return String.format(Locale.ROOT, "%.2fs", duration.toMillis() / 1000.0);
	}

	/**
	 * Document written to {@code batch-summary.json}.
	 *
	 * @param generatedAt when the summary was written
	 * @param config the batch configuration
	 * @param result the batch outcome
	 */
	public record BatchSummary(Instant generatedAt, BatchConfig config, BatchResult result) {
	}

}
