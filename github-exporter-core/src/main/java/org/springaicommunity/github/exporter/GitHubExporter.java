package org.springaicommunity.github.exporter;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Entry point owning the service graph of one export run: rate limiter, caches,
 * checkpoint store, GitHub services and the batch processor.
 *
 * <p>
 * Instances are created by {@link GitHubExporterBuilder} and must be closed, which stops
 * the in-process cache sweep and drains the rate limiter. Two exporters never share
 * state other than the files they point at.
 *
 * <pre>
 * {@code
 * try (GitHubExporter exporter = GitHubExporterBuilder.create().tokenFromEnv().build()) {
 *     BatchResult result = exporter.runBatch(BatchConfig.builder()
 *         .repository("spring-projects/spring-ai")
 *         .resourceTypeIds(List.of("prs", "issues"))
 *         .diffMode(true)
 *         .build());
 * }
 * }
 * </pre>
 */
public class GitHubExporter implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(GitHubExporter.class);

	private final ExportProperties properties;

	private final GitHubApiService apiService;

	private final RateLimiter rateLimiter;

	private final MemoryCache<Object> memoryCache;

	@Nullable
	private final FileResponseCache fileCache;

	private final StateManager stateManager;

	private final BatchProcessor batchProcessor;

	GitHubExporter(ExportProperties properties, GitHubApiService apiService, RateLimiter rateLimiter,
			MemoryCache<Object> memoryCache, @Nullable FileResponseCache fileCache, StateManager stateManager,
			BatchProcessor batchProcessor) {
		this.properties = properties;
		this.apiService = apiService;
		this.rateLimiter = rateLimiter;
		this.memoryCache = memoryCache;
		this.fileCache = fileCache;
		this.stateManager = stateManager;
		this.batchProcessor = batchProcessor;
		memoryCache.start();
	}

	/**
	 * Export many repositories.
	 * @param config the batch configuration
	 * @return the aggregated result
	 */
	public BatchResult runBatch(BatchConfig config) {
		return batchProcessor.process(config);
	}

	/**
	 * Export one resource type of one repository into the configured output directory.
	 * @param repository repository in "owner/name" form
	 * @param type resource type
	 * @param format output format
	 * @param diffMode whether to export only changes since the last checkpoint
	 * @return the export result
	 */
	public ExportResult export(String repository, ResourceType type, ExportFormat format, boolean diffMode) {
		return export(repository, type, format, properties.getOutputDirectory(), diffMode, false);
	}

	/**
	 * Export one resource type of one repository.
	 * @param repository repository in "owner/name" form
	 * @param type resource type
	 * @param format output format
	 * @param outputPath base output directory
	 * @param diffMode whether to export only changes since the last checkpoint
	 * @param forceFull whether to ignore the checkpoint
	 * @return the export result
	 */
	public ExportResult export(String repository, ResourceType type, ExportFormat format, Path outputPath,
			boolean diffMode, boolean forceFull) {
		return batchProcessor.exportSingle(repository, type, format, outputPath, diffMode, forceFull);
	}

	public GitHubApiService getApiService() {
		return apiService;
	}

	public RateLimiter getRateLimiter() {
		return rateLimiter;
	}

	public MemoryCache<Object> getMemoryCache() {
		return memoryCache;
	}

	@Nullable
	public FileResponseCache getFileCache() {
		return fileCache;
	}

	public StateManager getStateManager() {
		return stateManager;
	}

	@Override
	public void close() {
		memoryCache.logStats();
		memoryCache.close();
		rateLimiter.close();
		logger.debug("Exporter closed, rate limiter stats: {}", rateLimiter.getStats());
	}

}
