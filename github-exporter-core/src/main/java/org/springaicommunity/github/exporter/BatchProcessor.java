package org.springaicommunity.github.exporter;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs exports for many repositories and resource types with bounded parallelism.
 *
 * <p>
 * Repositories are split into sequential groups of {@code parallelism}. The repositories
 * of a group are exported concurrently and the whole group settles before the next one
 * starts. Within a repository, resource types are exported one after another.
 *
 * <p>
 * Failure handling:
 * <ul>
 * <li>a repository that cannot be resolved gets a failed row for every requested
 * resource type and none of them is attempted</li>
 * <li>a failing resource type does not stop the other resource types</li>
 * <li>an unexpected exception from a repository task marks that repository as failed
 * and never stops the other repositories or groups</li>
 * </ul>
 * Checkpoints are recorded only for successful exports.
 */
public class BatchProcessor {

	private static final Logger logger = LoggerFactory.getLogger(BatchProcessor.class);

	private final GitHubApiService apiService;

	private final ExporterFactory exporterFactory;

	private final StateManager stateManager;

	@Nullable
	private final RateLimiter rateLimiter;

	private final BatchSummaryWriter summaryWriter;

	private final BatchProgressListener listener;

	public BatchProcessor(GitHubApiService apiService, ExporterFactory exporterFactory, StateManager stateManager,
			@Nullable RateLimiter rateLimiter, BatchSummaryWriter summaryWriter, BatchProgressListener listener) {
		this.apiService = apiService;
		this.exporterFactory = exporterFactory;
		this.stateManager = stateManager;
		this.rateLimiter = rateLimiter;
		this.summaryWriter = summaryWriter;
		this.listener = listener;
	}

	/**
	 * Run a batch.
	 * @param config the batch configuration
	 * @return the aggregated result
	 */
	public BatchResult process(BatchConfig config) {
		long start = System.nanoTime();
		List<List<String>> groups = partition(config.repositories(), config.parallelism());
		logger.info("Starting batch export of {} repositories ({}) in {} groups of up to {}",
				config.repositories().size(), config.resourceTypes(), groups.size(), config.parallelism());

		syncReservoir();
		Map<String, List<RepositoryResult>> rowsByRepository = new LinkedHashMap<>();
		AtomicInteger threadCount = new AtomicInteger();
		ExecutorService pool = Executors.newFixedThreadPool(config.parallelism(), runnable -> {
			Thread thread = new Thread(runnable, "batch-export-" + threadCount.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		});
		try {
			for (int i = 0; i < groups.size(); i++) {
				List<String> group = groups.get(i);
				logger.info("Processing group {}/{}: {}", i + 1, groups.size(), group);
				listener.onGroupStart(i + 1, groups.size(), group);
				throttle();

				Map<String, Future<List<RepositoryResult>>> futures = new LinkedHashMap<>();
				for (String repository : group) {
					futures.put(repository, pool.submit(() -> processRepository(repository, config)));
				}
				for (Map.Entry<String, Future<List<RepositoryResult>>> entry : futures.entrySet()) {
					rowsByRepository.put(entry.getKey(), await(entry.getKey(), entry.getValue(), config));
				}
			}
		}
		finally {
			pool.shutdownNow();
		}

		BatchResult result = aggregate(rowsByRepository, Duration.ofNanos(System.nanoTime() - start));
		logger.info("Batch export completed: {}/{} repositories succeeded ({} partially), {} items, {} API calls in {}s",
				result.successfulRepositories(), result.totalRepositories(), result.partiallySucceededRepositories(),
				result.totalItemsExported(), result.totalApiCalls(), result.totalDuration().toSeconds());
		summaryWriter.write(config, result);
		listener.onBatchComplete(result);
		return result;
	}

	/**
	 * Export one resource type of one repository with the same diff and checkpoint
	 * semantics as a batch.
	 * @param repository repository in "owner/name" form
	 * @param type resource type
	 * @param format output format
	 * @param outputPath base output directory
	 * @param diffMode whether to export only changes since the last checkpoint
	 * @param forceFull whether to ignore the checkpoint
	 * @return the export result
	 * @throws GitHubApiException if the repository cannot be resolved
	 */
	public ExportResult exportSingle(String repository, ResourceType type, ExportFormat format, Path outputPath,
			boolean diffMode, boolean forceFull) {
		RepositoryInfo info = apiService.getRepository(repository);
		return runExport(normalize(repository), info, type, format, outputPath, diffMode, forceFull);
	}

	private List<RepositoryResult> processRepository(String repository, BatchConfig config) {
		listener.onRepositoryStart(repository);
		List<RepositoryResult> rows = new ArrayList<>();

		RepositoryInfo info;
		try {
			info = apiService.getRepository(repository);
		}
		catch (RuntimeException e) {
			logger.error("Failed to resolve repository {}: {}", repository, e.getMessage());
			for (ResourceType type : config.resourceTypes()) {
				RepositoryResult row = RepositoryResult.notAttempted(repository, type,
						"Repository resolution failed: " + e.getMessage());
				rows.add(row);
				listener.onResourceComplete(row);
			}
			listener.onRepositoryComplete(repository, false);
			return rows;
		}

		for (ResourceType type : config.resourceTypes()) {
			RepositoryResult row = exportType(repository, info, type, config);
			rows.add(row);
			listener.onResourceComplete(row);
		}
		listener.onRepositoryComplete(repository, rows.stream().anyMatch(RepositoryResult::success));
		return rows;
	}

	private RepositoryResult exportType(String repository, RepositoryInfo info, ResourceType type,
			BatchConfig config) {
		long start = System.nanoTime();
		try {
			ExportResult result = runExport(repository, info, type, config.format(), config.outputPath(),
					config.diffMode(), config.forceFullExport());
			return new RepositoryResult(repository, result.success(), type, result.itemsExported(),
					result.itemsFailed(), result.apiCalls(), result.duration(),
					result.errors().isEmpty() ? null : String.join("; ", result.errors()));
		}
		catch (RuntimeException e) {
			logger.error("Export of {} for {} failed: {}", type.getDisplayName(), repository, e.getMessage());
			return new RepositoryResult(repository, false, type, 0, 0, 0, Duration.ofNanos(System.nanoTime() - start),
					e.getMessage());
		}
	}

	private ExportResult runExport(String repository, RepositoryInfo info, ResourceType type, ExportFormat format,
			Path baseOutput, boolean diffMode, boolean forceFull) {
		DiffModeOptions diff;
		if (forceFull) {
			diff = DiffModeOptions.forced();
		}
		else if (diffMode) {
			diff = stateManager.getDiffModeOptions(repository, type, false);
		}
		else {
			diff = DiffModeOptions.disabled();
		}
		Path outputPath = baseOutput.resolve(info.owner()).resolve(info.name()).resolve(type.getDirectoryName());
		ExportRequest request = new ExportRequest(info.owner(), info.name(), type, format, outputPath, diff);

		ExportResult result = exporterFactory.create(request).export();
		if (result.success()) {
			stateManager.updateExportState(repository, type, result.itemsExported(), format, outputPath.toString(),
					result.dataAsOf());
		}
		else {
			logger.warn("Export of {} for {} did not succeed, checkpoint left unchanged", type.getDisplayName(),
					repository);
		}
		return result;
	}

	private List<RepositoryResult> await(String repository, Future<List<RepositoryResult>> future,
			BatchConfig config) {
		try {
			return future.get();
		}
		catch (ExecutionException e) {
			Throwable cause = (e.getCause() != null) ? e.getCause() : e;
			logger.error("Export task for {} failed unexpectedly: {}", repository, cause.getMessage(), cause);
			listener.onRepositoryComplete(repository, false);
			return config.resourceTypes()
				.stream()
				.map(type -> RepositoryResult.notAttempted(repository, type, "Unexpected failure: " + cause.getMessage()))
				.toList();
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ExportException("Batch export interrupted while waiting for " + repository, e);
		}
	}

	private BatchResult aggregate(Map<String, List<RepositoryResult>> rowsByRepository, Duration duration) {
		List<RepositoryResult> rows = new ArrayList<>();
		List<String> failedNames = new ArrayList<>();
		int successful = 0;
		int partial = 0;
		int items = 0;
		int apiCalls = 0;
		for (Map.Entry<String, List<RepositoryResult>> entry : rowsByRepository.entrySet()) {
			List<RepositoryResult> repositoryRows = entry.getValue();
			rows.addAll(repositoryRows);
			boolean anySuccess = repositoryRows.stream().anyMatch(RepositoryResult::success);
			boolean allSuccess = repositoryRows.stream().allMatch(RepositoryResult::success);
			if (anySuccess) {
				successful++;
				if (!allSuccess) {
					partial++;
				}
			}
			else {
				failedNames.add(entry.getKey());
			}
			for (RepositoryResult row : repositoryRows) {
				items += row.itemsExported();
				apiCalls += row.apiCalls();
			}
		}
		return new BatchResult(rowsByRepository.size(), successful, failedNames.size(), partial, items, apiCalls,
				duration, rows, failedNames);
	}

	private void syncReservoir() {
		if (rateLimiter == null) {
			return;
		}
		try {
			rateLimiter.updateReservoir();
		}
		catch (RuntimeException e) {
			logger.warn("Could not synchronize rate limiter with quota status: {}", e.getMessage());
		}
	}

	private void throttle() {
		if (rateLimiter == null) {
			return;
		}
		try {
			rateLimiter.checkAndThrottle();
		}
		catch (RuntimeException e) {
			logger.warn("Could not check rate limit before group: {}", e.getMessage());
		}
	}

	private static String normalize(String repository) {
		String[] parts = RepositoryInfo.splitReference(repository);
		return parts[0] + "/" + parts[1];
	}

	static <T> List<List<T>> partition(List<T> items, int size) {
		List<List<T>> groups = new ArrayList<>();
		for (int i = 0; i < items.size(); i += size) {
			groups.add(List.copyOf(items.subList(i, Math.min(items.size(), i + size))));
		}
		return groups;
	}

}
