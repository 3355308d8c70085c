package org.springaicommunity.github.exporter;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable checkpoint store enabling incremental exports.
 *
 * <p>
 * The whole {@link CheckpointStore} document is loaded on first use, kept in memory and
 * rewritten in full after every mutation. One lock guards the load, mutate and save
 * sequence so concurrent repository tasks never lose each other's updates.
 *
 * <p>
 * A missing or corrupt file is an empty store. Write failures are logged and the
 * in-memory checkpoints stay authoritative for the rest of the process.
 */
public class StateManager {

	private static final Logger logger = LoggerFactory.getLogger(StateManager.class);

	private final Path stateFile;

	private final ObjectMapper objectMapper;

	private final Clock clock;

	private final ReentrantLock lock = new ReentrantLock();

	private final Map<CheckpointKey, ExportCheckpoint> checkpoints = new LinkedHashMap<>();

	private boolean loaded;

	public StateManager(Path stateFile) {
		this(stateFile, ObjectMapperFactory.create(), Clock.systemUTC());
	}

	public StateManager(Path stateFile, ObjectMapper objectMapper, Clock clock) {
		this.stateFile = stateFile;
		this.objectMapper = objectMapper;
		this.clock = clock;
	}

	public Path getStateFile() {
		return stateFile;
	}

	/**
	 * Checkpoint of the last successful export.
	 * @param repository repository in "owner/name" form
	 * @param type resource type
	 * @return the checkpoint, or empty if that type was never exported
	 */
	public Optional<ExportCheckpoint> getLastExport(String repository, ResourceType type) {
		lock.lock();
		try {
			ensureLoaded();
			return Optional.ofNullable(checkpoints.get(new CheckpointKey(repository, type)));
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Record a successful export, replacing any earlier checkpoint for the same
	 * repository and resource type. The recorded time never moves backwards for a key.
	 * @param repository repository in "owner/name" form
	 * @param type resource type
	 * @param count number of items exported
	 * @param format output format used
	 * @param outputPath directory the items were written to
	 * @return the stored checkpoint
	 */
	public ExportCheckpoint updateExportState(String repository, ResourceType type, int count, ExportFormat format,
			String outputPath) {
		return updateExportState(repository, type, count, format, outputPath, null);
	}

	/**
	 * Record a successful export whose data may be older than the current time, for
	 * example because pages were served from a cache. The checkpoint is placed at
	 * {@code dataAsOf} so that changes after it are picked up by the next diff export.
	 * @param repository repository in "owner/name" form
	 * @param type resource type
	 * @param count number of items exported
	 * @param format output format used
	 * @param outputPath directory the items were written to
	 * @param dataAsOf when the exported data was fetched, or null for now
	 * @return the stored checkpoint
	 */
	public ExportCheckpoint updateExportState(String repository, ResourceType type, int count, ExportFormat format,
			String outputPath, @Nullable Instant dataAsOf) {
		lock.lock();
		try {
			ensureLoaded();
			CheckpointKey key = new CheckpointKey(repository, type);
			Instant now = clock.instant();
			if (dataAsOf != null && dataAsOf.isBefore(now)) {
				logger.debug("Checkpoint of {} {} placed at cached data time {}", repository, type.getId(), dataAsOf);
				now = dataAsOf;
			}
			ExportCheckpoint previous = checkpoints.get(key);
			if (previous != null && previous.lastExportAt().isAfter(now)) {
				logger.warn("Checkpoint of {} {} is already at {}, keeping it", repository, type.getId(),
						previous.lastExportAt());
				now = previous.lastExportAt();
			}
			ExportCheckpoint checkpoint = new ExportCheckpoint(repository, type, now, count, format, outputPath);
			checkpoints.put(key, checkpoint);
			save();
			logger.debug("Checkpoint updated: {} {} ({} items at {})", repository, type.getId(), count, now);
			return checkpoint;
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Decide how the next export of a resource type should be limited.
	 * @param repository repository in "owner/name" form
	 * @param type resource type
	 * @param forceFull true to ignore any checkpoint
	 * @return forced options, disabled options when there is no checkpoint, or options
	 * enabled since the checkpoint time
	 */
	public DiffModeOptions getDiffModeOptions(String repository, ResourceType type, boolean forceFull) {
		if (forceFull) {
			return DiffModeOptions.forced();
		}
		return getLastExport(repository, type).map(checkpoint -> DiffModeOptions.since(checkpoint.lastExportAt()))
			.orElseGet(DiffModeOptions::disabled);
	}

	/**
	 * Remove the checkpoint of one resource type.
	 * @param repository repository in "owner/name" form
	 * @param type resource type
	 * @return true if a checkpoint existed
	 */
	public boolean deleteExportState(String repository, ResourceType type) {
		lock.lock();
		try {
			ensureLoaded();
			boolean removed = checkpoints.remove(new CheckpointKey(repository, type)) != null;
			if (removed) {
				save();
			}
			return removed;
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * All checkpoints of one repository.
	 * @param repository repository in "owner/name" form
	 * @return the checkpoints, possibly empty
	 */
	public List<ExportCheckpoint> getRepositoryStates(String repository) {
		lock.lock();
		try {
			ensureLoaded();
			return checkpoints.values().stream().filter(c -> c.repository().equals(repository)).toList();
		}
		finally {
			lock.unlock();
		}
	}

	public List<ExportCheckpoint> getAllStates() {
		lock.lock();
		try {
			ensureLoaded();
			return List.copyOf(checkpoints.values());
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Remove every checkpoint.
	 */
	public void clear() {
		lock.lock();
		try {
			ensureLoaded();
			checkpoints.clear();
			save();
			logger.info("All export checkpoints cleared");
		}
		finally {
			lock.unlock();
		}
	}

	private void ensureLoaded() {
		if (loaded) {
			return;
		}
		loaded = true;
		if (!Files.exists(stateFile)) {
			logger.debug("No checkpoint file at {}, starting empty", stateFile);
			return;
		}
		try {
			CheckpointStore store = objectMapper.readValue(stateFile.toFile(), CheckpointStore.class);
			if (!CheckpointStore.CURRENT_VERSION.equals(store.version())) {
				logger.info("Checkpoint file version {} differs from {}, loading anyway", store.version(),
						CheckpointStore.CURRENT_VERSION);
			}
			for (ExportCheckpoint checkpoint : store.exports()) {
				checkpoints.put(new CheckpointKey(checkpoint.repository(), checkpoint.resourceType()), checkpoint);
			}
			logger.debug("Loaded {} checkpoints from {}", checkpoints.size(), stateFile);
		}
		catch (IOException | RuntimeException e) {
			logger.warn("Could not read checkpoint file {}, starting empty: {}", stateFile, e.getMessage());
			checkpoints.clear();
		}
	}

	private void save() {
		CheckpointStore store = new CheckpointStore(CheckpointStore.CURRENT_VERSION,
				new ArrayList<>(checkpoints.values()), clock.instant());
		try {
			Path parent = stateFile.toAbsolutePath().getParent();
			Files.createDirectories(parent);
			Path temp = Files.createTempFile(parent, "exports", ".tmp");
			try {
				objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), store);
				try {
					Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
				}
				catch (AtomicMoveNotSupportedException e) {
					Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING);
				}
			}
			finally {
				Files.deleteIfExists(temp);
			}
		}
		catch (IOException e) {
			logger.warn("Failed to save checkpoints to {}: {}", stateFile, e.getMessage());
		}
	}

	private record CheckpointKey(String repository, ResourceType type) {
	}

}
