package org.springaicommunity.github.exporter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Durable keyed cache that survives process restarts.
 *
 * <p>
 * Each key is stored as its own file, {@code cache_<sha-256 of key>.json}, holding a
 * {@link FileCacheEntry}. Entries older than their ttl are treated as absent when read;
 * there is no background sweep. Unreadable or corrupt files are cache misses, and write
 * failures are logged without failing the caller.
 *
 * <p>
 * Writes go to a temporary file that then replaces the target in one move, so
 * concurrent readers never observe a half-written entry.
 */
public class FileResponseCache {

	private static final Logger logger = LoggerFactory.getLogger(FileResponseCache.class);

	private static final String FILE_PREFIX = "cache_";

	private static final String FILE_SUFFIX = ".json";

	private final Path directory;

	private final Duration defaultTtl;

	private final ObjectMapper objectMapper;

	private final Clock clock;

	public FileResponseCache(Path directory) {
		this(directory, Duration.ofHours(24), ObjectMapperFactory.create(), Clock.systemUTC());
	}

	public FileResponseCache(Path directory, Duration defaultTtl, ObjectMapper objectMapper, Clock clock) {
		this.directory = directory;
		this.defaultTtl = defaultTtl;
		this.objectMapper = objectMapper;
		this.clock = clock;
	}

	public Path getDirectory() {
		return directory;
	}

	/**
	 * Create the cache directory if needed.
	 */
	public void init() {
		try {
			Files.createDirectories(directory);
		}
		catch (IOException e) {
			logger.warn("Could not create cache directory {}: {}", directory, e.getMessage());
		}
	}

	/**
	 * Read the full entry for a key.
	 * @param key cache key
	 * @return the entry, or empty if missing, expired or unreadable
	 */
	public Optional<FileCacheEntry> getEntry(String key) {
		Path file = fileFor(key);
		if (!Files.exists(file)) {
			return Optional.empty();
		}
		try {
			FileCacheEntry entry = objectMapper.readValue(file.toFile(), FileCacheEntry.class);
			if (entry.isExpired(clock.instant())) {
				logger.debug("Durable cache entry expired: {}", key);
				return Optional.empty();
			}
			return Optional.of(entry);
		}
		catch (IOException | RuntimeException e) {
			logger.debug("Unreadable durable cache entry for {} treated as miss: {}", key, e.getMessage());
			return Optional.empty();
		}
	}

	/**
	 * Read a value as JSON.
	 * @param key cache key
	 * @return the value, or empty on a miss
	 */
	public Optional<JsonNode> get(String key) {
		return getEntry(key).map(FileCacheEntry::data);
	}

	/**
	 * Read a value and convert it to the requested type.
	 * @param key cache key
	 * @param type target type
	 * @param <T> value type
	 * @return the value, or empty on a miss or if conversion fails
	 */
	public <T> Optional<T> get(String key, TypeReference<T> type) {
		return getEntry(key).flatMap(entry -> readData(entry, type));
	}

	/**
	 * Convert the data of an entry read with {@link #getEntry(String)}.
	 * @param entry the entry
	 * @param type target type
	 * @param <T> value type
	 * @return the value, or empty if the data has an unexpected shape
	 */
	public <T> Optional<T> readData(FileCacheEntry entry, TypeReference<T> type) {
		try {
			return Optional.ofNullable(objectMapper.convertValue(entry.data(), type));
		}
		catch (IllegalArgumentException e) {
			logger.debug("Durable cache entry from {} has an unexpected shape, treated as miss: {}", entry.timestamp(),
					e.getMessage());
			return Optional.empty();
		}
	}

	/**
	 * Store a value with the default ttl and no validator token.
	 * @param key cache key
	 * @param value value to store
	 */
	public void set(String key, Object value) {
		set(key, value, null, defaultTtl);
	}

	/**
	 * Store a value.
	 * @param key cache key
	 * @param value value to store
	 * @param etag validator token (may be null)
	 * @param ttl time-to-live of the entry
	 */
	public void set(String key, Object value, @Nullable String etag, Duration ttl) {
		FileCacheEntry entry = new FileCacheEntry(objectMapper.valueToTree(value), etag, clock.instant(),
				ttl.toMillis());
		Path target = fileFor(key);
		try {
			Files.createDirectories(directory);
			Path temp = Files.createTempFile(directory, FILE_PREFIX, ".tmp");
			try {
				objectMapper.writeValue(temp.toFile(), entry);
				moveIntoPlace(temp, target);
			}
			finally {
				Files.deleteIfExists(temp);
			}
			logger.debug("Durable cache stored: {}", key);
		}
		catch (IOException e) {
			logger.warn("Failed to write durable cache entry for {}: {}", key, e.getMessage());
		}
	}

	/**
	 * Whether a live entry exists for the key.
	 * @param key cache key
	 * @return true if a readable, non-expired entry exists
	 */
	public boolean has(String key) {
		return getEntry(key).isPresent();
	}

	/**
	 * Remove the entry for a key.
	 * @param key cache key
	 * @return true if a file was deleted
	 */
	public boolean delete(String key) {
		try {
			return Files.deleteIfExists(fileFor(key));
		}
		catch (IOException e) {
			logger.warn("Failed to delete durable cache entry for {}: {}", key, e.getMessage());
			return false;
		}
	}

	/**
	 * Remove all cache files in the directory.
	 * @return number of files deleted
	 */
	public int clear() {
		int deleted = 0;
		for (Path file : listCacheFiles()) {
			try {
				Files.deleteIfExists(file);
				deleted++;
			}
			catch (IOException e) {
				logger.warn("Failed to delete cache file {}: {}", file, e.getMessage());
			}
		}
		logger.info("Cleared {} durable cache entries", deleted);
		return deleted;
	}

	public FileCacheStats getStats() {
		List<Path> files = listCacheFiles();
		long totalSize = 0;
		Instant oldest = null;
		for (Path file : files) {
			try {
				totalSize += Files.size(file);
				FileCacheEntry entry = objectMapper.readValue(file.toFile(), FileCacheEntry.class);
				if (oldest == null || entry.timestamp().isBefore(oldest)) {
					oldest = entry.timestamp();
				}
			}
			catch (IOException | RuntimeException e) {
				logger.debug("Skipping unreadable cache file {}: {}", file, e.getMessage());
			}
		}
		return new FileCacheStats(files.size(), totalSize, oldest);
	}

	Path fileFor(String key) {
		return directory.resolve(FILE_PREFIX + sha256(key) + FILE_SUFFIX);
	}

	private List<Path> listCacheFiles() {
		List<Path> files = new ArrayList<>();
		if (!Files.isDirectory(directory)) {
			return files;
		}
		try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, FILE_PREFIX + "*" + FILE_SUFFIX)) {
			stream.forEach(files::add);
		}
		catch (IOException e) {
			logger.warn("Failed to list cache directory {}: {}", directory, e.getMessage());
		}
		return files;
	}

	private static void moveIntoPlace(Path source, Path target) throws IOException {
		try {
			Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
		}
		catch (AtomicMoveNotSupportedException e) {
			Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	private static String sha256(String key) {
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			byte[] hash = digest.digest(key.getBytes(StandardCharsets.UTF_8));
			StringBuilder hex = new StringBuilder(hash.length * 2);
			for (byte b : hash) {
				hex.append(String.format("%02x", b));
			}
			return hex.toString();
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 not available", e);
		}
	}

}
