package org.springaicommunity.github.exporter;

import java.time.Instant;
import java.util.List;

/**
 * The persisted checkpoint document: every {@link ExportCheckpoint} of one environment.
 *
 * @param version document format version
 * @param exports one checkpoint per (repository, resource type)
 * @param updatedAt when the document was last rewritten
 */
public record CheckpointStore(String version, List<ExportCheckpoint> exports, Instant updatedAt) {

	/**
	 * Current document format version.
	 */
	public static final String CURRENT_VERSION = "1.0.0";

	public CheckpointStore {
		exports = (exports != null) ? List.copyOf(exports) : List.of();
	}

}
