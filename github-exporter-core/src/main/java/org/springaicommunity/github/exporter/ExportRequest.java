package org.springaicommunity.github.exporter;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Parameters of one resource-type export for one repository.
 *
 * @param owner repository owner
 * @param repo repository name
 * @param resourceType what to export
 * @param format output format
 * @param outputPath directory the items are written to
 * @param diffMode incremental export options
 */
public record ExportRequest(String owner, String repo, ResourceType resourceType, ExportFormat format,
		Path outputPath, DiffModeOptions diffMode) {

	public String repository() {
		return owner + "/" + repo;
	}

	public boolean isDiffMode() {
		return diffMode.enabled() && diffMode.since() != null;
	}

	@Nullable
	public Instant sinceTimestamp() {
		return isDiffMode() ? diffMode.since() : null;
	}

}
