package org.springaicommunity.github.exporter;

import java.time.Instant;

/**
 * Record of the last successful export of one resource type for one repository.
 *
 * @param repository repository in "owner/name" form
 * @param resourceType the exported resource type
 * @param lastExportAt when the export completed
 * @param lastCount number of items exported
 * @param format output format used
 * @param outputPath directory the items were written to
 */
public record ExportCheckpoint(String repository, ResourceType resourceType, Instant lastExportAt, int lastCount,
		ExportFormat format, String outputPath) {
}
