package org.springaicommunity.github.exporter;

/**
 * Exports one resource type of one repository.
 *
 * <p>
 * Instances are created per {@link ExportRequest} by an {@link ExporterFactory} and are
 * not reused.
 */
public interface ResourceExporter {

	/**
	 * The resource type handled by this exporter.
	 * @return the resource type
	 */
	ResourceType getResourceType();

	/**
	 * Fetch and write all items. Never throws for per-item failures; those are counted
	 * in the result.
	 * @return the export outcome
	 */
	ExportResult export();

}
