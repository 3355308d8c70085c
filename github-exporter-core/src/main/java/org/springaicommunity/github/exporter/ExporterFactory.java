package org.springaicommunity.github.exporter;

/**
 * Creates the exporter for a request.
 */
@FunctionalInterface
public interface ExporterFactory {

	ResourceExporter create(ExportRequest request);

}
