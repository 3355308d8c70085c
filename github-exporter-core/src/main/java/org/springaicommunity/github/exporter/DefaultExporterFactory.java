package org.springaicommunity.github.exporter;

/**
 * Creates the built-in exporter for each resource type.
 */
public class DefaultExporterFactory implements ExporterFactory {

	private final ExporterContext context;

	public DefaultExporterFactory(ExporterContext context) {
		this.context = context;
	}

	@Override
	public ResourceExporter create(ExportRequest request) {
		return switch (request.resourceType()) {
			case PULL_REQUESTS -> new PullRequestExporter(context, request);
			case ISSUES -> new IssueExporter(context, request);
			case COMMITS -> new CommitExporter(context, request);
			case BRANCHES -> new BranchExporter(context, request);
			case RELEASES -> new ReleaseExporter(context, request);
		};
	}

}
