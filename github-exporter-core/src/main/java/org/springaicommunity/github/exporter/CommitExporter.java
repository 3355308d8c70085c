package org.springaicommunity.github.exporter;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.List;

/**
 * Exports commits of the default branch, passing the diff-mode lower bound to the API as
 * {@code since}.
 */
public class CommitExporter extends BaseExporter<Commit> {

	public CommitExporter(ExporterContext context, ExportRequest request) {
		super(context, request);
	}

	@Override
	protected List<Commit> fetchData() {
		return fetchPaged((page, perPage) -> context.apiService()
			.listCommits(request.owner(), request.repo(), getDiffModeSince(), page, perPage));
	}

	@Override
	protected TypeReference<List<Commit>> pageType() {
		return new TypeReference<>() {
		};
	}

}
