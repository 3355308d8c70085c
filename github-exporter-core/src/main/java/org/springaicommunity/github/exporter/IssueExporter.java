package org.springaicommunity.github.exporter;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.List;

/**
 * Exports issues, passing the diff-mode lower bound to the API as {@code since}. Pull
 * requests listed by the issues endpoint are skipped.
 */
public class IssueExporter extends BaseExporter<Issue> {

	public IssueExporter(ExporterContext context, ExportRequest request) {
		super(context, request);
	}

	@Override
	protected List<Issue> fetchData() {
		List<Issue> issues = fetchPaged((page, perPage) -> context.apiService()
			.listIssues(request.owner(), request.repo(), getDiffModeSince(), page, perPage));
		return issues.stream().filter(issue -> !issue.pullRequest()).toList();
	}

	@Override
	protected TypeReference<List<Issue>> pageType() {
		return new TypeReference<>() {
		};
	}

}
