package org.springaicommunity.github.exporter;

import com.fasterxml.jackson.core.type.TypeReference;

import java.time.Instant;
import java.util.List;

/**
 * Exports pull requests. The pulls endpoint has no {@code since} filter, so in diff mode
 * the fetched pull requests are filtered by {@code updatedAt}.
 */
public class PullRequestExporter extends BaseExporter<PullRequest> {

	public PullRequestExporter(ExporterContext context, ExportRequest request) {
		super(context, request);
	}

	@Override
	protected List<PullRequest> fetchData() {
		List<PullRequest> pullRequests = fetchPaged((page, perPage) -> context.apiService()
			.listPullRequests(request.owner(), request.repo(), page, perPage));
		Instant since = getDiffModeSince();
		if (since == null) {
			return pullRequests;
		}
		return pullRequests.stream().filter(pr -> pr.updatedAt().isAfter(since)).toList();
	}

	@Override
	protected TypeReference<List<PullRequest>> pageType() {
		return new TypeReference<>() {
		};
	}

}
