package org.springaicommunity.github.exporter;

import com.fasterxml.jackson.core.type.TypeReference;

import java.time.Instant;
import java.util.List;

/**
 * Exports releases. In diff mode only releases published after the lower bound are kept;
 * unpublished drafts are skipped.
 */
public class ReleaseExporter extends BaseExporter<Release> {

	public ReleaseExporter(ExporterContext context, ExportRequest request) {
		super(context, request);
	}

	@Override
	protected List<Release> fetchData() {
		List<Release> releases = fetchPaged(
				(page, perPage) -> context.apiService().listReleases(request.owner(), request.repo(), page, perPage));
		Instant since = getDiffModeSince();
		if (since == null) {
			return releases;
		}
		return releases.stream()
			.filter(release -> release.publishedAt() != null && release.publishedAt().isAfter(since))
			.toList();
	}

	@Override
	protected TypeReference<List<Release>> pageType() {
		return new TypeReference<>() {
		};
	}

}
