package org.springaicommunity.github.exporter;

import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Exports branches. Branches carry no change timestamp, so they are always exported in
 * full.
 */
public class BranchExporter extends BaseExporter<Branch> {

	private static final Logger logger = LoggerFactory.getLogger(BranchExporter.class);

	public BranchExporter(ExporterContext context, ExportRequest request) {
		super(context, request);
	}

	@Override
	protected List<Branch> fetchData() {
		if (isDiffMode()) {
			logger.debug("Diff mode does not apply to branches of {}, exporting all", request.repository());
		}
		return fetchPaged(
				(page, perPage) -> context.apiService().listBranches(request.owner(), request.repo(), page, perPage));
	}

	@Override
	protected TypeReference<List<Branch>> pageType() {
		return new TypeReference<>() {
		};
	}

}
