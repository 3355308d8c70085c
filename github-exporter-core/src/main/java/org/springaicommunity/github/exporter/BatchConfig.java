package org.springaicommunity.github.exporter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of a multi-repository export.
 *
 * <p>
 * Validated on construction so that configuration errors surface before any work
 * starts. Repository references are trimmed and duplicates dropped.
 *
 * @param repositories repositories in "owner/name" form
 * @param resourceTypes resource types exported for every repository
 * @param format output format
 * @param outputPath base output directory
 * @param parallelism maximum number of repositories exported concurrently (at least 1)
 * @param diffMode whether to export only changes since the last checkpoint
 * @param forceFullExport whether to ignore checkpoints
 */
public record BatchConfig(List<String> repositories, List<ResourceType> resourceTypes, ExportFormat format,
		Path outputPath, int parallelism, boolean diffMode, boolean forceFullExport) {

	public BatchConfig {
		if (repositories == null || repositories.isEmpty()) {
			throw new IllegalArgumentException("At least one repository is required");
		}
		List<String> normalized = new ArrayList<>();
		for (String repository : repositories) {
			String[] parts = RepositoryInfo.splitReference(repository);
			String reference = parts[0] + "/" + parts[1];
			if (!normalized.contains(reference)) {
				normalized.add(reference);
			}
		}
		repositories = List.copyOf(normalized);
		if (resourceTypes == null || resourceTypes.isEmpty()) {
			throw new IllegalArgumentException("At least one resource type is required");
		}
		resourceTypes = List.copyOf(resourceTypes);
		if (parallelism < 1) {
			throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
		}
	}

	/**
	 * Create a new builder for BatchConfig.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link BatchConfig}. Defaults: all resource types, markdown, output to
	 * {@code ./github-export}, parallelism 3, no diff mode.
	 */
	public static class Builder {

		private List<String> repositories = new ArrayList<>();

		private List<ResourceType> resourceTypes = List.of(ResourceType.values());

		private ExportFormat format = ExportFormat.MARKDOWN;

		private Path outputPath = Path.of("github-export");

		private int parallelism = 3;

		private boolean diffMode;

		private boolean forceFullExport;

		private Builder() {
		}

		public Builder repositories(List<String> repositories) {
			this.repositories = new ArrayList<>(repositories);
			return this;
		}

		public Builder repository(String repository) {
			this.repositories.add(repository);
			return this;
		}

		public Builder resourceTypes(List<ResourceType> resourceTypes) {
			this.resourceTypes = resourceTypes;
			return this;
		}

		/**
		 * Set resource types from identifiers such as "prs" or "issues".
		 * @param ids resource type identifiers
		 * @return this builder
		 * @throws IllegalArgumentException if an identifier is unknown
		 */
		public Builder resourceTypeIds(List<String> ids) {
			this.resourceTypes = ids.stream().map(ResourceType::fromId).toList();
			return this;
		}

		public Builder format(ExportFormat format) {
			this.format = format;
			return this;
		}

		public Builder outputPath(Path outputPath) {
			this.outputPath = outputPath;
			return this;
		}

		public Builder parallelism(int parallelism) {
			this.parallelism = parallelism;
			return this;
		}

		public Builder diffMode(boolean diffMode) {
			this.diffMode = diffMode;
			return this;
		}

		public Builder forceFullExport(boolean forceFullExport) {
			this.forceFullExport = forceFullExport;
			return this;
		}

		public BatchConfig build() {
			return new BatchConfig(repositories, resourceTypes, format, outputPath, parallelism, diffMode,
					forceFullExport);
		}

	}

}
