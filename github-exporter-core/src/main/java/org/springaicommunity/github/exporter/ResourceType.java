package org.springaicommunity.github.exporter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The kinds of data that can be exported from a repository.
 *
 * <p>
 * Each type has a short identifier used in configuration and in the checkpoint document,
 * and a directory name used for its output.
 */
public enum ResourceType {

	PULL_REQUESTS("prs", "PullRequests", "pull requests"),

	ISSUES("issues", "Issues", "issues"),

	COMMITS("commits", "Commits", "commits"),

	BRANCHES("branches", "Branches", "branches"),

	RELEASES("releases", "Releases", "releases");

	private final String id;

	private final String directoryName;

	private final String displayName;

	ResourceType(String id, String directoryName, String displayName) {
		this.id = id;
		this.directoryName = directoryName;
		this.displayName = displayName;
	}

	@JsonValue
	public String getId() {
		return id;
	}

	public String getDirectoryName() {
		return directoryName;
	}

	public String getDisplayName() {
		return displayName;
	}

	/**
	 * Resolve a resource type from its identifier or enum name, ignoring case.
	 * @param value identifier such as "prs" or "PULL_REQUESTS"
	 * @return the matching type
	 * @throws IllegalArgumentException if no type matches
	 */
	@JsonCreator
	public static ResourceType fromId(String value) {
		String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
		for (ResourceType type : values()) {
			if (type.id.equals(normalized) || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
				return type;
			}
		}
		throw new IllegalArgumentException("Unknown resource type '" + value + "'. Supported: "
				+ Arrays.stream(values()).map(ResourceType::getId).collect(Collectors.joining(", ")));
	}

}
