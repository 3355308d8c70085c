package org.springaicommunity.github.exporter;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Represents a GitHub pull request as listed by the REST API.
 *
 * @param number the pull request number within the repository
 * @param title the pull request title
 * @param body the pull request description (may be null)
 * @param state the state ("open" or "closed")
 * @param createdAt when the pull request was created
 * @param updatedAt when the pull request was last updated
 * @param closedAt when the pull request was closed (null if still open)
 * @param mergedAt when the pull request was merged (null if not merged)
 * @param htmlUrl the web URL of the pull request
 * @param author the user who opened the pull request
 * @param labels labels assigned to the pull request
 * @param draft whether this is a draft pull request
 * @param headRef the branch containing the changes (may be null)
 * @param baseRef the branch the changes target (may be null)
 */
public record PullRequest(int number, String title, @Nullable String body, String state, Instant createdAt,
		Instant updatedAt, @Nullable Instant closedAt, @Nullable Instant mergedAt, String htmlUrl, Author author,
		List<Label> labels, boolean draft, @Nullable String headRef, @Nullable String baseRef) implements ExportItem {

	@Override
	public String fileStem() {
		return "PR-" + number;
	}

	public boolean isMerged() {
		return mergedAt != null;
	}

}
