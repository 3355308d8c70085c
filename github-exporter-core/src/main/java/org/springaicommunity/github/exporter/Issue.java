package org.springaicommunity.github.exporter;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Represents a GitHub issue.
 *
 * <p>
 * The issues endpoint also lists pull requests. They are returned flagged with
 * {@code pullRequest} so that page sizes stay intact, and are dropped by the exporter.
 *
 * @param number the issue number within the repository
 * @param title the issue title
 * @param body the issue body (may be null)
 * @param state the issue state ("open" or "closed")
 * @param createdAt when the issue was created
 * @param updatedAt when the issue was last updated
 * @param closedAt when the issue was closed (null if still open)
 * @param htmlUrl the web URL of the issue
 * @param author the user who created the issue
 * @param labels labels assigned to the issue
 * @param comments number of comments
 * @param pullRequest whether this entry is actually a pull request
 */
public record Issue(int number, String title, @Nullable String body, String state, Instant createdAt,
		Instant updatedAt, @Nullable Instant closedAt, String htmlUrl, Author author, List<Label> labels,
		int comments, boolean pullRequest) implements ExportItem {

	@Override
	public String fileStem() {
		return "ISSUE-" + number;
	}

}
