package org.springaicommunity.github.exporter;

import org.jspecify.annotations.Nullable;

/**
 * Represents a GitHub user (author of a pull request, issue, commit or release).
 *
 * @param login the GitHub username, or "unknown" when the account is gone
 * @param name the user's display name (may be null if not set in their profile)
 */
public record Author(String login, @Nullable String name) {

	/**
	 * Placeholder for deleted or missing accounts.
	 */
	public static final Author UNKNOWN = new Author("unknown", null);

}
