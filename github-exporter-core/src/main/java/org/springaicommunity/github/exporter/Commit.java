package org.springaicommunity.github.exporter;

import java.time.Instant;

/**
 * Represents a commit on the default branch.
 *
 * @param sha the full commit SHA
 * @param message the commit message
 * @param author the commit author
 * @param committedAt when the commit was authored
 * @param htmlUrl the web URL of the commit
 */
public record Commit(String sha, String message, Author author, Instant committedAt, String htmlUrl)
		implements ExportItem {

	@Override
	public String fileStem() {
		return sha.length() > 12 ? sha.substring(0, 12) : sha;
	}

	/**
	 * First line of the commit message.
	 */
	@Override
	public String title() {
		int newline = message.indexOf('\n');
		return (newline >= 0) ? message.substring(0, newline).trim() : message.trim();
	}

}
