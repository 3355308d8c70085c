package org.springaicommunity.github.exporter;

import org.jspecify.annotations.Nullable;

/**
 * Basic repository information from the GitHub API.
 *
 * <p>
 * Obtained when a batch resolves an {@code owner/name} reference before exporting it.
 *
 * @param id the unique repository ID
 * @param owner the owner login
 * @param name the repository name (without owner)
 * @param description the repository description (may be null)
 * @param htmlUrl the web URL for the repository
 * @param isPrivate whether the repository is private
 * @param defaultBranch the default branch name
 */
public record RepositoryInfo(long id, String owner, String name, @Nullable String description, String htmlUrl,
		boolean isPrivate, String defaultBranch) {

	/**
	 * Returns the repository in "owner/name" form.
	 * @return the full repository name
	 */
	public String fullName() {
		return owner + "/" + name;
	}

	/**
	 * Split and validate an "owner/name" reference.
	 * @param reference repository reference
	 * @return two-element array of owner and name
	 * @throws IllegalArgumentException if the reference is not of the form "owner/name"
	 */
	public static String[] splitReference(String reference) {
		String trimmed = reference == null ? "" : reference.trim();
		String[] parts = trimmed.split("/");
		if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
			throw new IllegalArgumentException("Repository must be in 'owner/name' format: '" + reference + "'");
		}
		return parts;
	}

}
