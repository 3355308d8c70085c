package org.springaicommunity.github.exporter;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Represents a GitHub release.
 *
 * @param id the unique release ID
 * @param tagName the tag the release points to
 * @param name the release name (may be null)
 * @param body the release notes (may be null)
 * @param draft whether the release is a draft
 * @param prerelease whether the release is marked as a pre-release
 * @param createdAt when the release was created
 * @param publishedAt when the release was published (null for drafts)
 * @param author the user who created the release
 * @param htmlUrl the web URL of the release
 * @param assets files attached to the release
 */
public record Release(long id, String tagName, @Nullable String name, @Nullable String body, boolean draft,
		boolean prerelease, Instant createdAt, @Nullable Instant publishedAt, Author author, String htmlUrl,
		List<Asset> assets) implements ExportItem {

	@Override
	public String fileStem() {
		return ExportItem.uniqueStem(tagName, 100);
	}

	@Override
	public String title() {
		return (name != null && !name.isBlank()) ? name : tagName;
	}

	/**
	 * A file attached to a release.
	 *
	 * @param name the file name
	 * @param size size in bytes
	 * @param downloadCount number of downloads
	 * @param downloadUrl the browser download URL
	 */
	public record Asset(String name, long size, int downloadCount, String downloadUrl) {
	}

}
