package org.springaicommunity.github.exporter;

/**
 * Represents a repository branch.
 *
 * @param name the branch name
 * @param sha SHA of the branch head
 * @param protectedBranch whether branch protection is enabled
 */
public record Branch(String name, String sha, boolean protectedBranch) implements ExportItem {

	@Override
	public String fileStem() {
		return ExportItem.uniqueStem(name, 100);
	}

	@Override
	public String title() {
		return name;
	}

}
