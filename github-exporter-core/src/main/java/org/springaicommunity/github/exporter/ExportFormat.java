package org.springaicommunity.github.exporter;

import java.util.Locale;

/**
 * Output format for exported items.
 */
public enum ExportFormat {

	MARKDOWN(true, false),

	JSON(false, true),

	BOTH(true, true);

	private final boolean markdown;

	private final boolean json;

	ExportFormat(boolean markdown, boolean json) {
		this.markdown = markdown;
		this.json = json;
	}

	public boolean includesMarkdown() {
		return markdown;
	}

	public boolean includesJson() {
		return json;
	}

	/**
	 * Resolve a format label such as "json" or "md".
	 * @param value format label
	 * @return the matching format
	 * @throws IllegalArgumentException if the label is unknown
	 */
	public static ExportFormat fromLabel(String value) {
		String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
		return switch (normalized) {
			case "markdown", "md" -> MARKDOWN;
			case "json" -> JSON;
			case "both", "all" -> BOTH;
			default -> throw new IllegalArgumentException("Unknown export format: '" + value + "'");
		};
	}

}
