package org.springaicommunity.github.exporter;

/**
 * Unchecked exception for export failures that are not GitHub API errors, typically
 * wrapping a checked exception raised while fetching or writing data.
 */
public class ExportException extends RuntimeException {

	public ExportException(String message) {
		super(message);
	}

	public ExportException(String message, Throwable cause) {
		super(message, cause);
	}

}
