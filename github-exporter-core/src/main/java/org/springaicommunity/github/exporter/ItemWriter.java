package org.springaicommunity.github.exporter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes exported items to storage.
 */
public interface ItemWriter {

	/**
	 * Write one item.
	 * @param directory target directory
	 * @param item the item
	 * @param format output format
	 * @throws IOException if the item cannot be written
	 */
	void write(Path directory, ExportItem item, ExportFormat format) throws IOException;

}
