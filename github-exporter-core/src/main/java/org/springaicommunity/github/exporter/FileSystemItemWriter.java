package org.springaicommunity.github.exporter;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes each item as {@code <fileStem>.json} and/or {@code <fileStem>.md}.
 *
 * <p>
 * The markdown file carries the item's title as heading followed by its JSON form; full
 * rendering is left to downstream tools.
 */
public class FileSystemItemWriter implements ItemWriter {

	private final ObjectMapper objectMapper;

	public FileSystemItemWriter(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	@Override
	public void write(Path directory, ExportItem item, ExportFormat format) throws IOException {
		Files.createDirectories(directory);
		String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(item);
		if (format.includesJson()) {
			Files.writeString(directory.resolve(item.fileStem() + ".json"), json, StandardCharsets.UTF_8);
		}
		if (format.includesMarkdown()) {
			String markdown = "# " + item.title() + "\n\n```json\n" + json + "\n```\n";
			Files.writeString(directory.resolve(item.fileStem() + ".md"), markdown, StandardCharsets.UTF_8);
		}
	}

}
