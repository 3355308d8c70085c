package org.springaicommunity.github.exporter;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * An exported record that knows how it is named on disk.
 */
public interface ExportItem {

	/**
	 * File name (without extension) under which this item is written. Must be unique
	 * within one resource type of one repository and safe to use as a file name.
	 * @return the file stem
	 */
	String fileStem();

	/**
	 * Human-readable title used as the heading of rendered output.
	 * @return the title
	 */
	String title();

	/**
	 * Replace characters that are unsafe in file names with {@code -} and cap the length.
	 * @param raw the raw text
	 * @param maxLength maximum length of the result
	 * @return the sanitized text
	 */
	static String sanitize(String raw, int maxLength) {
		String cleaned = raw.replaceAll("[^A-Za-z0-9._-]+", "-").replaceAll("-{2,}", "-");
		cleaned = cleaned.replaceAll("^-|-$", "");
		if (cleaned.length() > maxLength) {
			cleaned = cleaned.substring(0, maxLength);
		}
		return cleaned.isEmpty() ? "untitled" : cleaned;
	}

	/**
	 * Sanitize a free-form name into a file stem that stays distinct from the stems of
	 * other names. When sanitizing altered the name, the first eight hex digits of its
	 * SHA-256 are appended, so {@code feature/x} and {@code feature-x} never share a file.
	 * @param raw the raw name
	 * @param maxLength maximum length of the result
	 * @return the file stem
	 */
	static String uniqueStem(String raw, int maxLength) {
		String cleaned = sanitize(raw, maxLength);
		if (cleaned.equals(raw)) {
			return cleaned;
		}
		String suffix = "-" + shortHash(raw);
		if (cleaned.length() + suffix.length() > maxLength) {
			cleaned = cleaned.substring(0, Math.max(0, maxLength - suffix.length()));
		}
		return cleaned + suffix;
	}

	private static String shortHash(String raw) {
		try {
			byte[] hash = MessageDigest.getInstance("SHA-256").digest(raw.getBytes(StandardCharsets.UTF_8));
			StringBuilder hex = new StringBuilder(8);
			for (int i = 0; i < 4; i++) {
				hex.append(String.format("%02x", hash[i]));
			}
			return hex.toString();
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 not available", e);
		}
	}

}
