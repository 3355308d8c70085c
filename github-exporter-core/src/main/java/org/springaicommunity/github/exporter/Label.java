package org.springaicommunity.github.exporter;

import org.jspecify.annotations.Nullable;

/**
 * Represents a GitHub label attached to an issue or pull request.
 *
 * @param name the label name
 * @param color the hex color code without the leading {@code #} (may be null)
 * @param description the label description (may be null)
 */
public record Label(String name, @Nullable String color, @Nullable String description) {
}
