package org.springaicommunity.github.exporter;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * How an export should limit itself to changed items.
 *
 * @param enabled true if only items changed after {@code since} are exported
 * @param since lower bound for changed items (null when not enabled)
 * @param forceFullExport true if a full export was explicitly requested
 */
public record DiffModeOptions(boolean enabled, @Nullable Instant since, boolean forceFullExport) {

	private static final DiffModeOptions DISABLED = new DiffModeOptions(false, null, false);

	private static final DiffModeOptions FORCED = new DiffModeOptions(false, null, true);

	/**
	 * Full export because there is nothing to diff against.
	 */
	public static DiffModeOptions disabled() {
		return DISABLED;
	}

	/**
	 * Full export because the caller asked for one.
	 */
	public static DiffModeOptions forced() {
		return FORCED;
	}

	/**
	 * Incremental export of items changed after the given time.
	 * @param since the previous checkpoint time
	 * @return enabled options
	 */
	public static DiffModeOptions since(Instant since) {
		return new DiffModeOptions(true, since, false);
	}

}
