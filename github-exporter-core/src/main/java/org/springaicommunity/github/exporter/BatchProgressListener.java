package org.springaicommunity.github.exporter;

import java.util.List;

/**
 * Receives progress callbacks from a {@link BatchProcessor}. Callbacks for different
 * repositories of a group may arrive concurrently.
 */
public interface BatchProgressListener {

	/**
	 * Listener that ignores all callbacks.
	 */
	BatchProgressListener NONE = new BatchProgressListener() {
	};

	default void onGroupStart(int groupNumber, int groupCount, List<String> repositories) {
	}

	default void onRepositoryStart(String repository) {
	}

	default void onResourceComplete(RepositoryResult result) {
	}

	default void onRepositoryComplete(String repository, boolean success) {
	}

	default void onBatchComplete(BatchResult result) {
	}

}
