package org.springaicommunity.github.exporter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Sleeper that records requested waits instead of sleeping. Optionally advances a
 * {@link MutableClock} by each wait.
 */
final class RecordingSleeper implements Sleeper {

	private final List<Duration> sleeps = new ArrayList<>();

	private final MutableClock clock;

	RecordingSleeper() {
		this(null);
	}

	RecordingSleeper(MutableClock clock) {
		this.clock = clock;
	}

	@Override
	public synchronized void sleep(Duration duration) {
		sleeps.add(duration);
		if (clock != null && !duration.isNegative()) {
			clock.advance(duration);
		}
	}

	synchronized List<Duration> sleeps() {
		return List.copyOf(sleeps);
	}

	synchronized Duration total() {
		return sleeps.stream().reduce(Duration.ZERO, Duration::plus);
	}

}
