package org.recall.indexing.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Flushes after a number of mutations or once a maximum age has passed since the last save,
 * whichever comes first. Either bound is disabled by passing {@code 0} / {@code Duration.ZERO}.
 *
 * <p>Not thread-safe; the index manager calls it under its write lock.</p>
 */
public class ThresholdFlushPolicy implements FlushPolicy {
	private final int everyMutations;
	private final Duration maxAge;
	private final Clock clock;

	private int pendingMutations;
	private Instant lastFlush;

	public ThresholdFlushPolicy(int everyMutations, Duration maxAge) {
		this(everyMutations, maxAge, Clock.systemUTC());
	}

	public ThresholdFlushPolicy(int everyMutations, Duration maxAge, Clock clock) {
		if (maxAge != null && maxAge.isNegative()) {
			throw new IllegalArgumentException("maxAge must not be negative: " + maxAge);
		}
		this.everyMutations = everyMutations;
		this.maxAge = maxAge == null ? Duration.ZERO : maxAge;
		this.clock = clock;
		this.pendingMutations = 0;
		this.lastFlush = clock.instant();
	}

	@Override
	public void recordMutation() {
		pendingMutations++;
	}

	@Override
	public boolean shouldFlush() {
		if (pendingMutations == 0) {
			return false;
		}
		if (everyMutations > 0 && pendingMutations >= everyMutations) {
			return true;
		}
		return !maxAge.isZero() && !clock.instant().isBefore(lastFlush.plus(maxAge));
	}

	@Override
	public void onFlushed() {
		pendingMutations = 0;
		lastFlush = clock.instant();
	}

	public int getPendingMutations() {
		return pendingMutations;
	}

	public int getEveryMutations() {
		return everyMutations;
	}

	public Duration getMaxAge() {
		return maxAge;
	}
}
