package org.recall.indexing.service;

/**
 * Decides when pending index mutations should be written to disk.
 *
 * <p>The manager reports every mutation through {@link #recordMutation()}, asks {@link #shouldFlush()}
 * afterwards, and calls {@link #onFlushed()} after each successful save.</p>
 */
public interface FlushPolicy {

	void recordMutation();

	boolean shouldFlush();

	void onFlushed();

	/**
	 * A policy that never asks for a flush. Callers flush explicitly.
	 */
	static FlushPolicy never() {
		return new FlushPolicy() {
			@Override
			public void recordMutation() {
			}

			@Override
			public boolean shouldFlush() {
				return false;
			}

			@Override
			public void onFlushed() {
			}
		};
	}
}
