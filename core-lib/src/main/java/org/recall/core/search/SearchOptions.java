package org.recall.core.search;

/**
 * Result shaping for a search: at most {@code limit} hits, each scoring at least {@code threshold}.
 */
public record SearchOptions(int limit, double threshold) {
	public static final int DEFAULT_LIMIT = 20;
	public static final double DEFAULT_THRESHOLD = 0.1;

	public SearchOptions {
		if (limit <= 0) {
			throw new IllegalArgumentException("limit must be > 0, was " + limit);
		}
		if (!Double.isFinite(threshold) || threshold < 0) {
			throw new IllegalArgumentException("threshold must be a finite value >= 0, was " + threshold);
		}
	}

	public static SearchOptions defaults() {
		return new SearchOptions(DEFAULT_LIMIT, DEFAULT_THRESHOLD);
	}

	public SearchOptions withLimit(int newLimit) {
		return new SearchOptions(newLimit, threshold);
	}

	public SearchOptions withThreshold(double newThreshold) {
		return new SearchOptions(limit, newThreshold);
	}
}
