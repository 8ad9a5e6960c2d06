package org.recall.core.search;

/**
 * BM25 tuning constants.
 *
 * @param k1 term frequency saturation
 * @param b  document length normalization, between 0 and 1
 */
public record Bm25Parameters(double k1, double b) {
	public static final double DEFAULT_K1 = 1.2;
	public static final double DEFAULT_B = 0.75;

	public Bm25Parameters {
		if (!Double.isFinite(k1) || k1 < 0) {
			throw new IllegalArgumentException("k1 must be a finite value >= 0, was " + k1);
		}
		if (!Double.isFinite(b) || b < 0 || b > 1) {
			throw new IllegalArgumentException("b must be within [0, 1], was " + b);
		}
	}

	public static Bm25Parameters defaults() {
		return new Bm25Parameters(DEFAULT_K1, DEFAULT_B);
	}
}
