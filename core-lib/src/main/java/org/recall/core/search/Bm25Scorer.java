package org.recall.core.search;

/**
 * Okapi BM25 term weighting.
 */
public class Bm25Scorer {
	private final Bm25Parameters parameters;

	public Bm25Scorer(Bm25Parameters parameters) {
		this.parameters = parameters;
	}

	/**
	 * {@code ln(1 + (N - df + 0.5) / (df + 0.5))}, always positive for {@code df <= N}.
	 */
	public double idf(int totalDocs, int documentFrequency) {
		return Math.log(1 + (totalDocs - documentFrequency + 0.5) / (documentFrequency + 0.5));
	}

	/**
	 * Contribution of one query term to one document's score.
	 */
	public double termScore(double idf, int termFrequency, int documentLength, double averageDocLength) {
		double k1 = parameters.k1();
		double b = parameters.b();
		double lengthRatio = averageDocLength > 0 ? documentLength / averageDocLength : 0.0;
		double norm = termFrequency + k1 * (1 - b + b * lengthRatio);
		return idf * termFrequency * (k1 + 1) / norm;
	}

	public Bm25Parameters getParameters() {
		return parameters;
	}
}
