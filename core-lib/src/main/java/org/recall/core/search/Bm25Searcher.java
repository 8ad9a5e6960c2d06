package org.recall.core.search;

import org.recall.core.index.InvertedIndex;
import org.recall.core.model.SearchHit;
import org.recall.core.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ranks indexed documents against a free-text query with BM25.
 */
public class Bm25Searcher {
	private static final Logger logger = LoggerFactory.getLogger(Bm25Searcher.class);

	private static final Comparator<SearchHit> RANKING = Comparator
			.comparingDouble(SearchHit::score).reversed()
			.thenComparing(SearchHit::id);

	private final Tokenizer tokenizer;
	private final Bm25Scorer scorer;

	public Bm25Searcher(Tokenizer tokenizer, Bm25Parameters parameters) {
		this.tokenizer = tokenizer;
		this.scorer = new Bm25Scorer(parameters);
	}

	public List<SearchHit> search(InvertedIndex index, String query) {
		return search(index, query, SearchOptions.defaults());
	}

	/**
	 * Score every document containing at least one query term.
	 *
	 * @return hits sorted by score descending, then id ascending; empty when nothing matches
	 */
	public List<SearchHit> search(InvertedIndex index, String query, SearchOptions options) {
		int totalDocs = index.totalDocs();
		if (totalDocs == 0) {
			return Collections.emptyList();
		}

		Set<String> queryTerms = new LinkedHashSet<>(tokenizer.tokenize(query));
		if (queryTerms.isEmpty()) {
			return Collections.emptyList();
		}

		double averageDocLength = index.averageDocLength();
		Map<String, Double> scores = new HashMap<>();

		for (String term : queryTerms) {
			Map<String, Integer> postings = index.postings(term);
			if (postings.isEmpty()) {
				continue;
			}

			double idf = scorer.idf(totalDocs, postings.size());
			for (Map.Entry<String, Integer> posting : postings.entrySet()) {
				String docId = posting.getKey();
				double contribution = scorer.termScore(idf, posting.getValue(),
						index.documentLength(docId), averageDocLength);
				scores.merge(docId, contribution, Double::sum);
			}
		}

		List<SearchHit> hits = scores.entrySet().stream()
				.filter(e -> e.getValue() >= options.threshold())
				.map(e -> new SearchHit(e.getKey(), e.getValue()))
				.sorted(RANKING)
				.limit(options.limit())
				.collect(Collectors.toList());

		logger.debug("Query '{}' ({} terms): {} candidates, {} hits",
				query, queryTerms.size(), scores.size(), hits.size());
		return hits;
	}

	public Tokenizer getTokenizer() {
		return tokenizer;
	}

	public Bm25Scorer getScorer() {
		return scorer;
	}
}
