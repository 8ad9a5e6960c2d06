package org.recall.core.text;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns raw text into normalized terms.
 *
 * <p>Text is lowercased, NFC-normalized and split on every run of characters that are neither letters,
 * combining marks nor digits.
 * Documents and queries must go through the same instance, otherwise scores are meaningless.</p>
 */
public class Tokenizer {
	private static final Pattern SEPARATOR = Pattern.compile("[^\\p{L}\\p{M}\\p{N}]+");

	private final int minTermLength;
	private final Set<String> stopWords;

	public Tokenizer() {
		this(1, Collections.emptySet());
	}

	public Tokenizer(int minTermLength, Set<String> stopWords) {
		if (minTermLength < 1) {
			throw new IllegalArgumentException("minTermLength must be >= 1, was " + minTermLength);
		}
		this.minTermLength = minTermLength;
		this.stopWords = Set.copyOf(stopWords);
	}

	/**
	 * Split text into terms, in order of appearance. Never throws; {@code null} yields no terms.
	 */
	public List<String> tokenize(String text) {
		if (text == null || text.isEmpty()) {
			return Collections.emptyList();
		}

		String[] tokens = SEPARATOR.split(normalize(text));
		List<String> terms = new ArrayList<>(tokens.length);

		for (String token : tokens) {
			if (isValidTerm(token)) {
				terms.add(token);
			}
		}

		return terms;
	}

	/**
	 * Count occurrences of each term, keyed in order of first appearance.
	 */
	public Map<String, Integer> termCounts(String text) {
		return countTerms(tokenize(text));
	}

	public static Map<String, Integer> countTerms(List<String> terms) {
		Map<String, Integer> counts = new LinkedHashMap<>();
		for (String term : terms) {
			counts.merge(term, 1, Integer::sum);
		}
		return counts;
	}

	public int getMinTermLength() {
		return minTermLength;
	}

	public Set<String> getStopWords() {
		return stopWords;
	}

	private static String normalize(String text) {
		return Normalizer.normalize(text.toLowerCase(Locale.ROOT), Normalizer.Form.NFC);
	}

	private boolean isValidTerm(String token) {
		if (token.isEmpty() || token.length() < minTermLength) {
			return false;
		}

		return !stopWords.contains(token);
	}

	/**
	 * Parse stop words from comma-separated string
	 */
	public static Set<String> parseStopWords(String stopWordsStr) {
		if (stopWordsStr == null || stopWordsStr.trim().isEmpty()) {
			return new HashSet<>();
		}

		String[] words = stopWordsStr.split(",");
		Set<String> stopWords = new HashSet<>();

		for (String word : words) {
			String cleaned = word.trim().toLowerCase(Locale.ROOT);
			if (!cleaned.isEmpty()) {
				stopWords.add(cleaned);
			}
		}

		return stopWords;
	}
}
