package org.recall.core.index;

import org.recall.core.text.Tokenizer;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Term to postings map plus per-document lengths.
 *
 * <p>Not thread-safe. Callers sharing an instance must serialize mutations themselves.</p>
 */
public class InvertedIndex {
	private final Map<String, Map<String, Integer>> postings;
	private final Map<String, DocumentEntry> documents;
	private long totalTokens;

	private InvertedIndex() {
		this.postings = new HashMap<>();
		this.documents = new HashMap<>();
		this.totalTokens = 0;
	}

	public static InvertedIndex createEmpty() {
		return new InvertedIndex();
	}

	/**
	 * Rebuild an index from persisted statistics.
	 *
	 * @param lengths document id to token length
	 * @param termPostings term to (document id to term frequency)
	 * @throws IllegalArgumentException if the two maps disagree with each other
	 */
	public static InvertedIndex restore(Map<String, Integer> lengths, Map<String, Map<String, Integer>> termPostings) {
		InvertedIndex index = new InvertedIndex();
		Map<String, Set<String>> termsByDoc = new HashMap<>();
		Map<String, Long> postedTokens = new HashMap<>();

		for (Map.Entry<String, Map<String, Integer>> term : termPostings.entrySet()) {
			String word = term.getKey();
			if (word == null || word.isEmpty()) {
				throw new IllegalArgumentException("empty term in postings");
			}
			if (term.getValue() == null || term.getValue().isEmpty()) {
				throw new IllegalArgumentException("term '" + word + "' has no postings");
			}

			Map<String, Integer> docs = new HashMap<>();
			for (Map.Entry<String, Integer> posting : term.getValue().entrySet()) {
				String docId = posting.getKey();
				Integer tf = posting.getValue();
				if (!lengths.containsKey(docId)) {
					throw new IllegalArgumentException("term '" + word + "' references unknown document '" + docId + "'");
				}
				if (tf == null || tf <= 0) {
					throw new IllegalArgumentException("term '" + word + "' has non-positive frequency for '" + docId + "'");
				}
				docs.put(docId, tf);
				termsByDoc.computeIfAbsent(docId, k -> new HashSet<>()).add(word);
				postedTokens.merge(docId, (long) tf, Long::sum);
			}
			index.postings.put(word, docs);
		}

		for (Map.Entry<String, Integer> doc : lengths.entrySet()) {
			String docId = doc.getKey();
			Integer length = doc.getValue();
			if (docId == null || docId.isBlank()) {
				throw new IllegalArgumentException("blank document id");
			}
			if (length == null || length < 0) {
				throw new IllegalArgumentException("document '" + docId + "' has invalid length " + length);
			}
			long posted = postedTokens.getOrDefault(docId, 0L);
			if (posted != length) {
				throw new IllegalArgumentException("document '" + docId + "' has length " + length
						+ " but its postings sum to " + posted);
			}
			index.documents.put(docId, new DocumentEntry(length, termsByDoc.getOrDefault(docId, Set.of())));
			index.totalTokens += length;
		}

		return index;
	}

	/**
	 * Index a document's tokens. An already indexed id is removed first, so repeated calls replace
	 * rather than accumulate.
	 */
	public void addDocument(String docId, List<String> tokens) {
		requireDocId(docId);

		removeDocument(docId);

		Map<String, Integer> counts = Tokenizer.countTerms(tokens);
		for (Map.Entry<String, Integer> count : counts.entrySet()) {
			postings.computeIfAbsent(count.getKey(), k -> new HashMap<>()).put(docId, count.getValue());
		}

		documents.put(docId, new DocumentEntry(tokens.size(), counts.keySet()));
		totalTokens += tokens.size();
	}

	/**
	 * Remove a document and every posting it contributed. Terms left without postings are dropped.
	 *
	 * @return {@code false} if the document was not indexed
	 */
	public boolean removeDocument(String docId) {
		DocumentEntry entry = documents.remove(docId);
		if (entry == null) {
			return false;
		}

		for (String term : entry.terms()) {
			Map<String, Integer> docs = postings.get(term);
			if (docs == null) {
				continue;
			}
			docs.remove(docId);
			if (docs.isEmpty()) {
				postings.remove(term);
			}
		}

		totalTokens -= entry.length();
		return true;
	}

	public void clear() {
		postings.clear();
		documents.clear();
		totalTokens = 0;
	}

	public boolean containsDocument(String docId) {
		return documents.containsKey(docId);
	}

	/**
	 * @return token length of the document, or -1 if it is not indexed
	 */
	public int documentLength(String docId) {
		DocumentEntry entry = documents.get(docId);
		return entry == null ? -1 : entry.length();
	}

	public int documentFrequency(String term) {
		Map<String, Integer> docs = postings.get(term);
		return docs == null ? 0 : docs.size();
	}

	public int termFrequency(String term, String docId) {
		Map<String, Integer> docs = postings.get(term);
		if (docs == null) {
			return 0;
		}
		return docs.getOrDefault(docId, 0);
	}

	/**
	 * Document id to term frequency for a term; empty if the term is unknown.
	 */
	public Map<String, Integer> postings(String term) {
		Map<String, Integer> docs = postings.get(term);
		return docs == null ? Collections.emptyMap() : Collections.unmodifiableMap(docs);
	}

	public Set<String> documentIds() {
		return Collections.unmodifiableSet(documents.keySet());
	}

	public Set<String> terms() {
		return Collections.unmodifiableSet(postings.keySet());
	}

	public int totalDocs() {
		return documents.size();
	}

	public int vocabularySize() {
		return postings.size();
	}

	public long totalTokens() {
		return totalTokens;
	}

	public double averageDocLength() {
		if (documents.isEmpty()) {
			return 0.0;
		}
		return (double) totalTokens / documents.size();
	}

	private static void requireDocId(String docId) {
		if (docId == null || docId.isBlank()) {
			throw new IllegalArgumentException("Document id must not be blank");
		}
	}
}
