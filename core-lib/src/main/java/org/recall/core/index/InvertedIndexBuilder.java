package org.recall.core.index;

import org.recall.core.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

public class InvertedIndexBuilder {
	private static final Logger logger = LoggerFactory.getLogger(InvertedIndexBuilder.class);

	private final Tokenizer tokenizer;

	public InvertedIndexBuilder(Tokenizer tokenizer) {
		this.tokenizer = tokenizer;
	}

	/**
	 * Tokenize a document's text and upsert it into the index
	 */
	public void indexDocument(InvertedIndex index, String docId, String text) {
		List<String> tokens = tokenizer.tokenize(text);
		index.addDocument(docId, tokens);

		logger.debug("Indexed document {} with {} tokens", docId, tokens.size());
	}

	/**
	 * Build a fresh index from document id to text
	 */
	public InvertedIndex build(Map<String, String> texts) {
		InvertedIndex index = InvertedIndex.createEmpty();

		for (Map.Entry<String, String> text : texts.entrySet()) {
			indexDocument(index, text.getKey(), text.getValue());
		}

		logger.debug("Built index with {} documents, {} terms", index.totalDocs(), index.vocabularySize());
		return index;
	}

	public Tokenizer getTokenizer() {
		return tokenizer;
	}
}
