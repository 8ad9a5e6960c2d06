package org.recall.core.index;

import java.util.Set;

/**
 * Per-document bookkeeping: token length and the distinct terms the document contributed postings to.
 */
public record DocumentEntry(int length, Set<String> terms) {
	public DocumentEntry {
		if (length < 0) {
			throw new IllegalArgumentException("length must be >= 0, was " + length);
		}
		terms = Set.copyOf(terms);
	}
}
