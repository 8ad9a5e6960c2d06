package org.recall.indexing.storage;

import java.util.Map;

/**
 * JSON shape of a persisted index. Keys are document ids and terms; all maps are plain string-keyed objects.
 *
 * @param version     format version, currently {@value IndexSerializer#FORMAT_VERSION}
 * @param totalDocs   number of indexed documents
 * @param totalTokens sum of all document lengths
 * @param documents   document id to token length
 * @param terms       term to (document id to term frequency)
 */
public record SerializedIndex(
		int version,
		int totalDocs,
		long totalTokens,
		Map<String, Integer> documents,
		Map<String, Map<String, Integer>> terms
) {}
