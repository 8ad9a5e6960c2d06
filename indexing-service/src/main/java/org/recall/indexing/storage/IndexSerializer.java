package org.recall.indexing.storage;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.recall.core.index.InvertedIndex;

import java.util.Map;
import java.util.TreeMap;

/**
 * Converts an {@link InvertedIndex} to and from its persisted JSON form. Nothing else knows the file format.
 */
public class IndexSerializer {
	public static final int FORMAT_VERSION = 1;

	private final Gson gson;

	public IndexSerializer() {
		this.gson = new GsonBuilder().setPrettyPrinting().create();
	}

	/**
	 * Snapshot the index into plain string-keyed maps. Keys are sorted so the output is stable.
	 */
	public SerializedIndex serialize(InvertedIndex index) {
		Map<String, Integer> documents = new TreeMap<>();
		for (String docId : index.documentIds()) {
			documents.put(docId, index.documentLength(docId));
		}

		Map<String, Map<String, Integer>> terms = new TreeMap<>();
		for (String term : index.terms()) {
			terms.put(term, new TreeMap<>(index.postings(term)));
		}

		return new SerializedIndex(FORMAT_VERSION, index.totalDocs(), index.totalTokens(), documents, terms);
	}

	/**
	 * Inverse of {@link #serialize(InvertedIndex)}.
	 *
	 * @throws IndexFormatException if the payload is structurally invalid
	 */
	public InvertedIndex deserialize(SerializedIndex raw) throws IndexFormatException {
		if (raw == null) {
			throw new IndexFormatException("Index payload is empty");
		}
		if (raw.version() != FORMAT_VERSION) {
			throw new IndexFormatException("Unsupported index format version: " + raw.version());
		}
		if (raw.documents() == null || raw.terms() == null) {
			throw new IndexFormatException("Index payload is missing 'documents' or 'terms'");
		}

		InvertedIndex index;
		try {
			index = InvertedIndex.restore(raw.documents(), raw.terms());
		} catch (IllegalArgumentException e) {
			throw new IndexFormatException("Inconsistent index payload: " + e.getMessage(), e);
		}

		if (index.totalDocs() != raw.totalDocs()) {
			throw new IndexFormatException("totalDocs is " + raw.totalDocs()
					+ " but " + index.totalDocs() + " documents are listed");
		}
		if (index.totalTokens() != raw.totalTokens()) {
			throw new IndexFormatException("totalTokens is " + raw.totalTokens()
					+ " but document lengths sum to " + index.totalTokens());
		}

		return index;
	}

	public String toJson(InvertedIndex index) {
		return gson.toJson(serialize(index));
	}

	/**
	 * Parse and validate a persisted index.
	 *
	 * @throws IndexFormatException if the text is blank, not JSON, or not a valid index
	 */
	public InvertedIndex fromJson(String json) throws IndexFormatException {
		if (json == null || json.isBlank()) {
			throw new IndexFormatException("Index file is empty");
		}

		SerializedIndex raw;
		try {
			raw = gson.fromJson(json, SerializedIndex.class);
		} catch (JsonParseException | IllegalStateException e) {
			throw new IndexFormatException("Index file is not valid JSON: " + e.getMessage(), e);
		}

		return deserialize(raw);
	}
}
