package org.recall.core.model;

import org.jetbrains.annotations.NotNull;

import java.io.Serial;
import java.io.Serializable;
import java.util.List;

/**
 * The part of a stored memory that the keyword index reads. The memory itself lives elsewhere.
 */
public record MemoryDocument(
		String id,
		String content,
		String type,
		List<String> tags,
		String source
) implements Serializable {

	public static MemoryDocument of(String id, MemoryFields fields) {
		return new MemoryDocument(id, fields.content(), fields.type(), fields.tags(), fields.source());
	}

	public static MemoryDocument of(String id, String content) {
		return new MemoryDocument(id, content, null, null, null);
	}

	@NotNull
	@Override
	public String toString() {
		return String.format("MemoryDocument{id='%s', type='%s', tags=%s, source='%s'}",
				id, type, tags, source);
	}

	@Serial
	private static final long serialVersionUID = 1L;
}
