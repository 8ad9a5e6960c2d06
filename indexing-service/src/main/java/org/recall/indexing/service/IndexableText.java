package org.recall.indexing.service;

import org.recall.core.model.MemoryDocument;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Reduces a memory to the single text the keyword index sees: content, type, tags, then source,
 * separated by spaces. The order is fixed so rebuilds produce identical indexes.
 */
public final class IndexableText {
	private IndexableText() {}

	public static String of(MemoryDocument memory) {
		List<String> parts = new ArrayList<>(4);

		addIfPresent(parts, memory.content());
		addIfPresent(parts, memory.type());

		if (memory.tags() != null) {
			String tags = memory.tags().stream()
					.filter(Objects::nonNull)
					.collect(Collectors.joining(" "));
			addIfPresent(parts, tags);
		}

		addIfPresent(parts, memory.source());

		return String.join(" ", parts);
	}

	private static void addIfPresent(List<String> parts, String value) {
		if (value != null && !value.isEmpty()) {
			parts.add(value);
		}
	}
}
