package org.recall.core.model;

import java.util.List;

/**
 * Text-bearing fields of a captured memory. Every field is optional.
 */
public record MemoryFields(
		String content,
		String type,
		List<String> tags,
		String source
) {
	public static MemoryFields ofContent(String content) {
		return new MemoryFields(content, null, null, null);
	}
}
