package org.recall.indexing.model;

/**
 * Outcome of a full rebuild. {@code indexed} counts distinct ids; {@code skipped} counts documents that could not be indexed.
 */
public record RebuildResult(
		IndexStats stats,
		int indexed,
		int skipped
) {}
