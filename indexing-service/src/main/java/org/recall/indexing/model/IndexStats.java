package org.recall.indexing.model;

public record IndexStats(
		int totalDocs,
		int vocabularySize,
		long totalTokens,
		double averageDocLength,
		boolean dirty,
		String indexFile
) {}
