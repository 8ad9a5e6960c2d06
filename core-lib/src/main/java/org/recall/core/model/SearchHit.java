package org.recall.core.model;

import org.jetbrains.annotations.NotNull;

public record SearchHit(
		String id,
		double score
) {
	@NotNull
	@Override
	public String toString() {
		return String.format("SearchHit{id='%s', score=%.4f}", id, score);
	}
}
