package com.study.webflux.recall.domain.memory.model;

import java.util.List;

public record MemoryEmbedding(
	String text,
	List<Float> vector
) {
	public MemoryEmbedding {
		if (vector == null || vector.isEmpty()) {
			throw new IllegalArgumentException("embedding vector cannot be empty");
		}
		vector = List.copyOf(vector);
	}

	public static MemoryEmbedding of(String text, List<Float> vector) {
		return new MemoryEmbedding(text, vector);
	}

	public int dimension() {
		return vector.size();
	}
}
