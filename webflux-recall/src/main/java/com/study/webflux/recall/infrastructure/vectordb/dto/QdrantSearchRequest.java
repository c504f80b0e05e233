package com.study.webflux.recall.infrastructure.vectordb.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public record QdrantSearchRequest(
	NamedVectorQuery vector,
	int limit,
	@JsonProperty("with_payload") boolean withPayload,
	QdrantFilter filter
) {
	public record NamedVectorQuery(
		String name,
		List<Float> vector
	) {
	}
}
