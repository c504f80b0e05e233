package com.study.webflux.recall.infrastructure.vectordb.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record QdrantScrollRequest(
	QdrantFilter filter,
	int limit,
	@JsonProperty("with_payload") boolean withPayload,
	@JsonProperty("with_vector") boolean withVector,
	@JsonProperty("order_by") OrderBy orderBy
) {
	public record OrderBy(
		String key,
		String direction
	) {
	}
}
