package com.study.webflux.recall.infrastructure.vectordb.dto;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record QdrantScrollResponse(
	Result result
) {
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record Result(
		List<Point> points
	) {
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record Point(
		Object id,
		Map<String, Object> payload
	) {
	}
}
