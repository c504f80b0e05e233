package com.study.webflux.recall.infrastructure.vectordb.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record QdrantScoredPoint(
	Object id,
	double score,
	Map<String, Object> payload
) {
}
