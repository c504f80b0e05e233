package com.study.webflux.recall.infrastructure.vectordb.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record QdrantSearchResponse(
	List<QdrantScoredPoint> result
) {
}
