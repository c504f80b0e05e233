package com.study.webflux.recall.infrastructure.vectordb.config;

public record QdrantConfig(
	String url,
	String apiKey,
	String collectionName,
	int vectorDimension,
	boolean autoCreateCollection
) {
}
