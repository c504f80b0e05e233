package com.study.webflux.recall.infrastructure.vectordb.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.study.webflux.recall.infrastructure.config.properties.RecallProperties;

@Configuration
public class QdrantConfiguration {

	@Bean
	public QdrantConfig qdrantConfig(RecallProperties properties) {
		var qdrant = properties.getQdrant();
		return new QdrantConfig(trimTrailingSlash(qdrant.getUrl()),
			qdrant.getApiKey(),
			qdrant.getCollectionName(),
			qdrant.getVectorDimension(),
			qdrant.isAutoCreateCollection());
	}

	private String trimTrailingSlash(String url) {
		if (url == null || url.isBlank()) {
			return "";
		}
		return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
	}
}
