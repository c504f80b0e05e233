package com.study.webflux.recall.domain.retrieval.model;

public enum RetrievalComponent {
	MEMORIES,
	FACTS
}
