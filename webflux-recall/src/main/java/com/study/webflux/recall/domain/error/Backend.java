package com.study.webflux.recall.domain.error;

public enum Backend {
	VECTOR_STORE,
	KNOWLEDGE_GRAPH,
	EMBEDDING,
	EMOTION
}
