package com.study.webflux.recall.domain.retrieval.model;

public enum RouteKind {
	TEMPORAL,
	FUSION
}
