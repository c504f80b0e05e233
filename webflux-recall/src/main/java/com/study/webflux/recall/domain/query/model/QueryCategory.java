package com.study.webflux.recall.domain.query.model;

public enum QueryCategory {
	FACTUAL,
	EMOTIONAL,
	CONVERSATIONAL,
	TEMPORAL,
	GENERAL
}
