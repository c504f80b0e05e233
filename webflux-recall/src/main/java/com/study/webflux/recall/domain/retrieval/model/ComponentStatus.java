package com.study.webflux.recall.domain.retrieval.model;

public enum ComponentStatus {
	OK,
	TIMEOUT,
	UNAVAILABLE,
	SKIPPED;

	public boolean failed() {
		return this == TIMEOUT || this == UNAVAILABLE;
	}
}
