package com.study.webflux.recall.domain.query.model;

public enum TemporalDirection {
	OLDEST,
	NEWEST;

	public boolean ascending() {
		return this == OLDEST;
	}
}
