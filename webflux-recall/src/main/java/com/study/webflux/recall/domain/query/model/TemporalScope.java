package com.study.webflux.recall.domain.query.model;

public enum TemporalScope {
	SESSION,
	ALL_TIME,
	RANGE
}
