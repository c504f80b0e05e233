package com.study.webflux.recall.domain.query.model;

/**
 * 메모리 저장소의 이름 있는 벡터 공간입니다.
 */
public enum NamedVector {
	CONTENT("content"),
	EMOTION("emotion"),
	SEMANTIC("semantic");

	private final String wireName;

	NamedVector(String wireName) {
		this.wireName = wireName;
	}

	public String wireName() {
		return wireName;
	}
}
