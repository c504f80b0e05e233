package com.study.webflux.recall.domain.user.model;

/**
 * 기억과 사실을 나누는 사용자 식별자입니다. 벡터 저장소 필터와 user_fact_relationships 의 user_id 에 그대로 쓰입니다.
 */
public record UserId(
	String value
) {
	public static final int MAX_LENGTH = 128;

	public UserId {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("userId cannot be null or blank");
		}
		value = value.trim();
		if (value.length() > MAX_LENGTH) {
			throw new IllegalArgumentException("userId must be at most " + MAX_LENGTH + " characters");
		}
	}

	public static UserId of(String value) {
		return new UserId(value);
	}
}
