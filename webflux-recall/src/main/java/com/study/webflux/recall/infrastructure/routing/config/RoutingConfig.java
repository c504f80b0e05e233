package com.study.webflux.recall.infrastructure.routing.config;

import java.time.Duration;

/**
 * 라우터의 구성요소별 타임아웃과 조회 한도입니다.
 */
public record RoutingConfig(
	Duration vectorTimeout,
	Duration factsTimeout,
	Duration embeddingTimeout,
	Duration emotionTimeout,
	boolean emotionLookupEnabled,
	int defaultLimit,
	int maxLimit,
	double factMinConfidence
) {
	public static RoutingConfig defaults() {
		return new RoutingConfig(Duration.ofMillis(150),
			Duration.ofMillis(100),
			Duration.ofMillis(300),
			Duration.ofMillis(100),
			true,
			10,
			50,
			0.5);
	}
}
