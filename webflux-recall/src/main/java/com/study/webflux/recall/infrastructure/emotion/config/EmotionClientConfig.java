package com.study.webflux.recall.infrastructure.emotion.config;

public record EmotionClientConfig(
	boolean enabled,
	String url
) {
}
