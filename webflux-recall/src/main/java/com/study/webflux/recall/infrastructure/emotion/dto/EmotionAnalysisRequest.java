package com.study.webflux.recall.infrastructure.emotion.dto;

public record EmotionAnalysisRequest(
	String text
) {
}
