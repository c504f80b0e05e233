package com.study.webflux.recall.infrastructure.emotion.dto;

public record EmotionAnalysisResponse(
	String label,
	Double confidence
) {
}
