package com.study.webflux.recall.domain.query.model;

import java.util.Locale;

/**
 * 외부 감정 분석기가 미리 계산한 감정 라벨과 신뢰도입니다.
 */
public record EmotionHint(
	String label,
	double confidence
) {
	public static final String NEUTRAL = "neutral";

	public EmotionHint {
		if (label == null || label.isBlank()) {
			throw new IllegalArgumentException("emotion label cannot be null or blank");
		}
		if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
			throw new IllegalArgumentException("emotion confidence must be between 0 and 1");
		}
		label = label.trim().toLowerCase(Locale.ROOT);
	}

	public static EmotionHint of(String label, double confidence) {
		return new EmotionHint(label, confidence);
	}

	public boolean isNeutral() {
		return NEUTRAL.equals(label);
	}
}
