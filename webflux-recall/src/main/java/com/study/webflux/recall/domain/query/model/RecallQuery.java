package com.study.webflux.recall.domain.query.model;

import java.time.Instant;

import com.study.webflux.recall.domain.user.model.UserId;

/**
 * 라우터에 전달되는 단일 질의입니다.
 *
 * <p>
 * turnAt 은 시간 표현("어제", "2시간 전")을 계산할 때 기준 시각으로 쓰이며, 없으면 현재 시각을 사용합니다.
 */
public record RecallQuery(
	String text,
	UserId userId,
	EmotionHint emotionHint,
	Instant turnAt
) {
	public RecallQuery {
		if (userId == null) {
			throw new IllegalArgumentException("userId cannot be null");
		}
		text = text == null ? "" : text;
		if (turnAt == null) {
			turnAt = Instant.now();
		}
	}

	public static RecallQuery of(UserId userId, String text) {
		return new RecallQuery(text, userId, null, null);
	}

	public static RecallQuery of(UserId userId, String text, EmotionHint emotionHint, Instant turnAt) {
		return new RecallQuery(text, userId, emotionHint, turnAt);
	}

	public RecallQuery withEmotionHint(EmotionHint hint) {
		return new RecallQuery(text, userId, hint, turnAt);
	}

	public boolean hasEmotionHint() {
		return emotionHint != null;
	}
}
