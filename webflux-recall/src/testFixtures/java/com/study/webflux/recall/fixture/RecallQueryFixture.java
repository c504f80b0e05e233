package com.study.webflux.recall.fixture;

import java.time.Instant;

import com.study.webflux.recall.domain.query.model.EmotionHint;
import com.study.webflux.recall.domain.query.model.RecallQuery;

public final class RecallQueryFixture {

	public static final Instant DEFAULT_TURN_AT = Instant.parse("2026-03-15T12:00:00Z");

	private RecallQueryFixture() {
	}

	public static RecallQuery create(String text) {
		return RecallQuery.of(UserIdFixture.create(), text, null, DEFAULT_TURN_AT);
	}

	public static RecallQuery create(String text, EmotionHint emotionHint) {
		return RecallQuery.of(UserIdFixture.create(), text, emotionHint, DEFAULT_TURN_AT);
	}

	public static RecallQuery create(String text, Instant turnAt) {
		return RecallQuery.of(UserIdFixture.create(), text, null, turnAt);
	}
}
