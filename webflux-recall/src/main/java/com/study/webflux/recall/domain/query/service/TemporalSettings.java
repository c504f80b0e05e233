package com.study.webflux.recall.domain.query.service;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 시간순 조회 설정입니다. 가장 오래된 기억 조회 개수는 5를 넘지 않습니다.
 */
public record TemporalSettings(
	Duration sessionWindow,
	int oldestLimit,
	int newestLimit,
	ZoneId zone
) {
	public static final int MAX_OLDEST_LIMIT = 5;

	public TemporalSettings {
		if (sessionWindow == null || sessionWindow.isNegative() || sessionWindow.isZero()) {
			throw new IllegalArgumentException("sessionWindow must be positive");
		}
		if (oldestLimit <= 0 || newestLimit <= 0) {
			throw new IllegalArgumentException("temporal limits must be positive");
		}
		oldestLimit = Math.min(oldestLimit, MAX_OLDEST_LIMIT);
		zone = zone == null ? ZoneOffset.UTC : zone;
	}

	public static TemporalSettings defaults() {
		return new TemporalSettings(Duration.ofHours(4), 3, 10, ZoneOffset.UTC);
	}
}
