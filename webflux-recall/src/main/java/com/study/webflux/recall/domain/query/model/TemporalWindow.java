package com.study.webflux.recall.domain.query.model;

import java.time.Instant;

/**
 * 시간순 조회 범위입니다. from 은 포함, to 는 제외하며 둘 다 비어 있을 수 있습니다.
 */
public record TemporalWindow(
	TemporalDirection direction,
	TemporalScope scope,
	int limit,
	Instant from,
	Instant to
) {
	public TemporalWindow {
		if (direction == null || scope == null) {
			throw new IllegalArgumentException("direction and scope are required");
		}
		if (limit <= 0) {
			throw new IllegalArgumentException("limit must be positive");
		}
		if (from != null && to != null && from.isAfter(to)) {
			throw new IllegalArgumentException("from must not be after to");
		}
		if (scope == TemporalScope.RANGE && (from == null || to == null)) {
			throw new IllegalArgumentException("range window requires both bounds");
		}
	}

	public TemporalWindow capLimit(int maxLimit) {
		if (maxLimit <= 0 || maxLimit >= limit) {
			return this;
		}
		return new TemporalWindow(direction, scope, maxLimit, from, to);
	}

	public boolean ascending() {
		return direction.ascending();
	}
}
