package com.study.webflux.recall.domain.retrieval.model;

import java.util.List;

/**
 * 개별 조회 구성요소의 결과입니다. 실패한 구성요소는 빈 목록을 가집니다.
 */
public record ComponentOutcome<T>(
	ComponentStatus status,
	List<T> items
) {
	public ComponentOutcome {
		items = items == null ? List.of() : List.copyOf(items);
	}

	public static <T> ComponentOutcome<T> ok(List<T> items) {
		return new ComponentOutcome<>(ComponentStatus.OK, items);
	}

	public static <T> ComponentOutcome<T> skipped() {
		return new ComponentOutcome<>(ComponentStatus.SKIPPED, List.of());
	}

	public static <T> ComponentOutcome<T> failed(ComponentStatus status) {
		return new ComponentOutcome<>(status, List.of());
	}

	public boolean launched() {
		return status != ComponentStatus.SKIPPED;
	}
}
