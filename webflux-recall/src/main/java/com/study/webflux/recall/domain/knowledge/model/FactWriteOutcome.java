package com.study.webflux.recall.domain.knowledge.model;

/**
 * 사실 저장 결과입니다.
 */
public enum FactWriteOutcome {
	/** 새 관계를 저장했습니다. */
	STORED,
	/** 기존 관계의 언급 횟수를 올렸습니다. */
	REINFORCED,
	/** 새 관계가 더 강해 반대 관계를 대체했습니다. */
	OPPOSING_SUPERSEDED,
	/** 반대 관계와 신뢰도가 비슷해 최근 언급을 우선했습니다. 두 관계 모두 보존됩니다. */
	TIE_RESOLVED_BY_RECENCY,
	/** 반대 관계가 더 강해 새 관계는 대체된 상태로만 보존했습니다. */
	SUPERSEDED_BY_EXISTING,
	/** 같은 그룹의 더 강한 관계에 병합했습니다. */
	MERGED_INTO_SIMILAR
}
