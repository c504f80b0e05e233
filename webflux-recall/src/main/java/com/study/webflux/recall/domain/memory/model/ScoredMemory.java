package com.study.webflux.recall.domain.memory.model;

import com.study.webflux.recall.domain.query.model.NamedVector;

/**
 * 단일 이름 벡터 검색에서 얻은 코사인 점수입니다.
 */
public record ScoredMemory(
	MemoryRecord record,
	NamedVector vector,
	double score
) {
}
