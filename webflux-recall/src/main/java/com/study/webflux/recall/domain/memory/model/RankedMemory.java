package com.study.webflux.recall.domain.memory.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.study.webflux.recall.domain.query.model.NamedVector;

/**
 * 최종 순위가 매겨진 기억입니다.
 *
 * @param record
 *            기억
 * @param score
 *            최종 점수 (시간순 결과는 1.0)
 * @param contributions
 *            벡터별 가중 점수 기여분
 * @param chronologicalRank
 *            시간순 결과에서의 순번 (1부터, 유사도 결과는 null)
 */
public record RankedMemory(
	MemoryRecord record,
	double score,
	Map<NamedVector, Double> contributions,
	Integer chronologicalRank
) {
	public RankedMemory {
		contributions = contributions == null || contributions.isEmpty()
			? Map.of()
			: Collections.unmodifiableMap(new EnumMap<>(contributions));
	}

	public static RankedMemory of(ScoredMemory scored) {
		return new RankedMemory(scored.record(),
			scored.score(),
			Map.of(scored.vector(), scored.score()),
			null);
	}

	public static RankedMemory chronological(MemoryRecord record, int rank) {
		return new RankedMemory(record, 1.0, Map.of(), rank);
	}

	public String id() {
		return record.id();
	}
}
