package com.study.webflux.recall.domain.query.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 질의 한 건에 대한 분류 결과입니다. 요청마다 새로 생성되며 저장되지 않습니다.
 *
 * @param category
 *            주 카테고리
 * @param confidence
 *            주 카테고리 신뢰도 (0~1)
 * @param secondaryCategories
 *            주 카테고리 점수의 일정 비율 이상을 얻은 카테고리
 * @param vectorStrategy
 *            벡터 검색 전략
 * @param categoryScores
 *            카테고리별 원점수
 * @param entityType
 *            사실 조회 필터용 엔티티 유형 힌트 (없으면 null)
 * @param relationshipType
 *            사실 조회 필터용 관계 유형 힌트 (없으면 null)
 * @param matchedIndicators
 *            매칭된 키워드 목록
 */
public record Classification(
	QueryCategory category,
	double confidence,
	List<QueryCategory> secondaryCategories,
	VectorStrategy vectorStrategy,
	Map<QueryCategory, Double> categoryScores,
	String entityType,
	String relationshipType,
	List<String> matchedIndicators
) {
	public static final double TEMPORAL_CONFIDENCE = 0.95;
	public static final double GENERAL_CONFIDENCE = 0.5;

	public Classification {
		if (category == null) {
			throw new IllegalArgumentException("category cannot be null");
		}
		if (vectorStrategy == null) {
			throw new IllegalArgumentException("vectorStrategy cannot be null");
		}
		if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
			throw new IllegalArgumentException("confidence must be between 0 and 1");
		}
		secondaryCategories = secondaryCategories == null ? List.of() : List.copyOf(secondaryCategories);
		categoryScores = categoryScores == null || categoryScores.isEmpty()
			? Map.of()
			: Collections.unmodifiableMap(new EnumMap<>(categoryScores));
		matchedIndicators = matchedIndicators == null ? List.of() : List.copyOf(matchedIndicators);
	}

	public static Classification temporal(List<String> matchedPatterns) {
		return new Classification(QueryCategory.TEMPORAL,
			TEMPORAL_CONFIDENCE,
			List.of(),
			VectorStrategy.contentOnly(),
			Map.of(),
			null,
			null,
			matchedPatterns);
	}

	public boolean includes(QueryCategory target) {
		return category == target || secondaryCategories.contains(target);
	}
}
