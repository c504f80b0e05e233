package com.study.webflux.recall.domain.knowledge.model;

import java.util.Set;

/**
 * 사용자 사실 조회 조건입니다. 비어 있는 조건은 적용하지 않습니다.
 */
public record FactFilter(
	String entityType,
	Set<String> relationshipTypes,
	double minConfidence
) {
	public static final double DEFAULT_MIN_CONFIDENCE = 0.5;

	public FactFilter {
		if (Double.isNaN(minConfidence) || minConfidence < 0.0 || minConfidence > 1.0) {
			throw new IllegalArgumentException("minConfidence must be between 0 and 1");
		}
		entityType = entityType == null || entityType.isBlank() ? null : FactEntity.normalize(entityType);
		relationshipTypes = relationshipTypes == null ? Set.of() : Set.copyOf(relationshipTypes);
	}

	public static FactFilter defaults() {
		return new FactFilter(null, Set.of(), DEFAULT_MIN_CONFIDENCE);
	}

	public static FactFilter of(String entityType, Set<String> relationshipTypes, double minConfidence) {
		return new FactFilter(entityType, relationshipTypes, minConfidence);
	}
}
