package com.study.webflux.recall.domain.knowledge.model;

import com.study.webflux.recall.domain.user.model.UserId;

/**
 * 사실 저장 요청입니다. 엔티티 이름/유형과 관계 유형은 소문자로 정규화되며 관계 유형이 비어 있으면 mentions 를 사용합니다.
 */
public record StoreFactCommand(
	UserId userId,
	String entityName,
	String entityType,
	String relationshipType,
	double confidence,
	String emotionalContext,
	String category
) {
	public static final String DEFAULT_RELATIONSHIP = "mentions";

	public StoreFactCommand {
		if (userId == null) {
			throw new IllegalArgumentException("userId cannot be null");
		}
		if (entityName == null || entityName.isBlank()) {
			throw new IllegalArgumentException("entityName cannot be null or blank");
		}
		if (entityType == null || entityType.isBlank()) {
			throw new IllegalArgumentException("entityType cannot be null or blank");
		}
		if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
			throw new IllegalArgumentException("confidence must be between 0 and 1");
		}
		entityName = FactEntity.normalize(entityName);
		entityType = FactEntity.normalize(entityType);
		relationshipType = relationshipType == null || relationshipType.isBlank()
			? DEFAULT_RELATIONSHIP
			: FactEntity.normalize(relationshipType);
		if (entityName.length() > 255 || entityType.length() > 64 || relationshipType.length() > 64) {
			throw new IllegalArgumentException("fact field too long");
		}
		if (relationshipType.startsWith("_")) {
			throw new IllegalArgumentException("reserved relationship type: " + relationshipType);
		}
	}

	public static StoreFactCommand of(UserId userId,
		String entityName,
		String entityType,
		String relationshipType,
		double confidence) {
		return new StoreFactCommand(userId, entityName, entityType, relationshipType, confidence,
			null, null);
	}
}
