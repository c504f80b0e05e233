package com.study.webflux.recall.domain.knowledge.model;

import java.time.Instant;

import com.study.webflux.recall.domain.user.model.UserId;

/**
 * 사용자와 엔티티 사이의 관계 (예: user-1 likes pizza).
 */
public record UserFact(
	UserId userId,
	Long entityId,
	String entityName,
	String entityType,
	String category,
	String relationshipType,
	double confidence,
	String emotionalContext,
	Instant lastMentioned,
	int mentionCount,
	boolean superseded
) {
	public UserFact {
		if (userId == null || entityId == null) {
			throw new IllegalArgumentException("userId and entityId are required");
		}
		if (relationshipType == null || relationshipType.isBlank()) {
			throw new IllegalArgumentException("relationshipType cannot be null or blank");
		}
		if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
			throw new IllegalArgumentException("confidence must be between 0 and 1");
		}
	}
}
