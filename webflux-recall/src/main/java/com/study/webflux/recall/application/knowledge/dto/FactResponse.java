package com.study.webflux.recall.application.knowledge.dto;

import java.time.Instant;

import com.study.webflux.recall.domain.knowledge.model.UserFact;

public record FactResponse(
	String entityName,
	String entityType,
	String category,
	String relationshipType,
	double confidence,
	String emotionalContext,
	Instant lastMentioned,
	int mentionCount
) {
	public static FactResponse from(UserFact fact) {
		return new FactResponse(fact.entityName(),
			fact.entityType(),
			fact.category(),
			fact.relationshipType(),
			fact.confidence(),
			fact.emotionalContext(),
			fact.lastMentioned(),
			fact.mentionCount());
	}
}
