package com.study.webflux.recall.application.knowledge.dto;

import com.study.webflux.recall.domain.knowledge.model.RelatedEntity;

public record RelatedEntityResponse(
	Long id,
	String name,
	String type,
	String category,
	int hops,
	double score
) {
	public static RelatedEntityResponse from(RelatedEntity related) {
		return new RelatedEntityResponse(related.entity().id(),
			related.entity().name(),
			related.entity().type(),
			related.entity().category(),
			related.hops(),
			related.score());
	}
}
