package com.study.webflux.recall.domain.knowledge.model;

public record RelatedEntity(
	FactEntity entity,
	int hops,
	double score
) {
	public static RelatedEntity at(FactEntity entity, int hops) {
		return new RelatedEntity(entity, hops, 1.0 / hops);
	}
}
