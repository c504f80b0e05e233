package com.study.webflux.recall.domain.knowledge.model;

/**
 * 엔티티 간 자동 발견 관계입니다. 권위 있는 데이터가 아니며 언제든 재생성할 수 있습니다.
 */
public record EntityRelationship(
	Long fromEntityId,
	Long toEntityId,
	String relationshipType,
	double weight
) {
	public static final String SIMILAR_TO = "similar_to";

	public Long otherEnd(Long entityId) {
		return fromEntityId.equals(entityId) ? toEntityId : fromEntityId;
	}
}
