package com.study.webflux.recall.infrastructure.knowledge.config;

/**
 * 지식 그래프 동작 설정입니다.
 *
 * @param minConfidence
 *            사실 조회 기본 최소 신뢰도
 * @param tieMargin
 *            반대 관계 신뢰도가 이 차이 이내면 최근 언급을 우선
 * @param similarityThreshold
 *            유사 관계로 연결할 트라이그램 유사도 하한 (초과)
 * @param maxSimilarityWeight
 *            유사 관계 가중치 상한
 * @param maxSimilarEntities
 *            엔티티당 새로 연결할 유사 엔티티 수
 * @param discoveryCandidateLimit
 *            유사도를 계산할 같은 유형의 최근 엔티티 수
 * @param maxHops
 *            관련 엔티티 탐색 최대 깊이
 * @param maxFactLimit
 *            한 번에 조회할 수 있는 사실 수
 */
public record KnowledgeGraphConfig(
	double minConfidence,
	double tieMargin,
	double similarityThreshold,
	double maxSimilarityWeight,
	int maxSimilarEntities,
	int discoveryCandidateLimit,
	int maxHops,
	int maxFactLimit
) {
	public static KnowledgeGraphConfig defaults() {
		return new KnowledgeGraphConfig(0.5, 0.05, 0.3, 0.9, 5, 500, 3, 100);
	}
}
