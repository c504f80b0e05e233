package com.study.webflux.recall.domain.knowledge.port;

import java.time.Instant;
import java.util.Collection;

import com.study.webflux.recall.domain.knowledge.model.EntityRelationship;
import com.study.webflux.recall.domain.knowledge.model.FactEntity;
import com.study.webflux.recall.domain.knowledge.model.FactFilter;
import com.study.webflux.recall.domain.knowledge.model.UserFact;
import com.study.webflux.recall.domain.user.model.UserId;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 엔티티, 사용자 사실, 엔티티 간 관계 저장소입니다.
 */
public interface KnowledgeGraphRepository {

	/** (name, type) 기준으로 엔티티를 생성하거나 기존 엔티티를 반환합니다. */
	Mono<FactEntity> upsertEntity(String name, String type, String category);

	/** 대체되지 않은 사용자 사실 중 주어진 관계 유형에 해당하는 것을 조회합니다. */
	Flux<UserFact> findActiveFacts(UserId userId, Long entityId, Collection<String> relationshipTypes);

	Mono<Void> markSuperseded(UserId userId, Long entityId, Collection<String> relationshipTypes);

	/**
	 * 사실을 저장합니다. 이미 존재하면 confidence 는 최댓값, mention_count 는 +1, last_mentioned 는 갱신하고 superseded 는 전달한 값으로
	 * 덮어씁니다.
	 */
	Mono<UserFact> upsertFact(UserId userId,
		FactEntity entity,
		String relationshipType,
		double confidence,
		String emotionalContext,
		boolean superseded,
		Instant mentionedAt);

	/** 신뢰도는 유지한 채 언급 횟수와 최근 언급 시각만 갱신합니다. */
	Mono<Void> touchFact(UserId userId, Long entityId, String relationshipType, Instant mentionedAt);

	/** 내부 마커 행과 대체된 사실은 제외하고 (confidence DESC, last_mentioned DESC) 순서로 조회합니다. */
	Flux<UserFact> findUserFacts(UserId userId, FactFilter filter, int limit);

	Flux<FactEntity> findRecentEntitiesByType(String type, Long excludeEntityId, int limit);

	Flux<FactEntity> findEntitiesByName(String name);

	Flux<FactEntity> findEntitiesByIds(Collection<Long> ids);

	Mono<Void> upsertEntityRelationship(EntityRelationship relationship);

	/** 주어진 엔티티가 어느 쪽이든 끝점인 관계를 조회합니다. */
	Flux<EntityRelationship> findEntityRelationships(Collection<Long> entityIds, String relationshipType);

	/**
	 * 현재 트랜잭션 안에서 작업을 세이브포인트로 감싸 실행합니다. 작업이 실패하면 세이브포인트까지만 롤백하고 오류를 그대로 전달하므로 바깥 트랜잭션은 계속
	 * 커밋할 수 있습니다.
	 */
	Mono<Void> runIsolated(Mono<Void> work);
}
