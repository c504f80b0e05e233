package com.study.webflux.recall.application.knowledge.service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;

import com.study.webflux.recall.domain.knowledge.model.EntityRelationship;
import com.study.webflux.recall.domain.knowledge.model.FactEntity;
import com.study.webflux.recall.domain.knowledge.model.FactFilter;
import com.study.webflux.recall.domain.knowledge.model.FactWriteOutcome;
import com.study.webflux.recall.domain.knowledge.model.RelatedEntity;
import com.study.webflux.recall.domain.knowledge.model.StoreFactCommand;
import com.study.webflux.recall.domain.knowledge.model.UserFact;
import com.study.webflux.recall.domain.knowledge.port.KnowledgeGraphRepository;
import com.study.webflux.recall.domain.knowledge.service.RelationshipRules;
import com.study.webflux.recall.domain.knowledge.service.TrigramSimilarity;
import com.study.webflux.recall.domain.retrieval.port.KnowledgeGraphUseCase;
import com.study.webflux.recall.domain.user.model.UserId;
import com.study.webflux.recall.infrastructure.knowledge.config.KnowledgeGraphConfig;
import com.study.webflux.recall.infrastructure.monitoring.config.RecallMetricsConfiguration;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 사용자 사실 저장/조회와 엔티티 관계 탐색을 담당합니다.
 *
 * <p>
 * 사실 저장은 하나의 트랜잭션에서 엔티티 upsert, 모순 검사, 유사 관계 통합, 사실 upsert, 트라이그램 기반 관계 발견 순으로 진행합니다. 관계 발견은
 * 세이브포인트 안에서 실행되며 실패하면 그 부분만 롤백되고 사실 저장은 그대로 커밋됩니다.
 */
@Slf4j
@Service
public class KnowledgeGraphService implements KnowledgeGraphUseCase {

	private final KnowledgeGraphRepository repository;
	private final TransactionalOperator transactionalOperator;
	private final RecallMetricsConfiguration recallMetrics;
	private final KnowledgeGraphConfig config;
	private final Clock clock;

	public KnowledgeGraphService(KnowledgeGraphRepository repository,
		TransactionalOperator transactionalOperator,
		RecallMetricsConfiguration recallMetrics,
		KnowledgeGraphConfig config,
		Clock clock) {
		this.repository = repository;
		this.transactionalOperator = transactionalOperator;
		this.recallMetrics = recallMetrics;
		this.config = config;
		this.clock = clock;
	}

	@Override
	public Flux<UserFact> getUserFacts(UserId userId, FactFilter filter, int limit) {
		if (limit <= 0 || limit > config.maxFactLimit()) {
			return Flux.error(new IllegalArgumentException(
				"limit must be between 1 and " + config.maxFactLimit()));
		}
		FactFilter effective = filter == null
			? FactFilter.of(null, Set.of(), config.minConfidence())
			: filter;
		return repository.findUserFacts(userId, effective, limit);
	}

	/**
	 * 사실을 저장합니다.
	 *
	 * @param command
	 *            정규화된 저장 요청
	 * @return 저장 결과
	 */
	@Override
	public Mono<FactWriteOutcome> storeFact(StoreFactCommand command) {
		Instant now = clock.instant();
		Mono<WriteResult> write = repository
			.upsertEntity(command.entityName(), command.entityType(), command.category())
			.flatMap(entity -> resolveContradiction(command, entity, now)
				.flatMap(outcome -> discoverRelationships(entity)
					.thenReturn(new WriteResult(entity, outcome))));

		return transactionalOperator.transactional(write)
			.doOnNext(result -> {
				recallMetrics.recordFactWrite(result.outcome());
				log.debug("사실 저장 완료 user={}, entity={}, relationship={}, outcome={}",
					command.userId().value(),
					result.entity().name(),
					command.relationshipType(),
					result.outcome());
			})
			.map(WriteResult::outcome);
	}

	/**
	 * 시작 엔티티에서 similar_to 관계를 따라 maxHops 까지 너비 우선으로 탐색합니다. 점수는 1/hops 입니다.
	 */
	@Override
	public Flux<RelatedEntity> getRelatedEntities(String entityName, int maxHops) {
		if (entityName == null || entityName.isBlank()) {
			return Flux.error(new IllegalArgumentException("entityName cannot be null or blank"));
		}
		if (maxHops <= 0) {
			return Flux.error(new IllegalArgumentException("maxHops must be positive"));
		}
		int hops = Math.min(maxHops, config.maxHops());
		return repository.findEntitiesByName(FactEntity.normalize(entityName))
			.map(FactEntity::id)
			.collectList()
			.flatMapMany(seeds -> {
				if (seeds.isEmpty()) {
					return Flux.empty();
				}
				Set<Long> visited = new HashSet<>(seeds);
				return expand(Set.copyOf(seeds), visited, new HashMap<>(), 1, hops)
					.flatMapMany(this::loadRelated);
			});
	}

	private Mono<FactWriteOutcome> resolveContradiction(StoreFactCommand command,
		FactEntity entity,
		Instant now) {
		Set<String> opposing = RelationshipRules.opposingOf(command.relationshipType());
		if (opposing.isEmpty()) {
			return consolidateAndUpsert(command, entity, now, FactWriteOutcome.STORED);
		}
		return repository.findActiveFacts(command.userId(), entity.id(), opposing)
			.collectList()
			.flatMap(existing -> {
				if (existing.isEmpty()) {
					return consolidateAndUpsert(command, entity, now, FactWriteOutcome.STORED);
				}
				double strongest = existing.stream()
					.mapToDouble(UserFact::confidence)
					.max()
					.orElse(0.0);

				if (strongest > command.confidence() + config.tieMargin()) {
					// 기존 반대 관계가 명확히 강하면 새 관계는 대체된 상태로만 남김
					return upsert(command, entity, true, now)
						.thenReturn(FactWriteOutcome.SUPERSEDED_BY_EXISTING);
				}

				FactWriteOutcome outcome = command.confidence() > strongest + config.tieMargin()
					? FactWriteOutcome.OPPOSING_SUPERSEDED
					: FactWriteOutcome.TIE_RESOLVED_BY_RECENCY;
				List<String> superseded = existing.stream().map(UserFact::relationshipType).toList();
				return repository.markSuperseded(command.userId(), entity.id(), superseded)
					.then(consolidateAndUpsert(command, entity, now, outcome));
			});
	}

	/**
	 * 같은 의미 그룹(likes/loves/enjoys/prefers 등)에서는 가장 강한 관계 하나만 활성 상태로 유지합니다.
	 */
	private Mono<FactWriteOutcome> consolidateAndUpsert(StoreFactCommand command,
		FactEntity entity,
		Instant now,
		FactWriteOutcome outcome) {
		Set<String> siblings = RelationshipRules.siblingsOf(command.relationshipType());
		if (siblings.isEmpty()) {
			return upsertActive(command, entity, now, outcome);
		}
		return repository.findActiveFacts(command.userId(), entity.id(), siblings)
			.collectList()
			.flatMap(existing -> {
				UserFact strongest = existing.stream()
					.max(Comparator.comparingDouble(UserFact::confidence))
					.orElse(null);
				if (strongest != null && strongest.confidence() >= command.confidence()) {
					return repository.touchFact(command.userId(),
						entity.id(),
						strongest.relationshipType(),
						now).thenReturn(FactWriteOutcome.MERGED_INTO_SIMILAR);
				}
				if (existing.isEmpty()) {
					return upsertActive(command, entity, now, outcome);
				}
				List<String> weaker = existing.stream().map(UserFact::relationshipType).toList();
				return repository.markSuperseded(command.userId(), entity.id(), weaker)
					.then(upsertActive(command, entity, now, outcome));
			});
	}

	private Mono<FactWriteOutcome> upsertActive(StoreFactCommand command,
		FactEntity entity,
		Instant now,
		FactWriteOutcome outcome) {
		return upsert(command, entity, false, now).map(fact -> {
			if (outcome == FactWriteOutcome.STORED && fact.mentionCount() > 1) {
				return FactWriteOutcome.REINFORCED;
			}
			return outcome;
		});
	}

	private Mono<UserFact> upsert(StoreFactCommand command,
		FactEntity entity,
		boolean superseded,
		Instant now) {
		return repository.upsertFact(command.userId(),
			entity,
			command.relationshipType(),
			command.confidence(),
			command.emotionalContext(),
			superseded,
			now);
	}

	/**
	 * 같은 유형의 최근 엔티티와 트라이그램 유사도를 계산하여 similar_to 관계를 만듭니다.
	 */
	Mono<Void> discoverRelationships(FactEntity entity) {
		return repository.runIsolated(similarityEdges(entity))
			.onErrorResume(error -> {
				recallMetrics.recordDiscoveryFailure();
				log.warn("Relationship discovery failed for entity '{}': {}",
					entity.name(),
					error.getMessage(),
					error);
				return Mono.empty();
			});
	}

	private Mono<Void> similarityEdges(FactEntity entity) {
		return repository.findRecentEntitiesByType(entity.type(),
			entity.id(),
			config.discoveryCandidateLimit())
			.map(candidate -> new Candidate(candidate,
				TrigramSimilarity.similarity(entity.name(), candidate.name())))
			.filter(candidate -> candidate.similarity() > config.similarityThreshold())
			.sort(Comparator.comparingDouble(Candidate::similarity).reversed())
			.take(config.maxSimilarEntities())
			.concatMap(candidate -> repository.upsertEntityRelationship(new EntityRelationship(
				Math.min(entity.id(), candidate.entity().id()),
				Math.max(entity.id(), candidate.entity().id()),
				EntityRelationship.SIMILAR_TO,
				Math.min(candidate.similarity(), config.maxSimilarityWeight()))))
			.then();
	}

	private Mono<Map<Long, Integer>> expand(Set<Long> frontier,
		Set<Long> visited,
		Map<Long, Integer> hopsById,
		int hop,
		int maxHops) {
		if (frontier.isEmpty() || hop > maxHops) {
			return Mono.just(hopsById);
		}
		return repository.findEntityRelationships(frontier, EntityRelationship.SIMILAR_TO)
			.collectList()
			.flatMap(edges -> {
				Set<Long> next = new HashSet<>();
				for (EntityRelationship edge : edges) {
					Long from = frontier.contains(edge.fromEntityId())
						? edge.fromEntityId()
						: edge.toEntityId();
					Long neighbour = edge.otherEnd(from);
					if (visited.add(neighbour)) {
						next.add(neighbour);
						hopsById.put(neighbour, hop);
					}
				}
				return expand(next, visited, hopsById, hop + 1, maxHops);
			});
	}

	private Flux<RelatedEntity> loadRelated(Map<Long, Integer> hopsById) {
		if (hopsById.isEmpty()) {
			return Flux.empty();
		}
		return repository.findEntitiesByIds(hopsById.keySet())
			.map(entity -> RelatedEntity.at(entity, hopsById.get(entity.id())))
			.sort(Comparator.comparingDouble(RelatedEntity::score)
				.reversed()
				.thenComparing(related -> related.entity().name()));
	}

	private record WriteResult(FactEntity entity, FactWriteOutcome outcome) {
	}

	private record Candidate(FactEntity entity, double similarity) {
	}
}
