package com.study.webflux.recall.infrastructure.knowledge.adapter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import io.r2dbc.spi.Readable;
import lombok.extern.slf4j.Slf4j;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.study.webflux.recall.domain.knowledge.model.EntityRelationship;
import com.study.webflux.recall.domain.knowledge.model.FactEntity;
import com.study.webflux.recall.domain.knowledge.model.FactFilter;
import com.study.webflux.recall.domain.knowledge.model.UserFact;
import com.study.webflux.recall.domain.knowledge.port.KnowledgeGraphRepository;
import com.study.webflux.recall.domain.user.model.UserId;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * PostgreSQL 지식 그래프 저장소입니다. 스키마는 schema.sql 을 따릅니다.
 *
 * <p>
 * 다른 파이프라인이 남기는 내부 마커 행(_processing_marker 엔티티, _enrichment 관계)은 조회 결과에서 제외합니다.
 */
@Slf4j
@Repository
public class R2dbcKnowledgeGraphRepository implements KnowledgeGraphRepository {

	static final String PROCESSING_MARKER_TYPE = "_processing_marker";
	static final String ENRICHMENT_PREFIX = "\\_enrichment%";

	private static final String ISOLATION_SAVEPOINT = "knowledge_isolated_work";

	private static final String ENTITY_COLUMNS = "e.id, e.entity_name, e.entity_type, e.category, e.created_at";

	private static final String FACT_COLUMNS = """
		f.user_id, f.entity_id, e.entity_name, e.entity_type, e.category, f.relationship_type,
		f.confidence, f.emotional_context, f.last_mentioned, f.mention_count, f.superseded
		""";

	private static final String UPSERT_ENTITY = """
		INSERT INTO fact_entities (entity_name, entity_type, category)
		VALUES (:name, :type, :category)
		ON CONFLICT (entity_name, entity_type)
		DO UPDATE SET category = COALESCE(fact_entities.category, EXCLUDED.category)
		RETURNING id, entity_name, entity_type, category, created_at
		""";

	private static final String UPSERT_FACT = """
		INSERT INTO user_fact_relationships
			(user_id, entity_id, relationship_type, confidence, emotional_context, last_mentioned, mention_count, superseded)
		VALUES (:userId, :entityId, :relationshipType, :confidence, :emotionalContext, :mentionedAt, 1, :superseded)
		ON CONFLICT (user_id, entity_id, relationship_type)
		DO UPDATE SET
			confidence = GREATEST(user_fact_relationships.confidence, EXCLUDED.confidence),
			emotional_context = COALESCE(EXCLUDED.emotional_context, user_fact_relationships.emotional_context),
			last_mentioned = EXCLUDED.last_mentioned,
			mention_count = user_fact_relationships.mention_count + 1,
			superseded = EXCLUDED.superseded
		RETURNING user_id, entity_id, relationship_type, confidence, emotional_context, last_mentioned,
			mention_count, superseded
		""";

	private static final String MARK_SUPERSEDED = """
		UPDATE user_fact_relationships
		SET superseded = TRUE
		WHERE user_id = :userId AND entity_id = :entityId
			AND relationship_type IN (:relationshipTypes) AND superseded = FALSE
		""";

	private static final String TOUCH_FACT = """
		UPDATE user_fact_relationships
		SET mention_count = mention_count + 1, last_mentioned = :mentionedAt
		WHERE user_id = :userId AND entity_id = :entityId AND relationship_type = :relationshipType
		""";

	private static final String UPSERT_ENTITY_RELATIONSHIP = """
		INSERT INTO entity_relationships (entity_a_id, entity_b_id, relationship_type, weight)
		VALUES (:entityA, :entityB, :relationshipType, :weight)
		ON CONFLICT (entity_a_id, entity_b_id, relationship_type)
		DO UPDATE SET weight = EXCLUDED.weight
		""";

	private final DatabaseClient databaseClient;

	public R2dbcKnowledgeGraphRepository(DatabaseClient databaseClient) {
		this.databaseClient = databaseClient;
	}

	@Override
	public Mono<FactEntity> upsertEntity(String name, String type, String category) {
		DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(UPSERT_ENTITY)
			.bind("name", name)
			.bind("type", type);
		spec = category == null ? spec.bindNull("category", String.class) : spec.bind("category", category);
		return spec.map(R2dbcKnowledgeGraphRepository::toEntity).one();
	}

	@Override
	public Flux<UserFact> findActiveFacts(UserId userId, Long entityId, Collection<String> relationshipTypes) {
		if (relationshipTypes == null || relationshipTypes.isEmpty()) {
			return Flux.empty();
		}
		String sql = "SELECT " + FACT_COLUMNS + """
			FROM user_fact_relationships f
			JOIN fact_entities e ON e.id = f.entity_id
			WHERE f.user_id = :userId AND f.entity_id = :entityId
				AND f.relationship_type IN (:relationshipTypes) AND f.superseded = FALSE
			""";
		return databaseClient.sql(sql)
			.bind("userId", userId.value())
			.bind("entityId", entityId)
			.bind("relationshipTypes", List.copyOf(relationshipTypes))
			.map(R2dbcKnowledgeGraphRepository::toFact)
			.all();
	}

	@Override
	public Mono<Void> markSuperseded(UserId userId, Long entityId, Collection<String> relationshipTypes) {
		if (relationshipTypes == null || relationshipTypes.isEmpty()) {
			return Mono.empty();
		}
		return databaseClient.sql(MARK_SUPERSEDED)
			.bind("userId", userId.value())
			.bind("entityId", entityId)
			.bind("relationshipTypes", List.copyOf(relationshipTypes))
			.fetch()
			.rowsUpdated()
			.doOnNext(updated -> log.debug("대체 처리된 사실 수 user={}, entityId={}, count={}",
				userId.value(),
				entityId,
				updated))
			.then();
	}

	@Override
	public Mono<UserFact> upsertFact(UserId userId,
		FactEntity entity,
		String relationshipType,
		double confidence,
		String emotionalContext,
		boolean superseded,
		Instant mentionedAt) {
		DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(UPSERT_FACT)
			.bind("userId", userId.value())
			.bind("entityId", entity.id())
			.bind("relationshipType", relationshipType)
			.bind("confidence", confidence)
			.bind("mentionedAt", mentionedAt)
			.bind("superseded", superseded);
		spec = emotionalContext == null
			? spec.bindNull("emotionalContext", String.class)
			: spec.bind("emotionalContext", emotionalContext);
		return spec.map(row -> new UserFact(
			UserId.of(row.get("user_id", String.class)),
			row.get("entity_id", Long.class),
			entity.name(),
			entity.type(),
			entity.category(),
			row.get("relationship_type", String.class),
			row.get("confidence", Double.class),
			row.get("emotional_context", String.class),
			row.get("last_mentioned", Instant.class),
			row.get("mention_count", Integer.class),
			Boolean.TRUE.equals(row.get("superseded", Boolean.class)))).one();
	}

	@Override
	public Mono<Void> touchFact(UserId userId, Long entityId, String relationshipType, Instant mentionedAt) {
		return databaseClient.sql(TOUCH_FACT)
			.bind("userId", userId.value())
			.bind("entityId", entityId)
			.bind("relationshipType", relationshipType)
			.bind("mentionedAt", mentionedAt)
			.fetch()
			.rowsUpdated()
			.then();
	}

	@Override
	public Flux<UserFact> findUserFacts(UserId userId, FactFilter filter, int limit) {
		StringBuilder sql = new StringBuilder("SELECT ").append(FACT_COLUMNS).append("""
			FROM user_fact_relationships f
			JOIN fact_entities e ON e.id = f.entity_id
			WHERE f.user_id = :userId
				AND f.superseded = FALSE
				AND f.confidence >= :minConfidence
				AND e.entity_type <> :markerType
				AND f.relationship_type NOT LIKE :enrichmentPrefix
			""");
		if (filter.entityType() != null) {
			sql.append(" AND e.entity_type = :entityType");
		}
		if (!filter.relationshipTypes().isEmpty()) {
			sql.append(" AND f.relationship_type IN (:relationshipTypes)");
		}
		sql.append(" ORDER BY f.confidence DESC, f.last_mentioned DESC LIMIT :limit");

		DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(sql.toString())
			.bind("userId", userId.value())
			.bind("minConfidence", filter.minConfidence())
			.bind("markerType", PROCESSING_MARKER_TYPE)
			.bind("enrichmentPrefix", ENRICHMENT_PREFIX)
			.bind("limit", limit);
		if (filter.entityType() != null) {
			spec = spec.bind("entityType", filter.entityType());
		}
		if (!filter.relationshipTypes().isEmpty()) {
			spec = spec.bind("relationshipTypes", new ArrayList<>(filter.relationshipTypes()));
		}
		return spec.map(R2dbcKnowledgeGraphRepository::toFact).all();
	}

	@Override
	public Flux<FactEntity> findRecentEntitiesByType(String type, Long excludeEntityId, int limit) {
		String sql = "SELECT " + ENTITY_COLUMNS + """
			FROM fact_entities e
			WHERE e.entity_type = :type AND e.id <> :excludeId
			ORDER BY e.created_at DESC, e.id DESC
			LIMIT :limit
			""";
		return databaseClient.sql(sql)
			.bind("type", type)
			.bind("excludeId", excludeEntityId)
			.bind("limit", limit)
			.map(R2dbcKnowledgeGraphRepository::toEntity)
			.all();
	}

	@Override
	public Flux<FactEntity> findEntitiesByName(String name) {
		String sql = "SELECT " + ENTITY_COLUMNS + """
			FROM fact_entities e
			WHERE e.entity_name = :name AND e.entity_type <> :markerType
			ORDER BY e.id
			""";
		return databaseClient.sql(sql)
			.bind("name", name)
			.bind("markerType", PROCESSING_MARKER_TYPE)
			.map(R2dbcKnowledgeGraphRepository::toEntity)
			.all();
	}

	@Override
	public Flux<FactEntity> findEntitiesByIds(Collection<Long> ids) {
		if (ids == null || ids.isEmpty()) {
			return Flux.empty();
		}
		String sql = "SELECT " + ENTITY_COLUMNS + " FROM fact_entities e WHERE e.id IN (:ids)";
		return databaseClient.sql(sql)
			.bind("ids", List.copyOf(ids))
			.map(R2dbcKnowledgeGraphRepository::toEntity)
			.all();
	}

	@Override
	public Mono<Void> upsertEntityRelationship(EntityRelationship relationship) {
		return databaseClient.sql(UPSERT_ENTITY_RELATIONSHIP)
			.bind("entityA", relationship.fromEntityId())
			.bind("entityB", relationship.toEntityId())
			.bind("relationshipType", relationship.relationshipType())
			.bind("weight", relationship.weight())
			.fetch()
			.rowsUpdated()
			.then();
	}

	@Override
	public Flux<EntityRelationship> findEntityRelationships(Collection<Long> entityIds, String relationshipType) {
		if (entityIds == null || entityIds.isEmpty()) {
			return Flux.empty();
		}
		String sql = """
			SELECT entity_a_id, entity_b_id, relationship_type, weight
			FROM entity_relationships
			WHERE relationship_type = :relationshipType
				AND (entity_a_id IN (:ids) OR entity_b_id IN (:ids))
			""";
		return databaseClient.sql(sql)
			.bind("relationshipType", relationshipType)
			.bind("ids", List.copyOf(entityIds))
			.map(row -> new EntityRelationship(
				row.get("entity_a_id", Long.class),
				row.get("entity_b_id", Long.class),
				row.get("relationship_type", String.class),
				row.get("weight", Double.class)))
			.all();
	}

	@Override
	public Mono<Void> runIsolated(Mono<Void> work) {
		return databaseClient.inConnection(connection -> Mono
			.from(connection.createSavepoint(ISOLATION_SAVEPOINT))
			.then(work)
			.then(Mono.from(connection.releaseSavepoint(ISOLATION_SAVEPOINT)))
			.onErrorResume(error -> Mono
				.from(connection.rollbackTransactionToSavepoint(ISOLATION_SAVEPOINT))
				.then(Mono.error(error))));
	}

	private static FactEntity toEntity(Readable row) {
		return new FactEntity(
			row.get("id", Long.class),
			row.get("entity_name", String.class),
			row.get("entity_type", String.class),
			row.get("category", String.class),
			row.get("created_at", Instant.class));
	}

	private static UserFact toFact(Readable row) {
		Integer mentionCount = row.get("mention_count", Integer.class);
		return new UserFact(
			UserId.of(row.get("user_id", String.class)),
			row.get("entity_id", Long.class),
			row.get("entity_name", String.class),
			row.get("entity_type", String.class),
			row.get("category", String.class),
			row.get("relationship_type", String.class),
			row.get("confidence", Double.class),
			row.get("emotional_context", String.class),
			row.get("last_mentioned", Instant.class),
			mentionCount == null ? 0 : mentionCount,
			Boolean.TRUE.equals(row.get("superseded", Boolean.class)));
	}
}
