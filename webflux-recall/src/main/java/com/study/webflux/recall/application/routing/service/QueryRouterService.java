package com.study.webflux.recall.application.routing.service;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.stream.IntStream;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.recall.application.fusion.service.VectorFusionService;
import com.study.webflux.recall.domain.error.Backend;
import com.study.webflux.recall.domain.error.BackendTimeoutException;
import com.study.webflux.recall.domain.error.BackendUnavailableException;
import com.study.webflux.recall.domain.error.RetrievalFailedException;
import com.study.webflux.recall.domain.knowledge.model.FactFilter;
import com.study.webflux.recall.domain.knowledge.model.UserFact;
import com.study.webflux.recall.domain.knowledge.service.RelationshipRules;
import com.study.webflux.recall.domain.memory.model.RankedMemory;
import com.study.webflux.recall.domain.memory.port.EmbeddingPort;
import com.study.webflux.recall.domain.memory.port.EmotionPort;
import com.study.webflux.recall.domain.memory.port.MemoryVectorPort;
import com.study.webflux.recall.domain.query.model.Classification;
import com.study.webflux.recall.domain.query.model.EmotionHint;
import com.study.webflux.recall.domain.query.model.QueryCategory;
import com.study.webflux.recall.domain.query.model.RecallQuery;
import com.study.webflux.recall.domain.query.model.StrategyKind;
import com.study.webflux.recall.domain.query.model.TemporalDetection;
import com.study.webflux.recall.domain.query.model.TemporalWindow;
import com.study.webflux.recall.domain.query.model.VectorStrategy;
import com.study.webflux.recall.domain.query.service.QueryClassifier;
import com.study.webflux.recall.domain.query.service.TemporalQueryDetector;
import com.study.webflux.recall.domain.retrieval.model.ComponentOutcome;
import com.study.webflux.recall.domain.retrieval.model.ComponentStatus;
import com.study.webflux.recall.domain.retrieval.model.RecallResult;
import com.study.webflux.recall.domain.retrieval.model.RetrievalComponent;
import com.study.webflux.recall.domain.retrieval.model.RouteKind;
import com.study.webflux.recall.domain.retrieval.port.KnowledgeGraphUseCase;
import com.study.webflux.recall.domain.retrieval.port.MemoryRecallUseCase;
import com.study.webflux.recall.infrastructure.monitoring.config.RecallMetricsConfiguration;
import com.study.webflux.recall.infrastructure.routing.config.RoutingConfig;
import reactor.core.publisher.Mono;

/**
 * 질의 라우터입니다.
 *
 * <p>
 * 시간 표현이 감지되면 분류와 융합을 건너뛰고 시간순 조회만 수행합니다. 그 외에는 분류 결과에 따라 사실 조회와 벡터 검색을 동시에 실행하고, 각 구성요소는
 * 자체 타임아웃을 가집니다. 실패한 구성요소는 빈 목록과 상태로 대체되며, 실행한 구성요소가 모두 실패한 경우에만 오류를 반환합니다.
 */
@Slf4j
@Service
public class QueryRouterService implements MemoryRecallUseCase {

	private final TemporalQueryDetector temporalQueryDetector;
	private final QueryClassifier queryClassifier;
	private final VectorFusionService vectorFusionService;
	private final KnowledgeGraphUseCase knowledgeGraphUseCase;
	private final EmbeddingPort embeddingPort;
	private final EmotionPort emotionPort;
	private final MemoryVectorPort memoryVectorPort;
	private final RecallMetricsConfiguration recallMetrics;
	private final RoutingConfig config;

	public QueryRouterService(TemporalQueryDetector temporalQueryDetector,
		QueryClassifier queryClassifier,
		VectorFusionService vectorFusionService,
		KnowledgeGraphUseCase knowledgeGraphUseCase,
		EmbeddingPort embeddingPort,
		EmotionPort emotionPort,
		MemoryVectorPort memoryVectorPort,
		RecallMetricsConfiguration recallMetrics,
		RoutingConfig config) {
		this.temporalQueryDetector = temporalQueryDetector;
		this.queryClassifier = queryClassifier;
		this.vectorFusionService = vectorFusionService;
		this.knowledgeGraphUseCase = knowledgeGraphUseCase;
		this.embeddingPort = embeddingPort;
		this.emotionPort = emotionPort;
		this.memoryVectorPort = memoryVectorPort;
		this.recallMetrics = recallMetrics;
		this.config = config;
	}

	@Override
	public Mono<RecallResult> route(RecallQuery query, Integer requestedLimit) {
		int limit = requestedLimit == null ? config.defaultLimit() : requestedLimit;
		if (limit <= 0 || limit > config.maxLimit()) {
			return Mono.error(new IllegalArgumentException(
				"limit must be between 1 and " + config.maxLimit()));
		}
		long startedAt = System.nanoTime();
		TemporalDetection detection = temporalQueryDetector.detect(query);
		Mono<RecallResult> routed = detection.temporal()
			? routeTemporal(query, detection, limit)
			: resolveEmotionHint(query)
				.flatMap(hinted -> routeFusion(hinted,
					queryClassifier.scoreCategories(hinted.text(), hinted.emotionHint()),
					limit));

		return routed.doOnNext(result -> {
			recallMetrics.recordRoute(result.route(),
				result.classification().category(),
				result.classification().vectorStrategy().kind());
			recallMetrics.recordResultCounts(result.memories().size(), result.facts().size());
		}).doFinally(signal -> recallMetrics.recordRouteLatency(
			Duration.ofNanos(System.nanoTime() - startedAt)));
	}

	/**
	 * 호출자가 전달한 힌트만 사용하여 분류합니다. 외부 감정 분석기는 호출하지 않으므로 같은 (text, emotionHint) 는 항상 같은 결과를 냅니다.
	 */
	@Override
	public Mono<Classification> classify(String text, EmotionHint emotionHint, Instant turnAt) {
		return Mono.fromCallable(() -> queryClassifier.classify(text, emotionHint, turnAt));
	}

	/**
	 * 시간순 조회 경로입니다. 방향에 맞는 정렬로 저장소를 직접 조회합니다.
	 */
	private Mono<RecallResult> routeTemporal(RecallQuery query,
		TemporalDetection detection,
		int limit) {
		TemporalWindow window = detection.window().capLimit(limit);
		Classification classification = Classification.temporal(detection.matchedPatterns());

		return memoryVectorPort.scrollChronological(query.userId(), window)
			.take(window.limit())
			.collectList()
			.timeout(config.vectorTimeout())
			.map(records -> IntStream.range(0, records.size())
				.mapToObj(index -> RankedMemory.chronological(records.get(index), index + 1))
				.toList())
			.map(ComponentOutcome::ok)
			.onErrorResume(error -> Mono.just(degrade(RetrievalComponent.MEMORIES, query, error)))
			.flatMap(memories -> assemble(classification,
				query.emotionHint(),
				RouteKind.TEMPORAL,
				window,
				memories,
				ComponentOutcome.skipped()));
	}

	private Mono<RecallResult> routeFusion(RecallQuery query,
		Classification classification,
		int limit) {
		Mono<ComponentOutcome<UserFact>> facts = classification.includes(QueryCategory.FACTUAL)
			? searchFacts(query, classification, limit)
			: Mono.just(ComponentOutcome.skipped());
		Mono<ComponentOutcome<RankedMemory>> memories = searchMemories(query,
			classification.vectorStrategy(),
			limit);

		return Mono.zip(memories, facts)
			.flatMap(tuple -> assemble(classification,
				query.emotionHint(),
				RouteKind.FUSION,
				null,
				tuple.getT1(),
				tuple.getT2()));
	}

	private Mono<ComponentOutcome<UserFact>> searchFacts(RecallQuery query,
		Classification classification,
		int limit) {
		return knowledgeGraphUseCase.getUserFacts(query.userId(), factFilterOf(classification), limit)
			.collectList()
			.timeout(config.factsTimeout())
			.map(ComponentOutcome::ok)
			.onErrorResume(error -> Mono.just(degrade(RetrievalComponent.FACTS, query, error)));
	}

	/**
	 * 질의를 임베딩하고 벡터 검색을 수행합니다. 벡터 저장소가 전략을 처리하지 못하면 CONTENT_ONLY 로 한 번 재시도합니다.
	 */
	private Mono<ComponentOutcome<RankedMemory>> searchMemories(RecallQuery query,
		VectorStrategy strategy,
		int limit) {
		return embeddingPort.embed(query.text())
			.timeout(config.embeddingTimeout())
			.onErrorMap(TimeoutException.class,
				error -> new BackendTimeoutException(Backend.EMBEDDING, config.embeddingTimeout(), error))
			.flatMap(embedding -> fuse(embedding.vector(), query, strategy, limit)
				.onErrorResume(BackendUnavailableException.class, error -> {
					if (strategy.kind() == StrategyKind.CONTENT_ONLY) {
						return Mono.error(error);
					}
					log.warn("Vector search with {} failed, retrying with CONTENT_ONLY: {}",
						strategy.kind(),
						error.getMessage());
					recallMetrics.recordStrategyFallback();
					return fuse(embedding.vector(), query, VectorStrategy.contentOnly(), limit);
				}))
			.map(ComponentOutcome::ok)
			.onErrorResume(error -> Mono.just(degrade(RetrievalComponent.MEMORIES, query, error)));
	}

	private Mono<List<RankedMemory>> fuse(List<Float> vector,
		RecallQuery query,
		VectorStrategy strategy,
		int limit) {
		return vectorFusionService.search(vector, query.userId(), strategy, limit)
			.collectList()
			.timeout(config.vectorTimeout())
			.onErrorMap(TimeoutException.class,
				error -> new BackendTimeoutException(Backend.VECTOR_STORE, config.vectorTimeout(), error));
	}

	private Mono<RecallQuery> resolveEmotionHint(RecallQuery query) {
		if (query.hasEmotionHint()) {
			return Mono.just(query);
		}
		return lookupEmotion(query.text())
			.map(query::withEmotionHint)
			.defaultIfEmpty(query);
	}

	private Mono<EmotionHint> lookupEmotion(String text) {
		if (!config.emotionLookupEnabled() || text == null || text.isBlank()) {
			return Mono.empty();
		}
		return emotionPort.analyze(text)
			.timeout(config.emotionTimeout())
			.onErrorResume(error -> {
				log.warn("Emotion analysis failed, classifying without hint: {}", error.toString());
				return Mono.empty();
			});
	}

	private FactFilter factFilterOf(Classification classification) {
		Set<String> relationshipTypes = classification.relationshipType() == null
			? Set.of()
			: RelationshipRules.similarGroupOf(classification.relationshipType());
		return FactFilter.of(classification.entityType(), relationshipTypes, config.factMinConfidence());
	}

	private <T> ComponentOutcome<T> degrade(RetrievalComponent component,
		RecallQuery query,
		Throwable error) {
		ComponentStatus status = isTimeout(error) ? ComponentStatus.TIMEOUT : ComponentStatus.UNAVAILABLE;
		log.warn("Retrieval component {} degraded to {} for user '{}': {}",
			component,
			status,
			query.userId().value(),
			error.getMessage());
		recallMetrics.recordComponentFailure(component, status);
		return ComponentOutcome.failed(status);
	}

	private boolean isTimeout(Throwable error) {
		return error instanceof TimeoutException || error instanceof BackendTimeoutException;
	}

	private Mono<RecallResult> assemble(Classification classification,
		EmotionHint emotionHint,
		RouteKind route,
		TemporalWindow window,
		ComponentOutcome<RankedMemory> memories,
		ComponentOutcome<UserFact> facts) {
		Map<RetrievalComponent, ComponentStatus> components = new EnumMap<>(RetrievalComponent.class);
		components.put(RetrievalComponent.MEMORIES, memories.status());
		components.put(RetrievalComponent.FACTS, facts.status());

		boolean anyLaunchedSucceeded = (memories.launched() && !memories.status().failed())
			|| (facts.launched() && !facts.status().failed());
		if (!anyLaunchedSucceeded) {
			return Mono.error(new RetrievalFailedException(classification, components));
		}
		return Mono.just(new RecallResult(classification,
			memories.items(),
			facts.items(),
			route,
			window,
			components,
			emotionHint));
	}
}
