package com.study.webflux.recall.application.fusion.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.recall.domain.memory.model.MemoryRecord;
import com.study.webflux.recall.domain.memory.model.RankedMemory;
import com.study.webflux.recall.domain.memory.model.ScoredMemory;
import com.study.webflux.recall.domain.memory.port.MemoryVectorPort;
import com.study.webflux.recall.domain.query.model.NamedVector;
import com.study.webflux.recall.domain.query.model.VectorStrategy;
import com.study.webflux.recall.domain.user.model.UserId;
import com.study.webflux.recall.infrastructure.monitoring.config.RecallMetricsConfiguration;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 선택된 전략에 따라 하나 또는 여러 이름 벡터로 기억을 검색하고 점수를 융합합니다.
 */
@Slf4j
@Service
public class VectorFusionService {

	private static final int CANDIDATE_MULTIPLIER = 2;

	private static final Comparator<RankedMemory> BY_SCORE_THEN_RECENCY = Comparator
		.comparingDouble(RankedMemory::score)
		.reversed()
		.thenComparing((RankedMemory memory) -> memory.record().timestamp(), Comparator.reverseOrder())
		.thenComparing(RankedMemory::id);

	private final MemoryVectorPort memoryVectorPort;
	private final RecallMetricsConfiguration recallMetrics;

	public VectorFusionService(MemoryVectorPort memoryVectorPort,
		RecallMetricsConfiguration recallMetrics) {
		this.memoryVectorPort = memoryVectorPort;
		this.recallMetrics = recallMetrics;
	}

	/**
	 * 전략에 맞춰 검색한 뒤 최종 점수 내림차순으로 최대 limit 개를 반환합니다.
	 *
	 * @param queryVector
	 *            질의 임베딩
	 * @param userId
	 *            사용자 ID
	 * @param strategy
	 *            벡터 전략
	 * @param limit
	 *            반환할 최대 개수
	 * @return 순위가 매겨진 기억. 결과가 없으면 빈 Flux
	 */
	public Flux<RankedMemory> search(List<Float> queryVector,
		UserId userId,
		VectorStrategy strategy,
		int limit) {
		if (limit <= 0) {
			return Flux.error(new IllegalArgumentException("limit must be positive"));
		}
		Mono<List<RankedMemory>> ranked = strategy.isPrimary()
			? searchPrimaryWithBackup(queryVector, userId, strategy, limit)
			: searchFused(queryVector, userId, strategy, limit);
		return ranked.doOnNext(memories -> memories
			.forEach(memory -> recallMetrics.recordMemoryScore(memory.score())))
			.flatMapMany(Flux::fromIterable);
	}

	/**
	 * 주 벡터 결과가 limit 에 못 미치면 backup 벡터 결과로 채웁니다. 주 벡터 결과가 항상 앞에 옵니다.
	 */
	private Mono<List<RankedMemory>> searchPrimaryWithBackup(List<Float> queryVector,
		UserId userId,
		VectorStrategy strategy,
		int limit) {
		NamedVector primary = strategy.primaryVector();
		NamedVector backup = strategy.backupVector();
		return searchVector(userId, primary, queryVector, limit)
			.map(this::rankSingle)
			.flatMap(primaryResults -> {
				if (primaryResults.size() >= limit || backup == null) {
					return Mono.just(truncate(primaryResults, limit));
				}
				return searchVector(userId, backup, queryVector, limit)
					.map(backupResults -> topUp(primaryResults, rankSingle(backupResults), limit))
					.onErrorResume(error -> {
						log.warn("Backup vector search failed, returning primary results only. vector={}, error={}",
							backup.wireName(),
							error.getMessage());
						return Mono.just(primaryResults);
					});
			});
	}

	/**
	 * 가중치가 있는 벡터를 동시에 limit*2 개씩 검색하고 Σ(weight × score) 로 합칩니다.
	 */
	private Mono<List<RankedMemory>> searchFused(List<Float> queryVector,
		UserId userId,
		VectorStrategy strategy,
		int limit) {
		int candidates = limit * CANDIDATE_MULTIPLIER;
		return Flux.fromIterable(strategy.weights().keySet())
			.flatMap(vector -> searchVector(userId, vector, queryVector, candidates))
			.collectList()
			.map(lists -> fuse(lists, strategy))
			.map(fused -> truncate(fused, limit));
	}

	private Mono<List<ScoredMemory>> searchVector(UserId userId,
		NamedVector vector,
		List<Float> queryVector,
		int limit) {
		return memoryVectorPort.search(userId, vector, queryVector, limit).collectList();
	}

	private List<RankedMemory> fuse(List<List<ScoredMemory>> lists, VectorStrategy strategy) {
		Map<String, MemoryRecord> records = new LinkedHashMap<>();
		Map<String, Map<NamedVector, Double>> contributions = new LinkedHashMap<>();
		for (List<ScoredMemory> list : lists) {
			for (ScoredMemory scored : list) {
				String id = scored.record().id();
				records.merge(id, scored.record(), (left, right) -> left);
				double weighted = strategy.weightOf(scored.vector()) * scored.score();
				contributions.computeIfAbsent(id, key -> new EnumMap<>(NamedVector.class))
					.merge(scored.vector(), weighted, Math::max);
			}
		}

		List<RankedMemory> fused = new ArrayList<>(records.size());
		records.forEach((id, record) -> {
			Map<NamedVector, Double> parts = contributions.get(id);
			double finalScore = parts.values().stream().mapToDouble(Double::doubleValue).sum();
			fused.add(new RankedMemory(record, finalScore, parts, null));
		});
		fused.sort(BY_SCORE_THEN_RECENCY);
		return fused;
	}

	private List<RankedMemory> rankSingle(List<ScoredMemory> scored) {
		return scored.stream()
			.map(RankedMemory::of)
			.sorted(BY_SCORE_THEN_RECENCY)
			.toList();
	}

	private List<RankedMemory> topUp(List<RankedMemory> primary,
		List<RankedMemory> backup,
		int limit) {
		Set<String> seen = new LinkedHashSet<>();
		List<RankedMemory> merged = new ArrayList<>(limit);
		for (RankedMemory memory : primary) {
			if (merged.size() < limit && seen.add(memory.id())) {
				merged.add(memory);
			}
		}
		for (RankedMemory memory : backup) {
			if (merged.size() < limit && seen.add(memory.id())) {
				merged.add(memory);
			}
		}
		return merged;
	}

	private List<RankedMemory> truncate(List<RankedMemory> memories, int limit) {
		return memories.size() > limit ? List.copyOf(memories.subList(0, limit)) : memories;
	}
}
