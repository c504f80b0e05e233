package com.study.webflux.recall.application.routing.dto;

import java.time.Instant;
import java.util.Map;

import com.study.webflux.recall.domain.memory.model.RankedMemory;
import com.study.webflux.recall.domain.query.model.NamedVector;

public record MemoryResponse(
	String id,
	String content,
	String emotionLabel,
	Double emotionIntensity,
	Instant timestamp,
	double score,
	Map<NamedVector, Double> contributions,
	Integer chronologicalRank
) {
	public static MemoryResponse from(RankedMemory memory) {
		return new MemoryResponse(memory.id(),
			memory.record().content(),
			memory.record().emotionLabel(),
			memory.record().emotionIntensity(),
			memory.record().timestamp(),
			memory.score(),
			memory.contributions(),
			memory.chronologicalRank());
	}
}
