package com.study.webflux.recall.domain.memory.model;

import java.time.Instant;

import com.study.webflux.recall.domain.user.model.UserId;

/**
 * 대화 턴마다 외부 작성기가 저장한 기억입니다. 라우터 입장에서는 읽기 전용이며 임베딩은 벡터 저장소에만 존재합니다.
 */
public record MemoryRecord(
	String id,
	UserId userId,
	String content,
	String emotionLabel,
	Double emotionIntensity,
	Instant timestamp
) {
	public MemoryRecord {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("memory id cannot be null or blank");
		}
		if (timestamp == null) {
			throw new IllegalArgumentException("memory timestamp cannot be null");
		}
		content = content == null ? "" : content;
	}
}
