package com.study.webflux.recall.fixture;

import java.time.Instant;

import com.study.webflux.recall.domain.memory.model.MemoryRecord;
import com.study.webflux.recall.domain.memory.model.ScoredMemory;
import com.study.webflux.recall.domain.query.model.NamedVector;

public final class MemoryRecordFixture {

	public static final Instant BASE_TIME = Instant.parse("2026-03-15T08:00:00Z");

	private MemoryRecordFixture() {
	}

	public static MemoryRecord create(String id) {
		return create(id, BASE_TIME);
	}

	public static MemoryRecord create(String id, Instant timestamp) {
		return new MemoryRecord(id,
			UserIdFixture.create(),
			"memory " + id,
			"neutral",
			0.1,
			timestamp);
	}

	public static MemoryRecord createMinutesAfterBase(String id, long minutes) {
		return create(id, BASE_TIME.plusSeconds(minutes * 60));
	}

	public static ScoredMemory scored(String id, NamedVector vector, double score) {
		return new ScoredMemory(create(id), vector, score);
	}

	public static ScoredMemory scored(MemoryRecord record, NamedVector vector, double score) {
		return new ScoredMemory(record, vector, score);
	}
}
