package com.study.webflux.recall.domain.retrieval.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.study.webflux.recall.domain.knowledge.model.UserFact;
import com.study.webflux.recall.domain.memory.model.RankedMemory;
import com.study.webflux.recall.domain.query.model.Classification;
import com.study.webflux.recall.domain.query.model.EmotionHint;
import com.study.webflux.recall.domain.query.model.TemporalWindow;

/**
 * 라우팅 결과입니다. 기억과 사실은 서로 다른 질문 형태에 답하므로 섞지 않고 각자의 순위대로 반환합니다.
 * emotionHint 는 분류에 실제로 사용한 힌트이며 외부 분석기에서 얻은 값일 수 있습니다.
 */
public record RecallResult(
	Classification classification,
	List<RankedMemory> memories,
	List<UserFact> facts,
	RouteKind route,
	TemporalWindow temporalWindow,
	Map<RetrievalComponent, ComponentStatus> components,
	EmotionHint emotionHint
) {
	public RecallResult {
		memories = memories == null ? List.of() : List.copyOf(memories);
		facts = facts == null ? List.of() : List.copyOf(facts);
		components = components == null || components.isEmpty()
			? Map.of()
			: Collections.unmodifiableMap(new EnumMap<>(components));
	}

	public boolean degraded() {
		return components.values().stream().anyMatch(ComponentStatus::failed);
	}
}
