package com.study.webflux.recall.application.routing.dto;

import java.util.List;
import java.util.Map;

import com.study.webflux.recall.application.knowledge.dto.FactResponse;
import com.study.webflux.recall.domain.error.RetrievalFailedException;
import com.study.webflux.recall.domain.query.model.Classification;
import com.study.webflux.recall.domain.query.model.EmotionHint;
import com.study.webflux.recall.domain.query.model.QueryCategory;
import com.study.webflux.recall.domain.query.model.TemporalWindow;
import com.study.webflux.recall.domain.retrieval.model.ComponentStatus;
import com.study.webflux.recall.domain.retrieval.model.RecallResult;
import com.study.webflux.recall.domain.retrieval.model.RetrievalComponent;
import com.study.webflux.recall.domain.retrieval.model.RouteKind;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "기억 조회 Response")
public record RetrieveResponse(
	Classification classification,
	List<MemoryResponse> memories,
	List<FactResponse> facts,
	RouteKind route,
	TemporalWindow temporalWindow,
	Map<RetrievalComponent, ComponentStatus> components,
	boolean degraded,
	EmotionHint emotionHint
) {
	public static RetrieveResponse from(RecallResult result) {
		return new RetrieveResponse(result.classification(),
			result.memories().stream().map(MemoryResponse::from).toList(),
			result.facts().stream().map(FactResponse::from).toList(),
			result.route(),
			result.temporalWindow(),
			result.components(),
			result.degraded(),
			result.emotionHint());
	}

	/**
	 * 모든 구성요소가 실패한 경우 호출자를 멈추지 않도록 빈 컨텍스트를 반환합니다.
	 */
	public static RetrieveResponse degraded(RetrievalFailedException failure) {
		Classification classification = failure.classification();
		return new RetrieveResponse(classification,
			List.of(),
			List.of(),
			classification != null && classification.category() == QueryCategory.TEMPORAL
				? RouteKind.TEMPORAL
				: RouteKind.FUSION,
			null,
			failure.components(),
			true,
			null);
	}
}
