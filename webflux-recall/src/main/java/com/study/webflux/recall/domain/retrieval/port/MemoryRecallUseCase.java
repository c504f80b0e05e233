package com.study.webflux.recall.domain.retrieval.port;

import java.time.Instant;

import com.study.webflux.recall.domain.query.model.Classification;
import com.study.webflux.recall.domain.query.model.EmotionHint;
import com.study.webflux.recall.domain.query.model.RecallQuery;
import com.study.webflux.recall.domain.retrieval.model.RecallResult;
import reactor.core.publisher.Mono;

public interface MemoryRecallUseCase {

	/**
	 * 질의를 라우팅하여 기억과 사실을 조회합니다.
	 *
	 * @param limit
	 *            최대 결과 수, null 이면 설정된 기본값
	 */
	Mono<RecallResult> route(RecallQuery query, Integer limit);

	Mono<Classification> classify(String text, EmotionHint emotionHint, Instant turnAt);
}
