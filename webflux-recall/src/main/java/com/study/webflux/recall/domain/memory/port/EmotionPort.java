package com.study.webflux.recall.domain.memory.port;

import com.study.webflux.recall.domain.query.model.EmotionHint;
import reactor.core.publisher.Mono;

/**
 * 외부 감정 분류 모델입니다. 판단할 수 없으면 빈 Mono 를 반환합니다.
 */
public interface EmotionPort {

	Mono<EmotionHint> analyze(String text);
}
