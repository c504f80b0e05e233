package com.study.webflux.recall.infrastructure.emotion.adapter;

import lombok.extern.slf4j.Slf4j;

import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import com.study.webflux.recall.domain.error.Backend;
import com.study.webflux.recall.domain.error.BackendUnavailableException;
import com.study.webflux.recall.domain.memory.port.EmotionPort;
import com.study.webflux.recall.domain.query.model.EmotionHint;
import com.study.webflux.recall.infrastructure.emotion.config.EmotionClientConfig;
import com.study.webflux.recall.infrastructure.emotion.dto.EmotionAnalysisRequest;
import com.study.webflux.recall.infrastructure.emotion.dto.EmotionAnalysisResponse;
import reactor.core.publisher.Mono;

/**
 * 외부 감정 분류 서비스의 POST /analyze 를 호출합니다.
 * 비활성화되어 있거나 응답 형식이 맞지 않으면 빈 Mono 를 반환합니다.
 */
@Slf4j
@Component
public class HttpEmotionAdapter implements EmotionPort {

	private final EmotionClientConfig config;
	private final WebClient webClient;

	public HttpEmotionAdapter(EmotionClientConfig config, WebClient.Builder webClientBuilder) {
		this.config = config;
		this.webClient = webClientBuilder.clone()
			.baseUrl(config.enabled() ? config.url() : "http://localhost")
			.build();
	}

	@Override
	public Mono<EmotionHint> analyze(String text) {
		if (!config.enabled() || text == null || text.isBlank()) {
			return Mono.empty();
		}
		return webClient.post()
			.uri("/analyze")
			.contentType(MediaType.APPLICATION_JSON)
			.bodyValue(new EmotionAnalysisRequest(text))
			.retrieve()
			.bodyToMono(EmotionAnalysisResponse.class)
			.mapNotNull(this::toHint)
			.onErrorMap(WebClientException.class,
				error -> new BackendUnavailableException(Backend.EMOTION, error.getMessage(), error));
	}

	private EmotionHint toHint(EmotionAnalysisResponse response) {
		if (response.label() == null || response.label().isBlank() || response.confidence() == null) {
			log.warn("감정 분석 응답 형식이 올바르지 않습니다: {}", response);
			return null;
		}
		double confidence = Math.max(0.0, Math.min(1.0, response.confidence()));
		return EmotionHint.of(response.label(), confidence);
	}
}
