package com.study.webflux.recall.application.routing.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.study.webflux.recall.application.routing.controller.docs.RecallApi;
import com.study.webflux.recall.application.routing.dto.ClassifyRequest;
import com.study.webflux.recall.application.routing.dto.RetrieveRequest;
import com.study.webflux.recall.application.routing.dto.RetrieveResponse;
import com.study.webflux.recall.domain.error.RetrievalFailedException;
import com.study.webflux.recall.domain.query.model.Classification;
import com.study.webflux.recall.domain.retrieval.port.MemoryRecallUseCase;
import jakarta.validation.Valid;
import reactor.core.publisher.Mono;

@Slf4j
@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/recall")
public class RecallController implements RecallApi {

	private final MemoryRecallUseCase memoryRecallUseCase;

	@PostMapping("/classify")
	public Mono<Classification> classify(@Valid @RequestBody ClassifyRequest request) {
		return Mono.defer(() -> memoryRecallUseCase.classify(request.text(),
			request.emotionHint() == null ? null : request.emotionHint().toDomain(),
			request.turnAt()))
			.onErrorMap(IllegalArgumentException.class,
				error -> new ResponseStatusException(HttpStatus.BAD_REQUEST, error.getMessage()));
	}

	@PostMapping("/retrieve")
	public Mono<RetrieveResponse> retrieve(@Valid @RequestBody RetrieveRequest request) {
		return Mono.fromSupplier(request::toQuery)
			.flatMap(query -> memoryRecallUseCase.route(query, request.limit()))
			.map(RetrieveResponse::from)
			.onErrorResume(RetrievalFailedException.class, error -> {
				log.warn("모든 조회 구성요소가 실패하여 빈 컨텍스트를 반환합니다. user={}, components={}",
					request.userId(),
					error.components());
				return Mono.just(RetrieveResponse.degraded(error));
			})
			.onErrorMap(IllegalArgumentException.class,
				error -> new ResponseStatusException(HttpStatus.BAD_REQUEST, error.getMessage()));
	}
}
