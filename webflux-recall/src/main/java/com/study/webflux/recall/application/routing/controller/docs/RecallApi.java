package com.study.webflux.recall.application.routing.controller.docs;

import com.study.webflux.recall.application.routing.dto.ClassifyRequest;
import com.study.webflux.recall.application.routing.dto.RetrieveRequest;
import com.study.webflux.recall.application.routing.dto.RetrieveResponse;
import com.study.webflux.recall.domain.query.model.Classification;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import reactor.core.publisher.Mono;

@Tag(
	name = "기억 조회 API",
	description = "질의 분류 및 다중 저장소 기억 조회 라우터"
)
public interface RecallApi {

	@Operation(
		summary = "질의 분류",
		description = "질의의 카테고리, 신뢰도, 보조 카테고리, 벡터 검색 전략을 반환합니다"
	)
	@ApiResponse(
		responseCode = "200",
		description = "분류 결과",
		content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
			schema = @Schema(implementation = Classification.class))
	)
	@ApiResponse(responseCode = "400", description = "잘못된 요청")
	Mono<Classification> classify(
		@Valid ClassifyRequest request
	);

	@Operation(
		summary = "기억 조회",
		description = "시간순 조회 또는 분류 기반 벡터/사실 조회를 수행합니다. 모든 구성요소가 실패해도 degraded=true 인 빈 결과를 반환합니다"
	)
	@ApiResponse(
		responseCode = "200",
		description = "조회 결과",
		content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
			schema = @Schema(implementation = RetrieveResponse.class))
	)
	@ApiResponse(responseCode = "400", description = "잘못된 요청")
	Mono<RetrieveResponse> retrieve(
		@Valid RetrieveRequest request
	);
}
