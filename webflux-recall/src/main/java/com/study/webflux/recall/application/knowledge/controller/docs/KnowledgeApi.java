package com.study.webflux.recall.application.knowledge.controller.docs;

import com.study.webflux.recall.application.knowledge.dto.FactResponse;
import com.study.webflux.recall.application.knowledge.dto.RelatedEntityResponse;
import com.study.webflux.recall.application.knowledge.dto.StoreFactRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Tag(
	name = "지식 그래프 API",
	description = "사용자 사실 저장/조회 및 관련 엔티티 탐색"
)
public interface KnowledgeApi {

	@Operation(
		summary = "사실 저장",
		description = "엔티티를 upsert 하고 모순 검사와 유사 관계 통합 후 사실을 저장합니다"
	)
	@ApiResponse(responseCode = "204", description = "저장 완료")
	@ApiResponse(responseCode = "400", description = "잘못된 요청")
	Mono<Void> storeFact(
		@Valid StoreFactRequest request
	);

	@Operation(
		summary = "사용자 사실 조회",
		description = "신뢰도 내림차순, 최근 언급 내림차순으로 사용자 사실을 반환합니다"
	)
	@ApiResponse(responseCode = "200", description = "사실 목록")
	Flux<FactResponse> getUserFacts(
		@Parameter(description = "사용자 ID") String userId,
		@Parameter(description = "엔티티 유형") String entityType,
		@Parameter(description = "관계 유형") String relationshipType,
		@Parameter(description = "최소 신뢰도") double minConfidence,
		@Parameter(description = "최대 개수") int limit
	);

	@Operation(
		summary = "관련 엔티티 조회",
		description = "similar_to 관계를 따라 최대 3단계까지 탐색하며 점수는 1/hops 입니다"
	)
	@ApiResponse(responseCode = "200", description = "관련 엔티티 목록")
	Flux<RelatedEntityResponse> getRelatedEntities(
		@Parameter(description = "엔티티 이름") String name,
		@Parameter(description = "최대 탐색 깊이") int maxHops
	);
}
