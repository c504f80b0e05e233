package com.study.webflux.recall.application.routing.dto;

import java.time.Instant;

import com.study.webflux.recall.domain.query.model.RecallQuery;
import com.study.webflux.recall.domain.user.model.UserId;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@Schema(description = "기억 조회 Request")
public record RetrieveRequest(
	@Schema(description = "사용자 ID", example = "550e8400-e29b-41d4-a716-446655440000")
	@NotBlank String userId,

	@Schema(description = "질의", example = "What was the first thing we talked about?")
	@NotNull @Size(max = 2000) String text,

	@Schema(description = "감정 힌트")
	@Valid EmotionHintRequest emotionHint,

	@Schema(description = "최대 결과 수, 생략하면 recall.retrieval.default-limit", example = "10")
	@Min(1) Integer limit,

	@Schema(description = "대화 턴 시각", example = "2024-12-21T12:00:00Z")
	Instant turnAt
) {
	public RecallQuery toQuery() {
		return RecallQuery.of(UserId.of(userId),
			text,
			emotionHint == null ? null : emotionHint.toDomain(),
			turnAt);
	}
}
