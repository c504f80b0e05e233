package com.study.webflux.recall.application.routing.dto;

import java.time.Instant;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@Schema(description = "질의 분류 Request")
public record ClassifyRequest(
	@Schema(description = "질의", example = "What foods do I like?")
	@NotNull @Size(max = 2000) String text,

	@Schema(description = "감정 힌트")
	@Valid EmotionHintRequest emotionHint,

	@Schema(description = "대화 턴 시각", example = "2024-12-21T12:00:00Z")
	Instant turnAt
) {
}
