package com.study.webflux.recall.application.routing.dto;

import com.study.webflux.recall.domain.query.model.EmotionHint;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@Schema(description = "미리 계산된 감정 힌트")
public record EmotionHintRequest(
	@Schema(description = "감정 라벨", example = "joy")
	@NotBlank String label,

	@Schema(description = "신뢰도", example = "0.82")
	@NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double confidence
) {
	public EmotionHint toDomain() {
		return EmotionHint.of(label, confidence);
	}
}
