package com.study.webflux.recall.application.knowledge.dto;

import com.study.webflux.recall.domain.knowledge.model.StoreFactCommand;
import com.study.webflux.recall.domain.user.model.UserId;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@Schema(description = "사실 저장 Request")
public record StoreFactRequest(
	@Schema(description = "사용자 ID", example = "550e8400-e29b-41d4-a716-446655440000")
	@NotBlank String userId,

	@Schema(description = "엔티티 이름", example = "pizza")
	@NotBlank @Size(max = 255) String entityName,

	@Schema(description = "엔티티 유형", example = "food")
	@NotBlank @Size(max = 64) String entityType,

	@Schema(description = "관계 유형 (비어 있으면 mentions)", example = "likes")
	@Size(max = 64) String relationshipType,

	@Schema(description = "신뢰도", example = "0.9")
	@NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double confidence,

	@Schema(description = "감정 맥락", example = "joy")
	String emotionalContext,

	@Schema(description = "엔티티 분류", example = "italian")
	String category
) {
	public StoreFactCommand toCommand() {
		return new StoreFactCommand(UserId.of(userId),
			entityName,
			entityType,
			relationshipType,
			confidence,
			emotionalContext,
			category);
	}
}
