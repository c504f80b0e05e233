package com.study.webflux.recall.domain.knowledge.model;

import java.time.Instant;
import java.util.Locale;

/**
 * 지식 그래프의 엔티티입니다. (name, type) 쌍은 유일합니다.
 */
public record FactEntity(
	Long id,
	String name,
	String type,
	String category,
	Instant createdAt
) {
	public FactEntity {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("entity name cannot be null or blank");
		}
		if (type == null || type.isBlank()) {
			throw new IllegalArgumentException("entity type cannot be null or blank");
		}
	}

	public static String normalize(String value) {
		return value == null ? null : value.trim().toLowerCase(Locale.ROOT);
	}
}
