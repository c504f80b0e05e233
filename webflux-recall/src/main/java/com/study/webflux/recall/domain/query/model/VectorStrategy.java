package com.study.webflux.recall.domain.query.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 벡터 검색 전략과 벡터별 가중치입니다.
 *
 * <p>
 * 가중치는 항상 합이 1.0(오차 1e-6)이어야 합니다. 단일 벡터 전략은 주 벡터에 1.0 을 가지며, 결과가 부족하면 backup 벡터로 채웁니다.
 */
public record VectorStrategy(
	StrategyKind kind,
	Map<NamedVector, Double> weights
) {
	private static final double WEIGHT_TOLERANCE = 1e-6;

	public VectorStrategy {
		if (kind == null) {
			throw new IllegalArgumentException("strategy kind cannot be null");
		}
		if (weights == null || weights.isEmpty()) {
			throw new IllegalArgumentException("strategy weights cannot be empty");
		}
		EnumMap<NamedVector, Double> copy = new EnumMap<>(NamedVector.class);
		double sum = 0.0;
		for (Map.Entry<NamedVector, Double> entry : weights.entrySet()) {
			Double weight = entry.getValue();
			if (weight == null || weight.isNaN() || weight < 0.0) {
				throw new IllegalArgumentException("invalid weight for " + entry.getKey());
			}
			if (weight > 0.0) {
				copy.put(entry.getKey(), weight);
				sum += weight;
			}
		}
		if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
			throw new IllegalArgumentException("strategy weights must sum to 1.0 but was " + sum);
		}
		if (kind.isPrimary() && (copy.size() != 1 || !copy.containsKey(kind.primary()))) {
			throw new IllegalArgumentException(kind + " must weight only " + kind.primary());
		}
		weights = Collections.unmodifiableMap(copy);
	}

	public static VectorStrategy contentOnly() {
		return primary(NamedVector.CONTENT);
	}

	public static VectorStrategy primary(NamedVector vector) {
		return new VectorStrategy(StrategyKind.primaryFor(vector), Map.of(vector, 1.0));
	}

	/**
	 * 정규화된 점수를 그대로 가중치로 사용합니다. 합이 1 이 아니면 다시 정규화합니다.
	 */
	public static VectorStrategy weighted(Map<NamedVector, Double> scores) {
		double total = scores.values().stream().mapToDouble(Double::doubleValue).sum();
		if (total <= 0.0) {
			return balanced();
		}
		EnumMap<NamedVector, Double> normalized = new EnumMap<>(NamedVector.class);
		scores.forEach((vector, score) -> normalized.put(vector, score / total));
		return new VectorStrategy(StrategyKind.WEIGHTED_COMBINATION, normalized);
	}

	public static VectorStrategy balanced() {
		double third = 1.0 / 3.0;
		return new VectorStrategy(StrategyKind.BALANCED_FUSION,
			Map.of(NamedVector.CONTENT, third, NamedVector.EMOTION, third, NamedVector.SEMANTIC, third));
	}

	public boolean isPrimary() {
		return kind.isPrimary();
	}

	public NamedVector primaryVector() {
		return kind.primary();
	}

	public NamedVector backupVector() {
		return kind.backup();
	}

	public double weightOf(NamedVector vector) {
		return weights.getOrDefault(vector, 0.0);
	}
}
