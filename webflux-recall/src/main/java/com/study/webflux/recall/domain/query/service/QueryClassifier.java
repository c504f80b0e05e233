package com.study.webflux.recall.domain.query.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.study.webflux.recall.domain.query.model.Classification;
import com.study.webflux.recall.domain.query.model.EmotionHint;
import com.study.webflux.recall.domain.query.model.NamedVector;
import com.study.webflux.recall.domain.query.model.QueryCategory;
import com.study.webflux.recall.domain.query.model.RecallQuery;
import com.study.webflux.recall.domain.query.model.TemporalDetection;
import com.study.webflux.recall.domain.query.model.VectorStrategy;

/**
 * 질의를 카테고리 패턴과 벡터 친화도 키워드로 점수화하여 분류합니다.
 *
 * <p>
 * 외부 상태 없이 동일한 (질의, 감정 힌트) 입력에 대해 항상 동일한 결과를 반환합니다. 시간 표현이 감지되면 다른 점수와 무관하게 TEMPORAL 로
 * 분류합니다.
 */
public class QueryClassifier {

	private static final List<QueryCategory> SCORED_CATEGORIES = List.of(QueryCategory.FACTUAL,
		QueryCategory.EMOTIONAL,
		QueryCategory.CONVERSATIONAL);

	private final ClassifierSettings settings;
	private final ClassifierSettings.Thresholds thresholds;
	private final TemporalQueryDetector temporalQueryDetector;

	public QueryClassifier(ClassifierSettings settings, TemporalQueryDetector temporalQueryDetector) {
		this.settings = settings;
		this.thresholds = settings.thresholds();
		this.temporalQueryDetector = temporalQueryDetector;
	}

	public Classification classify(RecallQuery query) {
		return classify(query.text(), query.emotionHint(), query.turnAt());
	}

	public Classification classify(String text, EmotionHint emotionHint, Instant turnAt) {
		TemporalDetection detection = temporalQueryDetector.detect(text, turnAt);
		if (detection.temporal()) {
			return Classification.temporal(detection.matchedPatterns());
		}
		return scoreCategories(text, emotionHint);
	}

	/**
	 * 시간 판별을 건너뛰고 카테고리/벡터 점수만으로 분류합니다. 시간 판별을 이미 수행한 호출자가 사용합니다.
	 */
	public Classification scoreCategories(String text, EmotionHint emotionHint) {
		QueryText query = QueryText.of(text);
		if (query.isBlank()) {
			return general(Map.of(), null, null, List.of(), VectorStrategy.balanced());
		}

		List<String> indicators = new ArrayList<>();
		Map<QueryCategory, Double> scores = new EnumMap<>(QueryCategory.class);
		for (QueryCategory category : SCORED_CATEGORIES) {
			double score = scorePatterns(query,
				settings.categoryPatterns().getOrDefault(category, List.of()),
				indicators);
			scores.put(category, score);
		}

		String entityType = firstMatch(query, settings.entityTypePatterns());
		if (entityType != null) {
			scores.merge(QueryCategory.FACTUAL, thresholds.entityMatchScore(), Double::sum);
			indicators.add("entity:" + entityType);
		}
		String relationshipType = firstMatch(query, settings.relationshipPatterns());

		if (isAuthoritative(emotionHint) && !emotionHint.isNeutral()) {
			scores.merge(QueryCategory.EMOTIONAL,
				emotionHint.confidence() * thresholds.emotionHintWeight(),
				Double::sum);
			indicators.add("emotion:" + emotionHint.label());
		}

		VectorStrategy strategy = chooseStrategy(query, emotionHint);
		return decide(scores, entityType, relationshipType, indicators, strategy);
	}

	private Classification decide(Map<QueryCategory, Double> scores,
		String entityType,
		String relationshipType,
		List<String> indicators,
		VectorStrategy strategy) {
		QueryCategory primary = null;
		double primaryScore = 0.0;
		double total = 0.0;
		for (QueryCategory category : SCORED_CATEGORIES) {
			double score = scores.getOrDefault(category, 0.0);
			total += score;
			if (score > primaryScore) {
				primary = category;
				primaryScore = score;
			}
		}

		if (primary == null || primaryScore < thresholds.minCategoryScore()) {
			return general(scores, entityType, relationshipType, indicators, strategy);
		}

		List<QueryCategory> secondary = new ArrayList<>();
		for (QueryCategory category : SCORED_CATEGORIES) {
			double score = scores.getOrDefault(category, 0.0);
			if (category != primary && score > 0.0
				&& score >= primaryScore * thresholds.secondaryRatio()) {
				secondary.add(category);
			}
		}

		double confidence = Math.min(1.0, primaryScore / total);
		return new Classification(primary,
			confidence,
			secondary,
			strategy,
			scores,
			entityType,
			relationshipType,
			indicators);
	}

	private VectorStrategy chooseStrategy(QueryText query, EmotionHint emotionHint) {
		Map<NamedVector, Double> raw = new EnumMap<>(NamedVector.class);
		for (NamedVector vector : NamedVector.values()) {
			long matches = settings.vectorPatterns().getOrDefault(vector, List.of()).stream()
				.filter(query::hasPhrase)
				.count();
			raw.put(vector, matches * settings.vectorWeights().getOrDefault(vector, 1.0));
		}

		// 신뢰도 높은 감정 힌트는 키워드 기반 감정 점수를 대체
		if (isAuthoritative(emotionHint)) {
			raw.put(NamedVector.EMOTION, emotionHint.isNeutral()
				? 0.0
				: emotionHint.confidence() * thresholds.emotionHintWeight());
		}

		double total = raw.values().stream().mapToDouble(Double::doubleValue).sum();
		if (total <= 0.0) {
			return VectorStrategy.balanced();
		}

		NamedVector top = NamedVector.CONTENT;
		double max = -1.0;
		Map<NamedVector, Double> normalized = new EnumMap<>(NamedVector.class);
		for (NamedVector vector : NamedVector.values()) {
			double share = raw.get(vector) / total;
			normalized.put(vector, share);
			if (share > max) {
				max = share;
				top = vector;
			}
		}

		if (max > thresholds.primaryVectorThreshold()) {
			return VectorStrategy.primary(top);
		}
		if (max > thresholds.weightedVectorThreshold()) {
			return VectorStrategy.weighted(normalized);
		}
		return VectorStrategy.balanced();
	}

	private double scorePatterns(QueryText query, List<String> patterns, List<String> indicators) {
		double score = 0.0;
		for (String pattern : patterns) {
			if (query.hasPhrase(pattern)) {
				score += thresholds.exactMatchScore();
				indicators.add(pattern);
			} else if (query.hasSubstring(pattern)) {
				score += thresholds.partialMatchScore();
			}
		}
		return score;
	}

	private String firstMatch(QueryText query, Map<String, List<String>> patterns) {
		for (Map.Entry<String, List<String>> entry : patterns.entrySet()) {
			for (String keyword : entry.getValue()) {
				if (query.hasInflected(keyword)) {
					return entry.getKey();
				}
			}
		}
		return null;
	}

	private boolean isAuthoritative(EmotionHint emotionHint) {
		return emotionHint != null
			&& emotionHint.confidence() > thresholds.emotionHintMinConfidence();
	}

	private Classification general(Map<QueryCategory, Double> scores,
		String entityType,
		String relationshipType,
		List<String> indicators,
		VectorStrategy strategy) {
		return new Classification(QueryCategory.GENERAL,
			Classification.GENERAL_CONFIDENCE,
			List.of(),
			strategy,
			scores,
			entityType,
			relationshipType,
			indicators);
	}
}
