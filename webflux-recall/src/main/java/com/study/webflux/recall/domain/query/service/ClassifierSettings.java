package com.study.webflux.recall.domain.query.service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.study.webflux.recall.domain.query.model.NamedVector;
import com.study.webflux.recall.domain.query.model.QueryCategory;

/**
 * 분류기가 사용하는 패턴 테이블과 임계값입니다. 생성 후 변경되지 않습니다.
 *
 * @param categoryPatterns
 *            카테고리별 키워드/구 패턴
 * @param entityTypePatterns
 *            엔티티 유형 힌트 추출용 키워드 (선언 순서대로 먼저 매칭된 유형 사용)
 * @param relationshipPatterns
 *            관계 유형 힌트 추출용 키워드 (선언 순서대로 먼저 매칭된 유형 사용)
 * @param vectorPatterns
 *            벡터 친화도 키워드
 * @param vectorWeights
 *            벡터 키워드 한 건당 가중치
 * @param thresholds
 *            점수 및 임계값
 */
public record ClassifierSettings(
	Map<QueryCategory, List<String>> categoryPatterns,
	Map<String, List<String>> entityTypePatterns,
	Map<String, List<String>> relationshipPatterns,
	Map<NamedVector, List<String>> vectorPatterns,
	Map<NamedVector, Double> vectorWeights,
	Thresholds thresholds
) {
	public ClassifierSettings {
		if (categoryPatterns == null || vectorPatterns == null || vectorWeights == null
			|| thresholds == null) {
			throw new IllegalArgumentException("classifier settings are incomplete");
		}
		if (vectorWeights.isEmpty()) {
			throw new IllegalArgumentException("vectorWeights cannot be empty");
		}
		categoryPatterns = Collections.unmodifiableMap(copyEnumKeyed(categoryPatterns,
			QueryCategory.class));
		vectorPatterns = Collections.unmodifiableMap(copyEnumKeyed(vectorPatterns,
			NamedVector.class));
		vectorWeights = Collections.unmodifiableMap(new EnumMap<>(vectorWeights));
		entityTypePatterns = copyOrdered(entityTypePatterns);
		relationshipPatterns = copyOrdered(relationshipPatterns);
	}

	/**
	 * @param exactMatchScore
	 *            토큰 경계에 맞는 정확한 매칭 점수
	 * @param partialMatchScore
	 *            부분 문자열 매칭 점수
	 * @param entityMatchScore
	 *            엔티티 유형 매칭 시 FACTUAL 에 더하는 점수
	 * @param minCategoryScore
	 *            이 점수 미만이면 GENERAL
	 * @param secondaryRatio
	 *            주 카테고리 대비 보조 카테고리 포함 비율
	 * @param primaryVectorThreshold
	 *            단일 벡터 전략 선택 임계값
	 * @param weightedVectorThreshold
	 *            가중 결합 전략 선택 임계값
	 * @param emotionHintMinConfidence
	 *            감정 힌트가 키워드 점수를 대체하는 최소 신뢰도
	 * @param emotionHintWeight
	 *            감정 힌트 신뢰도에 곱하는 가중치
	 */
	public record Thresholds(
		double exactMatchScore,
		double partialMatchScore,
		double entityMatchScore,
		double minCategoryScore,
		double secondaryRatio,
		double primaryVectorThreshold,
		double weightedVectorThreshold,
		double emotionHintMinConfidence,
		double emotionHintWeight
	) {
		public Thresholds {
			if (secondaryRatio <= 0.0 || secondaryRatio > 1.0) {
				throw new IllegalArgumentException("secondaryRatio must be in (0, 1]");
			}
			if (weightedVectorThreshold > primaryVectorThreshold) {
				throw new IllegalArgumentException(
					"weightedVectorThreshold must not exceed primaryVectorThreshold");
			}
		}

		public static Thresholds defaults() {
			return new Thresholds(2.0, 1.0, 1.5, 1.5, 0.7, 0.45, 0.35, 0.6, 3.0);
		}
	}

	public static ClassifierSettings defaults() {
		return new ClassifierSettings(defaultCategoryPatterns(),
			defaultEntityTypePatterns(),
			defaultRelationshipPatterns(),
			defaultVectorPatterns(),
			Map.of(NamedVector.CONTENT, 1.0, NamedVector.EMOTION, 1.5, NamedVector.SEMANTIC, 1.2),
			Thresholds.defaults());
	}

	public ClassifierSettings withThresholds(Thresholds newThresholds) {
		return new ClassifierSettings(categoryPatterns,
			entityTypePatterns,
			relationshipPatterns,
			vectorPatterns,
			vectorWeights,
			newThresholds);
	}

	private static Map<QueryCategory, List<String>> defaultCategoryPatterns() {
		Map<QueryCategory, List<String>> patterns = new EnumMap<>(QueryCategory.class);
		patterns.put(QueryCategory.FACTUAL, List.of(
			"what is", "what are", "what was", "what were",
			"define", "definition of", "explain", "how to", "how does",
			"meaning of", "tell me about", "information about", "description of",
			"do i", "my favorite", "favorite", "like", "love", "enjoy", "prefer",
			"dislike", "hate", "know about"));
		patterns.put(QueryCategory.EMOTIONAL, List.of(
			"feel", "feeling", "felt", "emotion", "emotional", "mood",
			"happy", "sad", "angry", "excited", "anxious", "worried", "scared", "upset",
			"how are you", "how're you", "how do you feel", "are you okay",
			"love", "hate", "fear", "passion", "joy", "sorrow", "lonely", "stressed"));
		patterns.put(QueryCategory.CONVERSATIONAL, List.of(
			"we talked", "we discussed", "we were talking", "our conversation", "our chat",
			"our discussion", "remember when", "recall when", "remember our",
			"you mentioned", "you said", "you told me", "earlier you",
			"what did we", "what have we", "what were we", "when we spoke",
			"you and i", "we were discussing", "what did you tell",
			"remind me about our", "remind me what we"));
		return patterns;
	}

	private static Map<String, List<String>> defaultEntityTypePatterns() {
		Map<String, List<String>> patterns = new LinkedHashMap<>();
		patterns.put("food", List.of("food", "eat", "meal", "dish", "cuisine", "restaurant",
			"recipe", "snack", "drink"));
		patterns.put("hobby", List.of("hobby", "hobbies", "interest", "pastime", "activity",
			"activities", "play", "practice", "sport"));
		patterns.put("place", List.of("place", "location", "city", "cities", "country",
			"countries", "visit", "travel", "where"));
		patterns.put("person", List.of("person", "friend", "family", "people", "someone", "who"));
		patterns.put("book", List.of("book", "read", "author", "novel"));
		patterns.put("music", List.of("music", "song", "artist", "album", "listen", "band"));
		patterns.put("movie", List.of("movie", "film", "watch", "cinema", "actor", "show"));
		patterns.put("art", List.of("art", "painting", "draw", "sculpture"));
		patterns.put("equipment", List.of("equipment", "gear", "tool", "device"));
		patterns.put("work", List.of("work", "job", "career", "office", "colleague"));
		patterns.put("study", List.of("study", "studies", "school", "class", "course",
			"university"));
		patterns.put("technology", List.of("tech", "technology", "coding", "programming",
			"software", "computer"));
		return patterns;
	}

	private static Map<String, List<String>> defaultRelationshipPatterns() {
		Map<String, List<String>> patterns = new LinkedHashMap<>();
		patterns.put("dislikes", List.of("dislike", "hate", "avoid", "don't like", "do not like"));
		patterns.put("likes", List.of("like", "love", "enjoy", "prefer", "favorite", "favourite"));
		patterns.put("knows", List.of("know", "familiar", "heard of", "aware of"));
		patterns.put("visited", List.of("visited", "been to", "went to"));
		patterns.put("wants", List.of("want", "need", "desire", "wish for"));
		patterns.put("owns", List.of("own", "owned", "belongs to"));
		patterns.put("fears", List.of("fear", "afraid of", "scared of"));
		return patterns;
	}

	private static Map<NamedVector, List<String>> defaultVectorPatterns() {
		Map<NamedVector, List<String>> patterns = new EnumMap<>(NamedVector.class);
		patterns.put(NamedVector.CONTENT, List.of(
			"fact", "information", "data", "detail", "specific", "exactly", "precisely",
			"technical", "specification", "configuration", "setting", "code", "algorithm",
			"how", "what", "when", "where", "why", "step", "process", "method", "procedure",
			"describe", "explain", "elaborate", "clarify", "specify", "define"));
		patterns.put(NamedVector.EMOTION, List.of(
			"happy", "joy", "excited", "love", "wonderful", "amazing", "great", "awesome",
			"sad", "angry", "frustrated", "upset", "worried", "anxious", "disappointed", "hurt",
			"calm", "peaceful", "relaxed", "content", "satisfied",
			"feel", "feeling", "emotion", "mood", "sentiment", "emotional", "emotionally",
			"how are you", "friendship", "bond", "trust", "intimacy", "closeness"));
		patterns.put(NamedVector.SEMANTIC, List.of(
			"concept", "idea", "theory", "principle", "philosophy", "belief", "meaning",
			"significance", "connection", "relationship", "correlation", "association", "link",
			"pattern", "similar", "relate", "related", "abstract", "metaphor", "symbol",
			"essence", "nature", "learn", "understand", "insight", "realization",
			"personality", "character", "trait", "behavior", "style", "tendency"));
		return patterns;
	}

	private static <K extends Enum<K>> Map<K, List<String>> copyEnumKeyed(Map<K, List<String>> source,
		Class<K> type) {
		Map<K, List<String>> copy = new EnumMap<>(type);
		source.forEach((key, values) -> copy.put(key, List.copyOf(values)));
		return copy;
	}

	private static Map<String, List<String>> copyOrdered(Map<String, List<String>> source) {
		if (source == null) {
			return Map.of();
		}
		Map<String, List<String>> copy = new LinkedHashMap<>();
		source.forEach((key, values) -> copy.put(key, List.copyOf(values)));
		return Collections.unmodifiableMap(copy);
	}
}
