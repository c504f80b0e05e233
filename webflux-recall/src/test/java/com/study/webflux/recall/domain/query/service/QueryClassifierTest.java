package com.study.webflux.recall.domain.query.service;

import com.study.webflux.recall.domain.query.model.Classification;
import com.study.webflux.recall.domain.query.model.EmotionHint;
import com.study.webflux.recall.domain.query.model.NamedVector;
import com.study.webflux.recall.domain.query.model.QueryCategory;
import com.study.webflux.recall.domain.query.model.StrategyKind;
import com.study.webflux.recall.fixture.RecallQueryFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class QueryClassifierTest {

	private QueryClassifier classifier;

	@BeforeEach
	void setUp() {
		classifier = new QueryClassifier(ClassifierSettings.defaults(),
			new TemporalQueryDetector(TemporalSettings.defaults()));
	}

	@Test
	@DisplayName("음식 선호 질문은 FACTUAL 로 분류하고 food/likes 힌트와 CONTENT_ONLY 전략을 사용한다")
	void classify_foodPreference_shouldBeFactualWithHints() {
		Classification result = classifier.classify(RecallQueryFixture.create("What foods do I like?"));

		assertThat(result.category()).isEqualTo(QueryCategory.FACTUAL);
		assertThat(result.entityType()).isEqualTo("food");
		assertThat(result.relationshipType()).isEqualTo("likes");
		assertThat(result.vectorStrategy().kind()).isEqualTo(StrategyKind.CONTENT_ONLY);
		assertThat(result.confidence()).isCloseTo(1.0, within(1e-9));
		assertThat(result.categoryScores().get(QueryCategory.FACTUAL)).isCloseTo(5.5, within(1e-9));
		assertThat(result.matchedIndicators()).contains("do i", "like", "entity:food");
	}

	@Test
	@DisplayName("안부를 묻는 질문은 EMOTIONAL 로 분류하고 EMOTION_PRIMARY 전략을 사용한다")
	void classify_howAreYouFeeling_shouldBeEmotionPrimary() {
		Classification result = classifier
			.classify(RecallQueryFixture.create("How are you feeling right now?"));

		assertThat(result.category()).isEqualTo(QueryCategory.EMOTIONAL);
		assertThat(result.vectorStrategy().kind()).isEqualTo(StrategyKind.EMOTION_PRIMARY);
		assertThat(result.vectorStrategy().weightOf(NamedVector.EMOTION)).isEqualTo(1.0);
		assertThat(result.secondaryCategories()).isEmpty();
	}

	@Test
	@DisplayName("첫 대화를 묻는 질문은 다른 점수와 무관하게 TEMPORAL 로 분류한다")
	void classify_firstThingWeTalkedAbout_shouldBeTemporal() {
		Classification result = classifier
			.classify(RecallQueryFixture.create("What was the first thing we talked about?"));

		assertThat(result.category()).isEqualTo(QueryCategory.TEMPORAL);
		assertThat(result.confidence()).isEqualTo(Classification.TEMPORAL_CONFIDENCE);
		assertThat(result.vectorStrategy().kind()).isEqualTo(StrategyKind.CONTENT_ONLY);
		assertThat(result.matchedIndicators()).contains("first");
	}

	@Test
	@DisplayName("빈 질의는 GENERAL 과 균등 가중치 전략을 반환한다")
	void classify_blankText_shouldReturnGeneralBalanced() {
		Classification result = classifier.classify(RecallQueryFixture.create("   "));

		assertThat(result.category()).isEqualTo(QueryCategory.GENERAL);
		assertThat(result.confidence()).isEqualTo(Classification.GENERAL_CONFIDENCE);
		assertThat(result.vectorStrategy().kind()).isEqualTo(StrategyKind.BALANCED_FUSION);
		assertThat(result.vectorStrategy().weights().values())
			.allSatisfy(weight -> assertThat(weight).isCloseTo(1.0 / 3.0, within(1e-9)));
	}

	@Test
	@DisplayName("매칭 점수가 최소 점수 미만이면 GENERAL 로 분류한다")
	void classify_weakSignal_shouldFallBackToGeneral() {
		Classification result = classifier.classify(RecallQueryFixture.create("banana smoothie"));

		assertThat(result.category()).isEqualTo(QueryCategory.GENERAL);
		assertThat(result.vectorStrategy().kind()).isEqualTo(StrategyKind.BALANCED_FUSION);
	}

	@Test
	@DisplayName("주 카테고리 점수의 70% 이상인 카테고리는 보조 카테고리에 포함된다")
	void classify_mixedSignals_shouldIncludeSecondaryCategory() {
		Classification result = classifier
			.classify(RecallQueryFixture.create("Do I feel sad about food?"));

		assertThat(result.category()).isEqualTo(QueryCategory.EMOTIONAL);
		assertThat(result.secondaryCategories()).containsExactly(QueryCategory.FACTUAL);
		assertThat(result.includes(QueryCategory.FACTUAL)).isTrue();
		assertThat(result.entityType()).isEqualTo("food");
		assertThat(result.relationshipType()).isNull();
	}

	@Test
	@DisplayName("신뢰도 높은 감정 힌트는 EMOTIONAL 점수를 더하고 감정 벡터 점수를 대체한다")
	void classify_withAuthoritativeEmotionHint_shouldBoostEmotion() {
		Classification result = classifier.scoreCategories("tell me something",
			EmotionHint.of("sad", 0.9));

		assertThat(result.category()).isEqualTo(QueryCategory.EMOTIONAL);
		assertThat(result.categoryScores().get(QueryCategory.EMOTIONAL)).isCloseTo(2.7, within(1e-9));
		assertThat(result.vectorStrategy().kind()).isEqualTo(StrategyKind.EMOTION_PRIMARY);
		assertThat(result.matchedIndicators()).contains("emotion:sad");
	}

	@Test
	@DisplayName("중립 감정 힌트는 감정 벡터 점수를 0으로 만든다")
	void classify_withNeutralHint_shouldSuppressEmotionVector() {
		Classification result = classifier.scoreCategories("how are you feeling",
			EmotionHint.of(EmotionHint.NEUTRAL, 0.95));

		assertThat(result.vectorStrategy().kind()).isEqualTo(StrategyKind.CONTENT_ONLY);
		assertThat(result.vectorStrategy().weightOf(NamedVector.EMOTION)).isZero();
	}

	@Test
	@DisplayName("신뢰도가 낮은 감정 힌트는 무시한다")
	void classify_withWeakHint_shouldIgnoreHint() {
		Classification withoutHint = classifier.scoreCategories("tell me something", null);
		Classification withWeakHint = classifier.scoreCategories("tell me something",
			EmotionHint.of("angry", 0.4));

		assertThat(withWeakHint.category()).isEqualTo(withoutHint.category());
		assertThat(withWeakHint.vectorStrategy()).isEqualTo(withoutHint.vectorStrategy());
	}

	@Test
	@DisplayName("여러 벡터가 비슷하게 매칭되면 가중 결합 전략을 사용하고 가중치 합은 1이다")
	void classify_mixedVectorKeywords_shouldUseWeightedCombination() {
		Classification result = classifier
			.scoreCategories("what idea makes me feel", null);

		assertThat(result.vectorStrategy().kind()).isEqualTo(StrategyKind.WEIGHTED_COMBINATION);
		double sum = result.vectorStrategy().weights().values().stream()
			.mapToDouble(Double::doubleValue)
			.sum();
		assertThat(sum).isCloseTo(1.0, within(1e-6));
	}

	@Test
	@DisplayName("같은 입력은 항상 같은 분류 결과를 반환한다")
	void classify_sameInput_shouldBeDeterministic() {
		Classification first = classifier.classify(RecallQueryFixture.create("What foods do I like?"));
		Classification second = classifier.classify(RecallQueryFixture.create("What foods do I like?"));

		assertThat(first).isEqualTo(second);
	}
}
