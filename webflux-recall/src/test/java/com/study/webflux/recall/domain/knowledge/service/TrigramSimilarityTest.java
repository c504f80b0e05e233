package com.study.webflux.recall.domain.knowledge.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TrigramSimilarityTest {

	@Test
	@DisplayName("단어마다 앞 공백 두 개, 뒤 공백 한 개를 붙여 트라이그램을 만든다")
	void trigrams_shouldPadEachWord() {
		assertThat(TrigramSimilarity.trigrams("cat"))
			.containsExactlyInAnyOrder("  c", " ca", "cat", "at ");
	}

	@Test
	@DisplayName("같은 문자열의 유사도는 1이다")
	void similarity_identical_shouldBeOne() {
		assertThat(TrigramSimilarity.similarity("Pizza", "pizza")).isEqualTo(1.0);
	}

	@Test
	@DisplayName("비슷한 이름은 임계값 0.3 을 넘고 무관한 이름은 넘지 않는다")
	void similarity_shouldSeparateSimilarFromUnrelated() {
		assertThat(TrigramSimilarity.similarity("pizza", "pizzas")).isGreaterThan(0.3);
		assertThat(TrigramSimilarity.similarity("pizza", "sushi")).isLessThan(0.3);
	}

	@Test
	@DisplayName("cat 과 cats 의 유사도는 pg_trgm 과 같은 3/6 이다")
	void similarity_catAndCats_shouldMatchPgTrgm() {
		assertThat(TrigramSimilarity.similarity("cat", "cats")).isCloseTo(0.5, within(1e-9));
	}

	@Test
	@DisplayName("빈 입력의 유사도는 0이다")
	void similarity_empty_shouldBeZero() {
		assertThat(TrigramSimilarity.similarity("", "pizza")).isZero();
		assertThat(TrigramSimilarity.similarity(null, "pizza")).isZero();
	}
}
