package com.study.webflux.recall.domain.knowledge.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RelationshipRulesTest {

	@Test
	@DisplayName("반대 관계는 대칭이다")
	void opposingOf_shouldBeSymmetric() {
		assertThat(RelationshipRules.opposingOf("likes")).contains("dislikes", "hates", "avoids");
		assertThat(RelationshipRules.opposingOf("dislikes")).contains("likes", "loves", "enjoys");
		assertThat(RelationshipRules.opposingOf("distrusts")).containsExactly("trusts");
	}

	@Test
	@DisplayName("favorite 는 likes 와 같은 그룹이며 dislikes 와 반대이다")
	void favorite_shouldShareLikesGroup() {
		assertThat(RelationshipRules.similarGroupOf("favorite")).contains("likes", "loves");
		assertThat(RelationshipRules.opposingOf("favorite")).contains("dislikes");
		assertThat(RelationshipRules.opposingOf("dislikes")).contains("favorite");
	}

	@Test
	@DisplayName("규칙이 없는 관계는 반대 관계가 없다")
	void opposingOf_unknown_shouldBeEmpty() {
		assertThat(RelationshipRules.opposingOf("mentions")).isEmpty();
	}

	@Test
	@DisplayName("유사 그룹은 자기 자신을 포함하고 형제 관계는 자기 자신을 제외한다")
	void similarGroupOf_shouldIncludeSelf() {
		assertThat(RelationshipRules.similarGroupOf("likes"))
			.containsExactlyInAnyOrder("likes", "loves", "enjoys", "prefers", "favorite");
		assertThat(RelationshipRules.siblingsOf("likes"))
			.containsExactlyInAnyOrder("loves", "enjoys", "prefers", "favorite");
		assertThat(RelationshipRules.similarGroupOf("visited")).containsExactly("visited");
		assertThat(RelationshipRules.siblingsOf("visited")).isEmpty();
	}
}
