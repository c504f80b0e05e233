package com.study.webflux.recall.domain.knowledge.model;

import com.study.webflux.recall.fixture.UserIdFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StoreFactCommandTest {

	@Test
	@DisplayName("엔티티와 관계 유형은 소문자로 정규화된다")
	void create_shouldNormalize() {
		StoreFactCommand command = StoreFactCommand.of(UserIdFixture.create(), "  Pizza ", "FOOD", "Likes",
			0.9);

		assertThat(command.entityName()).isEqualTo("pizza");
		assertThat(command.entityType()).isEqualTo("food");
		assertThat(command.relationshipType()).isEqualTo("likes");
	}

	@Test
	@DisplayName("관계 유형이 비어 있으면 mentions 를 사용한다")
	void create_withoutRelationship_shouldDefaultToMentions() {
		StoreFactCommand command = StoreFactCommand.of(UserIdFixture.create(), "pizza", "food", " ", 0.9);

		assertThat(command.relationshipType()).isEqualTo(StoreFactCommand.DEFAULT_RELATIONSHIP);
	}

	@Test
	@DisplayName("밑줄로 시작하는 내부 관계 유형과 범위를 벗어난 신뢰도는 거부한다")
	void create_invalid_shouldThrow() {
		assertThatThrownBy(() -> StoreFactCommand.of(UserIdFixture.create(), "pizza", "food",
			"_enrichment_done", 0.9)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> StoreFactCommand.of(UserIdFixture.create(), "pizza", "food", "likes",
			1.5)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> StoreFactCommand.of(UserIdFixture.create(), "pizza", null, "likes",
			0.5)).isInstanceOf(IllegalArgumentException.class);
	}
}
