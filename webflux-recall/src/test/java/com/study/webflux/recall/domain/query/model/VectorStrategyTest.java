package com.study.webflux.recall.domain.query.model;

import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class VectorStrategyTest {

	@Test
	@DisplayName("가중치 합이 1이 아니면 생성할 수 없다")
	void create_withInvalidSum_shouldThrow() {
		assertThatThrownBy(() -> new VectorStrategy(StrategyKind.WEIGHTED_COMBINATION,
			Map.of(NamedVector.CONTENT, 0.5, NamedVector.EMOTION, 0.4)))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("단일 벡터 전략은 자신의 주 벡터에만 가중치를 가질 수 있다")
	void create_primaryWithForeignVector_shouldThrow() {
		assertThatThrownBy(() -> new VectorStrategy(StrategyKind.EMOTION_PRIMARY,
			Map.of(NamedVector.CONTENT, 1.0)))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("weighted 는 점수를 합이 1이 되도록 정규화하고 0 가중치는 제외한다")
	void weighted_shouldNormalizeAndDropZeroWeights() {
		VectorStrategy strategy = VectorStrategy.weighted(Map.of(NamedVector.CONTENT, 2.0,
			NamedVector.SEMANTIC, 2.0,
			NamedVector.EMOTION, 0.0));

		assertThat(strategy.kind()).isEqualTo(StrategyKind.WEIGHTED_COMBINATION);
		assertThat(strategy.weights()).containsOnlyKeys(NamedVector.CONTENT, NamedVector.SEMANTIC);
		assertThat(strategy.weightOf(NamedVector.CONTENT)).isCloseTo(0.5, within(1e-9));
		assertThat(strategy.weightOf(NamedVector.EMOTION)).isZero();
	}

	@Test
	@DisplayName("단일 벡터 전략은 정해진 backup 벡터를 가진다")
	void primary_shouldExposeBackupVector() {
		assertThat(VectorStrategy.contentOnly().backupVector()).isEqualTo(NamedVector.SEMANTIC);
		assertThat(VectorStrategy.primary(NamedVector.EMOTION).backupVector())
			.isEqualTo(NamedVector.CONTENT);
		assertThat(VectorStrategy.primary(NamedVector.SEMANTIC).backupVector())
			.isEqualTo(NamedVector.CONTENT);
		assertThat(VectorStrategy.balanced().isPrimary()).isFalse();
	}
}
