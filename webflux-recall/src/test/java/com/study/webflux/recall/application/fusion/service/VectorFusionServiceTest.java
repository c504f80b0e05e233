package com.study.webflux.recall.application.fusion.service;

import java.util.List;
import java.util.Map;

import com.study.webflux.recall.domain.error.Backend;
import com.study.webflux.recall.domain.error.BackendUnavailableException;
import com.study.webflux.recall.domain.memory.model.MemoryRecord;
import com.study.webflux.recall.domain.memory.model.RankedMemory;
import com.study.webflux.recall.domain.memory.port.MemoryVectorPort;
import com.study.webflux.recall.domain.query.model.NamedVector;
import com.study.webflux.recall.domain.query.model.VectorStrategy;
import com.study.webflux.recall.domain.user.model.UserId;
import com.study.webflux.recall.fixture.MemoryRecordFixture;
import com.study.webflux.recall.fixture.UserIdFixture;
import com.study.webflux.recall.infrastructure.monitoring.config.RecallMetricsConfiguration;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VectorFusionServiceTest {

	private static final List<Float> QUERY_VECTOR = List.of(0.1f, 0.2f, 0.3f);

	@Mock
	private MemoryVectorPort memoryVectorPort;

	private SimpleMeterRegistry meterRegistry;
	private VectorFusionService service;
	private UserId userId;

	@BeforeEach
	void setUp() {
		meterRegistry = new SimpleMeterRegistry();
		service = new VectorFusionService(memoryVectorPort, new RecallMetricsConfiguration(meterRegistry));
		userId = UserIdFixture.create();
	}

	@Test
	@DisplayName("주 벡터 결과가 충분하면 backup 벡터를 검색하지 않는다")
	void search_primaryWithEnoughResults_shouldSkipBackup() {
		when(memoryVectorPort.search(userId, NamedVector.CONTENT, QUERY_VECTOR, 2)).thenReturn(Flux.just(
			MemoryRecordFixture.scored("m1", NamedVector.CONTENT, 0.9),
			MemoryRecordFixture.scored("m2", NamedVector.CONTENT, 0.7)));

		StepVerifier.create(service.search(QUERY_VECTOR, userId, VectorStrategy.contentOnly(), 2))
			.assertNext(memory -> assertThat(memory.id()).isEqualTo("m1"))
			.assertNext(memory -> assertThat(memory.id()).isEqualTo("m2"))
			.verifyComplete();

		verify(memoryVectorPort, never()).search(eq(userId), eq(NamedVector.SEMANTIC), any(), anyInt());
		assertThat(meterRegistry.find("recall.memory.score").summary().count()).isEqualTo(2);
	}

	@Test
	@DisplayName("주 벡터 결과가 부족하면 backup 벡터 결과로 중복 없이 채운다")
	void search_primaryWithFewResults_shouldTopUpFromBackup() {
		when(memoryVectorPort.search(userId, NamedVector.CONTENT, QUERY_VECTOR, 3)).thenReturn(Flux.just(
			MemoryRecordFixture.scored("m1", NamedVector.CONTENT, 0.6)));
		when(memoryVectorPort.search(userId, NamedVector.SEMANTIC, QUERY_VECTOR, 3)).thenReturn(Flux.just(
			MemoryRecordFixture.scored("m1", NamedVector.SEMANTIC, 0.95),
			MemoryRecordFixture.scored("m2", NamedVector.SEMANTIC, 0.9),
			MemoryRecordFixture.scored("m3", NamedVector.SEMANTIC, 0.5)));

		StepVerifier.create(service.search(QUERY_VECTOR, userId, VectorStrategy.contentOnly(), 3)
			.map(RankedMemory::id)
			.collectList())
			.assertNext(ids -> assertThat(ids).containsExactly("m1", "m2", "m3"))
			.verifyComplete();
	}

	@Test
	@DisplayName("backup 벡터 검색이 실패해도 주 벡터 결과는 반환한다")
	void search_backupFailure_shouldReturnPrimaryResults() {
		when(memoryVectorPort.search(userId, NamedVector.EMOTION, QUERY_VECTOR, 5)).thenReturn(Flux.just(
			MemoryRecordFixture.scored("m1", NamedVector.EMOTION, 0.8)));
		when(memoryVectorPort.search(userId, NamedVector.CONTENT, QUERY_VECTOR, 5)).thenReturn(Flux.error(
			new BackendUnavailableException(Backend.VECTOR_STORE, "connection refused")));

		StepVerifier.create(service.search(QUERY_VECTOR, userId, VectorStrategy.primary(NamedVector.EMOTION), 5))
			.assertNext(memory -> {
				assertThat(memory.id()).isEqualTo("m1");
				assertThat(memory.contributions()).containsOnlyKeys(NamedVector.EMOTION);
			})
			.verifyComplete();
	}

	@Test
	@DisplayName("주 벡터 검색이 실패하면 오류를 전파한다")
	void search_primaryFailure_shouldPropagate() {
		when(memoryVectorPort.search(userId, NamedVector.CONTENT, QUERY_VECTOR, 5)).thenReturn(Flux.error(
			new BackendUnavailableException(Backend.VECTOR_STORE, "connection refused")));

		StepVerifier.create(service.search(QUERY_VECTOR, userId, VectorStrategy.contentOnly(), 5))
			.expectError(BackendUnavailableException.class)
			.verify();
	}

	@Test
	@DisplayName("가중 결합은 벡터마다 limit*2 개를 검색하고 가중 합으로 순위를 매긴다")
	void search_weighted_shouldFuseScores() {
		VectorStrategy strategy = VectorStrategy.weighted(Map.of(NamedVector.CONTENT, 1.0,
			NamedVector.SEMANTIC, 1.0));
		when(memoryVectorPort.search(userId, NamedVector.CONTENT, QUERY_VECTOR, 4)).thenReturn(Flux.just(
			MemoryRecordFixture.scored("m1", NamedVector.CONTENT, 0.9),
			MemoryRecordFixture.scored("m2", NamedVector.CONTENT, 0.8)));
		when(memoryVectorPort.search(userId, NamedVector.SEMANTIC, QUERY_VECTOR, 4)).thenReturn(Flux.just(
			MemoryRecordFixture.scored("m2", NamedVector.SEMANTIC, 0.9),
			MemoryRecordFixture.scored("m3", NamedVector.SEMANTIC, 0.7)));

		StepVerifier.create(service.search(QUERY_VECTOR, userId, strategy, 2).collectList())
			.assertNext(memories -> {
				assertThat(memories).extracting(RankedMemory::id).containsExactly("m2", "m1");
				assertThat(memories.get(0).score()).isCloseTo(0.85, within(1e-9));
				assertThat(memories.get(0).contributions())
					.containsOnlyKeys(NamedVector.CONTENT, NamedVector.SEMANTIC);
				assertThat(memories.get(1).score()).isCloseTo(0.45, within(1e-9));
			})
			.verifyComplete();
	}

	@Test
	@DisplayName("균형 결합은 세 벡터를 모두 검색하고 여러 벡터에 나온 기억을 단일 벡터 기억보다 앞에 둔다")
	void search_balanced_shouldFuseAllThreeVectors() {
		MemoryRecord older = MemoryRecordFixture.createMinutesAfterBase("m-old", 0);
		MemoryRecord newer = MemoryRecordFixture.createMinutesAfterBase("m-new", 10);
		when(memoryVectorPort.search(userId, NamedVector.CONTENT, QUERY_VECTOR, 10)).thenReturn(Flux.just(
			MemoryRecordFixture.scored("m-all", NamedVector.CONTENT, 0.6),
			MemoryRecordFixture.scored("m-single", NamedVector.CONTENT, 0.99),
			MemoryRecordFixture.scored(older, NamedVector.CONTENT, 0.9)));
		when(memoryVectorPort.search(userId, NamedVector.EMOTION, QUERY_VECTOR, 10)).thenReturn(Flux.just(
			MemoryRecordFixture.scored("m-all", NamedVector.EMOTION, 0.6),
			MemoryRecordFixture.scored("m-y", NamedVector.EMOTION, 0.75),
			MemoryRecordFixture.scored("m-x", NamedVector.EMOTION, 0.75)));
		when(memoryVectorPort.search(userId, NamedVector.SEMANTIC, QUERY_VECTOR, 10)).thenReturn(Flux.just(
			MemoryRecordFixture.scored("m-all", NamedVector.SEMANTIC, 0.6),
			MemoryRecordFixture.scored(newer, NamedVector.SEMANTIC, 0.9)));

		StepVerifier.create(service.search(QUERY_VECTOR, userId, VectorStrategy.balanced(), 5).collectList())
			.assertNext(memories -> {
				assertThat(memories).extracting(RankedMemory::id)
					.containsExactly("m-all", "m-single", "m-new", "m-old", "m-x");
				assertThat(memories.get(0).score()).isCloseTo(0.6, within(1e-9));
				assertThat(memories.get(0).contributions())
					.containsOnlyKeys(NamedVector.CONTENT, NamedVector.EMOTION, NamedVector.SEMANTIC);
				assertThat(memories.get(1).score()).isCloseTo(0.33, within(1e-9));
				assertThat(memories.get(2).score()).isCloseTo(0.3, within(1e-9));
				assertThat(memories.get(3).score()).isEqualTo(memories.get(2).score());
				assertThat(memories.get(4).score()).isCloseTo(0.25, within(1e-9));
			})
			.verifyComplete();
	}

	@Test
	@DisplayName("점수가 같으면 더 최근 기억이 앞에 온다")
	void search_tiedScores_shouldPreferNewerMemory() {
		MemoryRecord older = MemoryRecordFixture.createMinutesAfterBase("m-old", 0);
		MemoryRecord newer = MemoryRecordFixture.createMinutesAfterBase("m-new", 10);
		when(memoryVectorPort.search(userId, NamedVector.CONTENT, QUERY_VECTOR, 2)).thenReturn(Flux.just(
			MemoryRecordFixture.scored(older, NamedVector.CONTENT, 0.8),
			MemoryRecordFixture.scored(newer, NamedVector.CONTENT, 0.8)));

		StepVerifier.create(service.search(QUERY_VECTOR, userId, VectorStrategy.contentOnly(), 2)
			.map(RankedMemory::id)
			.collectList())
			.assertNext(ids -> assertThat(ids).containsExactly("m-new", "m-old"))
			.verifyComplete();
	}

	@Test
	@DisplayName("limit 이 0 이하이면 오류를 반환한다")
	void search_nonPositiveLimit_shouldFail() {
		StepVerifier.create(service.search(QUERY_VECTOR, userId, VectorStrategy.contentOnly(), 0))
			.expectError(IllegalArgumentException.class)
			.verify();
	}
}
