package com.study.webflux.recall.infrastructure.vectordb;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;

import com.study.webflux.recall.domain.error.Backend;
import com.study.webflux.recall.domain.error.BackendUnavailableException;
import com.study.webflux.recall.domain.query.model.NamedVector;
import com.study.webflux.recall.domain.query.model.TemporalDirection;
import com.study.webflux.recall.domain.query.model.TemporalScope;
import com.study.webflux.recall.domain.query.model.TemporalWindow;
import com.study.webflux.recall.fixture.UserIdFixture;
import com.study.webflux.recall.infrastructure.vectordb.config.QdrantConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class QdrantMemoryVectorAdapterTest {

	private static final String COLLECTION = "memories";
	private static final Instant BASE_TIME = Instant.parse("2026-03-15T08:00:00Z");

	private final AtomicReference<String> capturedPath = new AtomicReference<>();
	private final AtomicReference<String> capturedBody = new AtomicReference<>();

	private DisposableServer server;

	@AfterEach
	void tearDown() {
		if (server != null) {
			server.disposeNow();
		}
	}

	@Test
	@DisplayName("이름 벡터 검색 결과를 점수와 함께 매핑하고 잘못된 포인트는 건너뛴다")
	void search_mapsPointsAndSkipsMalformed() {
		QdrantMemoryVectorAdapter adapter = startServer(200, """
			{"result":[
			  {"id":"m1","score":0.91,"payload":{"user_id":"user-1","content":"I like pizza",
			    "emotion_label":"joy","emotion_intensity":0.7,"timestamp":1773561600.0}},
			  {"id":"bad","score":0.5,"payload":{"content":"no timestamp"}},
			  {"id":7,"score":0.42,"payload":{"user_id":"user-1","timestamp":1773561660.5}}
			]}
			""");

		StepVerifier.create(adapter.search(UserIdFixture.create(), NamedVector.EMOTION, List.of(0.1f, 0.2f), 5))
			.assertNext(scored -> {
				assertThat(scored.record().id()).isEqualTo("m1");
				assertThat(scored.record().content()).isEqualTo("I like pizza");
				assertThat(scored.record().emotionLabel()).isEqualTo("joy");
				assertThat(scored.record().emotionIntensity()).isEqualTo(0.7);
				assertThat(scored.record().timestamp()).isEqualTo(BASE_TIME);
				assertThat(scored.vector()).isEqualTo(NamedVector.EMOTION);
				assertThat(scored.score()).isEqualTo(0.91);
			})
			.assertNext(scored -> {
				assertThat(scored.record().id()).isEqualTo("7");
				assertThat(scored.record().content()).isEmpty();
				assertThat(scored.record().emotionLabel()).isNull();
				assertThat(scored.record().timestamp()).isEqualTo(BASE_TIME.plusMillis(60_500));
			})
			.verifyComplete();

		assertThat(capturedPath.get()).isEqualTo("/collections/memories/points/search");
		assertThat(capturedBody.get())
			.contains("\"name\":\"emotion\"")
			.contains("\"key\":\"user_id\"")
			.contains("\"value\":\"user-1\"")
			.contains("\"limit\":5")
			.contains("\"with_payload\":true");
	}

	@Test
	@DisplayName("시간순 스크롤은 timestamp 범위와 정렬 방향을 요청에 담는다")
	void scrollChronological_sendsRangeAndOrder() {
		QdrantMemoryVectorAdapter adapter = startServer(200, """
			{"result":{"points":[
			  {"id":"m1","payload":{"user_id":"user-1","content":"first","timestamp":1773561600.0}}
			],"next_page_offset":null}}
			""");
		TemporalWindow window = new TemporalWindow(TemporalDirection.OLDEST,
			TemporalScope.SESSION,
			3,
			BASE_TIME,
			BASE_TIME.plus(4, ChronoUnit.HOURS));

		StepVerifier.create(adapter.scrollChronological(UserIdFixture.create(), window))
			.assertNext(record -> {
				assertThat(record.id()).isEqualTo("m1");
				assertThat(record.content()).isEqualTo("first");
			})
			.verifyComplete();

		assertThat(capturedPath.get()).isEqualTo("/collections/memories/points/scroll");
		assertThat(capturedBody.get())
			.contains("\"gte\":1.7735616E9")
			.contains("\"lt\":1.773576E9")
			.contains("\"direction\":\"asc\"")
			.contains("\"with_vector\":false")
			.contains("\"limit\":3");
	}

	@Test
	@DisplayName("전체 기간 최신 조회는 범위 조건 없이 내림차순으로 요청한다")
	void scrollChronological_allTimeHasNoRange() {
		QdrantMemoryVectorAdapter adapter = startServer(200, "{\"result\":{\"points\":[]}}");
		TemporalWindow window = new TemporalWindow(TemporalDirection.NEWEST,
			TemporalScope.ALL_TIME,
			10,
			null,
			null);

		StepVerifier.create(adapter.scrollChronological(UserIdFixture.create(), window))
			.verifyComplete();

		assertThat(capturedBody.get())
			.contains("\"direction\":\"desc\"")
			.doesNotContain("range");
	}

	@Test
	@DisplayName("Qdrant 오류 응답은 BackendUnavailableException 으로 변환된다")
	void search_serverError_mapsToBackendUnavailable() {
		QdrantMemoryVectorAdapter adapter = startServer(500, "{\"status\":{\"error\":\"boom\"}}");

		StepVerifier.create(adapter.search(UserIdFixture.create(), NamedVector.CONTENT, List.of(0.1f), 5))
			.expectErrorSatisfies(error -> {
				assertThat(error).isInstanceOf(BackendUnavailableException.class);
				assertThat(((BackendUnavailableException) error).backend()).isEqualTo(Backend.VECTOR_STORE);
			})
			.verify();
	}

	private QdrantMemoryVectorAdapter startServer(int status, String responseBody) {
		server = HttpServer.create()
			.port(0)
			.route(routes -> routes.post("/collections/{collection}/points/{operation}",
				(request, response) -> request.receive()
					.aggregate()
					.asString()
					.doOnNext(body -> {
						capturedPath.set(request.path().startsWith("/")
							? request.path()
							: "/" + request.path());
						capturedBody.set(body);
					})
					.then(response.status(status)
						.header("Content-Type", "application/json")
						.sendString(Mono.just(responseBody))
						.then())))
			.bindNow();

		WebClient.Builder builder = WebClient.builder().clientConnector(new ReactorClientHttpConnector());
		QdrantConfig config = new QdrantConfig("http://localhost:" + server.port(), null, COLLECTION, 2, false);
		return new QdrantMemoryVectorAdapter(builder, config);
	}
}
