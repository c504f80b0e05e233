package com.study.webflux.recall.infrastructure.emotion.adapter;

import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;

import com.study.webflux.recall.domain.error.Backend;
import com.study.webflux.recall.domain.error.BackendUnavailableException;
import com.study.webflux.recall.infrastructure.emotion.config.EmotionClientConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class HttpEmotionAdapterTest {

	private DisposableServer server;

	@AfterEach
	void tearDown() {
		if (server != null) {
			server.disposeNow();
		}
	}

	@Test
	@DisplayName("비활성화 상태에서는 호출 없이 빈 결과를 반환한다")
	void analyze_disabled_returnsEmpty() {
		HttpEmotionAdapter adapter = new HttpEmotionAdapter(new EmotionClientConfig(false, ""),
			WebClient.builder());

		StepVerifier.create(adapter.analyze("I feel great")).verifyComplete();
	}

	@Test
	@DisplayName("응답 라벨은 소문자로 정규화되고 신뢰도는 0~1 로 제한된다")
	void analyze_normalizesLabelAndClampsConfidence() {
		HttpEmotionAdapter adapter = startServer(200, "{\"label\":\"Sad\",\"confidence\":1.4}");

		StepVerifier.create(adapter.analyze("I miss my dog"))
			.assertNext(hint -> {
				assertThat(hint.label()).isEqualTo("sad");
				assertThat(hint.confidence()).isEqualTo(1.0);
			})
			.verifyComplete();
	}

	@Test
	@DisplayName("라벨이 없는 응답은 힌트 없음으로 처리한다")
	void analyze_malformedResponse_returnsEmpty() {
		HttpEmotionAdapter adapter = startServer(200, "{\"confidence\":0.8}");

		StepVerifier.create(adapter.analyze("hello")).verifyComplete();
	}

	@Test
	@DisplayName("빈 텍스트는 분석하지 않는다")
	void analyze_blankText_returnsEmpty() {
		HttpEmotionAdapter adapter = startServer(200, "{\"label\":\"joy\",\"confidence\":0.9}");

		StepVerifier.create(adapter.analyze("  ")).verifyComplete();
	}

	@Test
	@DisplayName("분석 서버 오류는 EMOTION 백엔드 오류로 변환된다")
	void analyze_serverError_mapsToBackendUnavailable() {
		HttpEmotionAdapter adapter = startServer(503, "{}");

		StepVerifier.create(adapter.analyze("hello"))
			.expectErrorSatisfies(error -> {
				assertThat(error).isInstanceOf(BackendUnavailableException.class);
				assertThat(((BackendUnavailableException) error).backend()).isEqualTo(Backend.EMOTION);
			})
			.verify();
	}

	private HttpEmotionAdapter startServer(int status, String responseBody) {
		server = HttpServer.create()
			.port(0)
			.route(routes -> routes.post("/analyze",
				(request, response) -> request.receive()
					.aggregate()
					.then(response.status(status)
						.header("Content-Type", "application/json")
						.sendString(Mono.just(responseBody))
						.then())))
			.bindNow();

		EmotionClientConfig config = new EmotionClientConfig(true, "http://localhost:" + server.port());
		return new HttpEmotionAdapter(config,
			WebClient.builder().clientConnector(new ReactorClientHttpConnector()));
	}
}
