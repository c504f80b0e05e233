package com.study.webflux.recall.infrastructure.vectordb.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

import com.study.webflux.recall.domain.query.model.NamedVector;
import reactor.core.publisher.Mono;

/**
 * 기억 컬렉션이 없으면 content/emotion/semantic 이름 벡터와 user_id, timestamp 페이로드 인덱스를 가진 컬렉션을 생성합니다.
 */
@Slf4j
@Component
public class QdrantCollectionInitializer implements ApplicationRunner {

	private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

	private final QdrantConfig config;
	private final WebClient webClient;

	public QdrantCollectionInitializer(QdrantConfig config, WebClient.Builder webClientBuilder) {
		this.config = config;
		WebClient.Builder builder = webClientBuilder.clone().baseUrl(config.url());
		if (StringUtils.hasText(config.apiKey())) {
			builder.defaultHeader("api-key", config.apiKey());
		}
		this.webClient = builder.build();
	}

	@Override
	public void run(ApplicationArguments args) {
		if (!config.autoCreateCollection()) {
			log.info("Qdrant 컬렉션 자동 생성이 비활성화되어 초기화를 건너뜁니다. collection={}",
				config.collectionName());
			return;
		}

		if (collectionExists(config.collectionName())) {
			log.info("Qdrant 컬렉션이 이미 존재합니다. collection={}", config.collectionName());
			return;
		}

		createCollection(config.collectionName(), config.vectorDimension());
		createPayloadIndex(config.collectionName(), "user_id", "keyword");
		createPayloadIndex(config.collectionName(), "timestamp", "float");
	}

	private boolean collectionExists(String collectionName) {
		return webClient.get()
			.uri("/collections/{collectionName}", collectionName)
			.exchangeToMono(response -> {
				HttpStatusCode status = response.statusCode();
				if (status.is2xxSuccessful()) {
					return Mono.just(true);
				}
				if (status.value() == 404) {
					return Mono.just(false);
				}
				return response.bodyToMono(String.class)
					.defaultIfEmpty("")
					.flatMap(body -> Mono.error(new IllegalStateException(
						"Qdrant 컬렉션 조회 실패 status=" + status.value() + " body=" + body)));
			})
			.blockOptional(REQUEST_TIMEOUT)
			.orElse(false);
	}

	private void createCollection(String collectionName, int vectorDimension) {
		Map<String, Object> vectors = new LinkedHashMap<>();
		for (NamedVector vector : NamedVector.values()) {
			vectors.put(vector.wireName(), Map.of("size", vectorDimension, "distance", "Cosine"));
		}

		execute(webClient.put()
			.uri("/collections/{collectionName}", collectionName)
			.contentType(MediaType.APPLICATION_JSON)
			.bodyValue(Map.of("vectors", vectors)), "컬렉션 생성");

		log.info("Qdrant 컬렉션을 준비했습니다. collection={}, vectors={}, vectorDimension={}",
			collectionName,
			vectors.keySet(),
			vectorDimension);
	}

	private void createPayloadIndex(String collectionName, String field, String schema) {
		execute(webClient.put()
			.uri("/collections/{collectionName}/index", collectionName)
			.contentType(MediaType.APPLICATION_JSON)
			.bodyValue(Map.of("field_name", field, "field_schema", schema)), "페이로드 인덱스 생성");
		log.info("Qdrant 페이로드 인덱스를 생성했습니다. collection={}, field={}, schema={}",
			collectionName,
			field,
			schema);
	}

	private void execute(WebClient.RequestHeadersSpec<?> request, String action) {
		request.exchangeToMono(response -> {
			HttpStatusCode status = response.statusCode();
			if (status.is2xxSuccessful() || status.value() == 409) {
				return Mono.empty();
			}
			return response.bodyToMono(String.class)
				.defaultIfEmpty("")
				.flatMap(body -> Mono.error(new IllegalStateException(
					"Qdrant " + action + " 실패 status=" + status.value() + " body=" + body)));
		}).block(REQUEST_TIMEOUT);
	}
}
