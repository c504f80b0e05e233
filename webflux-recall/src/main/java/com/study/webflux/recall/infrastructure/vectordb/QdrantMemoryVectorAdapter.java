package com.study.webflux.recall.infrastructure.vectordb;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import com.study.webflux.recall.domain.error.Backend;
import com.study.webflux.recall.domain.error.BackendUnavailableException;
import com.study.webflux.recall.domain.memory.model.MemoryRecord;
import com.study.webflux.recall.domain.memory.model.ScoredMemory;
import com.study.webflux.recall.domain.memory.port.MemoryVectorPort;
import com.study.webflux.recall.domain.query.model.NamedVector;
import com.study.webflux.recall.domain.query.model.TemporalWindow;
import com.study.webflux.recall.domain.user.model.UserId;
import com.study.webflux.recall.infrastructure.vectordb.config.QdrantConfig;
import com.study.webflux.recall.infrastructure.vectordb.dto.QdrantFilter;
import com.study.webflux.recall.infrastructure.vectordb.dto.QdrantScoredPoint;
import com.study.webflux.recall.infrastructure.vectordb.dto.QdrantScrollRequest;
import com.study.webflux.recall.infrastructure.vectordb.dto.QdrantScrollResponse;
import com.study.webflux.recall.infrastructure.vectordb.dto.QdrantSearchRequest;
import com.study.webflux.recall.infrastructure.vectordb.dto.QdrantSearchResponse;
import reactor.core.publisher.Flux;

/**
 * Qdrant REST API 기반 기억 저장소 어댑터입니다. 이름 벡터(content/emotion/semantic) 검색과 timestamp 정렬 스크롤을 지원합니다.
 */
@Slf4j
@Component
public class QdrantMemoryVectorAdapter implements MemoryVectorPort {

	static final String USER_ID = "user_id";
	static final String CONTENT = "content";
	static final String TIMESTAMP = "timestamp";
	static final String EMOTION_LABEL = "emotion_label";
	static final String EMOTION_INTENSITY = "emotion_intensity";

	private final WebClient webClient;
	private final String collectionName;

	public QdrantMemoryVectorAdapter(WebClient.Builder webClientBuilder, QdrantConfig config) {
		WebClient.Builder builder = webClientBuilder.clone()
			.baseUrl(config.url())
			.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);

		if (config.apiKey() != null && !config.apiKey().isBlank()) {
			builder.defaultHeader("api-key", config.apiKey());
		}

		this.webClient = builder.build();
		this.collectionName = config.collectionName();
	}

	@Override
	public Flux<ScoredMemory> search(UserId userId,
		NamedVector vector,
		List<Float> queryVector,
		int limit) {
		QdrantSearchRequest request = new QdrantSearchRequest(
			new QdrantSearchRequest.NamedVectorQuery(vector.wireName(), queryVector),
			limit,
			true,
			new QdrantFilter(List.of(QdrantFilter.FilterCondition.matchValue(USER_ID, userId.value()))));

		return webClient.post()
			.uri("/collections/{collection}/points/search", collectionName)
			.bodyValue(request)
			.retrieve()
			.bodyToMono(QdrantSearchResponse.class)
			.onErrorMap(WebClientException.class, error -> new BackendUnavailableException(
				Backend.VECTOR_STORE,
				"search on vector '" + vector.wireName() + "' failed: " + error.getMessage(),
				error))
			.flatMapMany(response -> Flux.fromIterable(
				response.result() == null ? List.of() : response.result()))
			.mapNotNull(point -> toScoredMemory(point, vector));
	}

	@Override
	public Flux<MemoryRecord> scrollChronological(UserId userId, TemporalWindow window) {
		List<QdrantFilter.FilterCondition> conditions = new ArrayList<>();
		conditions.add(QdrantFilter.FilterCondition.matchValue(USER_ID, userId.value()));
		if (window.from() != null || window.to() != null) {
			conditions.add(QdrantFilter.FilterCondition.range(TIMESTAMP,
				toEpochSeconds(window.from()),
				toEpochSeconds(window.to())));
		}

		QdrantScrollRequest request = new QdrantScrollRequest(new QdrantFilter(conditions),
			window.limit(),
			true,
			false,
			new QdrantScrollRequest.OrderBy(TIMESTAMP, window.ascending() ? "asc" : "desc"));

		return webClient.post()
			.uri("/collections/{collection}/points/scroll", collectionName)
			.bodyValue(request)
			.retrieve()
			.bodyToMono(QdrantScrollResponse.class)
			.onErrorMap(WebClientException.class, error -> new BackendUnavailableException(
				Backend.VECTOR_STORE,
				"chronological scroll failed: " + error.getMessage(),
				error))
			.flatMapMany(response -> Flux.fromIterable(response.result() == null
				|| response.result().points() == null
					? List.of()
					: response.result().points()))
			.mapNotNull(point -> toRecord(point.id(), point.payload()));
	}

	private ScoredMemory toScoredMemory(QdrantScoredPoint point, NamedVector vector) {
		MemoryRecord record = toRecord(point.id(), point.payload());
		return record == null ? null : new ScoredMemory(record, vector, point.score());
	}

	private MemoryRecord toRecord(Object id, Map<String, Object> payload) {
		if (id == null || payload == null) {
			log.warn("잘못된 포인트: id 또는 payload 누락 id={}", id);
			return null;
		}
		Object userIdObj = payload.get(USER_ID);
		Object timestampObj = payload.get(TIMESTAMP);
		if (!(userIdObj instanceof String userIdValue) || !(timestampObj instanceof Number timestamp)) {
			log.warn("잘못된 페이로드: 포인트 {}의 user_id/timestamp 누락 또는 잘못됨", id);
			return null;
		}

		Object contentObj = payload.get(CONTENT);
		Object emotionLabelObj = payload.get(EMOTION_LABEL);
		Object intensityObj = payload.get(EMOTION_INTENSITY);

		return new MemoryRecord(String.valueOf(id),
			UserId.of(userIdValue),
			contentObj instanceof String content ? content : "",
			emotionLabelObj instanceof String label ? label : null,
			intensityObj instanceof Number intensity ? intensity.doubleValue() : null,
			Instant.ofEpochMilli(Math.round(timestamp.doubleValue() * 1000)));
	}

	private Double toEpochSeconds(Instant instant) {
		return instant == null ? null : instant.toEpochMilli() / 1000.0;
	}
}
