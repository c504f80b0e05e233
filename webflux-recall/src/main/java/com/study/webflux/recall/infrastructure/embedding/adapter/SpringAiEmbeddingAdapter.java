package com.study.webflux.recall.infrastructure.embedding.adapter;

import java.util.ArrayList;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Component;

import com.study.webflux.recall.domain.error.Backend;
import com.study.webflux.recall.domain.error.BackendUnavailableException;
import com.study.webflux.recall.domain.memory.model.MemoryEmbedding;
import com.study.webflux.recall.domain.memory.port.EmbeddingPort;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@Slf4j
@Component
public class SpringAiEmbeddingAdapter implements EmbeddingPort {

	private final EmbeddingModel embeddingModel;

	public SpringAiEmbeddingAdapter(EmbeddingModel embeddingModel) {
		this.embeddingModel = embeddingModel;
	}

	@Override
	public Mono<MemoryEmbedding> embed(String text) {
		return Mono.fromCallable(() -> {
			float[] output = embeddingModel.embed(text);
			List<Float> vector = new ArrayList<>(output.length);
			for (float value : output) {
				vector.add(value);
			}
			return MemoryEmbedding.of(text, vector);
		})
			.subscribeOn(Schedulers.boundedElastic())
			.onErrorMap(error -> !(error instanceof BackendUnavailableException), error -> {
				log.warn("임베딩 생성 실패: {}", error.getMessage());
				return new BackendUnavailableException(Backend.EMBEDDING, error.getMessage(), error);
			});
	}
}
