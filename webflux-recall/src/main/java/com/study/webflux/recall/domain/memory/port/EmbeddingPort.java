package com.study.webflux.recall.domain.memory.port;

import com.study.webflux.recall.domain.memory.model.MemoryEmbedding;
import reactor.core.publisher.Mono;

public interface EmbeddingPort {

	Mono<MemoryEmbedding> embed(String text);
}
