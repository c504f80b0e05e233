package com.study.webflux.recall.infrastructure.knowledge.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.study.webflux.recall.infrastructure.config.properties.RecallProperties;

/** 지식 그래프 설정을 제공합니다. TransactionalOperator 는 R2DBC 트랜잭션 자동 설정을 사용합니다. */
@Configuration
public class KnowledgeGraphConfiguration {

	@Bean
	public KnowledgeGraphConfig knowledgeGraphConfig(RecallProperties properties) {
		var graph = properties.getGraph();
		return new KnowledgeGraphConfig(graph.getMinConfidence(),
			graph.getTieMargin(),
			graph.getSimilarityThreshold(),
			graph.getMaxSimilarityWeight(),
			graph.getMaxSimilarEntities(),
			graph.getDiscoveryCandidateLimit(),
			graph.getMaxHops(),
			graph.getMaxFactLimit());
	}
}
