package com.study.webflux.recall.infrastructure.routing.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.study.webflux.recall.infrastructure.config.properties.RecallProperties;

/** 라우터 타임아웃/한도 설정을 제공합니다. */
@Configuration
public class RoutingConfiguration {

	@Bean
	public RoutingConfig routingConfig(RecallProperties properties) {
		var timeouts = properties.getTimeouts();
		var retrieval = properties.getRetrieval();
		return new RoutingConfig(timeouts.getVector(),
			timeouts.getFacts(),
			timeouts.getEmbedding(),
			timeouts.getEmotion(),
			properties.getEmotion().isEnabled(),
			retrieval.getDefaultLimit(),
			retrieval.getMaxLimit(),
			retrieval.getFactMinConfidence());
	}

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}
}
