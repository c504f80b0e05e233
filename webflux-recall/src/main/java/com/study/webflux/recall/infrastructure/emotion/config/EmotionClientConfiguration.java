package com.study.webflux.recall.infrastructure.emotion.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.study.webflux.recall.infrastructure.config.properties.RecallProperties;

@Configuration
public class EmotionClientConfiguration {

	@Bean
	public EmotionClientConfig emotionClientConfig(RecallProperties properties) {
		RecallProperties.Emotion emotion = properties.getEmotion();
		String url = emotion.getUrl() == null ? "" : emotion.getUrl().trim();
		while (url.endsWith("/")) {
			url = url.substring(0, url.length() - 1);
		}
		return new EmotionClientConfig(emotion.isEnabled() && !url.isEmpty(), url);
	}
}
