package com.study.webflux.recall.infrastructure.query.config;

import java.time.ZoneId;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.study.webflux.recall.domain.query.service.ClassifierSettings;
import com.study.webflux.recall.domain.query.service.QueryClassifier;
import com.study.webflux.recall.domain.query.service.TemporalQueryDetector;
import com.study.webflux.recall.domain.query.service.TemporalSettings;
import com.study.webflux.recall.infrastructure.config.properties.RecallProperties;

/** 질의 분류기와 시간 판별기를 구성합니다. */
@Configuration
public class QueryClassificationConfiguration {

	@Bean
	public TemporalSettings temporalSettings(RecallProperties properties) {
		var temporal = properties.getTemporal();
		return new TemporalSettings(temporal.getSessionWindow(),
			temporal.getOldestLimit(),
			temporal.getNewestLimit(),
			ZoneId.of(temporal.getZone()));
	}

	/** 기본 패턴 테이블에 설정된 임계값을 적용합니다. */
	@Bean
	public ClassifierSettings classifierSettings(RecallProperties properties) {
		var classifier = properties.getClassifier();
		return ClassifierSettings.defaults().withThresholds(new ClassifierSettings.Thresholds(
			classifier.getExactMatchScore(),
			classifier.getPartialMatchScore(),
			classifier.getEntityMatchScore(),
			classifier.getMinCategoryScore(),
			classifier.getSecondaryRatio(),
			classifier.getPrimaryVectorThreshold(),
			classifier.getWeightedVectorThreshold(),
			classifier.getEmotionHintMinConfidence(),
			classifier.getEmotionHintWeight()));
	}

	@Bean
	public TemporalQueryDetector temporalQueryDetector(TemporalSettings temporalSettings) {
		return new TemporalQueryDetector(temporalSettings);
	}

	@Bean
	public QueryClassifier queryClassifier(ClassifierSettings classifierSettings,
		TemporalQueryDetector temporalQueryDetector) {
		return new QueryClassifier(classifierSettings, temporalQueryDetector);
	}
}
