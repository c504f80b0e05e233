package com.study.webflux.recall.infrastructure.config.properties;

import java.time.Duration;

import lombok.Getter;
import lombok.Setter;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * recall.* 설정입니다. 각 @Configuration 클래스가 이 값을 불변 설정 record 로 변환합니다.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "recall")
public class RecallProperties {

	private Qdrant qdrant = new Qdrant();
	private Emotion emotion = new Emotion();
	private Timeouts timeouts = new Timeouts();
	private Retrieval retrieval = new Retrieval();
	private Classifier classifier = new Classifier();
	private Temporal temporal = new Temporal();
	private Graph graph = new Graph();

	@Getter
	@Setter
	public static class Qdrant {
		private String url = "http://localhost:6333";
		private String apiKey;
		private String collectionName = "memories";
		private int vectorDimension = 384;
		private boolean autoCreateCollection = true;
	}

	@Getter
	@Setter
	public static class Emotion {
		private boolean enabled = true;
		private String url = "http://localhost:8090";
	}

	@Getter
	@Setter
	public static class Timeouts {
		private Duration vector = Duration.ofMillis(150);
		private Duration facts = Duration.ofMillis(100);
		private Duration embedding = Duration.ofMillis(300);
		private Duration emotion = Duration.ofMillis(100);
	}

	@Getter
	@Setter
	public static class Retrieval {
		private int defaultLimit = 10;
		private int maxLimit = 50;
		private double factMinConfidence = 0.5;
	}

	@Getter
	@Setter
	public static class Classifier {
		private double exactMatchScore = 2.0;
		private double partialMatchScore = 1.0;
		private double entityMatchScore = 1.5;
		private double minCategoryScore = 1.5;
		private double secondaryRatio = 0.7;
		private double primaryVectorThreshold = 0.45;
		private double weightedVectorThreshold = 0.35;
		private double emotionHintMinConfidence = 0.6;
		private double emotionHintWeight = 3.0;
	}

	@Getter
	@Setter
	public static class Temporal {
		private Duration sessionWindow = Duration.ofHours(4);
		private int oldestLimit = 3;
		private int newestLimit = 10;
		private String zone = "UTC";
	}

	@Getter
	@Setter
	public static class Graph {
		private double minConfidence = 0.5;
		private double tieMargin = 0.05;
		private double similarityThreshold = 0.3;
		private double maxSimilarityWeight = 0.9;
		private int maxSimilarEntities = 5;
		private int discoveryCandidateLimit = 500;
		private int maxHops = 3;
		private int maxFactLimit = 100;
	}
}
