package com.study.webflux.recall.infrastructure.monitoring.config;

import java.time.Duration;

import org.springframework.stereotype.Component;

import com.study.webflux.recall.domain.knowledge.model.FactWriteOutcome;
import com.study.webflux.recall.domain.query.model.QueryCategory;
import com.study.webflux.recall.domain.query.model.StrategyKind;
import com.study.webflux.recall.domain.retrieval.model.ComponentStatus;
import com.study.webflux.recall.domain.retrieval.model.RetrievalComponent;
import com.study.webflux.recall.domain.retrieval.model.RouteKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * 질의 라우팅 품질 메트릭을 제공합니다.
 *
 * <p>
 * 라우트/카테고리/전략 분포, 구성요소 실패, CONTENT_ONLY 재시도, 기억 유사도 점수, 사실 저장 결과를 기록합니다.
 */
@Component
public class RecallMetricsConfiguration {

	private final MeterRegistry meterRegistry;

	private final Counter strategyFallbackCounter;
	private final Counter relationshipDiscoveryFailureCounter;

	private final DistributionSummary memoryScore;
	private final DistributionSummary memoryResultCount;
	private final DistributionSummary factResultCount;

	private final Timer routeLatency;

	public RecallMetricsConfiguration(MeterRegistry meterRegistry) {
		this.meterRegistry = meterRegistry;

		this.strategyFallbackCounter = Counter.builder("recall.strategy.fallback.count")
			.description("Number of vector searches retried with CONTENT_ONLY")
			.register(meterRegistry);

		this.relationshipDiscoveryFailureCounter = Counter
			.builder("recall.knowledge.discovery.failure.count")
			.description("Number of failed relationship discovery runs")
			.register(meterRegistry);

		this.memoryScore = DistributionSummary.builder("recall.memory.score")
			.description("Final score of ranked memories")
			.publishPercentiles(0.5, 0.75, 0.9, 0.95, 0.99)
			.register(meterRegistry);

		this.memoryResultCount = DistributionSummary.builder("recall.memory.result.count")
			.description("Number of memories returned per query")
			.register(meterRegistry);

		this.factResultCount = DistributionSummary.builder("recall.fact.result.count")
			.description("Number of facts returned per query")
			.register(meterRegistry);

		this.routeLatency = Timer.builder("recall.route.latency")
			.description("End-to-end routing latency")
			.publishPercentiles(0.5, 0.95, 0.99)
			.register(meterRegistry);
	}

	/**
	 * 라우팅 결과(경로, 카테고리, 전략)를 기록합니다.
	 */
	public void recordRoute(RouteKind route, QueryCategory category, StrategyKind strategy) {
		Counter.builder("recall.route.count")
			.description("Routed queries by route, category and strategy")
			.tag("route", route.name())
			.tag("category", category.name())
			.tag("strategy", strategy.name())
			.register(meterRegistry)
			.increment();
	}

	/**
	 * 구성요소 실패를 기록합니다.
	 */
	public void recordComponentFailure(RetrievalComponent component, ComponentStatus status) {
		Counter.builder("recall.component.failure.count")
			.description("Retrieval component failures")
			.tag("component", component.name())
			.tag("status", status.name())
			.register(meterRegistry)
			.increment();
	}

	public void recordStrategyFallback() {
		strategyFallbackCounter.increment();
	}

	public void recordMemoryScore(double score) {
		memoryScore.record(score);
	}

	public void recordResultCounts(int memories, int facts) {
		memoryResultCount.record(memories);
		factResultCount.record(facts);
	}

	public void recordRouteLatency(Duration elapsed) {
		routeLatency.record(elapsed);
	}

	/**
	 * 사실 저장 결과를 기록합니다.
	 */
	public void recordFactWrite(FactWriteOutcome outcome) {
		Counter.builder("recall.knowledge.write.count")
			.description("Fact writes by outcome")
			.tag("outcome", outcome.name())
			.register(meterRegistry)
			.increment();
	}

	public void recordDiscoveryFailure() {
		relationshipDiscoveryFailureCounter.increment();
	}
}
