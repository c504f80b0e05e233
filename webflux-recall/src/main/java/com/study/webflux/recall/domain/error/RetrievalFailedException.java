package com.study.webflux.recall.domain.error;

import java.util.Map;

import com.study.webflux.recall.domain.query.model.Classification;
import com.study.webflux.recall.domain.retrieval.model.ComponentStatus;
import com.study.webflux.recall.domain.retrieval.model.RetrievalComponent;

/**
 * 실행한 모든 조회 구성요소가 실패했을 때 발생합니다. 호출자가 빈 컨텍스트를 구성할 수 있도록 분류 결과와 상태를 함께 전달합니다.
 */
public class RetrievalFailedException extends RecallException {

	private final Classification classification;
	private final Map<RetrievalComponent, ComponentStatus> components;

	public RetrievalFailedException(Classification classification,
		Map<RetrievalComponent, ComponentStatus> components) {
		super("all retrieval components failed: " + components);
		this.classification = classification;
		this.components = Map.copyOf(components);
	}

	public Classification classification() {
		return classification;
	}

	public Map<RetrievalComponent, ComponentStatus> components() {
		return components;
	}
}
