package com.study.webflux.recall.domain.query.model;

import java.util.List;

public record TemporalDetection(
	boolean temporal,
	TemporalWindow window,
	List<String> matchedPatterns
) {
	private static final TemporalDetection NONE = new TemporalDetection(false, null, List.of());

	public TemporalDetection {
		if (temporal && window == null) {
			throw new IllegalArgumentException("temporal detection requires a window");
		}
		matchedPatterns = matchedPatterns == null ? List.of() : List.copyOf(matchedPatterns);
	}

	public static TemporalDetection none() {
		return NONE;
	}

	public static TemporalDetection of(TemporalWindow window, List<String> matchedPatterns) {
		return new TemporalDetection(true, window, matchedPatterns);
	}
}
