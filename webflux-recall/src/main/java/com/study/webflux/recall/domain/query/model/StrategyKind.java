package com.study.webflux.recall.domain.query.model;

public enum StrategyKind {
	CONTENT_ONLY(NamedVector.CONTENT, NamedVector.SEMANTIC),
	EMOTION_PRIMARY(NamedVector.EMOTION, NamedVector.CONTENT),
	SEMANTIC_PRIMARY(NamedVector.SEMANTIC, NamedVector.CONTENT),
	WEIGHTED_COMBINATION(null, null),
	BALANCED_FUSION(null, null);

	private final NamedVector primary;
	private final NamedVector backup;

	StrategyKind(NamedVector primary, NamedVector backup) {
		this.primary = primary;
		this.backup = backup;
	}

	public boolean isPrimary() {
		return primary != null;
	}

	public NamedVector primary() {
		return primary;
	}

	public NamedVector backup() {
		return backup;
	}

	public static StrategyKind primaryFor(NamedVector vector) {
		return switch (vector) {
			case CONTENT -> CONTENT_ONLY;
			case EMOTION -> EMOTION_PRIMARY;
			case SEMANTIC -> SEMANTIC_PRIMARY;
		};
	}
}
