package com.study.webflux.recall.infrastructure.vectordb.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

public record QdrantFilter(
	List<FilterCondition> must
) {
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record FilterCondition(
		String key,
		Match match,
		Range range
	) {
		public static FilterCondition matchValue(String key, Object value) {
			return new FilterCondition(key, new Match(value), null);
		}

		public static FilterCondition range(String key, Double gte, Double lt) {
			return new FilterCondition(key, null, new Range(gte, lt));
		}
	}

	public record Match(
		Object value
	) {
	}

	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record Range(
		Double gte,
		Double lt
	) {
	}
}
