package com.study.webflux.recall.domain.knowledge.service;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 관계 유형 간의 반대/유사 규칙입니다.
 */
public final class RelationshipRules {

	private static final Map<String, Set<String>> OPPOSITES = buildOpposites();

	private static final List<Set<String>> SIMILAR_GROUPS = List.of(
		Set.of("likes", "loves", "enjoys", "prefers", "favorite"),
		Set.of("dislikes", "hates", "avoids"),
		Set.of("does", "plays", "practices"),
		Set.of("owns", "has"));

	private RelationshipRules() {
	}

	/**
	 * 주어진 관계와 동시에 성립할 수 없는 관계 유형입니다.
	 */
	public static Set<String> opposingOf(String relationshipType) {
		return OPPOSITES.getOrDefault(relationshipType, Set.of());
	}

	/**
	 * 같은 의미 그룹에 속한 관계 유형입니다. 자기 자신을 포함하며 그룹이 없으면 자기 자신만 반환합니다.
	 */
	public static Set<String> similarGroupOf(String relationshipType) {
		for (Set<String> group : SIMILAR_GROUPS) {
			if (group.contains(relationshipType)) {
				return group;
			}
		}
		return relationshipType == null ? Set.of() : Set.of(relationshipType);
	}

	/**
	 * 같은 그룹에서 자기 자신을 제외한 관계 유형입니다.
	 */
	public static Set<String> siblingsOf(String relationshipType) {
		Set<String> siblings = new HashSet<>(similarGroupOf(relationshipType));
		siblings.remove(relationshipType);
		return Set.copyOf(siblings);
	}

	private static Map<String, Set<String>> buildOpposites() {
		Map<String, Set<String>> forward = Map.of(
			"likes", Set.of("dislikes", "hates", "avoids"),
			"loves", Set.of("dislikes", "hates", "avoids"),
			"enjoys", Set.of("dislikes", "hates", "avoids"),
			"prefers", Set.of("dislikes", "avoids", "rejects"),
			"favorite", Set.of("dislikes", "hates", "avoids"),
			"wants", Set.of("rejects", "avoids", "dislikes"),
			"needs", Set.of("rejects", "avoids"),
			"supports", Set.of("opposes", "rejects"),
			"trusts", Set.of("distrusts", "suspects"),
			"believes", Set.of("doubts", "rejects"));

		// 반대 관계는 대칭이므로 역방향도 등록
		Map<String, Set<String>> all = new HashMap<>();
		forward.forEach((type, opposites) -> {
			all.computeIfAbsent(type, key -> new HashSet<>()).addAll(opposites);
			opposites.forEach(opposite -> all.computeIfAbsent(opposite, key -> new HashSet<>())
				.add(type));
		});
		Map<String, Set<String>> frozen = new HashMap<>();
		all.forEach((type, opposites) -> frozen.put(type, Set.copyOf(opposites)));
		return Map.copyOf(frozen);
	}
}
