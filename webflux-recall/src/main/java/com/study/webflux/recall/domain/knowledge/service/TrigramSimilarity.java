package com.study.webflux.recall.domain.knowledge.service;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * PostgreSQL pg_trgm 의 similarity() 와 같은 방식의 트라이그램 유사도입니다.
 *
 * <p>
 * 영숫자가 아닌 문자로 단어를 나누고, 각 단어 앞에 공백 두 개, 뒤에 공백 한 개를 붙여 트라이그램 집합을 만든 뒤 자카드 계수를 계산합니다.
 */
public final class TrigramSimilarity {

	private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

	private TrigramSimilarity() {
	}

	public static double similarity(String left, String right) {
		Set<String> a = trigrams(left);
		Set<String> b = trigrams(right);
		if (a.isEmpty() || b.isEmpty()) {
			return 0.0;
		}
		Set<String> intersection = new HashSet<>(a);
		intersection.retainAll(b);
		int union = a.size() + b.size() - intersection.size();
		return (double)intersection.size() / union;
	}

	static Set<String> trigrams(String value) {
		Set<String> result = new HashSet<>();
		if (value == null) {
			return result;
		}
		for (String word : NON_WORD.split(value.toLowerCase(Locale.ROOT))) {
			if (word.isEmpty()) {
				continue;
			}
			String padded = "  " + word + " ";
			for (int i = 0; i + 3 <= padded.length(); i++) {
				result.add(padded.substring(i, i + 3));
			}
		}
		return result;
	}
}
