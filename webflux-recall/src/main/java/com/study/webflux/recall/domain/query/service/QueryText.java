package com.study.webflux.recall.domain.query.service;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 소문자 정규화와 토큰 분리를 마친 질의 텍스트입니다.
 */
public final class QueryText {

	private static final Pattern SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}']+");
	private static final List<String> INFLECTIONS = List.of("", "s", "es", "d", "ed", "ing");

	private final List<String> tokens;
	private final String padded;

	private QueryText(String raw) {
		String normalized = raw == null ? "" : raw.toLowerCase(Locale.ROOT).trim();
		this.tokens = Arrays.stream(SEPARATOR.split(normalized))
			.filter(token -> !token.isEmpty())
			.toList();
		this.padded = " " + String.join(" ", tokens) + " ";
	}

	public static QueryText of(String raw) {
		return new QueryText(raw);
	}

	public boolean isBlank() {
		return tokens.isEmpty();
	}

	/**
	 * 키워드(또는 여러 단어로 된 구)가 토큰 경계에 맞춰 정확히 등장하는지 확인합니다.
	 */
	public boolean hasPhrase(String keyword) {
		String phrase = canonical(keyword);
		return !phrase.isEmpty() && padded.contains(" " + phrase + " ");
	}

	/**
	 * 토큰 경계와 무관하게 부분 문자열로 등장하는지 확인합니다.
	 */
	public boolean hasSubstring(String keyword) {
		String phrase = canonical(keyword);
		return !phrase.isEmpty() && padded.contains(phrase);
	}

	/**
	 * 단일 단어 키워드는 간단한 어미 변화(s, es, d, ed, ing)까지 허용합니다.
	 */
	public boolean hasInflected(String keyword) {
		String phrase = canonical(keyword);
		if (phrase.isEmpty()) {
			return false;
		}
		if (phrase.indexOf(' ') >= 0) {
			return hasPhrase(phrase);
		}
		for (String token : tokens) {
			if (!token.startsWith(phrase)) {
				continue;
			}
			String suffix = token.substring(phrase.length());
			if (INFLECTIONS.contains(suffix)) {
				return true;
			}
		}
		return false;
	}

	private static String canonical(String keyword) {
		if (keyword == null) {
			return "";
		}
		return String.join(" ", Arrays.stream(SEPARATOR.split(keyword.toLowerCase(Locale.ROOT)))
			.filter(token -> !token.isEmpty())
			.toList());
	}
}
