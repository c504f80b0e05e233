package com.study.webflux.recall.domain.query.service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.study.webflux.recall.domain.query.model.RecallQuery;
import com.study.webflux.recall.domain.query.model.TemporalDetection;
import com.study.webflux.recall.domain.query.model.TemporalDirection;
import com.study.webflux.recall.domain.query.model.TemporalScope;
import com.study.webflux.recall.domain.query.model.TemporalWindow;

/**
 * 질의가 유사도 검색이 아닌 시간순 조회를 원하는지, 원한다면 어느 방향인지 판별합니다.
 *
 * <p>
 * OLDEST 는 반드시 오름차순 조회와 작은 개수 제한으로 이어져야 합니다. "가장 최근 N개" 경로를 재사용하면 첫 대화를 물었을 때 마지막 대화가
 * 반환됩니다.
 */
public class TemporalQueryDetector {

	private static final List<String> OLDEST_PATTERNS = List.of("very first",
		"first",
		"earliest",
		"initial",
		"when did we start",
		"at first",
		"started with",
		"beginning of");

	private static final List<String> NEWEST_PATTERNS = List.of("most recent",
		"latest",
		"last",
		"recently",
		"recent",
		"just now",
		"a moment ago",
		"moments ago",
		"just said",
		"just told");

	private static final Pattern UNITS_AGO = Pattern.compile(
		"\\b(\\d+|a|an|one|two|three|four|five|six|seven|eight|nine|ten)\\s+(minute|hour|day|week)s?\\s+ago\\b",
		Pattern.CASE_INSENSITIVE);
	private static final Pattern YESTERDAY = boundary("yesterday");
	private static final Pattern LAST_WEEK = boundary("last week");
	private static final Pattern THIS_MORNING = boundary("this morning");
	private static final Pattern TODAY = boundary("today");

	private static final Map<String, Integer> NUMBER_WORDS = Map.ofEntries(Map.entry("a", 1),
		Map.entry("an", 1),
		Map.entry("one", 1),
		Map.entry("two", 2),
		Map.entry("three", 3),
		Map.entry("four", 4),
		Map.entry("five", 5),
		Map.entry("six", 6),
		Map.entry("seven", 7),
		Map.entry("eight", 8),
		Map.entry("nine", 9),
		Map.entry("ten", 10));

	private static final int MAX_UNITS = 10_000;

	private final TemporalSettings settings;
	private final List<Pattern> oldestPatterns;
	private final List<Pattern> newestPatterns;

	public TemporalQueryDetector(TemporalSettings settings) {
		this.settings = settings;
		this.oldestPatterns = OLDEST_PATTERNS.stream().map(TemporalQueryDetector::boundary).toList();
		this.newestPatterns = NEWEST_PATTERNS.stream().map(TemporalQueryDetector::boundary).toList();
	}

	public TemporalDetection detect(RecallQuery query) {
		return detect(query.text(), query.turnAt());
	}

	public TemporalDetection detect(String text, Instant turnAt) {
		if (text == null || text.isBlank()) {
			return TemporalDetection.none();
		}
		String normalized = text.toLowerCase(Locale.ROOT);
		Instant now = turnAt == null ? Instant.now() : turnAt;

		List<String> oldest = matches(normalized, OLDEST_PATTERNS, oldestPatterns);
		List<String> matched = new ArrayList<>(oldest);

		TemporalWindow range = relativeRange(normalized, now, !oldest.isEmpty(), matched);
		if (range != null) {
			return TemporalDetection.of(range, matched);
		}

		if (!oldest.isEmpty()) {
			TemporalWindow window = new TemporalWindow(TemporalDirection.OLDEST,
				TemporalScope.SESSION,
				settings.oldestLimit(),
				now.minus(settings.sessionWindow()),
				now);
			return TemporalDetection.of(window, matched);
		}

		List<String> newest = matches(normalized, NEWEST_PATTERNS, newestPatterns);
		if (!newest.isEmpty()) {
			TemporalWindow window = new TemporalWindow(TemporalDirection.NEWEST,
				TemporalScope.ALL_TIME,
				settings.newestLimit(),
				null,
				null);
			return TemporalDetection.of(window, newest);
		}
		return TemporalDetection.none();
	}

	private TemporalWindow relativeRange(String text,
		Instant now,
		boolean oldestRequested,
		List<String> matched) {
		Instant from = null;
		Instant to = null;

		Matcher unitsAgo = UNITS_AGO.matcher(text);
		if (unitsAgo.find()) {
			int amount = parseAmount(unitsAgo.group(1));
			Duration unit = unitOf(unitsAgo.group(2));
			from = now.minus(unit.multipliedBy(amount + 1L));
			to = now.minus(unit.multipliedBy(Math.max(0, amount - 1L)));
			matched.add(unitsAgo.group());
		} else if (YESTERDAY.matcher(text).find()) {
			LocalDate today = LocalDate.ofInstant(now, settings.zone());
			from = today.minusDays(1).atStartOfDay(settings.zone()).toInstant();
			to = today.atStartOfDay(settings.zone()).toInstant();
			matched.add("yesterday");
		} else if (LAST_WEEK.matcher(text).find()) {
			from = now.minus(7, ChronoUnit.DAYS);
			to = now;
			matched.add("last week");
		} else if (THIS_MORNING.matcher(text).find() || TODAY.matcher(text).find()) {
			from = LocalDate.ofInstant(now, settings.zone()).atStartOfDay(settings.zone()).toInstant();
			to = now;
			matched.add(text.contains("this morning") ? "this morning" : "today");
		}

		if (from == null) {
			return null;
		}
		TemporalDirection direction = oldestRequested ? TemporalDirection.OLDEST : TemporalDirection.NEWEST;
		int limit = oldestRequested ? settings.oldestLimit() : settings.newestLimit();
		return new TemporalWindow(direction, TemporalScope.RANGE, limit, from, to);
	}

	private List<String> matches(String text, List<String> names, List<Pattern> patterns) {
		List<String> found = new ArrayList<>();
		for (int i = 0; i < patterns.size(); i++) {
			if (patterns.get(i).matcher(text).find()) {
				found.add(names.get(i));
			}
		}
		return found;
	}

	private int parseAmount(String token) {
		Integer word = NUMBER_WORDS.get(token.toLowerCase(Locale.ROOT));
		if (word != null) {
			return word;
		}
		try {
			return Math.min(MAX_UNITS, Math.max(1, Integer.parseInt(token)));
		} catch (NumberFormatException e) {
			return 1;
		}
	}

	private Duration unitOf(String unit) {
		return switch (unit.toLowerCase(Locale.ROOT)) {
			case "minute" -> Duration.ofMinutes(1);
			case "hour" -> Duration.ofHours(1);
			case "day" -> Duration.ofDays(1);
			default -> Duration.ofDays(7);
		};
	}

	private static Pattern boundary(String phrase) {
		return Pattern.compile("\\b" + Pattern.quote(phrase).replace(" ", "\\E\\s+\\Q") + "\\b",
			Pattern.CASE_INSENSITIVE);
	}
}
