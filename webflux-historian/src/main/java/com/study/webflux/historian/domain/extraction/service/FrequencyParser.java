package com.study.webflux.historian.domain.extraction.service;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.study.webflux.historian.domain.extraction.exception.InvalidFrequencyException;

/**
 * {@code HH:MM:SS} 형식의 리샘플링 주기를 초 단위 {@link Duration}으로 변환합니다.
 */
public final class FrequencyParser {

	private static final Pattern HH_MM_SS = Pattern.compile("^(\\d{1,4}):([0-5]?\\d):([0-5]?\\d)$");

	private FrequencyParser() {
	}

	public static Duration parse(String text) {
		if (text == null) {
			throw new InvalidFrequencyException("frequency is required");
		}
		Matcher matcher = HH_MM_SS.matcher(text.trim());
		if (!matcher.matches()) {
			throw new InvalidFrequencyException(
				"Invalid time format. Expected HH:MM:SS, got " + text);
		}
		long hours = Long.parseLong(matcher.group(1));
		long minutes = Long.parseLong(matcher.group(2));
		long seconds = Long.parseLong(matcher.group(3));

		Duration frequency = Duration.ofHours(hours).plusMinutes(minutes).plusSeconds(seconds);
		if (frequency.isZero()) {
			throw new InvalidFrequencyException("frequency must be positive, got " + text);
		}
		return frequency;
	}

	public static String format(Duration frequency) {
		long totalSeconds = frequency.getSeconds();
		return String.format("%02d:%02d:%02d", totalSeconds / 3600, (totalSeconds % 3600) / 60,
			totalSeconds % 60);
	}
}
