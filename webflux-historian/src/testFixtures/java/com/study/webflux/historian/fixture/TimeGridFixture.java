package com.study.webflux.historian.fixture;

import java.time.Duration;
import java.time.LocalDateTime;

import com.study.webflux.historian.domain.extraction.model.TimeGrid;
import com.study.webflux.historian.domain.extraction.service.TimeGridBuilder;

public final class TimeGridFixture {

	public static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 0, 0, 0);
	public static final LocalDateTime END = LocalDateTime.of(2024, 1, 1, 1, 0, 0);
	public static final Duration FREQUENCY = Duration.ofMinutes(30);

	private TimeGridFixture() {
	}

	/** 00:00, 00:30, 01:00 세 지점의 격자 */
	public static TimeGrid create() {
		return create(START, END, FREQUENCY);
	}

	public static TimeGrid create(LocalDateTime start, LocalDateTime end, Duration frequency) {
		return new TimeGridBuilder(1_000_000).build(start, end, frequency);
	}

	public static LocalDateTime at(int hour, int minute) {
		return at(hour, minute, 0);
	}

	public static LocalDateTime at(int hour, int minute, int second) {
		return LocalDateTime.of(2024, 1, 1, hour, minute, second);
	}
}
