package com.study.webflux.historian.domain.extraction.service;

import java.time.Duration;
import java.time.LocalDateTime;

import com.study.webflux.historian.domain.extraction.exception.InvalidFrequencyException;
import com.study.webflux.historian.domain.extraction.exception.InvalidRangeException;
import com.study.webflux.historian.domain.extraction.model.TimeGrid;

/**
 * (start, end, frequency) 조합으로 정규 시간 격자를 만듭니다. 같은 입력에는 항상 같은 격자를 반환합니다.
 */
public class TimeGridBuilder {

	private final long maxGridPoints;

	public TimeGridBuilder(long maxGridPoints) {
		if (maxGridPoints < 1) {
			throw new IllegalArgumentException("maxGridPoints must be positive");
		}
		this.maxGridPoints = Math.min(maxGridPoints, Integer.MAX_VALUE);
	}

	/**
	 * {@code start <= t <= end}를 만족하는 격자를 생성합니다. 길이는 {@code floor((end - start) / frequency) + 1}입니다.
	 *
	 * @throws InvalidRangeException
	 *             구간이 비었거나 {@code end < start}이거나 격자가 허용 크기를 넘는 경우
	 * @throws InvalidFrequencyException
	 *             주기가 없거나 0 이하인 경우
	 */
	public TimeGrid build(LocalDateTime start, LocalDateTime end, Duration frequency) {
		if (start == null || end == null) {
			throw new InvalidRangeException("start and end are required");
		}
		if (end.isBefore(start)) {
			throw new InvalidRangeException(
				"end " + end + " is before start " + start);
		}
		if (frequency == null || frequency.isZero() || frequency.isNegative()) {
			throw new InvalidFrequencyException("frequency must be positive, got " + frequency);
		}

		long steps = Duration.between(start, end).dividedBy(frequency);
		long size = steps + 1;
		if (size > maxGridPoints) {
			throw new InvalidRangeException(String.format(
				"window [%s, %s] at %s yields %d grid points, limit is %d",
				start, end, frequency, size, maxGridPoints));
		}
		return new TimeGrid(start, end, frequency, (int) size);
	}
}
