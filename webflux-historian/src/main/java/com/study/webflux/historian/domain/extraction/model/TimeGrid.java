package com.study.webflux.historian.domain.extraction.model;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * 요청 하나에 대한 정규 시간 격자입니다.
 *
 * <p>
 * {@code start}부터 {@code frequency} 간격으로 {@code size}개의 시각을 가지며 마지막 시각은 {@code end}를 넘지 않습니다.
 * 시각은 인덱스로 계산하므로 격자 전체를 메모리에 올리지 않습니다. 같은 요청의 모든 태그가 읽기 전용으로 공유합니다.
 *
 * <p>
 * 격자 구간은 {@code [g(i), g(i+1))}이고 마지막 구간은 {@code [g(last), end)}로 잘립니다. 경계 시각의 샘플은 그 시각이 여는 구간에
 * 속합니다. 단, {@code end}가 격자 시각이면 마지막 구간은 {@code end}를 포함하므로 {@code end} 시각의 샘플이 마지막 격자 값이 됩니다.
 */
public record TimeGrid(
	LocalDateTime start,
	LocalDateTime end,
	Duration frequency,
	int size
) {
	public TimeGrid {
		Objects.requireNonNull(start, "start");
		Objects.requireNonNull(end, "end");
		Objects.requireNonNull(frequency, "frequency");
		if (size < 1) {
			throw new IllegalArgumentException("grid size must be positive");
		}
	}

	public LocalDateTime timestampAt(int index) {
		Objects.checkIndex(index, size);
		return start.plus(frequency.multipliedBy(index));
	}

	public LocalDateTime last() {
		return timestampAt(size - 1);
	}

	/**
	 * 샘플 시각이 속하는 격자 구간의 인덱스를 반환합니다.
	 *
	 * @return {@code start} 이전이거나 {@code end} 이후라면 -1. {@code end} 시각은 격자 위에 있을 때만 마지막 인덱스로 받습니다.
	 */
	public int indexOf(LocalDateTime timestamp) {
		if (timestamp.equals(end)) {
			return last().equals(end) ? size - 1 : -1;
		}
		if (timestamp.isBefore(start) || timestamp.isAfter(end)) {
			return -1;
		}
		long index = Duration.between(start, timestamp).dividedBy(frequency);
		return index < size ? (int) index : -1;
	}

	public List<LocalDateTime> timestamps() {
		return IntStream.range(0, size).mapToObj(this::timestampAt).toList();
	}
}
