package com.study.webflux.historian.domain.extraction.model;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 추출 파이프라인 입력입니다. 범위/주기 검증은 파이프라인의 검증 단계에서 수행합니다.
 *
 * @param label
 *            산출물 이름 접두어, 없으면 기본값을 사용합니다
 */
public record ExtractionCommand(
	List<TagId> tags,
	LocalDateTime start,
	LocalDateTime end,
	Duration frequency,
	String label
) {
	public ExtractionCommand {
		tags = tags == null ? List.of() : List.copyOf(tags);
	}

	public static ExtractionCommand of(List<String> tags,
		LocalDateTime start,
		LocalDateTime end,
		Duration frequency) {
		return of(tags, start, end, frequency, null);
	}

	public static ExtractionCommand of(List<String> tags,
		LocalDateTime start,
		LocalDateTime end,
		Duration frequency,
		String label) {
		List<TagId> tagIds = tags == null ? List.of() : tags.stream().map(TagId::of).toList();
		return new ExtractionCommand(tagIds, start, end, frequency, label);
	}

	public String describe() {
		return String.format("tags=%d, window=[%s, %s], frequency=%s", tags.size(), start, end,
			frequency);
	}
}
