package com.study.webflux.historian.domain.extraction.model;

import java.util.List;

/**
 * 추출 요청의 결과입니다.
 *
 * @param failedTags
 *            부분 결과 정책에서 조회에 실패해 전체 결측으로 남은 태그
 * @param emptyTags
 *            구간 안에 원시 샘플이 하나도 없어 전체 결측으로 남은 태그
 */
public record ExtractionResult(
	ExportArtifact artifact,
	int rowCount,
	List<TagId> failedTags,
	List<TagId> emptyTags
) {
	public ExtractionResult {
		failedTags = failedTags == null ? List.of() : List.copyOf(failedTags);
		emptyTags = emptyTags == null ? List.of() : List.copyOf(emptyTags);
	}

	public boolean isPartial() {
		return !failedTags.isEmpty();
	}
}
