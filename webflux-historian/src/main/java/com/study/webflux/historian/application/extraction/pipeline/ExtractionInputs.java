package com.study.webflux.historian.application.extraction.pipeline;

import java.util.List;

import com.study.webflux.historian.domain.extraction.model.TagId;
import com.study.webflux.historian.domain.extraction.model.TimeGrid;

/**
 * 검증 단계를 통과한 파이프라인 입력입니다.
 *
 * @param tags
 *            중복이 제거된 요청 순서의 태그 목록
 * @param grid
 *            모든 태그가 공유하는 격자
 * @param artifactName
 *            생성할 산출물 이름
 */
public record ExtractionInputs(
	List<TagId> tags,
	TimeGrid grid,
	String artifactName
) {
	public ExtractionInputs {
		tags = List.copyOf(tags);
	}
}
