package com.study.webflux.historian.domain.monitoring.model;

/** 추출 파이프라인의 처리 단계를 정의합니다. 단계는 선언 순서대로만 진행합니다. */
public enum ExtractionPipelineStage {
	/** 태그 목록, 구간, 주기를 검증하고 격자를 만듭니다. */
	VALIDATING,

	/** 태그별 원시 샘플 청크를 조회합니다. */
	RETRIEVING,

	/** 청크를 격자 구간 평균으로 접습니다. */
	RESAMPLING,

	/** 결측 격자 지점을 채웁니다. */
	FILLING,

	/** 태그 시리즈를 하나의 테이블로 병합합니다. */
	MERGING,

	/** 테이블을 CSV로 직렬화해 저장합니다. */
	EXPORTING
}
