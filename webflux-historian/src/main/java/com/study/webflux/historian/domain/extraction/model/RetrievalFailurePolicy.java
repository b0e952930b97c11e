package com.study.webflux.historian.domain.extraction.model;

/** 태그 단위 조회 실패를 요청 전체에 어떻게 반영할지 정의합니다. */
public enum RetrievalFailurePolicy {
	/** 실패한 태그는 전체 결측 열로 남기고 failedTags로 보고합니다. 모든 태그가 실패하면 요청이 실패합니다. */
	PARTIAL_RESULT,

	/** 첫 번째 태그 실패에서 요청 전체를 실패시키고 나머지 태그 조회를 취소합니다. */
	FAIL_REQUEST
}
