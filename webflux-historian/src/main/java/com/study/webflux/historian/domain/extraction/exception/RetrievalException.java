package com.study.webflux.historian.domain.extraction.exception;

import com.study.webflux.historian.domain.extraction.model.TagId;

/**
 * 태그 하나의 원시 샘플 조회가 실패했을 때 발생합니다. 저장소 장애, 청크 타임아웃, 잘못된 행을 모두 포함합니다.
 */
public class RetrievalException extends HistorianPipelineException {

	private final TagId tag;

	public RetrievalException(TagId tag, String message) {
		super(describe(tag, message));
		this.tag = tag;
	}

	public RetrievalException(TagId tag, String message, Throwable cause) {
		super(describe(tag, message), cause);
		this.tag = tag;
	}

	public TagId getTag() {
		return tag;
	}

	private static String describe(TagId tag, String message) {
		return "Retrieval failed for tag " + tag + ": " + message;
	}
}
