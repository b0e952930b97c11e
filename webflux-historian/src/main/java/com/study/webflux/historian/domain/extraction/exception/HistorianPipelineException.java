package com.study.webflux.historian.domain.extraction.exception;

/**
 * 추출 파이프라인이 호출자에게 전달하는 모든 오류의 상위 타입입니다.
 */
public abstract class HistorianPipelineException extends RuntimeException {

	protected HistorianPipelineException(String message) {
		super(message);
	}

	protected HistorianPipelineException(String message, Throwable cause) {
		super(message, cause);
	}
}
