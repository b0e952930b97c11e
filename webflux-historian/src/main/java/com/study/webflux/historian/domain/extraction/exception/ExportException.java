package com.study.webflux.historian.domain.extraction.exception;

/** 병합 테이블 직렬화 또는 산출물 저장이 실패했을 때 발생합니다. */
public class ExportException extends HistorianPipelineException {

	public ExportException(String message) {
		super(message);
	}

	public ExportException(String message, Throwable cause) {
		super(message, cause);
	}
}
