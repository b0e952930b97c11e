package com.study.webflux.historian.domain.extraction.exception;

/** 조회 구간이 잘못되었거나 격자가 허용 크기를 넘을 때 발생합니다. */
public class InvalidRangeException extends HistorianPipelineException {

	public InvalidRangeException(String message) {
		super(message);
	}
}
