package com.study.webflux.historian.domain.extraction.exception;

/**
 * 병합 대상 시리즈가 요청 격자와 맞지 않을 때 발생합니다. 상위 단계의 버그를 의미합니다.
 */
public class SeriesLengthMismatchException extends HistorianPipelineException {

	public SeriesLengthMismatchException(String message) {
		super(message);
	}
}
