package com.study.webflux.historian.domain.extraction.exception;

/** 리샘플링 주기가 0 이하이거나 형식이 잘못되었을 때 발생합니다. */
public class InvalidFrequencyException extends HistorianPipelineException {

	public InvalidFrequencyException(String message) {
		super(message);
	}
}
