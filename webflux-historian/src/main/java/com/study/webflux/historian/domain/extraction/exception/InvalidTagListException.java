package com.study.webflux.historian.domain.extraction.exception;

public class InvalidTagListException extends HistorianPipelineException {

	public InvalidTagListException(String message) {
		super(message);
	}
}
