package com.study.webflux.historian.application.extraction.controller;

import lombok.RequiredArgsConstructor;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.study.webflux.historian.application.extraction.controller.docs.ExtractionApi;
import com.study.webflux.historian.application.extraction.dto.ExtractionRequest;
import com.study.webflux.historian.application.extraction.dto.ExtractionResponse;
import com.study.webflux.historian.domain.extraction.exception.HistorianPipelineException;
import com.study.webflux.historian.domain.extraction.exception.InvalidFrequencyException;
import com.study.webflux.historian.domain.extraction.exception.InvalidRangeException;
import com.study.webflux.historian.domain.extraction.exception.InvalidTagListException;
import com.study.webflux.historian.domain.extraction.exception.RetrievalException;
import com.study.webflux.historian.domain.extraction.port.HistorianExtractionUseCase;
import jakarta.validation.Valid;
import reactor.core.publisher.Mono;

@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class ExtractionController implements ExtractionApi {

	private final HistorianExtractionUseCase extractionUseCase;

	@PostMapping(path = "/process", produces = MediaType.APPLICATION_JSON_VALUE)
	public Mono<ExtractionResponse> process(@Valid @RequestBody ExtractionRequest request) {
		return Mono.fromCallable(request::toCommand)
			.flatMap(extractionUseCase::process)
			.map(ExtractionResponse::from)
			.onErrorMap(HistorianPipelineException.class, this::toResponseStatus);
	}

	private ResponseStatusException toResponseStatus(HistorianPipelineException error) {
		return new ResponseStatusException(statusOf(error), error.getMessage(), error);
	}

	private HttpStatus statusOf(HistorianPipelineException error) {
		if (error instanceof InvalidRangeException
			|| error instanceof InvalidFrequencyException
			|| error instanceof InvalidTagListException) {
			return HttpStatus.BAD_REQUEST;
		}
		if (error instanceof RetrievalException) {
			return HttpStatus.BAD_GATEWAY;
		}
		return HttpStatus.INTERNAL_SERVER_ERROR;
	}
}
