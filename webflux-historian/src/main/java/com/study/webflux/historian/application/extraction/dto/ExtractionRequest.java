package com.study.webflux.historian.application.extraction.dto;

import java.time.LocalDateTime;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.study.webflux.historian.domain.extraction.model.ExtractionCommand;
import com.study.webflux.historian.domain.extraction.service.FrequencyParser;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

@Schema(description = "태그 추출 Request")
public record ExtractionRequest(
	@Schema(description = "추출할 태그 이름 목록(요청 순서대로 열이 배치됨)", example = "[\"T1\", \"T2\"]")
	@NotEmpty List<String> tags,

	@Schema(description = "구간 시작", example = "2024-01-01 00:00:00")
	@JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
	@NotNull LocalDateTime startDate,

	@Schema(description = "구간 끝", example = "2024-01-01 00:02:00")
	@JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
	@NotNull LocalDateTime endDate,

	@Schema(description = "리샘플링 주기(HH:MM:SS)", example = "00:01:00")
	@NotBlank String frequency,

	@Schema(description = "산출물 이름 접두어", example = "line1", nullable = true)
	String label
) {

	public ExtractionCommand toCommand() {
		return ExtractionCommand.of(tags, startDate, endDate, FrequencyParser.parse(frequency), label);
	}
}
