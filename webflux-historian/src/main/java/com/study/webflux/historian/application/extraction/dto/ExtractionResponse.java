package com.study.webflux.historian.application.extraction.dto;

import java.util.List;

import com.study.webflux.historian.domain.extraction.model.ExtractionResult;
import com.study.webflux.historian.domain.extraction.model.TagId;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "태그 추출 Response")
public record ExtractionResponse(
	@Schema(description = "처리 결과 메시지", example = "Data processed successfully")
	String message,

	@Schema(description = "생성된 산출물 이름", example = "[\"line1_20240101_120000.csv\"]")
	List<String> processedFiles,

	@Schema(description = "산출물 데이터 행 수", example = "3")
	int rowCount,

	@Schema(description = "조회에 실패해 결측으로 내보낸 태그")
	List<String> failedTags,

	@Schema(description = "구간 안에 샘플이 없던 태그")
	List<String> emptyTags
) {
	public static final String SUCCESS_MESSAGE = "Data processed successfully";

	public static ExtractionResponse from(ExtractionResult result) {
		return new ExtractionResponse(SUCCESS_MESSAGE,
			List.of(result.artifact().name()),
			result.rowCount(),
			result.failedTags().stream().map(TagId::value).toList(),
			result.emptyTags().stream().map(TagId::value).toList());
	}
}
