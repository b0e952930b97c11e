package com.study.webflux.historian.application.extraction.controller.docs;

import com.study.webflux.historian.application.extraction.dto.ExtractionRequest;
import com.study.webflux.historian.application.extraction.dto.ExtractionResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import reactor.core.publisher.Mono;

@Tag(
	name = "추출 API",
	description = "히스토리안 태그 조회, 리샘플링, CSV 내보내기 파이프라인"
)
public interface ExtractionApi {

	@Operation(
		summary = "태그 추출 및 CSV 내보내기",
		description = "요청 구간의 태그 샘플을 주기별 평균으로 리샘플링하고 결측을 채운 뒤 하나의 CSV 파일로 저장합니다"
	)
	@ApiResponse(responseCode = "200", description = "처리 완료")
	@ApiResponse(responseCode = "400", description = "잘못된 구간, 주기 또는 태그 목록")
	@ApiResponse(responseCode = "502", description = "히스토리안 저장소 조회 실패")
	@ApiResponse(responseCode = "500", description = "병합 또는 내보내기 실패")
	Mono<ExtractionResponse> process(
		@Valid ExtractionRequest request
	);
}
