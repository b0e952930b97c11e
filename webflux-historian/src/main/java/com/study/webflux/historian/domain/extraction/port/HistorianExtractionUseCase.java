package com.study.webflux.historian.domain.extraction.port;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import com.study.webflux.historian.domain.extraction.model.ExtractionCommand;
import com.study.webflux.historian.domain.extraction.model.ExtractionResult;
import com.study.webflux.historian.domain.extraction.model.TagId;
import reactor.core.publisher.Mono;

/**
 * HistorianExtractionUseCase는 태그 추출-리샘플링-병합-내보내기 파이프라인을 실행하는 인터페이스를 정의합니다.
 */
public interface HistorianExtractionUseCase {

	/**
	 * 파이프라인을 실행하고 생성된 산출물 정보를 반환합니다.
	 *
	 * <p>
	 * 검증 오류는 저장소 조회 전에 실패합니다. 조회 실패 처리는 {@code historian.retrieval.failure-policy} 설정을 따릅니다. 모든
	 * 오류는 {@link com.study.webflux.historian.domain.extraction.exception.HistorianPipelineException} 하위
	 * 타입으로 전달됩니다.
	 *
	 * @param command
	 *            태그 목록, 구간, 주기
	 * @return 추출 결과
	 */
	Mono<ExtractionResult> process(ExtractionCommand command);

	default Mono<ExtractionResult> process(List<TagId> tags,
		LocalDateTime start,
		LocalDateTime end,
		Duration frequency) {
		return process(new ExtractionCommand(tags, start, end, frequency, null));
	}
}
