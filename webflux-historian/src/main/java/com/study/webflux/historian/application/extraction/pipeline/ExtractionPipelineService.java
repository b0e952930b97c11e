package com.study.webflux.historian.application.extraction.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.historian.application.extraction.pipeline.stage.ExtractionInputService;
import com.study.webflux.historian.application.extraction.pipeline.stage.TableExportService;
import com.study.webflux.historian.application.extraction.pipeline.stage.TagSeriesStreamService;
import com.study.webflux.historian.application.monitoring.aop.MonitoredPipeline;
import com.study.webflux.historian.domain.extraction.model.ExtractionCommand;
import com.study.webflux.historian.domain.extraction.model.ExtractionResult;
import com.study.webflux.historian.domain.extraction.port.HistorianExtractionUseCase;
import reactor.core.publisher.Mono;

/**
 * 검증 → 태그별 조회/리샘플링/결측 채움 → 병합 → 내보내기 순서로 추출 파이프라인을 조립합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExtractionPipelineService implements HistorianExtractionUseCase {

	private final ExtractionInputService inputService;
	private final TagSeriesStreamService tagSeriesStreamService;
	private final TableExportService tableExportService;

	@Override
	@MonitoredPipeline
	public Mono<ExtractionResult> process(ExtractionCommand command) {
		return inputService.prepareInputs(command)
			.flatMap(inputs -> tagSeriesStreamService.assembleAll(inputs)
				.flatMap(outcomes -> tableExportService.mergeAndExport(inputs, outcomes)))
			.doOnNext(result -> {
				if (result.isPartial()) {
					log.warn("Extraction finished with failed tags {}", result.failedTags());
				}
			});
	}
}
