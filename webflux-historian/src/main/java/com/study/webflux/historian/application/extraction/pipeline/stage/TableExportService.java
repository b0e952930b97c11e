package com.study.webflux.historian.application.extraction.pipeline.stage;

import java.util.List;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.historian.application.extraction.pipeline.ExtractionInputs;
import com.study.webflux.historian.application.extraction.pipeline.TagSeriesOutcome;
import com.study.webflux.historian.application.monitoring.service.PipelineTracer;
import com.study.webflux.historian.domain.extraction.model.ExportArtifact;
import com.study.webflux.historian.domain.extraction.model.ExtractionResult;
import com.study.webflux.historian.domain.extraction.model.MergedTable;
import com.study.webflux.historian.domain.extraction.model.TagId;
import com.study.webflux.historian.domain.extraction.port.ArtifactSink;
import com.study.webflux.historian.domain.extraction.port.MergedTableWriter;
import com.study.webflux.historian.domain.extraction.service.SeriesMerger;
import com.study.webflux.historian.domain.monitoring.model.ExtractionPipelineStage;
import reactor.core.publisher.Mono;

@Slf4j
@Service
@RequiredArgsConstructor
public class TableExportService {

	private final SeriesMerger seriesMerger;
	private final MergedTableWriter tableWriter;
	private final ArtifactSink artifactSink;
	private final PipelineTracer pipelineTracer;

	/**
	 * 태그 시리즈를 하나의 테이블로 병합하고 산출물로 저장합니다.
	 */
	public Mono<ExtractionResult> mergeAndExport(ExtractionInputs inputs,
		List<TagSeriesOutcome> outcomes) {
		return pipelineTracer.traceStage(ExtractionPipelineStage.MERGING,
			() -> Mono.fromCallable(() -> seriesMerger.merge(inputs.grid(),
				inputs.tags(),
				outcomes.stream().map(TagSeriesOutcome::series).toList())))
			.flatMap(table -> pipelineTracer.traceStage(ExtractionPipelineStage.EXPORTING,
				() -> export(inputs, table)))
			.map(artifact -> {
				List<TagId> failedTags = outcomes.stream()
					.filter(TagSeriesOutcome::isFailed)
					.map(TagSeriesOutcome::tag)
					.toList();
				List<TagId> emptyTags = outcomes.stream()
					.filter(TagSeriesOutcome::isEmpty)
					.map(TagSeriesOutcome::tag)
					.toList();
				return new ExtractionResult(artifact, inputs.grid().size(), failedTags, emptyTags);
			});
	}

	private Mono<ExportArtifact> export(
		ExtractionInputs inputs,
		MergedTable table) {
		return artifactSink.store(inputs.artifactName(), out -> tableWriter.write(table, out))
			.doOnNext(artifact -> log.info("Exported {} rows x {} tags to {} ({} bytes)",
				table.rowCount(), table.tags().size(), artifact.location(), artifact.sizeBytes()));
	}
}
