package com.study.webflux.historian.application.extraction.pipeline.stage;

import java.util.List;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.historian.application.extraction.pipeline.ExtractionInputs;
import com.study.webflux.historian.application.extraction.pipeline.TagSeriesOutcome;
import com.study.webflux.historian.application.monitoring.service.PipelineTracer;
import com.study.webflux.historian.domain.extraction.exception.HistorianPipelineException;
import com.study.webflux.historian.domain.extraction.exception.RetrievalException;
import com.study.webflux.historian.domain.extraction.model.RetrievalFailurePolicy;
import com.study.webflux.historian.domain.extraction.model.TagId;
import com.study.webflux.historian.domain.extraction.port.HistorianSampleReader;
import com.study.webflux.historian.domain.extraction.service.GapFillPolicy;
import com.study.webflux.historian.domain.extraction.service.SeriesResampler;
import com.study.webflux.historian.domain.extraction.service.SeriesResampler.ResamplingAccumulator;
import com.study.webflux.historian.domain.monitoring.model.ExtractionPipelineStage;
import com.study.webflux.historian.infrastructure.common.config.properties.HistorianProperties;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 태그별로 조회-리샘플링-결측 채움을 수행합니다.
 *
 * <p>
 * 청크는 도착하는 즉시 누산기에 접혀 버려지므로 태그 하나의 메모리 사용량은 격자 크기와 청크 크기에 비례합니다.
 */
@Slf4j
@Service
public class TagSeriesStreamService {

	private final HistorianSampleReader sampleReader;
	private final SeriesResampler resampler;
	private final GapFillPolicy gapFillPolicy;
	private final PipelineTracer pipelineTracer;
	private final int chunkSize;
	private final int tagParallelism;
	private final RetrievalFailurePolicy failurePolicy;

	public TagSeriesStreamService(HistorianSampleReader sampleReader,
		SeriesResampler resampler,
		GapFillPolicy gapFillPolicy,
		PipelineTracer pipelineTracer,
		HistorianProperties properties) {
		this.sampleReader = sampleReader;
		this.resampler = resampler;
		this.gapFillPolicy = gapFillPolicy;
		this.pipelineTracer = pipelineTracer;
		this.chunkSize = requirePositive(properties.getRetrieval().getChunkSize(),
			"historian.retrieval.chunk-size");
		this.tagParallelism = requirePositive(properties.getRetrieval().getTagParallelism(),
			"historian.retrieval.tag-parallelism");
		this.failurePolicy = properties.getRetrieval().getFailurePolicy();
	}

	/**
	 * 모든 태그를 병렬로 처리하고 요청 순서대로 결과를 모읍니다.
	 *
	 * <p>
	 * 부분 결과 정책에서도 모든 태그가 실패하면 첫 번째 실패로 요청을 종료합니다.
	 */
	public Mono<List<TagSeriesOutcome>> assembleAll(ExtractionInputs inputs) {
		return Flux.fromIterable(inputs.tags())
			.flatMapSequential(tag -> assemble(inputs, tag), tagParallelism)
			.collectList()
			.flatMap(outcomes -> {
				boolean allFailed = !outcomes.isEmpty()
					&& outcomes.stream().allMatch(TagSeriesOutcome::isFailed);
				if (allFailed) {
					return Mono.<List<TagSeriesOutcome>>error(outcomes.get(0).failure());
				}
				return Mono.just(outcomes);
			});
	}

	public Mono<TagSeriesOutcome> assemble(ExtractionInputs inputs, TagId tag) {
		return Mono.defer(() -> {
			ResamplingAccumulator accumulator = resampler.open(tag, inputs.grid());
			return pipelineTracer
				.traceRetrieval(tag, () -> sampleReader.fetch(tag,
					inputs.grid().start(),
					inputs.grid().end(),
					chunkSize))
				.onErrorMap(error -> !(error instanceof HistorianPipelineException),
					error -> new RetrievalException(tag, error.getMessage(), error))
				.doOnNext(accumulator::accept)
				.then(pipelineTracer.traceTagCompletion(accumulator))
				.then(Mono.fromCallable(() -> {
					logTagSummary(accumulator);
					return accumulator.finish();
				}))
				.flatMap(series -> pipelineTracer.traceStage(ExtractionPipelineStage.FILLING,
					() -> Mono.fromCallable(() -> gapFillPolicy.fill(series))))
				.map(TagSeriesOutcome::success);
		})
			.onErrorResume(RetrievalException.class, error -> handleFailure(inputs, tag, error));
	}

	private Mono<TagSeriesOutcome> handleFailure(ExtractionInputs inputs,
		TagId tag,
		RetrievalException error) {
		if (failurePolicy == RetrievalFailurePolicy.FAIL_REQUEST) {
			log.error("Retrieval failed for tag {}, failing request", tag, error);
			return Mono.error(error);
		}
		log.warn("Retrieval failed for tag {}, exporting it as absent: {}", tag, error.getMessage());
		return pipelineTracer.traceTagFailure(tag)
			.thenReturn(TagSeriesOutcome.failed(tag, inputs.grid(), error));
	}

	private void logTagSummary(ResamplingAccumulator accumulator) {
		if (accumulator.acceptedCount() == 0) {
			log.warn("No data collected for tag {}", accumulator.tag());
			return;
		}
		log.info("Tag {}: {} samples in {} chunks ({} discarded), span [{}, {}]",
			accumulator.tag(),
			accumulator.acceptedCount(),
			accumulator.chunkCount(),
			accumulator.discardedCount(),
			accumulator.firstTimestamp(),
			accumulator.lastTimestamp());
	}

	private static int requirePositive(int value, String name) {
		if (value <= 0) {
			throw new IllegalStateException(name + " must be positive, got " + value);
		}
		return value;
	}
}
