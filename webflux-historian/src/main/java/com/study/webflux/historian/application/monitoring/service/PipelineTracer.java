package com.study.webflux.historian.application.monitoring.service;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import org.springframework.stereotype.Component;

import com.study.webflux.historian.application.monitoring.context.PipelineContext;
import com.study.webflux.historian.application.monitoring.monitor.ExtractionPipelineTracker;
import com.study.webflux.historian.domain.extraction.model.RawSample;
import com.study.webflux.historian.domain.extraction.model.TagId;
import com.study.webflux.historian.domain.extraction.service.SeriesResampler.ResamplingAccumulator;
import com.study.webflux.historian.domain.monitoring.model.ExtractionPipelineStage;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Reactor 컨텍스트의 추적기에 단계 전이와 태그 카운터를 기록합니다. 추적기가 없으면 원래 스트림을 그대로 반환합니다.
 */
@Component
public class PipelineTracer {

	public <T> Mono<T> traceStage(ExtractionPipelineStage stage, Supplier<Mono<T>> supplier) {
		return Mono.deferContextual(contextView -> {
			ExtractionPipelineTracker tracker = PipelineContext.findTracker(contextView);
			if (tracker != null) {
				tracker.advanceTo(stage);
			}
			return supplier.get();
		});
	}

	/**
	 * 조회 단계로 전이하고, 첫 청크가 도착하면 리샘플링 단계로 전이하며 청크별 샘플 수를 기록합니다.
	 */
	public Flux<List<RawSample>> traceRetrieval(TagId tag,
		Supplier<Flux<List<RawSample>>> supplier) {
		return Flux.deferContextual(contextView -> {
			ExtractionPipelineTracker tracker = PipelineContext.findTracker(contextView);
			if (tracker == null) {
				return supplier.get();
			}
			tracker.advanceTo(ExtractionPipelineStage.RETRIEVING);
			AtomicBoolean firstChunk = new AtomicBoolean(true);
			return supplier.get().doOnNext(chunk -> {
				if (firstChunk.compareAndSet(true, false)) {
					tracker.advanceTo(ExtractionPipelineStage.RESAMPLING);
				}
				tracker.recordChunk(tag, chunk.size());
			});
		});
	}

	public Mono<Void> traceTagCompletion(ResamplingAccumulator accumulator) {
		return Mono.deferContextual(contextView -> {
			ExtractionPipelineTracker tracker = PipelineContext.findTracker(contextView);
			if (tracker != null) {
				tracker.recordDiscarded(accumulator.tag(), accumulator.discardedCount());
			}
			return Mono.empty();
		});
	}

	public Mono<Void> traceTagFailure(TagId tag) {
		return Mono.deferContextual(contextView -> {
			ExtractionPipelineTracker tracker = PipelineContext.findTracker(contextView);
			if (tracker != null) {
				tracker.recordTagFailure(tag);
			}
			return Mono.empty();
		});
	}
}
