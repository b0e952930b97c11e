package com.study.webflux.historian.infrastructure.monitoring.micrometer;

import java.util.concurrent.TimeUnit;

import org.springframework.stereotype.Component;

import com.study.webflux.historian.application.monitoring.monitor.ExtractionPipelineTracker.PipelineSummary;
import com.study.webflux.historian.application.monitoring.monitor.ExtractionPipelineTracker.StageSnapshot;
import com.study.webflux.historian.application.monitoring.monitor.ExtractionPipelineTracker.TagSnapshot;
import com.study.webflux.historian.application.monitoring.monitor.PipelineMetricsReporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Micrometer를 사용하여 추출 파이프라인 메트릭을 Prometheus로 내보내는 Reporter입니다.
 */
@Component
public class MicrometerPipelineMetricsReporter implements PipelineMetricsReporter {

	static final String METRIC_PREFIX = "historian.pipeline";

	private final MeterRegistry meterRegistry;

	public MicrometerPipelineMetricsReporter(MeterRegistry meterRegistry) {
		this.meterRegistry = meterRegistry;
	}

	@Override
	public void report(PipelineSummary summary) {
		recordPipelineMetrics(summary);
		recordStageMetrics(summary);
		recordTagMetrics(summary);
	}

	private void recordPipelineMetrics(PipelineSummary summary) {
		String status = summary.status().name().toLowerCase();

		// 파이프라인 실행 시간
		Timer.builder(METRIC_PREFIX + ".duration")
			.tag("status", status)
			.description("Total extraction pipeline execution time")
			.register(meterRegistry)
			.record(summary.durationMillis(), TimeUnit.MILLISECONDS);

		Counter.builder(METRIC_PREFIX + ".executions")
			.tag("status", status)
			.description("Number of extraction pipeline executions")
			.register(meterRegistry)
			.increment();
	}

	private void recordStageMetrics(PipelineSummary summary) {
		for (StageSnapshot stage : summary.stages()) {
			if (stage.durationMillis() < 0) {
				continue;
			}
			Timer.builder(METRIC_PREFIX + ".stage.duration")
				.tag("stage", stage.stage().name().toLowerCase())
				.description("Extraction stage execution time")
				.register(meterRegistry)
				.record(stage.durationMillis(), TimeUnit.MILLISECONDS);
		}
	}

	private void recordTagMetrics(PipelineSummary summary) {
		long failedTags = 0;
		for (TagSnapshot tag : summary.tags().values()) {
			meterRegistry.counter(METRIC_PREFIX + ".chunks").increment(tag.chunks());
			meterRegistry.counter(METRIC_PREFIX + ".samples").increment(tag.samples());
			meterRegistry.counter(METRIC_PREFIX + ".samples.discarded").increment(tag.discarded());
			if (tag.failed()) {
				failedTags++;
			}
		}
		if (failedTags > 0) {
			meterRegistry.counter(METRIC_PREFIX + ".tags.failed").increment(failedTags);
		}
	}
}
