package com.study.webflux.historian.infrastructure.monitoring.micrometer;

import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.study.webflux.historian.application.monitoring.monitor.ExtractionPipelineTracker.PipelineSummary;
import com.study.webflux.historian.application.monitoring.monitor.PipelineMetricsReporter;

/**
 * 여러 PipelineMetricsReporter를 조합하여 하나의 Reporter로 제공합니다. 한 Reporter의 실패가 나머지 Reporter나 요청 결과에
 * 영향을 주지 않습니다.
 */
@Slf4j
public class CompositePipelineMetricsReporter implements PipelineMetricsReporter {

	private final List<PipelineMetricsReporter> reporters;

	public CompositePipelineMetricsReporter(List<PipelineMetricsReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	@Override
	public void report(PipelineSummary summary) {
		for (PipelineMetricsReporter reporter : reporters) {
			try {
				reporter.report(summary);
			} catch (RuntimeException e) {
				log.warn("Pipeline metrics reporter {} failed for {}",
					reporter.getClass().getSimpleName(), summary.pipelineId(), e);
			}
		}
	}
}
