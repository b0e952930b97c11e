package com.study.webflux.historian.application.monitoring.monitor;

import java.time.Clock;

import org.springframework.stereotype.Component;

@Component
public class ExtractionPipelineMonitor {

	private final PipelineMetricsReporter reporter;
	private final Clock clock;

	public ExtractionPipelineMonitor(PipelineMetricsReporter reporter, Clock clock) {
		this.reporter = reporter;
		this.clock = clock;
	}

	/**
	 * 요청 설명 기준으로 파이프라인 추적기를 생성합니다.
	 */
	public ExtractionPipelineTracker create(String requestSummary) {
		return new ExtractionPipelineTracker(requestSummary, reporter, clock);
	}
}
