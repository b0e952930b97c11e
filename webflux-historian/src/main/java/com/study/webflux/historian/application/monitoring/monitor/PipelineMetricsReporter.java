package com.study.webflux.historian.application.monitoring.monitor;

import com.study.webflux.historian.application.monitoring.monitor.ExtractionPipelineTracker.PipelineSummary;

/** 종료된 파이프라인 요약을 외부로 내보냅니다. */
public interface PipelineMetricsReporter {

	void report(PipelineSummary summary);
}
