package com.study.webflux.historian.application.monitoring.monitor;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import com.study.webflux.historian.application.monitoring.monitor.ExtractionPipelineTracker.PipelineSummary;
import com.study.webflux.historian.application.monitoring.monitor.ExtractionPipelineTracker.StageSnapshot;
import com.study.webflux.historian.application.monitoring.monitor.ExtractionPipelineTracker.TagSnapshot;

/** 파이프라인 요약을 로그로 남기는 Reporter입니다. */
@Slf4j
@Component
public class LoggingPipelineMetricsReporter implements PipelineMetricsReporter {

	@Override
	public void report(PipelineSummary summary) {
		log.info("Pipeline {} {} in {}ms at stage {} ({})",
			summary.pipelineId(),
			summary.status(),
			summary.durationMillis(),
			summary.lastStage(),
			summary.requestSummary());

		if (!log.isDebugEnabled()) {
			return;
		}
		for (StageSnapshot stage : summary.stages()) {
			log.debug("Pipeline {} stage {} took {}ms", summary.pipelineId(), stage.stage(),
				stage.durationMillis());
		}
		for (TagSnapshot tag : summary.tags().values()) {
			log.debug("Pipeline {} tag {}: chunks={}, samples={}, discarded={}, failed={}",
				summary.pipelineId(), tag.tag(), tag.chunks(), tag.samples(), tag.discarded(),
				tag.failed());
		}
	}
}
