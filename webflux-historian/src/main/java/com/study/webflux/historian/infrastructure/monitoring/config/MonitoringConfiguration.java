package com.study.webflux.historian.infrastructure.monitoring.config;

import java.time.Clock;
import java.util.List;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import com.study.webflux.historian.application.monitoring.monitor.LoggingPipelineMetricsReporter;
import com.study.webflux.historian.application.monitoring.monitor.PipelineMetricsReporter;
import com.study.webflux.historian.infrastructure.monitoring.micrometer.CompositePipelineMetricsReporter;
import com.study.webflux.historian.infrastructure.monitoring.micrometer.MicrometerPipelineMetricsReporter;

/** 파이프라인 모니터링 설정을 제공합니다. */
@Configuration
public class MonitoringConfiguration {

	/** 로그 + Micrometer Reporter를 조합한 Composite Reporter를 생성합니다. */
	@Bean
	@Primary
	public PipelineMetricsReporter compositePipelineMetricsReporter(
		LoggingPipelineMetricsReporter loggingReporter,
		MicrometerPipelineMetricsReporter micrometerReporter) {
		return new CompositePipelineMetricsReporter(List.of(loggingReporter, micrometerReporter));
	}

	@Bean
	@ConditionalOnMissingBean
	public Clock clock() {
		return Clock.systemDefaultZone();
	}
}
