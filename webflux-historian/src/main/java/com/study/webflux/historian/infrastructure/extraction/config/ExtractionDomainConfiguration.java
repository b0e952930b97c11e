package com.study.webflux.historian.infrastructure.extraction.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.study.webflux.historian.domain.extraction.service.ArtifactNameGenerator;
import com.study.webflux.historian.domain.extraction.service.ForwardBackFillPolicy;
import com.study.webflux.historian.domain.extraction.service.GapFillPolicy;
import com.study.webflux.historian.domain.extraction.service.SeriesMerger;
import com.study.webflux.historian.domain.extraction.service.SeriesResampler;
import com.study.webflux.historian.domain.extraction.service.TimeGridBuilder;
import com.study.webflux.historian.infrastructure.common.config.properties.HistorianProperties;

/** 프레임워크에 의존하지 않는 도메인 서비스를 빈으로 등록합니다. */
@Configuration
public class ExtractionDomainConfiguration {

	@Bean
	public TimeGridBuilder timeGridBuilder(HistorianProperties properties) {
		return new TimeGridBuilder(properties.getPipeline().getMaxGridPoints());
	}

	@Bean
	public SeriesResampler seriesResampler() {
		return new SeriesResampler();
	}

	@Bean
	public GapFillPolicy gapFillPolicy() {
		return new ForwardBackFillPolicy();
	}

	@Bean
	public SeriesMerger seriesMerger() {
		return new SeriesMerger();
	}

	@Bean
	public ArtifactNameGenerator artifactNameGenerator(Clock clock, HistorianProperties properties) {
		return new ArtifactNameGenerator(clock, properties.getExport().getDefaultLabel());
	}
}
