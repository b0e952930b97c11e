package com.study.webflux.historian.infrastructure.export.config;

import java.nio.file.Path;
import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.study.webflux.historian.domain.extraction.port.ArtifactSink;
import com.study.webflux.historian.domain.extraction.port.MergedTableWriter;
import com.study.webflux.historian.infrastructure.common.config.properties.HistorianProperties;
import com.study.webflux.historian.infrastructure.export.adapter.CsvMergedTableWriter;
import com.study.webflux.historian.infrastructure.export.adapter.FileSystemArtifactSink;

@Configuration
public class ExportConfiguration {

	@Bean
	public MergedTableWriter mergedTableWriter(HistorianProperties properties) {
		HistorianProperties.Export export = properties.getExport();
		return new CsvMergedTableWriter(export.getTimestampPattern(), export.getDecimalPlaces());
	}

	@Bean
	public ArtifactSink artifactSink(HistorianProperties properties, Clock clock) {
		return new FileSystemArtifactSink(Path.of(properties.getExport().getOutputDir()), clock);
	}
}
