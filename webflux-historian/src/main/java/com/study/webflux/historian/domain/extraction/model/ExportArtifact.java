package com.study.webflux.historian.domain.extraction.model;

import java.nio.file.Path;
import java.time.Instant;

/** 요청 하나의 결과로 만들어진 불변 내보내기 파일입니다. */
public record ExportArtifact(
	String name,
	Path location,
	long sizeBytes,
	Instant createdAt
) {
	public ExportArtifact {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("artifact name cannot be null or blank");
		}
		if (location == null) {
			throw new IllegalArgumentException("artifact location cannot be null");
		}
	}
}
