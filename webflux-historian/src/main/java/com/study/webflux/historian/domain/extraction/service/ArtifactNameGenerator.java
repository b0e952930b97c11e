package com.study.webflux.historian.domain.extraction.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * {@code <label>_<yyyyMMdd_HHmmss>.csv} 형식의 산출물 이름을 만듭니다.
 */
public class ArtifactNameGenerator {

	private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
	private static final String EXTENSION = ".csv";

	private final Clock clock;
	private final String defaultLabel;

	public ArtifactNameGenerator(Clock clock, String defaultLabel) {
		this.clock = clock;
		this.defaultLabel = sanitize(defaultLabel);
		if (this.defaultLabel.isEmpty()) {
			throw new IllegalArgumentException("default label cannot be blank");
		}
	}

	public String generate(String label) {
		String prefix = label == null ? "" : sanitize(stripConfigurationSuffix(label.trim()));
		if (prefix.isEmpty()) {
			prefix = defaultLabel;
		}
		return prefix + "_" + LocalDateTime.now(clock).format(STAMP) + EXTENSION;
	}

	private static String stripConfigurationSuffix(String label) {
		return label.endsWith(".txt") ? label.substring(0, label.length() - 4) : label;
	}

	private static String sanitize(String label) {
		if (label == null) {
			return "";
		}
		String sanitized = label.replaceAll("[^A-Za-z0-9._-]", "_");
		// 숨김 파일이나 상위 경로로 해석되지 않도록 선행 점은 제거
		return sanitized.replaceFirst("^\\.+", "");
	}
}
