package com.study.webflux.historian.domain.extraction.model;

import java.time.LocalDateTime;

public record RawSample(
	TagId tag,
	LocalDateTime timestamp,
	double value
) {
	public RawSample {
		if (tag == null) {
			throw new IllegalArgumentException("tag cannot be null");
		}
		if (timestamp == null) {
			throw new IllegalArgumentException("timestamp cannot be null");
		}
	}

	public static RawSample of(TagId tag, LocalDateTime timestamp, double value) {
		return new RawSample(tag, timestamp, value);
	}
}
