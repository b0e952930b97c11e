package com.study.webflux.historian.fixture;

import java.util.List;

import com.study.webflux.historian.domain.extraction.model.ExtractionCommand;

public final class ExtractionCommandFixture {

	public static final String DEFAULT_LABEL = "line1";

	private ExtractionCommandFixture() {
	}

	/** T1, T2 / 00:00 ~ 01:00 / 30분 */
	public static ExtractionCommand create() {
		return create(List.of("T1", "T2"));
	}

	public static ExtractionCommand create(List<String> tags) {
		return ExtractionCommand.of(tags,
			TimeGridFixture.START,
			TimeGridFixture.END,
			TimeGridFixture.FREQUENCY,
			DEFAULT_LABEL);
	}
}
