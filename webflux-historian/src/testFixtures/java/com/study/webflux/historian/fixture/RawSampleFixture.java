package com.study.webflux.historian.fixture;

import java.time.LocalDateTime;
import java.util.List;

import com.study.webflux.historian.domain.extraction.model.RawSample;
import com.study.webflux.historian.domain.extraction.model.TagId;

public final class RawSampleFixture {

	private RawSampleFixture() {
	}

	public static RawSample create(String tag, LocalDateTime timestamp, double value) {
		return RawSample.of(TagId.of(tag), timestamp, value);
	}

	/** T1: 00:05=5, 00:40=7 */
	public static List<RawSample> t1Samples() {
		return List.of(
			create("T1", TimeGridFixture.at(0, 5), 5.0),
			create("T1", TimeGridFixture.at(0, 40), 7.0));
	}
}
