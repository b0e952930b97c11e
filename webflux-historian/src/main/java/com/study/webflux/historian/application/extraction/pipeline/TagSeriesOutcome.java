package com.study.webflux.historian.application.extraction.pipeline;

import com.study.webflux.historian.domain.extraction.exception.RetrievalException;
import com.study.webflux.historian.domain.extraction.model.TagId;
import com.study.webflux.historian.domain.extraction.model.TagSeries;
import com.study.webflux.historian.domain.extraction.model.TimeGrid;

/**
 * 태그 하나의 파이프라인 결과입니다. 조회에 실패한 태그는 전체 결측 시리즈와 실패 원인을 함께 가집니다.
 */
public record TagSeriesOutcome(
	TagId tag,
	TagSeries series,
	RetrievalException failure
) {

	public static TagSeriesOutcome success(TagSeries series) {
		return new TagSeriesOutcome(series.tag(), series, null);
	}

	public static TagSeriesOutcome failed(TagId tag, TimeGrid grid, RetrievalException failure) {
		return new TagSeriesOutcome(tag, TagSeries.absent(tag, grid), failure);
	}

	public boolean isFailed() {
		return failure != null;
	}

	public boolean isEmpty() {
		return !isFailed() && series.isEntirelyAbsent();
	}
}
