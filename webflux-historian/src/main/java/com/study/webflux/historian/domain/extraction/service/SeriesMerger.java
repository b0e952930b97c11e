package com.study.webflux.historian.domain.extraction.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.study.webflux.historian.domain.extraction.exception.SeriesLengthMismatchException;
import com.study.webflux.historian.domain.extraction.model.MergedTable;
import com.study.webflux.historian.domain.extraction.model.TagId;
import com.study.webflux.historian.domain.extraction.model.TagSeries;
import com.study.webflux.historian.domain.extraction.model.TimeGrid;

/**
 * 같은 격자로 만든 태그 시리즈들을 격자 인덱스 기준으로 묶어 하나의 테이블로 만듭니다.
 *
 * <p>
 * 열 순서는 전달된 시리즈 순서와 무관하게 요청 태그 순서를 따릅니다.
 */
public class SeriesMerger {

	public MergedTable merge(TimeGrid grid, List<TagId> requestedTags, Collection<TagSeries> series) {
		Map<TagId, TagSeries> byTag = new HashMap<>();
		for (TagSeries tagSeries : series) {
			verifyAligned(grid, tagSeries);
			byTag.put(tagSeries.tag(), tagSeries);
		}

		List<TagSeries> columns = new ArrayList<>(requestedTags.size());
		for (TagId tag : requestedTags) {
			TagSeries column = byTag.get(tag);
			if (column == null) {
				throw new SeriesLengthMismatchException("no series produced for tag " + tag);
			}
			columns.add(column);
		}
		return new MergedTable(grid, requestedTags, columns);
	}

	private void verifyAligned(TimeGrid grid, TagSeries series) {
		if (series.length() != grid.size()) {
			throw new SeriesLengthMismatchException(String.format(
				"series for tag %s has %d points, grid has %d",
				series.tag(), series.length(), grid.size()));
		}
		if (!grid.equals(series.grid())) {
			throw new SeriesLengthMismatchException(
				"series for tag " + series.tag() + " was built against a different grid");
		}
	}
}
