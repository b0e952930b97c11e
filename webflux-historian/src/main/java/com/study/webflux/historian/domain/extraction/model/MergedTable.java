package com.study.webflux.historian.domain.extraction.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 격자 시각 하나당 한 행, 요청 태그 하나당 한 열을 가지는 병합 테이블입니다.
 *
 * <p>
 * 행 수는 격자 길이와 같고 열 수는 태그 수 + 1(시각 열)입니다.
 */
public record MergedTable(
	TimeGrid grid,
	List<TagId> tags,
	List<TagSeries> columns
) {
	public MergedTable {
		tags = List.copyOf(tags);
		columns = List.copyOf(columns);
		if (tags.size() != columns.size()) {
			throw new IllegalArgumentException("tag count and column count differ");
		}
	}

	public int rowCount() {
		return grid.size();
	}

	public int columnCount() {
		return tags.size() + 1;
	}

	public LocalDateTime timestampAt(int row) {
		return grid.timestampAt(row);
	}

	public double valueAt(int row, int tagIndex) {
		return columns.get(tagIndex).valueAt(row);
	}

	public boolean isAbsent(int row, int tagIndex) {
		return columns.get(tagIndex).isAbsent(row);
	}
}
