package com.study.webflux.historian.domain.extraction.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * 격자에 정렬된 태그 하나의 값 시퀀스입니다. 값이 없는 격자 지점은 {@link #ABSENT}(NaN)로 표시합니다.
 */
public record TagSeries(
	TagId tag,
	TimeGrid grid,
	double[] values
) {
	public static final double ABSENT = Double.NaN;

	public TagSeries {
		Objects.requireNonNull(tag, "tag");
		Objects.requireNonNull(grid, "grid");
		Objects.requireNonNull(values, "values");
	}

	public static TagSeries absent(TagId tag, TimeGrid grid) {
		double[] values = new double[grid.size()];
		Arrays.fill(values, ABSENT);
		return new TagSeries(tag, grid, values);
	}

	@Override
	public double[] values() {
		return values.clone();
	}

	public int length() {
		return values.length;
	}

	public double valueAt(int index) {
		return values[index];
	}

	public boolean isAbsent(int index) {
		return Double.isNaN(values[index]);
	}

	public int presentCount() {
		int count = 0;
		for (double value : values) {
			if (!Double.isNaN(value)) {
				count++;
			}
		}
		return count;
	}

	public boolean isEntirelyAbsent() {
		return presentCount() == 0;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof TagSeries series)) {
			return false;
		}
		return tag.equals(series.tag) && grid.equals(series.grid)
			&& Arrays.equals(values, series.values);
	}

	@Override
	public int hashCode() {
		return Objects.hash(tag, grid, Arrays.hashCode(values));
	}

	@Override
	public String toString() {
		return "TagSeries[tag=" + tag + ", grid=" + grid + ", values=" + Arrays.toString(values)
			+ "]";
	}
}
