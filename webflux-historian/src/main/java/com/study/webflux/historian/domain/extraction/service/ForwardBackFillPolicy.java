package com.study.webflux.historian.domain.extraction.service;

import com.study.webflux.historian.domain.extraction.model.TagSeries;

/**
 * 직전 값으로 앞에서부터 채운 뒤, 선행 결측 구간만 가장 가까운 뒤쪽 값으로 채웁니다.
 *
 * <p>
 * 뒤쪽 채움은 전방 탐색이 필요하므로 스트리밍이 아닌 배치 단계입니다. 값이 하나도 없는 시리즈는 그대로 전체 결측입니다.
 */
public class ForwardBackFillPolicy implements GapFillPolicy {

	@Override
	public TagSeries fill(TagSeries series) {
		double[] values = series.values();
		int firstPresent = -1;
		double previous = TagSeries.ABSENT;

		for (int i = 0; i < values.length; i++) {
			if (Double.isNaN(values[i])) {
				values[i] = previous;
				continue;
			}
			if (firstPresent < 0) {
				firstPresent = i;
			}
			previous = values[i];
		}

		if (firstPresent < 0) {
			return series;
		}
		for (int i = 0; i < firstPresent; i++) {
			values[i] = values[firstPresent];
		}
		return new TagSeries(series.tag(), series.grid(), values);
	}
}
