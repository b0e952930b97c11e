package com.study.webflux.historian.domain.extraction.service;

import com.study.webflux.historian.domain.extraction.model.TagSeries;

/**
 * 리샘플링 후 남은 결측 격자 지점을 채우는 정책입니다. 완성된 시리즈 전체를 입력으로 받습니다.
 */
public interface GapFillPolicy {

	TagSeries fill(TagSeries series);
}
