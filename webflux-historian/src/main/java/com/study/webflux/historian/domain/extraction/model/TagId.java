package com.study.webflux.historian.domain.extraction.model;

import com.study.webflux.historian.domain.extraction.exception.InvalidTagListException;

/**
 * 히스토리안 저장소의 계측 지점(태그) 식별자입니다. 대소문자를 구분합니다.
 */
public record TagId(
	String value
) {
	public TagId {
		if (value == null || value.isBlank()) {
			throw new InvalidTagListException("tag cannot be null or blank");
		}
	}

	public static TagId of(String value) {
		return new TagId(value);
	}

	@Override
	public String toString() {
		return value;
	}
}
