package com.study.webflux.historian.domain.extraction.service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArtifactNameGeneratorTest {

	private final Clock clock = Clock.fixed(Instant.parse("2024-03-05T14:07:09Z"), ZoneOffset.UTC);
	private final ArtifactNameGenerator generator = new ArtifactNameGenerator(clock, "extraction");

	@Test
	@DisplayName("라벨과 생성 시각으로 이름을 만든다")
	void generate_labelAndStamp() {
		assertThat(generator.generate("line1")).isEqualTo("line1_20240305_140709.csv");
	}

	@Test
	@DisplayName("설정 파일 확장자 .txt는 제거한다")
	void generate_stripsTxtSuffix() {
		assertThat(generator.generate("tags_line1.txt")).isEqualTo("tags_line1_20240305_140709.csv");
	}

	@Test
	@DisplayName("라벨이 없으면 기본 라벨을 사용한다")
	void generate_blankLabel_usesDefault() {
		assertThat(generator.generate(null)).isEqualTo("extraction_20240305_140709.csv");
		assertThat(generator.generate("  ")).isEqualTo("extraction_20240305_140709.csv");
	}

	@Test
	@DisplayName("경로 구분자와 특수 문자는 밑줄로 바꾼다")
	void generate_sanitizesPathCharacters() {
		assertThat(generator.generate("../etc/passwd")).isEqualTo("_etc_passwd_20240305_140709.csv");
		assertThat(generator.generate("라인 1")).isEqualTo("___1_20240305_140709.csv");
	}

	@Test
	@DisplayName("기본 라벨이 비어 있으면 생성할 수 없다")
	void constructor_blankDefault_throws() {
		assertThatThrownBy(() -> new ArtifactNameGenerator(clock, "..."))
			.isInstanceOf(IllegalArgumentException.class);
	}
}
