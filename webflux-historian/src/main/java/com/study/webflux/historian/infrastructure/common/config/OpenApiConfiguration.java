package com.study.webflux.historian.infrastructure.common.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.models.GroupedOpenApi;

/**
 * 추출 API 문서 설정입니다. 추출 엔드포인트는 {@code extraction} 그룹으로 따로 노출합니다.
 */
@Configuration
public class OpenApiConfiguration {

	public static final String EXTRACTION_GROUP = "extraction";

	@Bean
	public OpenAPI historianOpenApi(@Value("${spring.application.name:historian-extractor}") String applicationName) {
		return new OpenAPI()
			.info(new Info()
				.title(applicationName)
				.description("Historian tag retrieval on a regular time grid, exported as one CSV per request")
				.version("0.1.0"));
	}

	@Bean
	public GroupedOpenApi extractionApiGroup() {
		return GroupedOpenApi.builder()
			.group(EXTRACTION_GROUP)
			.pathsToMatch("/api/**")
			.build();
	}
}
