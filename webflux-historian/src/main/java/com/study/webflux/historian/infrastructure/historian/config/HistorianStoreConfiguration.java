package com.study.webflux.historian.infrastructure.historian.config;

import java.time.Duration;

import javax.sql.DataSource;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import com.study.webflux.historian.domain.extraction.port.HistorianSampleReader;
import com.study.webflux.historian.infrastructure.common.config.properties.HistorianProperties;
import com.study.webflux.historian.infrastructure.historian.adapter.JdbcHistorianSampleReader;

@Configuration
public class HistorianStoreConfiguration {

	/**
	 * 청크 제한 시간을 문장 단위 쿼리 제한 시간으로도 적용한 JdbcTemplate입니다.
	 */
	@Bean
	public JdbcTemplate historianJdbcTemplate(DataSource dataSource, HistorianProperties properties) {
		JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
		Duration chunkTimeout = properties.getRetrieval().getChunkTimeout();
		jdbcTemplate.setQueryTimeout((int) Math.max(1, chunkTimeout.toSeconds()));
		jdbcTemplate.setFetchSize(properties.getStore().getFetchSize());
		return jdbcTemplate;
	}

	@Bean
	public HistorianSampleReader historianSampleReader(JdbcTemplate historianJdbcTemplate,
		HistorianProperties properties) {
		return new JdbcHistorianSampleReader(historianJdbcTemplate,
			properties.getStore(),
			properties.getRetrieval().getChunkTimeout());
	}
}
