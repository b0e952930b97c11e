package com.study.webflux.historian.infrastructure.common.config.properties;

import java.time.Duration;

import lombok.Getter;
import lombok.Setter;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.study.webflux.historian.domain.extraction.model.RetrievalFailurePolicy;

@Getter
@Setter
@ConfigurationProperties(prefix = "historian")
public class HistorianProperties {

	private Retrieval retrieval = new Retrieval();
	private Pipeline pipeline = new Pipeline();
	private Export export = new Export();
	private Store store = new Store();

	@Getter
	@Setter
	public static class Retrieval {
		private int chunkSize = 5000;
		private Duration chunkTimeout = Duration.ofSeconds(30);
		private int tagParallelism = 4;
		private RetrievalFailurePolicy failurePolicy = RetrievalFailurePolicy.PARTIAL_RESULT;
	}

	@Getter
	@Setter
	public static class Pipeline {
		private long maxGridPoints = 5_000_000L;
	}

	@Getter
	@Setter
	public static class Export {
		private String outputDir = "/tmp/csv_processor_output";
		private String timestampPattern = "yyyy-MM-dd HH:mm:ss";
		private int decimalPlaces = 4;
		private String defaultLabel = "extraction";
	}

	/**
	 * 원시 샘플 테이블 구조입니다. 식별자는 SQL에 직접 삽입되므로 영문자, 숫자, 밑줄만 허용합니다.
	 */
	@Getter
	@Setter
	public static class Store {
		private String table = "TagData";
		private String tagColumn = "TagName";
		private String timestampColumn = "Timestamp";
		private String valueColumn = "Value";
		private int fetchSize = 1000;
	}
}
