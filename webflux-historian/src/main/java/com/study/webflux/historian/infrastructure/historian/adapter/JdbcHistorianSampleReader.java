package com.study.webflux.historian.infrastructure.historian.adapter;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

import lombok.extern.slf4j.Slf4j;

import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import com.study.webflux.historian.domain.extraction.exception.RetrievalException;
import com.study.webflux.historian.domain.extraction.model.RawSample;
import com.study.webflux.historian.domain.extraction.model.TagId;
import com.study.webflux.historian.domain.extraction.port.HistorianSampleReader;
import com.study.webflux.historian.infrastructure.common.config.properties.HistorianProperties;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * JDBC 히스토리안 저장소에서 태그 샘플을 키셋 페이지네이션으로 읽습니다.
 *
 * <p>
 * 행은 {@code (timestamp, value)} 순으로 정렬됩니다. 다음 청크는 직전 청크의 마지막 시각부터 다시 시작하고 그 시각에서 이미 내보낸
 * 행 수만큼 건너뛰므로 청크 경계에 걸친 같은 시각의 샘플도 빠지거나 중복되지 않습니다.
 */
@Slf4j
public class JdbcHistorianSampleReader implements HistorianSampleReader {

	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	private final JdbcTemplate jdbcTemplate;
	private final Duration chunkTimeout;
	private final String chunkQuery;

	public JdbcHistorianSampleReader(JdbcTemplate jdbcTemplate,
		HistorianProperties.Store store,
		Duration chunkTimeout) {
		this.jdbcTemplate = jdbcTemplate;
		this.chunkTimeout = chunkTimeout;
		this.chunkQuery = buildChunkQuery(store);
		log.debug("Historian chunk query: {}", chunkQuery);
	}

	@Override
	public Flux<List<RawSample>> fetch(TagId tag, LocalDateTime start, LocalDateTime end,
		int chunkBound) {
		if (chunkBound <= 0) {
			return Flux.error(new IllegalArgumentException("chunkBound must be positive: " + chunkBound));
		}
		return fetchChunk(tag, new ChunkCursor(start, 0), end, chunkBound)
			.expand(chunk -> chunk.isLast(chunkBound)
				? Mono.empty()
				: fetchChunk(tag, chunk.next(), end, chunkBound))
			.map(Chunk::samples)
			.filter(samples -> !samples.isEmpty());
	}

	private Mono<Chunk> fetchChunk(TagId tag, ChunkCursor cursor, LocalDateTime end, int chunkBound) {
		return Mono.fromCallable(() -> jdbcTemplate.query(chunkQuery,
			(rs, rowNum) -> mapRow(tag, rs),
			tag.value(),
			cursor.from(),
			end,
			cursor.skip(),
			chunkBound))
			.subscribeOn(Schedulers.boundedElastic())
			.timeout(chunkTimeout)
			.map(samples -> new Chunk(cursor, samples))
			.doOnNext(chunk -> log.debug("Fetched {} samples of {} from {}", chunk.samples().size(),
				tag, cursor.from()))
			.onErrorMap(TimeoutException.class, e -> new RetrievalException(tag,
				"chunk from " + cursor.from() + " timed out after " + chunkTimeout, e))
			.onErrorMap(DataAccessException.class, e -> new RetrievalException(tag,
				e.getMostSpecificCause().getMessage(), e));
	}

	private RawSample mapRow(TagId tag, ResultSet rs) throws SQLException {
		LocalDateTime timestamp = rs.getObject(1, LocalDateTime.class);
		double value = rs.getDouble(2);
		boolean valueMissing = rs.wasNull();
		if (timestamp == null || valueMissing) {
			throw new RetrievalException(tag,
				"malformed row " + rs.getRow() + " (timestamp=" + timestamp + ", value missing="
					+ valueMissing + ")");
		}
		return new RawSample(tag, timestamp, value);
	}

	static String buildChunkQuery(HistorianProperties.Store store) {
		String table = identifier(store.getTable(), "historian.store.table");
		String tagColumn = identifier(store.getTagColumn(), "historian.store.tag-column");
		String timestampColumn = identifier(store.getTimestampColumn(),
			"historian.store.timestamp-column");
		String valueColumn = identifier(store.getValueColumn(), "historian.store.value-column");
		return "SELECT " + timestampColumn + ", " + valueColumn
			+ " FROM " + table
			+ " WHERE " + tagColumn + " = ?"
			+ " AND " + timestampColumn + " >= ?"
			+ " AND " + timestampColumn + " <= ?"
			+ " ORDER BY " + timestampColumn + ", " + valueColumn
			+ " OFFSET ? ROWS FETCH NEXT ? ROWS ONLY";
	}

	private static String identifier(String value, String property) {
		if (value == null || !IDENTIFIER.matcher(value).matches()) {
			throw new IllegalStateException(property + " is not a plain SQL identifier: " + value);
		}
		return value;
	}

	/** 다음 청크의 시작 시각과 그 시각에서 건너뛸 행 수입니다. */
	record ChunkCursor(LocalDateTime from, int skip) {
	}

	private record Chunk(ChunkCursor cursor, List<RawSample> samples) {

		boolean isLast(int chunkBound) {
			return samples.size() < chunkBound;
		}

		ChunkCursor next() {
			LocalDateTime last = samples.get(samples.size() - 1).timestamp();
			int atLast = 0;
			for (int i = samples.size() - 1; i >= 0 && samples.get(i).timestamp().equals(last); i--) {
				atLast++;
			}
			int skip = last.equals(cursor.from()) ? cursor.skip() + atLast : atLast;
			return new ChunkCursor(last, skip);
		}
	}
}
