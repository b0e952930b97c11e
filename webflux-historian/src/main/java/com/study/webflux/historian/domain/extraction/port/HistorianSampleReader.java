package com.study.webflux.historian.domain.extraction.port;

import java.time.LocalDateTime;
import java.util.List;

import com.study.webflux.historian.domain.extraction.model.RawSample;
import com.study.webflux.historian.domain.extraction.model.TagId;
import reactor.core.publisher.Flux;

/**
 * 히스토리안 저장소에서 태그 하나의 원시 샘플을 청크 단위로 읽는 포트입니다.
 */
public interface HistorianSampleReader {

	/**
	 * {@code [start, end]} 구간의 원시 샘플을 시각 오름차순 청크로 스트리밍합니다.
	 *
	 * <p>
	 * 결과는 지연 실행되며 한 번만 구독할 수 있고, 각 청크는 최대 {@code chunkBound}개의 샘플을 가집니다. 청크 크기는 메모리 상한일 뿐
	 * 전체 결과에는 영향을 주지 않습니다. 실패는
	 * {@link com.study.webflux.historian.domain.extraction.exception.RetrievalException}으로 전달됩니다.
	 *
	 * @param tag
	 *            조회할 태그
	 * @param start
	 *            구간 시작(포함)
	 * @param end
	 *            구간 끝(포함)
	 * @param chunkBound
	 *            청크당 최대 샘플 수
	 * @return 샘플 청크 스트림
	 */
	Flux<List<RawSample>> fetch(TagId tag, LocalDateTime start, LocalDateTime end, int chunkBound);
}
