package com.study.webflux.historian.fixture;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import com.study.webflux.historian.domain.extraction.exception.RetrievalException;
import com.study.webflux.historian.domain.extraction.model.RawSample;
import com.study.webflux.historian.domain.extraction.model.TagId;
import com.study.webflux.historian.domain.extraction.port.HistorianSampleReader;
import reactor.core.publisher.Flux;

/**
 * 메모리 저장소 기반 테스트용 Reader입니다. 태그별 실패 주입과 조회 횟수 확인을 지원합니다.
 */
public class InMemoryHistorianSampleReader implements HistorianSampleReader {

	private final Map<TagId, List<RawSample>> samples = new ConcurrentHashMap<>();
	private final Map<TagId, String> failures = new ConcurrentHashMap<>();
	private final AtomicInteger fetchCount = new AtomicInteger();
	private final AtomicInteger chunkCount = new AtomicInteger();

	public InMemoryHistorianSampleReader add(RawSample sample) {
		samples.computeIfAbsent(sample.tag(), key -> new ArrayList<>()).add(sample);
		return this;
	}

	public InMemoryHistorianSampleReader addAll(List<RawSample> rawSamples) {
		rawSamples.forEach(this::add);
		return this;
	}

	public InMemoryHistorianSampleReader failOn(String tag, String message) {
		failures.put(TagId.of(tag), message);
		return this;
	}

	public int fetchCount() {
		return fetchCount.get();
	}

	public int chunkCount() {
		return chunkCount.get();
	}

	@Override
	public Flux<List<RawSample>> fetch(TagId tag, LocalDateTime start, LocalDateTime end,
		int chunkBound) {
		return Flux.defer(() -> {
			fetchCount.incrementAndGet();
			String failure = failures.get(tag);
			if (failure != null) {
				return Flux.error(new RetrievalException(tag, failure));
			}
			List<RawSample> matched = samples.getOrDefault(tag, List.of()).stream()
				.filter(sample -> !sample.timestamp().isBefore(start)
					&& !sample.timestamp().isAfter(end))
				.sorted(Comparator.comparing(RawSample::timestamp))
				.toList();

			List<List<RawSample>> chunks = new ArrayList<>();
			for (int i = 0; i < matched.size(); i += chunkBound) {
				chunks.add(matched.subList(i, Math.min(i + chunkBound, matched.size())));
			}
			return Flux.fromIterable(chunks).doOnNext(chunk -> chunkCount.incrementAndGet());
		});
	}
}
