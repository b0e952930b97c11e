package com.study.webflux.historian.application.monitoring.monitor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import com.study.webflux.historian.domain.extraction.model.TagId;
import com.study.webflux.historian.domain.monitoring.model.ExtractionPipelineStage;
import com.study.webflux.historian.domain.monitoring.model.PipelineStatus;
import reactor.core.publisher.Mono;

/**
 * 요청 하나의 파이프라인 진행 상태를 추적합니다.
 *
 * <p>
 * 단계는 {@link ExtractionPipelineStage} 선언 순서로만 전진하며 이미 지난 단계로의 전이는 무시합니다. 태그 파이프라인이 병렬로
 * 실행되므로 요청 단계는 가장 앞선 태그가 도달한 단계입니다. 종료 상태는 한 번만 기록되고 그때 Reporter로 요약을 전달합니다.
 */
public class ExtractionPipelineTracker {

	private final String pipelineId = UUID.randomUUID().toString();
	private final String requestSummary;
	private final PipelineMetricsReporter reporter;
	private final Clock clock;
	private final Instant startedAt;

	private final Map<ExtractionPipelineStage, Instant> stageEnteredAt = new EnumMap<>(
		ExtractionPipelineStage.class);
	private final Map<TagId, TagCounters> tagCounters = new ConcurrentHashMap<>();
	private final Map<String, Object> attributes = new ConcurrentHashMap<>();
	private final AtomicBoolean finished = new AtomicBoolean(false);

	private volatile ExtractionPipelineStage currentStage;
	private volatile PipelineStatus status = PipelineStatus.RUNNING;
	private volatile Instant finishedAt;

	public ExtractionPipelineTracker(String requestSummary,
		PipelineMetricsReporter reporter,
		Clock clock) {
		this.requestSummary = requestSummary;
		this.reporter = reporter;
		this.clock = clock;
		this.startedAt = clock.instant();
		this.currentStage = ExtractionPipelineStage.VALIDATING;
		this.stageEnteredAt.put(ExtractionPipelineStage.VALIDATING, startedAt);
	}

	public String pipelineId() {
		return pipelineId;
	}

	public ExtractionPipelineStage currentStage() {
		return currentStage;
	}

	public PipelineStatus status() {
		return status;
	}

	/**
	 * 다음 단계로 전이합니다.
	 *
	 * @return 전이가 일어났으면 true, 이미 같은 단계 이상이거나 종료된 경우 false
	 */
	public synchronized boolean advanceTo(ExtractionPipelineStage stage) {
		if (finished.get() || stage.ordinal() <= currentStage.ordinal()) {
			return false;
		}
		currentStage = stage;
		stageEnteredAt.put(stage, clock.instant());
		return true;
	}

	public void recordChunk(TagId tag, int sampleCount) {
		TagCounters counters = countersOf(tag);
		counters.chunks.incrementAndGet();
		counters.samples.addAndGet(sampleCount);
	}

	public void recordDiscarded(TagId tag, long discardedCount) {
		countersOf(tag).discarded.addAndGet(discardedCount);
	}

	public void recordTagFailure(TagId tag) {
		countersOf(tag).failed.set(true);
	}

	public void recordAttribute(String key, Object value) {
		if (value != null) {
			attributes.put(key, value);
		}
	}

	/** 결과 Mono의 성공/실패/취소에 맞춰 종료 상태를 기록합니다. */
	public <T> Mono<T> attachLifecycle(Mono<T> mono) {
		return mono
			.doOnSuccess(result -> finish(PipelineStatus.COMPLETED))
			.doOnError(error -> {
				recordAttribute("error", error.getClass().getSimpleName());
				finish(PipelineStatus.FAILED);
			})
			.doOnCancel(() -> finish(PipelineStatus.CANCELLED));
	}

	void finish(PipelineStatus finalStatus) {
		if (!finished.compareAndSet(false, true)) {
			return;
		}
		this.finishedAt = clock.instant();
		this.status = finalStatus;
		reporter.report(summary());
	}

	public synchronized PipelineSummary summary() {
		Instant end = finishedAt != null ? finishedAt : clock.instant();
		List<StageSnapshot> stages = new ArrayList<>();
		List<ExtractionPipelineStage> entered = new ArrayList<>(stageEnteredAt.keySet());
		for (int i = 0; i < entered.size(); i++) {
			ExtractionPipelineStage stage = entered.get(i);
			Instant from = stageEnteredAt.get(stage);
			Instant to = i + 1 < entered.size() ? stageEnteredAt.get(entered.get(i + 1)) : end;
			stages.add(new StageSnapshot(stage, from, Duration.between(from, to).toMillis()));
		}

		Map<String, TagSnapshot> tags = new LinkedHashMap<>();
		tagCounters.forEach((tag, counters) -> tags.put(tag.value(), counters.snapshot(tag)));

		return new PipelineSummary(pipelineId,
			status,
			requestSummary,
			currentStage,
			startedAt,
			end,
			Duration.between(startedAt, end).toMillis(),
			Collections.unmodifiableList(stages),
			Collections.unmodifiableMap(tags),
			Map.copyOf(attributes));
	}

	private TagCounters countersOf(TagId tag) {
		return tagCounters.computeIfAbsent(tag, key -> new TagCounters());
	}

	private static final class TagCounters {
		private final AtomicLong chunks = new AtomicLong();
		private final AtomicLong samples = new AtomicLong();
		private final AtomicLong discarded = new AtomicLong();
		private final AtomicBoolean failed = new AtomicBoolean();

		private TagSnapshot snapshot(TagId tag) {
			return new TagSnapshot(tag.value(), chunks.get(), samples.get(), discarded.get(),
				failed.get());
		}
	}

	public record PipelineSummary(
		String pipelineId,
		PipelineStatus status,
		String requestSummary,
		ExtractionPipelineStage lastStage,
		Instant startedAt,
		Instant finishedAt,
		long durationMillis,
		List<StageSnapshot> stages,
		Map<String, TagSnapshot> tags,
		Map<String, Object> attributes
	) {
	}

	public record StageSnapshot(
		ExtractionPipelineStage stage,
		Instant enteredAt,
		long durationMillis
	) {
	}

	public record TagSnapshot(
		String tag,
		long chunks,
		long samples,
		long discarded,
		boolean failed
	) {
	}
}
