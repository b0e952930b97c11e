package com.study.webflux.historian.domain.extraction.service;

import java.time.LocalDateTime;
import java.util.List;

import com.study.webflux.historian.domain.extraction.model.RawSample;
import com.study.webflux.historian.domain.extraction.model.TagId;
import com.study.webflux.historian.domain.extraction.model.TagSeries;
import com.study.webflux.historian.domain.extraction.model.TimeGrid;

/**
 * 원시 샘플 청크를 격자 구간별 평균으로 접습니다.
 *
 * <p>
 * 누산기는 격자 지점마다 합계와 개수만 유지하므로 청크를 받은 뒤 바로 버릴 수 있습니다. 청크 경계는 결과에 영향을 주지 않습니다.
 */
public class SeriesResampler {

	public ResamplingAccumulator open(TagId tag, TimeGrid grid) {
		return new ResamplingAccumulator(tag, grid);
	}

	/** 청크 묶음을 한 번에 리샘플링합니다. */
	public TagSeries resample(TagId tag, TimeGrid grid, Iterable<List<RawSample>> chunks) {
		ResamplingAccumulator accumulator = open(tag, grid);
		for (List<RawSample> chunk : chunks) {
			accumulator.accept(chunk);
		}
		return accumulator.finish();
	}

	/**
	 * 태그 하나의 증분 리샘플링 상태입니다. 요청 범위에서 단일 스트림만 사용하며 스레드 안전하지 않습니다.
	 */
	public static final class ResamplingAccumulator {

		private final TagId tag;
		private final TimeGrid grid;
		private final double[] sums;
		private final int[] counts;
		private long acceptedCount;
		private long discardedCount;
		private long chunkCount;
		private LocalDateTime firstTimestamp;
		private LocalDateTime lastTimestamp;
		private boolean finished;

		private ResamplingAccumulator(TagId tag, TimeGrid grid) {
			this.tag = tag;
			this.grid = grid;
			this.sums = new double[grid.size()];
			this.counts = new int[grid.size()];
		}

		public void accept(List<RawSample> chunk) {
			if (finished) {
				throw new IllegalStateException("accumulator for " + tag + " is already finished");
			}
			chunkCount++;
			for (RawSample sample : chunk) {
				if (!tag.equals(sample.tag())) {
					throw new IllegalArgumentException(
						"sample of " + sample.tag() + " folded into series of " + tag);
				}
				int index = grid.indexOf(sample.timestamp());
				if (index < 0) {
					discardedCount++;
					continue;
				}
				sums[index] += sample.value();
				counts[index]++;
				acceptedCount++;
				if (firstTimestamp == null) {
					firstTimestamp = sample.timestamp();
				}
				lastTimestamp = sample.timestamp();
			}
		}

		/** 누산 결과를 시리즈로 확정합니다. 샘플이 없는 구간은 결측으로 남깁니다. */
		public TagSeries finish() {
			finished = true;
			double[] values = new double[grid.size()];
			for (int i = 0; i < values.length; i++) {
				values[i] = counts[i] == 0 ? TagSeries.ABSENT : sums[i] / counts[i];
			}
			return new TagSeries(tag, grid, values);
		}

		public TagId tag() {
			return tag;
		}

		public long acceptedCount() {
			return acceptedCount;
		}

		public long discardedCount() {
			return discardedCount;
		}

		public long chunkCount() {
			return chunkCount;
		}

		public LocalDateTime firstTimestamp() {
			return firstTimestamp;
		}

		public LocalDateTime lastTimestamp() {
			return lastTimestamp;
		}
	}
}
