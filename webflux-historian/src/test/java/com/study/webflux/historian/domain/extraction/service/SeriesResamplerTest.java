package com.study.webflux.historian.domain.extraction.service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.study.webflux.historian.domain.extraction.model.RawSample;
import com.study.webflux.historian.domain.extraction.model.TagId;
import com.study.webflux.historian.domain.extraction.model.TagSeries;
import com.study.webflux.historian.domain.extraction.model.TimeGrid;
import com.study.webflux.historian.domain.extraction.service.SeriesResampler.ResamplingAccumulator;
import com.study.webflux.historian.fixture.RawSampleFixture;
import com.study.webflux.historian.fixture.TimeGridFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.study.webflux.historian.fixture.TimeGridFixture.at;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeriesResamplerTest {

	private static final TagId T1 = TagId.of("T1");

	private final SeriesResampler resampler = new SeriesResampler();

	@Test
	@DisplayName("구간마다 샘플 평균을 계산하고 샘플이 없는 구간은 결측으로 둔다")
	void resample_meanPerInterval() {
		TimeGrid grid = TimeGridFixture.create();

		TagSeries series = resampler.resample(T1, grid, List.of(RawSampleFixture.t1Samples()));

		assertThat(series.length()).isEqualTo(3);
		assertThat(series.valueAt(0)).isEqualTo(5.0);
		assertThat(series.valueAt(1)).isEqualTo(7.0);
		assertThat(series.isAbsent(2)).isTrue();
	}

	@Test
	@DisplayName("한 구간의 여러 샘플은 산술 평균으로 접힌다")
	void resample_multipleSamplesInInterval_averaged() {
		TimeGrid grid = TimeGridFixture.create();
		List<RawSample> samples = List.of(
			RawSampleFixture.create("T1", at(0, 1), 1.0),
			RawSampleFixture.create("T1", at(0, 2), 2.0),
			RawSampleFixture.create("T1", at(0, 29), 6.0));

		TagSeries series = resampler.resample(T1, grid, List.of(samples));

		assertThat(series.valueAt(0)).isEqualTo(3.0);
	}

	@Test
	@DisplayName("격자 경계 시각의 샘플은 그 시각이 여는 구간에 속한다")
	void resample_boundarySampleBelongsToOpeningInterval() {
		TimeGrid grid = TimeGridFixture.create();

		TagSeries series = resampler.resample(T1, grid,
			List.of(List.of(RawSampleFixture.create("T1", at(0, 30), 4.0))));

		assertThat(series.isAbsent(0)).isTrue();
		assertThat(series.valueAt(1)).isEqualTo(4.0);
	}

	@Test
	@DisplayName("격자 위의 end 시각 샘플은 마지막 격자 값이 되고 end 이후 샘플은 버린다")
	void resample_sampleAtEnd_landsInLastInterval() {
		TimeGrid grid = TimeGridFixture.create();
		ResamplingAccumulator accumulator = resampler.open(T1, grid);

		accumulator.accept(List.of(
			RawSampleFixture.create("T1", at(1, 0), 9.0),
			RawSampleFixture.create("T1", at(1, 0, 1), 100.0)));
		TagSeries series = accumulator.finish();

		assertThat(series.isAbsent(0)).isTrue();
		assertThat(series.isAbsent(1)).isTrue();
		assertThat(series.valueAt(2)).isEqualTo(9.0);
		assertThat(accumulator.acceptedCount()).isEqualTo(1);
		assertThat(accumulator.discardedCount()).isEqualTo(1);
	}

	@Test
	@DisplayName("모든 격자 시각에 샘플이 있으면 채움 후에도 원래 값이 그대로 나온다")
	void resampleThenFill_samplesOnEveryGridPoint_passThrough() {
		TimeGrid grid = TimeGridFixture.create();
		List<RawSample> samples = List.of(
			RawSampleFixture.create("T1", at(0, 0), 1.0),
			RawSampleFixture.create("T1", at(0, 30), 2.0),
			RawSampleFixture.create("T1", at(1, 0), 3.0));

		TagSeries filled = new ForwardBackFillPolicy().fill(resampler.resample(T1, grid, List.of(samples)));

		assertThat(filled.values()).containsExactly(1.0, 2.0, 3.0);
	}

	@Test
	@DisplayName("한 점짜리 격자는 그 시각의 샘플 값을 가진다")
	void resampleThenFill_singlePointGrid_keepsSample() {
		TimeGrid grid = TimeGridFixture.create(at(0, 0), at(0, 0), Duration.ofMinutes(30));

		TagSeries filled = new ForwardBackFillPolicy().fill(resampler.resample(T1, grid,
			List.of(List.of(RawSampleFixture.create("T1", at(0, 0), 42.0)))));

		assertThat(filled.values()).containsExactly(42.0);
	}

	@Test
	@DisplayName("청크 크기와 무관하게 같은 결과를 만든다")
	void resample_chunkingDoesNotChangeResult() {
		TimeGrid grid = TimeGridFixture.create(at(0, 0), at(2, 0), Duration.ofMinutes(15));
		List<RawSample> samples = new ArrayList<>();
		for (int minute = 0; minute < 120; minute += 3) {
			samples.add(RawSampleFixture.create("T1", at(minute / 60, minute % 60), minute * 0.5));
		}

		TagSeries whole = resampler.resample(T1, grid, List.of(samples));
		List<List<RawSample>> singles = samples.stream().map(List::of).toList();
		TagSeries oneByOne = resampler.resample(T1, grid, singles);
		List<List<RawSample>> sevens = new ArrayList<>();
		for (int i = 0; i < samples.size(); i += 7) {
			sevens.add(samples.subList(i, Math.min(i + 7, samples.size())));
		}
		TagSeries bySeven = resampler.resample(T1, grid, sevens);

		assertThat(oneByOne).isEqualTo(whole);
		assertThat(bySeven).isEqualTo(whole);
	}

	@Test
	@DisplayName("누산기는 수집 통계를 기록한다")
	void accumulator_tracksStatistics() {
		ResamplingAccumulator accumulator = resampler.open(T1, TimeGridFixture.create());

		accumulator.accept(List.of(RawSampleFixture.create("T1", at(0, 5), 5.0)));
		accumulator.accept(List.of(RawSampleFixture.create("T1", at(0, 40), 7.0)));

		assertThat(accumulator.chunkCount()).isEqualTo(2);
		assertThat(accumulator.acceptedCount()).isEqualTo(2);
		assertThat(accumulator.firstTimestamp()).isEqualTo(at(0, 5));
		assertThat(accumulator.lastTimestamp()).isEqualTo(at(0, 40));
	}

	@Test
	@DisplayName("다른 태그의 샘플은 거부한다")
	void accumulator_foreignTag_rejected() {
		ResamplingAccumulator accumulator = resampler.open(T1, TimeGridFixture.create());

		assertThatThrownBy(() -> accumulator.accept(
			List.of(RawSampleFixture.create("T2", at(0, 5), 1.0))))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("확정된 누산기에는 더 이상 청크를 넣을 수 없다")
	void accumulator_afterFinish_rejected() {
		ResamplingAccumulator accumulator = resampler.open(T1, TimeGridFixture.create());
		accumulator.finish();

		assertThatThrownBy(() -> accumulator.accept(List.of()))
			.isInstanceOf(IllegalStateException.class);
	}
}
