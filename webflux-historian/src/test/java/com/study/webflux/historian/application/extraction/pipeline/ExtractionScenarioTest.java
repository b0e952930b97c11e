package com.study.webflux.historian.application.extraction.pipeline;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;

import com.study.webflux.historian.application.extraction.pipeline.stage.ExtractionInputService;
import com.study.webflux.historian.application.extraction.pipeline.stage.TableExportService;
import com.study.webflux.historian.application.extraction.pipeline.stage.TagSeriesStreamService;
import com.study.webflux.historian.application.monitoring.service.PipelineTracer;
import com.study.webflux.historian.domain.extraction.exception.InvalidRangeException;
import com.study.webflux.historian.domain.extraction.exception.RetrievalException;
import com.study.webflux.historian.domain.extraction.model.ExtractionCommand;
import com.study.webflux.historian.domain.extraction.model.RetrievalFailurePolicy;
import com.study.webflux.historian.domain.extraction.model.TagId;
import com.study.webflux.historian.domain.extraction.port.ArtifactSink;
import com.study.webflux.historian.domain.extraction.port.HistorianSampleReader;
import com.study.webflux.historian.domain.extraction.service.ArtifactNameGenerator;
import com.study.webflux.historian.domain.extraction.service.ForwardBackFillPolicy;
import com.study.webflux.historian.domain.extraction.service.SeriesMerger;
import com.study.webflux.historian.domain.extraction.service.SeriesResampler;
import com.study.webflux.historian.domain.extraction.service.TimeGridBuilder;
import com.study.webflux.historian.fixture.ExtractionCommandFixture;
import com.study.webflux.historian.fixture.InMemoryHistorianSampleReader;
import com.study.webflux.historian.fixture.RawSampleFixture;
import com.study.webflux.historian.fixture.TimeGridFixture;
import com.study.webflux.historian.infrastructure.common.config.properties.HistorianProperties;
import com.study.webflux.historian.infrastructure.export.adapter.CsvMergedTableWriter;
import com.study.webflux.historian.infrastructure.export.adapter.FileSystemArtifactSink;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 도메인 서비스, CSV Writer, 파일 저장소를 실제로 조립한 추출 시나리오 테스트입니다.
 */
class ExtractionScenarioTest {

	private static final String EXPECTED_CSV = """
		timestamp,T1,T2
		2024-01-01 00:00:00,5.0000,
		2024-01-01 00:30:00,7.0000,
		2024-01-01 01:00:00,7.0000,
		""";

	@TempDir
	Path outputDir;

	private final Clock clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);

	@ParameterizedTest
	@ValueSource(ints = {1, 10_000})
	@DisplayName("T1/T2 시나리오를 청크 크기와 무관하게 같은 CSV로 내보낸다")
	void process_exportsExpectedCsv(int chunkSize) throws IOException {
		InMemoryHistorianSampleReader reader = new InMemoryHistorianSampleReader()
			.addAll(RawSampleFixture.t1Samples());
		ExtractionPipelineService service = service(reader, chunkSize,
			RetrievalFailurePolicy.PARTIAL_RESULT);

		StepVerifier.create(service.process(ExtractionCommandFixture.create()))
			.assertNext(result -> {
				assertThat(result.rowCount()).isEqualTo(3);
				assertThat(result.artifact().name()).isEqualTo("line1_20240601_120000.csv");
				assertThat(result.emptyTags()).containsExactly(TagId.of("T2"));
				assertThat(result.failedTags()).isEmpty();
			})
			.verifyComplete();

		assertThat(Files.readString(outputDir.resolve("line1_20240601_120000.csv"),
			StandardCharsets.UTF_8)).isEqualTo(EXPECTED_CSV);
		if (chunkSize == 1) {
			assertThat(reader.chunkCount()).isEqualTo(2);
		}
	}

	@Test
	@DisplayName("같은 초에 같은 라벨로 두 번 요청해도 두 산출물이 모두 남는다")
	void process_twoRequestsInSameSecond_bothExported() throws IOException {
		InMemoryHistorianSampleReader reader = new InMemoryHistorianSampleReader()
			.addAll(RawSampleFixture.t1Samples());
		ExtractionPipelineService service = service(reader, 10, RetrievalFailurePolicy.PARTIAL_RESULT);

		StepVerifier.create(service.process(ExtractionCommandFixture.create()))
			.assertNext(result -> assertThat(result.artifact().name()).isEqualTo("line1_20240601_120000.csv"))
			.verifyComplete();
		StepVerifier.create(service.process(ExtractionCommandFixture.create()))
			.assertNext(result -> assertThat(result.artifact().name()).isEqualTo("line1_20240601_120000_1.csv"))
			.verifyComplete();

		assertThat(Files.readString(outputDir.resolve("line1_20240601_120000.csv"),
			StandardCharsets.UTF_8)).isEqualTo(EXPECTED_CSV);
		assertThat(Files.readString(outputDir.resolve("line1_20240601_120000_1.csv"),
			StandardCharsets.UTF_8)).isEqualTo(EXPECTED_CSV);
	}

	@Test
	@DisplayName("end가 start보다 앞서면 저장소를 조회하지 않고 실패한다")
	void process_reversedRange_noStoreAccess() {
		InMemoryHistorianSampleReader reader = new InMemoryHistorianSampleReader();
		ExtractionPipelineService service = service(reader, 10, RetrievalFailurePolicy.PARTIAL_RESULT);
		ExtractionCommand command = ExtractionCommand.of(List.of("T1"), TimeGridFixture.END,
			TimeGridFixture.START, Duration.ofMinutes(30));

		StepVerifier.create(service.process(command))
			.expectError(InvalidRangeException.class)
			.verify();

		assertThat(reader.fetchCount()).isZero();
		assertThat(outputDir).isEmptyDirectory();
	}

	@Test
	@DisplayName("부분 결과 정책에서 실패한 태그는 빈 열로 내보낸다")
	void process_partialPolicy_exportsFailedTagAsAbsent() throws IOException {
		InMemoryHistorianSampleReader reader = new InMemoryHistorianSampleReader()
			.addAll(RawSampleFixture.t1Samples())
			.failOn("T2", "socket closed");
		ExtractionPipelineService service = service(reader, 10, RetrievalFailurePolicy.PARTIAL_RESULT);

		StepVerifier.create(service.process(ExtractionCommandFixture.create()))
			.assertNext(result -> {
				assertThat(result.isPartial()).isTrue();
				assertThat(result.failedTags()).containsExactly(TagId.of("T2"));
				assertThat(result.emptyTags()).isEmpty();
			})
			.verifyComplete();

		assertThat(Files.readString(outputDir.resolve("line1_20240601_120000.csv")))
			.isEqualTo(EXPECTED_CSV);
	}

	@Test
	@DisplayName("요청 실패 정책에서 태그가 실패하면 산출물을 남기지 않는다")
	void process_failRequestPolicy_leavesNoArtifact() throws IOException {
		InMemoryHistorianSampleReader reader = new InMemoryHistorianSampleReader()
			.addAll(RawSampleFixture.t1Samples())
			.failOn("T2", "socket closed");
		ExtractionPipelineService service = service(reader, 10, RetrievalFailurePolicy.FAIL_REQUEST);

		StepVerifier.create(service.process(ExtractionCommandFixture.create()))
			.expectError(RetrievalException.class)
			.verify();

		try (Stream<Path> files = Files.list(outputDir)) {
			assertThat(files).isEmpty();
		}
	}

	@Test
	@DisplayName("조회 중 취소되면 산출물을 만들지 않는다")
	void process_cancelledDuringRetrieval_leavesNoArtifact() throws IOException {
		HistorianSampleReader neverEnding = (tag, start, end, bound) -> Flux.never();
		ExtractionPipelineService service = service(neverEnding, 10,
			RetrievalFailurePolicy.PARTIAL_RESULT);

		StepVerifier.create(service.process(ExtractionCommandFixture.create()))
			.expectSubscription()
			.thenAwait(Duration.ofMillis(50))
			.thenCancel()
			.verify();

		try (Stream<Path> files = Files.list(outputDir)) {
			assertThat(files).isEmpty();
		}
	}

	@Test
	@DisplayName("태그, 구간, 주기만 받는 오버로드는 기본 라벨로 내보낸다")
	void process_overloadUsesDefaultLabel() {
		InMemoryHistorianSampleReader reader = new InMemoryHistorianSampleReader()
			.addAll(RawSampleFixture.t1Samples());
		ExtractionPipelineService service = service(reader, 10, RetrievalFailurePolicy.PARTIAL_RESULT);

		StepVerifier.create(service.process(List.of(TagId.of("T1")), TimeGridFixture.START,
			TimeGridFixture.END, TimeGridFixture.FREQUENCY))
			.assertNext(result -> {
				assertThat(result.artifact().name()).isEqualTo("extraction_20240601_120000.csv");
				assertThat(result.emptyTags()).isEmpty();
			})
			.verifyComplete();

		assertThat(outputDir.resolve("extraction_20240601_120000.csv")).exists();
	}

	@Test
	@DisplayName("태그 열은 요청 순서를 따른다")
	void process_columnsFollowRequestOrder() throws IOException {
		InMemoryHistorianSampleReader reader = new InMemoryHistorianSampleReader()
			.addAll(RawSampleFixture.t1Samples())
			.add(RawSampleFixture.create("T2", TimeGridFixture.at(0, 45), 1.23456));
		ExtractionPipelineService service = service(reader, 10, RetrievalFailurePolicy.PARTIAL_RESULT);

		StepVerifier.create(service.process(ExtractionCommandFixture.create(List.of("T2", "T1"))))
			.expectNextCount(1)
			.verifyComplete();

		assertThat(Files.readAllLines(outputDir.resolve("line1_20240601_120000.csv")))
			.containsExactly(
				"timestamp,T2,T1",
				"2024-01-01 00:00:00,1.2346,5.0000",
				"2024-01-01 00:30:00,1.2346,7.0000",
				"2024-01-01 01:00:00,1.2346,7.0000");
	}

	private ExtractionPipelineService service(HistorianSampleReader reader, int chunkSize,
		RetrievalFailurePolicy policy) {
		HistorianProperties properties = new HistorianProperties();
		properties.getRetrieval().setChunkSize(chunkSize);
		properties.getRetrieval().setFailurePolicy(policy);

		PipelineTracer tracer = new PipelineTracer();
		ArtifactSink sink = new FileSystemArtifactSink(outputDir, clock);
		return new ExtractionPipelineService(
			new ExtractionInputService(new TimeGridBuilder(10_000),
				new ArtifactNameGenerator(clock, "extraction")),
			new TagSeriesStreamService(reader, new SeriesResampler(), new ForwardBackFillPolicy(),
				tracer, properties),
			new TableExportService(new SeriesMerger(),
				new CsvMergedTableWriter("yyyy-MM-dd HH:mm:ss", 4), sink, tracer));
	}
}
