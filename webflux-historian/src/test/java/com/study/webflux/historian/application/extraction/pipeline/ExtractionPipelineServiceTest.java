package com.study.webflux.historian.application.extraction.pipeline;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import com.study.webflux.historian.application.extraction.pipeline.stage.ExtractionInputService;
import com.study.webflux.historian.application.extraction.pipeline.stage.TableExportService;
import com.study.webflux.historian.application.extraction.pipeline.stage.TagSeriesStreamService;
import com.study.webflux.historian.domain.extraction.exception.InvalidRangeException;
import com.study.webflux.historian.domain.extraction.model.ExportArtifact;
import com.study.webflux.historian.domain.extraction.model.ExtractionCommand;
import com.study.webflux.historian.domain.extraction.model.ExtractionResult;
import com.study.webflux.historian.domain.extraction.model.TagId;
import com.study.webflux.historian.domain.extraction.model.TagSeries;
import com.study.webflux.historian.fixture.ExtractionCommandFixture;
import com.study.webflux.historian.fixture.TimeGridFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExtractionPipelineServiceTest {

	@Mock
	private ExtractionInputService inputService;

	@Mock
	private TagSeriesStreamService tagSeriesStreamService;

	@Mock
	private TableExportService tableExportService;

	private ExtractionPipelineService service;

	@BeforeEach
	void setUp() {
		service = new ExtractionPipelineService(inputService, tagSeriesStreamService,
			tableExportService);
	}

	@Test
	@DisplayName("검증 → 태그 조립 → 병합/내보내기 순서로 스테이지를 호출한다")
	void process_shouldDelegateToStages() {
		ExtractionCommand command = ExtractionCommandFixture.create();
		ExtractionInputs inputs = new ExtractionInputs(command.tags(), TimeGridFixture.create(),
			"line1_20240101_000000.csv");
		List<TagSeriesOutcome> outcomes = command.tags().stream()
			.map(tag -> TagSeriesOutcome.success(TagSeries.absent(tag, inputs.grid())))
			.toList();
		ExtractionResult result = new ExtractionResult(
			new ExportArtifact(inputs.artifactName(), Path.of("/tmp", inputs.artifactName()), 10,
				Instant.EPOCH),
			3, List.of(), List.of(TagId.of("T1"), TagId.of("T2")));

		when(inputService.prepareInputs(command)).thenReturn(Mono.just(inputs));
		when(tagSeriesStreamService.assembleAll(inputs)).thenReturn(Mono.just(outcomes));
		when(tableExportService.mergeAndExport(eq(inputs), eq(outcomes))).thenReturn(Mono.just(result));

		StepVerifier.create(service.process(command))
			.expectNext(result)
			.verifyComplete();

		verify(tableExportService).mergeAndExport(inputs, outcomes);
	}

	@Test
	@DisplayName("입력 검증에 실패하면 이후 스테이지를 호출하지 않는다")
	void process_invalidInput_stopsBeforeRetrieval() {
		ExtractionCommand command = ExtractionCommandFixture.create();
		when(inputService.prepareInputs(any()))
			.thenReturn(Mono.error(new InvalidRangeException("end before start")));

		StepVerifier.create(service.process(command))
			.expectError(InvalidRangeException.class)
			.verify();

		verifyNoInteractions(tagSeriesStreamService, tableExportService);
	}
}
