package com.study.webflux.historian.application.extraction.pipeline.stage;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.historian.application.extraction.pipeline.ExtractionInputs;
import com.study.webflux.historian.domain.extraction.exception.InvalidTagListException;
import com.study.webflux.historian.domain.extraction.model.ExtractionCommand;
import com.study.webflux.historian.domain.extraction.model.TagId;
import com.study.webflux.historian.domain.extraction.model.TimeGrid;
import com.study.webflux.historian.domain.extraction.service.ArtifactNameGenerator;
import com.study.webflux.historian.domain.extraction.service.TimeGridBuilder;
import reactor.core.publisher.Mono;

@Slf4j
@Service
@RequiredArgsConstructor
public class ExtractionInputService {

	private final TimeGridBuilder timeGridBuilder;
	private final ArtifactNameGenerator artifactNameGenerator;

	/**
	 * 요청을 검증하고 격자와 산출물 이름을 준비합니다. 저장소에 접근하기 전에 잘못된 입력을 거부합니다.
	 *
	 * @param command
	 *            추출 요청
	 * @return 검증된 파이프라인 입력
	 */
	public Mono<ExtractionInputs> prepareInputs(ExtractionCommand command) {
		return Mono.fromCallable(() -> {
			List<TagId> tags = distinctTags(command.tags());
			TimeGrid grid = timeGridBuilder.build(command.start(), command.end(), command.frequency());
			String artifactName = artifactNameGenerator.generate(command.label());
			log.debug("Prepared extraction of {} tags over {} grid points into {}", tags.size(),
				grid.size(), artifactName);
			return new ExtractionInputs(tags, grid, artifactName);
		});
	}

	private List<TagId> distinctTags(List<TagId> requested) {
		if (requested.isEmpty()) {
			throw new InvalidTagListException("At least one tag is required");
		}
		LinkedHashSet<TagId> distinct = new LinkedHashSet<>(requested);
		if (distinct.size() < requested.size()) {
			log.debug("Ignoring {} duplicate tag(s)", requested.size() - distinct.size());
		}
		return new ArrayList<>(distinct);
	}
}
