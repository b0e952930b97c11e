package com.study.webflux.historian.domain.extraction.port;

import java.io.IOException;
import java.io.OutputStream;

import com.study.webflux.historian.domain.extraction.model.ExportArtifact;
import reactor.core.publisher.Mono;

/**
 * 직렬화된 산출물을 이름과 함께 영속화하는 포트입니다. 보관/정리 정책은 호출자가 결정합니다.
 */
public interface ArtifactSink {

	/**
	 * 내용을 모두 쓴 뒤에만 산출물을 노출합니다. 실패하거나 취소되면 부분 산출물을 남기지 않습니다.
	 *
	 * @param name
	 *            산출물 이름
	 * @param content
	 *            출력 스트림에 내용을 쓰는 콜백
	 * @return 저장된 산출물
	 */
	Mono<ExportArtifact> store(String name, ArtifactContent content);

	@FunctionalInterface
	interface ArtifactContent {

		void writeTo(OutputStream out) throws IOException;
	}
}
