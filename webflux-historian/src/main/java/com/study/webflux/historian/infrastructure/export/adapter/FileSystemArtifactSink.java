package com.study.webflux.historian.infrastructure.export.adapter;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

import lombok.extern.slf4j.Slf4j;

import com.study.webflux.historian.domain.extraction.exception.ExportException;
import com.study.webflux.historian.domain.extraction.model.ExportArtifact;
import com.study.webflux.historian.domain.extraction.port.ArtifactSink;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 출력 디렉터리에 산출물을 저장합니다.
 *
 * <p>
 * 내용은 같은 디렉터리의 임시 파일에 먼저 쓴 뒤 하드 링크로 최종 이름에 노출합니다. 실패하거나 취소되면 임시 파일을 지웁니다. 기존 산출물은
 * 덮어쓰지 않으며, 같은 초에 같은 라벨로 들어온 요청은 숫자 접미사가 붙은 이름을 받습니다.
 */
@Slf4j
public class FileSystemArtifactSink implements ArtifactSink {

	private static final int MAX_NAME_ATTEMPTS = 1000;

	private final Path outputDir;
	private final Clock clock;

	public FileSystemArtifactSink(Path outputDir, Clock clock) {
		this.outputDir = outputDir.toAbsolutePath().normalize();
		this.clock = clock;
		try {
			Files.createDirectories(this.outputDir);
		} catch (IOException e) {
			throw new IllegalStateException("Cannot create output directory " + this.outputDir, e);
		}
		log.info("Artifacts will be written to {}", this.outputDir);
	}

	public Path outputDir() {
		return outputDir;
	}

	@Override
	public Mono<ExportArtifact> store(String name, ArtifactContent content) {
		return Mono.<ExportArtifact>create(sink -> {
			AtomicBoolean cancelled = new AtomicBoolean(false);
			sink.onCancel(() -> cancelled.set(true));
			try {
				sink.success(writeAtomically(name, content, cancelled));
			} catch (ExportException e) {
				sink.error(e);
			} catch (IOException | RuntimeException e) {
				sink.error(new ExportException("Failed to export " + name + ": " + e.getMessage(), e));
			}
		}).subscribeOn(Schedulers.boundedElastic());
	}

	private ExportArtifact writeAtomically(String name,
		ArtifactContent content,
		AtomicBoolean cancelled) throws IOException {
		resolveTarget(name);

		Path temp = Files.createTempFile(outputDir, "." + name + ".", ".part");
		try {
			try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(temp))) {
				content.writeTo(out);
			}
			if (cancelled.get()) {
				throw new ExportException("Export of " + name + " was cancelled");
			}
			Path target = publish(temp, name);
			long size = Files.size(target);
			log.debug("Stored artifact {} ({} bytes)", target, size);
			return new ExportArtifact(target.getFileName().toString(), target, size, clock.instant());
		} finally {
			deleteQuietly(temp);
		}
	}

	/**
	 * 완성된 임시 파일을 비어 있는 이름에 노출합니다.
	 *
	 * <p>
	 * 하드 링크 생성은 대상이 이미 있으면 실패하므로 이름 선점과 노출이 한 번에 일어납니다. 이름이 이미 쓰였다면 {@code <이름>_1.csv},
	 * {@code <이름>_2.csv} 순으로 다음 이름을 시도합니다.
	 */
	private Path publish(Path temp, String name) throws IOException {
		int dot = name.lastIndexOf('.');
		String base = dot > 0 ? name.substring(0, dot) : name;
		String extension = dot > 0 ? name.substring(dot) : "";
		for (int attempt = 0; attempt < MAX_NAME_ATTEMPTS; attempt++) {
			Path target = resolveTarget(attempt == 0 ? name : base + "_" + attempt + extension);
			try {
				link(temp, target);
				return target;
			} catch (FileAlreadyExistsException e) {
				log.debug("Artifact name {} is taken, trying next suffix", target.getFileName());
			}
		}
		throw new ExportException(
			"No free artifact name for " + name + " after " + MAX_NAME_ATTEMPTS + " attempts");
	}

	private void link(Path temp, Path target) throws IOException {
		try {
			Files.createLink(target, temp);
		} catch (UnsupportedOperationException e) {
			// 하드 링크가 없는 파일 시스템. 대상이 있으면 FileAlreadyExistsException
			Files.copy(temp, target);
		}
	}

	private Path resolveTarget(String name) {
		if (name == null || name.isBlank()) {
			throw new ExportException("Artifact name cannot be blank");
		}
		Path target = outputDir.resolve(name).normalize();
		if (!outputDir.equals(target.getParent())) {
			throw new ExportException("Artifact name escapes output directory: " + name);
		}
		return target;
	}

	private void deleteQuietly(Path temp) {
		try {
			Files.deleteIfExists(temp);
		} catch (IOException e) {
			log.warn("Failed to delete temporary file {}", temp, e);
		}
	}
}
