package com.study.webflux.historian.application.monitoring.aop;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * {@code Mono}를 반환하는 추출 진입점에 붙이면 요청마다 파이프라인 추적기를 만들어 Reactor 컨텍스트에 넣습니다.
 *
 * <p>
 * 요청 요약은 인자 중 첫 번째 {@link com.study.webflux.historian.domain.extraction.model.ExtractionCommand}에서 만듭니다.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface MonitoredPipeline {
}
