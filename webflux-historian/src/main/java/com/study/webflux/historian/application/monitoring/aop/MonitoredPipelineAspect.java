package com.study.webflux.historian.application.monitoring.aop;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import com.study.webflux.historian.application.monitoring.context.PipelineContext;
import com.study.webflux.historian.application.monitoring.monitor.ExtractionPipelineMonitor;
import com.study.webflux.historian.application.monitoring.monitor.ExtractionPipelineTracker;
import com.study.webflux.historian.domain.extraction.model.ExtractionCommand;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import reactor.core.publisher.Mono;

@Slf4j
@Aspect
@Component
public class MonitoredPipelineAspect {

	private final ExtractionPipelineMonitor pipelineMonitor;

	public MonitoredPipelineAspect(ExtractionPipelineMonitor pipelineMonitor) {
		this.pipelineMonitor = pipelineMonitor;
	}

	@Around("@annotation(com.study.webflux.historian.application.monitoring.aop.MonitoredPipeline)")
	public Object wrapPipeline(ProceedingJoinPoint joinPoint) throws Throwable {
		Object result = joinPoint.proceed();

		if (!(result instanceof Mono<?> mono)) {
			return result;
		}

		ExtractionPipelineTracker tracker = pipelineMonitor.create(resolveRequestSummary(joinPoint.getArgs()));

		Mono<?> withContext = mono.contextWrite(ctx -> PipelineContext.withTracker(ctx, tracker));
		return tracker.attachLifecycle(withContext);
	}

	private String resolveRequestSummary(Object[] args) {
		if (args != null) {
			for (Object candidate : args) {
				if (candidate instanceof ExtractionCommand command) {
					return command.describe();
				}
			}
		}
		log.debug("Monitored pipeline has no extraction command argument.");
		return "";
	}
}
