package com.study.webflux.historian.application.monitoring.context;

import com.study.webflux.historian.application.monitoring.monitor.ExtractionPipelineTracker;
import reactor.util.context.Context;
import reactor.util.context.ContextView;

public final class PipelineContext {

	public static final Object TRACKER_KEY = new Object();

	private PipelineContext() {
	}

	public static Context withTracker(Context context, ExtractionPipelineTracker tracker) {
		return context.put(TRACKER_KEY, tracker);
	}

	public static ExtractionPipelineTracker findTracker(ContextView contextView) {
		if (contextView.hasKey(TRACKER_KEY)) {
			return contextView.get(TRACKER_KEY);
		}
		return null;
	}
}
