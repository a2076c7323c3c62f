package com.nursingjobs.pipeline.ingest.service;

import com.nursingjobs.pipeline.ingest.model.PipelineEvent;
import com.nursingjobs.pipeline.ingest.model.PipelineState;

import java.util.EnumMap;
import java.util.Map;

/**
 * Allowed run transitions. Scrape and classify failures are terminal, so classification can
 * only start from {@link PipelineState#SCRAPE_SUCCEEDED} and announcing only from
 * {@link PipelineState#CLASSIFY_SUCCEEDED}.
 */
public final class PipelineStateMachine {
    private static final Map<PipelineState, Map<PipelineEvent, PipelineState>> TRANSITIONS = new EnumMap<>(PipelineState.class);

    static {
        allow(PipelineState.SCRAPE_PENDING, PipelineEvent.START_SCRAPE, PipelineState.SCRAPING);
        allow(PipelineState.SCRAPING, PipelineEvent.SCRAPE_OK, PipelineState.SCRAPE_SUCCEEDED);
        allow(PipelineState.SCRAPING, PipelineEvent.SCRAPE_ERROR, PipelineState.SCRAPE_FAILED);
        allow(PipelineState.SCRAPE_SUCCEEDED, PipelineEvent.START_CLASSIFY, PipelineState.CLASSIFYING);
        allow(PipelineState.CLASSIFYING, PipelineEvent.CLASSIFY_OK, PipelineState.CLASSIFY_SUCCEEDED);
        allow(PipelineState.CLASSIFYING, PipelineEvent.CLASSIFY_ERROR, PipelineState.CLASSIFY_FAILED);
        allow(PipelineState.CLASSIFY_SUCCEEDED, PipelineEvent.START_ANNOUNCE, PipelineState.ANNOUNCING);
        allow(PipelineState.ANNOUNCING, PipelineEvent.ANNOUNCE_FINISHED, PipelineState.DONE);
    }

    private PipelineStateMachine() {
    }

    public static PipelineState next(PipelineState current, PipelineEvent event) {
        PipelineState target = TRANSITIONS.getOrDefault(current, Map.of()).get(event);
        if (target == null) {
            throw new IllegalStateException("No transition from " + current + " on " + event);
        }
        return target;
    }

    public static boolean canApply(PipelineState current, PipelineEvent event) {
        return TRANSITIONS.getOrDefault(current, Map.of()).containsKey(event);
    }

    private static void allow(PipelineState from, PipelineEvent event, PipelineState to) {
        TRANSITIONS.computeIfAbsent(from, ignored -> new EnumMap<>(PipelineEvent.class)).put(event, to);
    }
}
