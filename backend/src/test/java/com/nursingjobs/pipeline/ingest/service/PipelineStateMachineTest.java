package com.nursingjobs.pipeline.ingest.service;

import com.nursingjobs.pipeline.ingest.model.PipelineEvent;
import com.nursingjobs.pipeline.ingest.model.PipelineState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineStateMachineTest {

    @Test
    void happyPathEndsDone() {
        PipelineState state = PipelineState.SCRAPE_PENDING;
        for (PipelineEvent event : new PipelineEvent[] {
            PipelineEvent.START_SCRAPE,
            PipelineEvent.SCRAPE_OK,
            PipelineEvent.START_CLASSIFY,
            PipelineEvent.CLASSIFY_OK,
            PipelineEvent.START_ANNOUNCE,
            PipelineEvent.ANNOUNCE_FINISHED
        }) {
            state = PipelineStateMachine.next(state, event);
        }
        assertThat(state).isEqualTo(PipelineState.DONE);
        assertThat(state.isTerminal()).isTrue();
        assertThat(state.isFailure()).isFalse();
    }

    @Test
    void classificationCannotStartAfterFailedScrape() {
        PipelineState failed = PipelineStateMachine.next(PipelineState.SCRAPING, PipelineEvent.SCRAPE_ERROR);

        assertThat(failed).isEqualTo(PipelineState.SCRAPE_FAILED);
        assertThat(failed.isTerminal()).isTrue();
        assertThat(PipelineStateMachine.canApply(failed, PipelineEvent.START_CLASSIFY)).isFalse();
        assertThatThrownBy(() -> PipelineStateMachine.next(failed, PipelineEvent.START_CLASSIFY))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("No transition from SCRAPE_FAILED on START_CLASSIFY");
    }

    @Test
    void announcingCannotStartAfterFailedClassification() {
        PipelineState failed = PipelineStateMachine.next(PipelineState.CLASSIFYING, PipelineEvent.CLASSIFY_ERROR);

        assertThat(failed).isEqualTo(PipelineState.CLASSIFY_FAILED);
        assertThat(PipelineStateMachine.canApply(failed, PipelineEvent.START_ANNOUNCE)).isFalse();
    }

    @Test
    void stagesCannotBeSkipped() {
        assertThat(PipelineStateMachine.canApply(PipelineState.SCRAPE_PENDING, PipelineEvent.START_CLASSIFY)).isFalse();
        assertThat(PipelineStateMachine.canApply(PipelineState.SCRAPE_SUCCEEDED, PipelineEvent.START_ANNOUNCE)).isFalse();
        assertThat(PipelineStateMachine.canApply(PipelineState.DONE, PipelineEvent.START_SCRAPE)).isFalse();
    }
}
