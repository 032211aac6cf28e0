package com.dcruver.lifepatterns.pipeline;

import com.dcruver.lifepatterns.domain.LifePatternException;
import lombok.Getter;

/**
 * A stage failed mid-run. Carries the failed stage and the results of the
 * stages that completed before it, for diagnostics.
 */
@Getter
public class PipelineStageException extends LifePatternException {
    private final PipelineStage stage;
    private final transient AnalysisState partialState;

    public PipelineStageException(PipelineStage stage, AnalysisState partialState, Throwable cause) {
        super(String.format("Stage %s failed: %s", stage, cause.getMessage()), cause);
        this.stage = stage;
        this.partialState = partialState;
    }
}
