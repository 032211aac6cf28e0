package com.dcruver.lifepatterns.pipeline;

/**
 * Analysis stages in execution order.
 */
public enum PipelineStage {
    EMBEDDING,
    CLUSTERING,
    AGGREGATION,
    ANOMALY_DETECTION,
    CYCLE_DETECTION,
    SYNTHESIS
}
