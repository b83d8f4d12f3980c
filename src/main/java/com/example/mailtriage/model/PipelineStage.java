package com.example.mailtriage.model;

/**
 * Per-request pipeline states. {@link #CLASSIFICATION_FAILED} is not terminal:
 * it moves on to {@link #NORMALIZED} through the fallback output.
 */
public enum PipelineStage {
    RECEIVED,
    PARSED,
    SIGNALS_EXTRACTED,
    CLASSIFIED,
    CLASSIFICATION_FAILED,
    NORMALIZED,
    COMPLETED
}
