package org.healthplatform.warehouse.pipeline;

import org.healthplatform.warehouse.exception.TransformException;

/**
 * A run ended in {@link PipelineState#FAILED}. Names the stage that was executing and wraps the
 * typed error it raised.
 */
public class TransformFailedException extends RuntimeException {

    private final PipelineState failedAt;

    public TransformFailedException(PipelineState failedAt, TransformException cause) {
        super(failedAt.getLabel() + " failed: " + cause.getDetail(), cause);
        this.failedAt = failedAt;
    }

    public PipelineState getFailedAt() {
        return failedAt;
    }

    public TransformException getError() {
        return (TransformException) getCause();
    }
}
