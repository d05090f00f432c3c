package org.healthplatform.warehouse.job;

import org.healthplatform.warehouse.pipeline.TransformPipeline;
import org.healthplatform.warehouse.pipeline.TransformRunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.stereotype.Component;

/**
 * Runs the transform pipeline once per step execution and records its counts in the job's
 * execution context.
 */
@Component
public class TransformTasklet implements Tasklet {

    private static final Logger log = LoggerFactory.getLogger(TransformTasklet.class);

    static final String OBJECT_NAME_KEY = "objectName";
    static final String ROWS_PARSED_KEY = "rowsParsed";
    static final String ROWS_WRITTEN_KEY = "rowsWritten";

    private final TransformPipeline pipeline;

    public TransformTasklet(TransformPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        log.info("Executing TransformTasklet for step {}", chunkContext.getStepContext().getStepName());

        // A failure propagates to Spring Batch and fails the step and the job
        TransformRunResult result = pipeline.run();

        contribution.incrementWriteCount(result.getRowsWritten());
        ExecutionContext jobContext = chunkContext.getStepContext().getStepExecution()
            .getJobExecution().getExecutionContext();
        jobContext.putString(OBJECT_NAME_KEY, result.getObjectName());
        jobContext.putLong(ROWS_PARSED_KEY, result.getRowsParsed());
        jobContext.putLong(ROWS_WRITTEN_KEY, result.getRowsWritten());

        return RepeatStatus.FINISHED;
    }
}
