package org.healthplatform.warehouse.job;

import org.healthplatform.warehouse.pipeline.TransformFailedException;
import org.healthplatform.warehouse.repository.LifeExpectancyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobExecutionListener;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.stereotype.Component;

/**
 * Reports the outcome of each transform job: which stage failed and why, or what was loaded.
 */
@Component
public class TransformJobListener implements JobExecutionListener {

    private static final Logger log = LoggerFactory.getLogger(TransformJobListener.class);

    private final LifeExpectancyRepository repository;

    public TransformJobListener(LifeExpectancyRepository repository) {
        this.repository = repository;
    }

    @Override
    public void beforeJob(JobExecution jobExecution) {
        log.info("JOB '{}' STARTING with parameters {}",
            jobExecution.getJobInstance().getJobName(), jobExecution.getJobParameters());
    }

    @Override
    public void afterJob(JobExecution jobExecution) {
        String jobName = jobExecution.getJobInstance().getJobName();
        BatchStatus status = jobExecution.getStatus();
        log.info("JOB '{}' FINISHED with Status: [{}]", jobName, status);

        if (status == BatchStatus.COMPLETED) {
            ExecutionContext context = jobExecution.getExecutionContext();
            log.info("Job '{}' loaded {} rows from {}; latest batch in warehouse: {}", jobName,
                context.getLong(TransformTasklet.ROWS_WRITTEN_KEY, 0L),
                context.getString(TransformTasklet.OBJECT_NAME_KEY, "?"),
                repository.findLatestIngestedAt().map(Object::toString).orElse("none"));
        } else if (status == BatchStatus.FAILED) {
            jobExecution.getAllFailureExceptions().forEach(ex -> {
                if (ex instanceof TransformFailedException) {
                    TransformFailedException failure = (TransformFailedException) ex;
                    log.error("Job '{}' failed at stage {}: {}", jobName,
                        failure.getFailedAt().getLabel(), failure.getError().getDetail());
                } else {
                    log.error("Failure Exception in Job '{}': {}", jobName, ex.getMessage(), ex);
                }
            });
        } else {
            log.warn("Job '{}' finished with status: {}", jobName, status);
        }
    }
}
