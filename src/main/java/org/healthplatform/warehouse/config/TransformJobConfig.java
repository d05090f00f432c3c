package org.healthplatform.warehouse.config;

import org.healthplatform.warehouse.job.TransformJobListener;
import org.healthplatform.warehouse.job.TransformTasklet;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.support.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;

/**
 * The transform job: a single tasklet step, no retry or skip policy. Each launch gets a new
 * run id, so every invocation is a fresh job instance.
 */
@Configuration
@EnableConfigurationProperties(TransformProperties.class)
public class TransformJobConfig {

    public static final String JOB_NAME = "lifeExpectancyTransformJob";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Step transformStep(JobRepository jobRepository, PlatformTransactionManager transactionManager,
                              TransformTasklet transformTasklet) {
        return new StepBuilder("transformStep", jobRepository)
            .tasklet(transformTasklet, transactionManager)
            .build();
    }

    @Bean
    public Job lifeExpectancyTransformJob(JobRepository jobRepository, Step transformStep,
                                          TransformJobListener transformJobListener) {
        return new JobBuilder(JOB_NAME, jobRepository)
            .incrementer(new RunIdIncrementer())
            .listener(transformJobListener)
            .start(transformStep)
            .build();
    }
}
