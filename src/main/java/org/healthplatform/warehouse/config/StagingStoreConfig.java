package org.healthplatform.warehouse.config;

import com.amazonaws.ClientConfiguration;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.client.builder.AwsClientBuilder.EndpointConfiguration;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import org.healthplatform.warehouse.staging.S3StagingStore;
import org.healthplatform.warehouse.staging.StagingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the S3 client used to read raw snapshots from the staging bucket.
 */
@Configuration
public class StagingStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StagingStoreConfig.class);

    @Bean
    public AmazonS3 stagingS3Client(TransformProperties properties) {
        TransformProperties.Staging staging = properties.getStaging();
        log.info("Staging store endpoint: {} (bucket {})", staging.getEndpoint(), staging.getBucket());

        ClientConfiguration clientConfig = new ClientConfiguration();
        clientConfig.setConnectionTimeout(60 * 1000);
        clientConfig.setSocketTimeout(15 * 60 * 1000);

        return AmazonS3ClientBuilder.standard()
            .withClientConfiguration(clientConfig)
            .withCredentials(new AWSStaticCredentialsProvider(
                new BasicAWSCredentials(staging.getAccessKey(), staging.getSecretKey())))
            .withEndpointConfiguration(new EndpointConfiguration(staging.getEndpoint(), staging.getRegion()))
            // MinIO only serves path-style requests
            .withPathStyleAccessEnabled(true)
            .build();
    }

    @Bean
    public StagingStore stagingStore(AmazonS3 stagingS3Client, TransformProperties properties) {
        return new S3StagingStore(stagingS3Client, properties.getStaging().getBucket());
    }
}
