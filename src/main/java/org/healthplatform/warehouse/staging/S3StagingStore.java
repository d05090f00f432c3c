package org.healthplatform.warehouse.staging;

import com.amazonaws.AmazonClientException;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.model.ListObjectsV2Request;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import com.amazonaws.services.s3.model.S3Object;
import com.amazonaws.services.s3.model.S3ObjectInputStream;
import com.amazonaws.services.s3.model.S3ObjectSummary;
import com.amazonaws.util.IOUtils;
import org.healthplatform.warehouse.exception.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Staging store backed by an S3-compatible bucket (MinIO in the default deployment).
 */
public class S3StagingStore implements StagingStore {

    private static final Logger log = LoggerFactory.getLogger(S3StagingStore.class);

    private final AmazonS3 s3Client;
    private final String bucket;

    public S3StagingStore(AmazonS3 s3Client, String bucket) {
        this.s3Client = s3Client;
        this.bucket = bucket;
    }

    @Override
    public List<StagedObject> list(String prefix) {
        List<StagedObject> objects = new ArrayList<>();
        ListObjectsV2Request request = new ListObjectsV2Request()
            .withBucketName(bucket)
            .withPrefix(prefix);
        try {
            ListObjectsV2Result result;
            do {
                result = s3Client.listObjectsV2(request);
                for (S3ObjectSummary summary : result.getObjectSummaries()) {
                    // Directory markers created by some S3 clients
                    if (summary.getKey().endsWith("/") && summary.getSize() == 0) {
                        continue;
                    }
                    objects.add(new StagedObject(summary.getKey(),
                        summary.getLastModified().toInstant(), summary.getSize()));
                }
                request.setContinuationToken(result.getNextContinuationToken());
            } while (result.isTruncated());
        } catch (AmazonClientException e) {
            throw new StoreException(
                String.format("Failed to list s3://%s/%s: %s", bucket, prefix, e.getMessage()), e);
        }
        log.debug("Listed {} object(s) under s3://{}/{}", objects.size(), bucket, prefix);
        return objects;
    }

    @Override
    public byte[] fetch(String name) {
        try (S3Object object = s3Client.getObject(bucket, name);
             S3ObjectInputStream content = object.getObjectContent()) {
            return IOUtils.toByteArray(content);
        } catch (AmazonClientException | IOException e) {
            throw new StoreException(
                String.format("Failed to fetch s3://%s/%s: %s", bucket, name, e.getMessage()), e);
        }
    }
}
