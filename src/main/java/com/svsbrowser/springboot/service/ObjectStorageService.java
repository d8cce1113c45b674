package com.svsbrowser.springboot.service;

import com.svsbrowser.springboot.model.StoredObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.util.Optional;

/**
 * Binary object storage in a single bucket.
 */
@Service
public class ObjectStorageService {

    private static final Logger logger = LoggerFactory.getLogger(ObjectStorageService.class);

    private final S3Client s3Client;
    private final String bucket;

    public ObjectStorageService(S3Client s3Client,
                                @Value("${app.thumbnails.bucket:svs-thumbnails}") String bucket) {
        this.s3Client = s3Client;
        this.bucket = bucket;
    }

    public void ensureBucketExists() {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
            logger.debug("Bucket {} already exists", bucket);
        } catch (NoSuchBucketException e) {
            s3Client.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
            logger.info("Created bucket {}", bucket);
        }
    }

    public void put(byte[] data, String key, String contentType) {
        s3Client.putObject(PutObjectRequest.builder()
                        .bucket(bucket)
                        .key(key)
                        .contentType(contentType)
                        .contentLength((long) data.length)
                        .build(),
                RequestBody.fromBytes(data));
        logger.debug("Stored {} ({} bytes)", key, data.length);
    }

    public Optional<StoredObject> get(String key) {
        try {
            ResponseBytes<GetObjectResponse> bytes =
                    s3Client.getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(key).build());
            return Optional.of(new StoredObject(bytes.asByteArray(), bytes.response().contentType()));
        } catch (NoSuchKeyException e) {
            logger.debug("Object {} not found", key);
            return Optional.empty();
        }
    }

    public boolean exists(String key) {
        try {
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw e;
        }
    }

    public void delete(String key) {
        s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
    }
}
