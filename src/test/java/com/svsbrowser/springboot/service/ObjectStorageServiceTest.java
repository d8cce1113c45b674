package com.svsbrowser.springboot.service;

import com.svsbrowser.springboot.model.StoredObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ObjectStorageServiceTest {

    private static final String BUCKET = "svs-thumbnails";

    @Mock
    private S3Client s3Client;

    private ObjectStorageService storageService;

    @BeforeEach
    void setUp() {
        storageService = new ObjectStorageService(s3Client, BUCKET);
    }

    @Test
    void createsBucketOnlyWhenMissing() {
        when(s3Client.headBucket(any(HeadBucketRequest.class))).thenThrow(NoSuchBucketException.builder().build());

        storageService.ensureBucketExists();

        ArgumentCaptor<CreateBucketRequest> captor = ArgumentCaptor.forClass(CreateBucketRequest.class);
        verify(s3Client).createBucket(captor.capture());
        assertThat(captor.getValue().bucket()).isEqualTo(BUCKET);
    }

    @Test
    void existingBucketIsLeftAlone() {
        storageService.ensureBucketExists();

        verify(s3Client, never()).createBucket(any(CreateBucketRequest.class));
    }

    @Test
    void putSendsKeyContentTypeAndLength() {
        storageService.put(new byte[]{1, 2, 3}, "thumbnails/pages/5100/thumbnail.png", "image/png");

        ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(captor.capture(), any(RequestBody.class));
        PutObjectRequest request = captor.getValue();
        assertThat(request.bucket()).isEqualTo(BUCKET);
        assertThat(request.key()).isEqualTo("thumbnails/pages/5100/thumbnail.png");
        assertThat(request.contentType()).isEqualTo("image/png");
        assertThat(request.contentLength()).isEqualTo(3L);
    }

    @Test
    void getReturnsBytesAndContentType() {
        GetObjectResponse response = GetObjectResponse.builder().contentType("image/png").build();
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenReturn(ResponseBytes.fromByteArray(response, new byte[]{9, 8}));

        Optional<StoredObject> stored = storageService.get("thumbnails/pages/5100/thumbnail.png");

        assertThat(stored).isPresent();
        assertThat(stored.get().data()).containsExactly(9, 8);
        assertThat(stored.get().contentType()).isEqualTo("image/png");
    }

    @Test
    void getOfMissingKeyIsEmpty() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class))).thenThrow(NoSuchKeyException.builder().build());

        assertThat(storageService.get("missing")).isEmpty();
    }

    @Test
    void existsMapsNotFoundToFalse() {
        when(s3Client.headObject(any(HeadObjectRequest.class)))
                .thenThrow(S3Exception.builder().statusCode(404).build());

        assertThat(storageService.exists("missing")).isFalse();
    }

    @Test
    void existsPropagatesOtherErrors() {
        when(s3Client.headObject(any(HeadObjectRequest.class)))
                .thenThrow(S3Exception.builder().statusCode(500).message("boom").build());

        assertThatThrownBy(() -> storageService.exists("key")).isInstanceOf(S3Exception.class);
    }

    @Test
    void deleteTargetsBucketAndKey() {
        storageService.delete("thumbnails/pages/1/thumbnail.jpg");

        ArgumentCaptor<DeleteObjectRequest> captor = ArgumentCaptor.forClass(DeleteObjectRequest.class);
        verify(s3Client).deleteObject(captor.capture());
        assertThat(captor.getValue().bucket()).isEqualTo(BUCKET);
        assertThat(captor.getValue().key()).isEqualTo("thumbnails/pages/1/thumbnail.jpg");
    }
}
